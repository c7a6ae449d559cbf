package com.banklink;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Bank Link Engine.
 *
 * Bank Link Engine links a user's bank accounts through an Open Banking
 * provider: it runs the OAuth consent flow, keeps the resulting tokens
 * encrypted and fresh, caches balances and transactions, and hosts the token
 * broker that holds the provider client secret.
 */
@SpringBootApplication
public class BankLinkApplication {

    public static void main(String[] args) {
        SpringApplication.run(BankLinkApplication.class, args);
    }
}
