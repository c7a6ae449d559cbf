package com.banklink.common.exception;

/**
 * The broker is missing its provider client credentials.
 */
public class BrokerConfigurationException extends BankLinkException {

    public BrokerConfigurationException(String message) {
        super(ErrorCategory.CONFIGURATION, message);
    }
}
