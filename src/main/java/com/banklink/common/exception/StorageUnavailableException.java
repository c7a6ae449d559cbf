package com.banklink.common.exception;

/**
 * Thrown when the secure persistence primitive cannot be used.
 * Token-class data is never written anywhere else.
 */
public class StorageUnavailableException extends BankLinkException {

    public StorageUnavailableException(String message) {
        super(ErrorCategory.STORAGE_UNAVAILABLE, message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(ErrorCategory.STORAGE_UNAVAILABLE, message, cause);
    }
}
