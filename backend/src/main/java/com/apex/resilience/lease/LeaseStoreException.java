package com.apex.resilience.lease;

public class LeaseStoreException extends RuntimeException {
    public LeaseStoreException(String message) {
        super(message);
    }

    public LeaseStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
