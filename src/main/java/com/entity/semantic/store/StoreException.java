package com.entity.semantic.store;

/**
 * Raised when a {@link DurableStore} cannot read or write its backing storage.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
