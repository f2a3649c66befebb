package com.sqlrecorder.store;

/**
 * Thrown when the shared store cannot be reached. Never retried: tracing is
 * diagnostic and the failure is reported to whoever triggered the store call.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) { super(message); }

    public StoreUnavailableException(String message, Throwable cause) { super(message, cause); }
}
