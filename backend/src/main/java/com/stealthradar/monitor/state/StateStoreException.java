package com.stealthradar.monitor.state;

/**
 * Key/value store unreachable or rejected the operation.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
