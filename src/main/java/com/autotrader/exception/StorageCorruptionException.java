package com.autotrader.exception;

/**
 * A persisted record could not be read back. Fatal when raised during startup load.
 */
public class StorageCorruptionException extends RuntimeException {

    public StorageCorruptionException(String message) {
        super(message);
    }

    public StorageCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
