package com.autotrader.exception;

/**
 * Malformed request to the position manager or strategy service.
 * Always raised before any state is touched.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }
}
