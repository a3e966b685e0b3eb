package com.textlens.backend.exception;

/**
 * Malformed or out-of-range request parameter. Raised before any model is called.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}
