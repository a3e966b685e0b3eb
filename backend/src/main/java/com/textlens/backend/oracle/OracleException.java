package com.textlens.backend.oracle;

/**
 * Failure of a model backend call: transport error, non-2xx answer or an unexpected payload.
 */
public class OracleException extends RuntimeException {

    public OracleException(String message) {
        super(message);
    }

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
