package com.openforge.mindstore.vector;

/**
 * Raised when the vector backend cannot serve a request (not connected,
 * RPC failure, rejected request). Never retried by the memory engine.
 */
public class VectorBackendException extends RuntimeException {

    public VectorBackendException(String message) {
        super(message);
    }

    public VectorBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
