package com.apex.riskcore.exception;

/**
 * Raised for invalid configuration or malformed input. Business outcomes such as rejected trades
 * or insufficient history are reported through return values instead.
 */
public class RiskCoreException extends RuntimeException {
    public RiskCoreException(String message) {
        super(message);
    }

    public RiskCoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
