package com.omnifuzz.model;

/**
 * Typed failure from the transport, categorized so results can show why a
 * request produced no response.
 */
public class TransportException extends Exception {

    public enum ErrorType {
        TIMEOUT,
        CONNECTION_FAILED,
        NO_RESPONSE,
        IO_ERROR
    }

    private final ErrorType errorType;

    public TransportException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public TransportException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() { return errorType; }
}
