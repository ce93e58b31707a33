package com.omnifuzz.model;

/**
 * A payload processor rejected its input (e.g. base64-decode of non-base64 text).
 * Recorded on the affected result; never aborts a run.
 */
public class EncodingException extends Exception {

    private final String processor;

    public EncodingException(String processor, String message) {
        super(message);
        this.processor = processor;
    }

    public EncodingException(String processor, String message, Throwable cause) {
        super(message, cause);
        this.processor = processor;
    }

    public String getProcessor() { return processor; }
}
