package com.pandora.orchestrator.claude;

public class ModelInvocationException extends RuntimeException {

    private final int statusCode;

    public ModelInvocationException(int statusCode, String body) {
        super("Model API error %d: %s".formatted(statusCode, body));
        this.statusCode = statusCode;
    }

    public ModelInvocationException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status of the provider response, or -1 when the call never got one. */
    public int statusCode() { return statusCode; }
}
