package com.rde.ingestion.client;

public class TransientSourceException extends SourceException {

    private final boolean retryable;

    public TransientSourceException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public TransientSourceException(String message, Throwable cause) {
        super(message, cause);
        this.retryable = true;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
