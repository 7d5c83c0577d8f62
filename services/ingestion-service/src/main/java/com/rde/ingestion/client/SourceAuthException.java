package com.rde.ingestion.client;

public class SourceAuthException extends SourceException {

    public SourceAuthException(String message) {
        super(message);
    }
}
