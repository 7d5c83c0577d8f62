package com.rde.ingestion.domain;

public class MalformedItemException extends RuntimeException {

    public MalformedItemException(String message) {
        super(message);
    }
}
