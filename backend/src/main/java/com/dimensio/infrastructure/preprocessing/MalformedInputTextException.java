package com.dimensio.infrastructure.preprocessing;

public class MalformedInputTextException extends RuntimeException {

    public MalformedInputTextException(String message) {
        super(message);
    }
}
