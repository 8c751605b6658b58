package com.dimensio.infrastructure.engine.resolve;

public class UnhandledDimensionException extends RuntimeException {

    public UnhandledDimensionException(String message) {
        super(message);
    }
}
