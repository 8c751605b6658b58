package com.dimensio.application.extraction.exception;

public class UnknownDimensionException extends RuntimeException {
    public UnknownDimensionException(String dimension) {
        super("Unknown dimension: " + dimension);
    }
}
