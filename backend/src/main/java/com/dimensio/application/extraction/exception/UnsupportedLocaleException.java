package com.dimensio.application.extraction.exception;

public class UnsupportedLocaleException extends RuntimeException {
    public UnsupportedLocaleException(String locale) {
        super("Unsupported locale: " + locale);
    }
}
