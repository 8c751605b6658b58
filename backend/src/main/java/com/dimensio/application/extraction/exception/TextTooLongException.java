package com.dimensio.application.extraction.exception;

public class TextTooLongException extends RuntimeException {
    public TextTooLongException(int maxLength) {
        super(String.format("Text must not exceed %d characters.", maxLength));
    }
}
