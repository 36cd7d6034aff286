package com.autofurigana.application.furigana.exception;

public class TextTooLongException extends RuntimeException {
    public TextTooLongException(String message) {
        super(message);
    }
}
