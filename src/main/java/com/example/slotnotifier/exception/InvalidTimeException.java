package com.example.slotnotifier.exception;

import lombok.Getter;

/**
 * Exception for a notification time that cannot be read as a time of day
 */
@Getter
public class InvalidTimeException extends RuntimeException {

    private final String text;

    public InvalidTimeException(String text) {
        super(String.format("Invalid notification time: '%s'", text));
        this.text = text;
    }
}
