package com.example.slotnotifier.exception;

import lombok.Getter;

/**
 * Exception for a slot whose date or time range cannot be parsed
 */
@Getter
public class InvalidSlotFormatException extends RuntimeException {

    private final String field;
    private final String value;

    public InvalidSlotFormatException(String field, String value) {
        super(String.format("Invalid slot %s: '%s'", field, value));
        this.field = field;
        this.value = value;
    }
}
