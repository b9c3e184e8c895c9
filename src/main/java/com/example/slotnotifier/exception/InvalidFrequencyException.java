package com.example.slotnotifier.exception;

import lombok.Getter;

/**
 * Exception for a notification frequency label that maps to no known frequency
 */
@Getter
public class InvalidFrequencyException extends RuntimeException {

    private final String label;

    public InvalidFrequencyException(String label) {
        super(String.format("Unsupported notification frequency: '%s'", label));
        this.label = label;
    }
}
