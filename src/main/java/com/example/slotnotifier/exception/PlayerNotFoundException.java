package com.example.slotnotifier.exception;

import lombok.Getter;

/**
 * Exception for a player identity absent from the preference source
 */
@Getter
public class PlayerNotFoundException extends RuntimeException {

    private final String identity;

    public PlayerNotFoundException(String identity) {
        super("Player not found: " + identity);
        this.identity = identity;
    }
}
