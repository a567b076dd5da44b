package com.flagpole.flags;

/**
 * Base type of the errors raised by flag spaces and handler registries.
 * Handler failures are never wrapped in this type; they reach the caller as thrown.
 */
public class FlagpoleException extends RuntimeException {

    public FlagpoleException(String message) {
        super(message);
    }

    public FlagpoleException(String message, Throwable cause) {
        super(message, cause);
    }
}
