package com.jsonstreams.core;

/**
 * Raised when a value of the wrong type is passed, such as a non-text object key
 * or a value the active encoder cannot represent.
 */
public final class InvalidTypeException extends JsonStreamsException {

    public InvalidTypeException(String message) {
        super(message);
    }

    public InvalidTypeException(String message, Throwable cause) {
        super(message, cause);
    }
}
