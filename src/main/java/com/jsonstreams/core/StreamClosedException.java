package com.jsonstreams.core;

/**
 * Raised when writing into, opening a child on, or closing a container that is already closed.
 */
public final class StreamClosedException extends JsonStreamsException {

    public StreamClosedException(String message) {
        super(message);
    }
}
