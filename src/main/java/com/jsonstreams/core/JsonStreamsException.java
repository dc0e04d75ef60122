package com.jsonstreams.core;

/**
 * Base type of every error raised by the stream writer.
 * <p>
 * These are programming errors: the output already written to the sink is not
 * repaired, and the document is left incomplete.
 */
public class JsonStreamsException extends RuntimeException {

    public JsonStreamsException(String message) {
        super(message);
    }

    public JsonStreamsException(String message, Throwable cause) {
        super(message, cause);
    }
}
