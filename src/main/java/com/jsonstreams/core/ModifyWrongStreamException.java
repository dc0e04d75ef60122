package com.jsonstreams.core;

/**
 * Raised when a container is modified while one of its children is still open.
 * <p>
 * Output is streamed, so nothing can be placed into a parent until the child has
 * written its closing bracket. Close the child first.
 */
public final class ModifyWrongStreamException extends JsonStreamsException {

    public ModifyWrongStreamException(String message) {
        super(message);
    }
}
