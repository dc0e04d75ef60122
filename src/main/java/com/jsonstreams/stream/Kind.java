package com.jsonstreams.stream;

import java.util.Locale;

/**
 * The two JSON container types a stream can produce.
 */
public enum Kind {
    ARRAY('[', ']'),
    OBJECT('{', '}');

    private final char open;
    private final char close;

    Kind(char open, char close) {
        this.open = open;
        this.close = close;
    }

    public char openBracket() {
        return open;
    }

    public char closeBracket() {
        return close;
    }

    /**
     * Parses {@code "array"} or {@code "object"}, ignoring case.
     *
     * @throws IllegalArgumentException for any other name
     */
    public static Kind parse(String name) {
        if (name != null) {
            switch (name.trim().toLowerCase(Locale.ROOT)) {
                case "array":
                    return ARRAY;
                case "object":
                    return OBJECT;
                default:
                    break;
            }
        }
        throw new IllegalArgumentException("Unknown container kind: " + name + " (expected array or object)");
    }
}
