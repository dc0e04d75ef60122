package com.jsonstreams.encoder;

/**
 * Whitespace helpers shared by the stream and the encoders.
 */
public final class Indentation {
    private static final int CACHED_WIDTH = 64;
    private static final String BLANKS = " ".repeat(CACHED_WIDTH);

    private Indentation() {
        // Utility class
    }

    /**
     * Returns a string of {@code count} spaces.
     */
    public static String spaces(int count) {
        if (count <= 0) {
            return "";
        }
        if (count <= CACHED_WIDTH) {
            return BLANKS.substring(0, count);
        }
        return " ".repeat(count);
    }

    /**
     * Returns the newline plus padding that starts a line at the given nesting level.
     */
    public static String lineStart(int indent, int depth) {
        return "\n" + spaces(indent * depth);
    }

    /**
     * Shifts every continuation line of {@code text} right by {@code indent * depth} spaces.
     * The first line is left untouched.
     */
    public static String rebase(String text, int indent, int depth) {
        int shift = indent * depth;
        if (shift <= 0 || text.indexOf('\n') < 0) {
            return text;
        }
        return text.replace("\n", lineStart(indent, depth));
    }
}
