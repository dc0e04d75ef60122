package com.jsonstreams.stream;

import java.util.Objects;

/**
 * The delimiters placed between entries ({@code item}) and between an object key
 * and its value ({@code key}).
 */
public final class Separators {
    public static final Separators COMPACT = new Separators(",", ":");
    public static final Separators INDENTED = new Separators(",", ": ");
    public static final Separators SPACED = new Separators(", ", ": ");

    private final String item;
    private final String key;

    public Separators(String item, String key) {
        this.item = Objects.requireNonNull(item, "item separator cannot be null");
        this.key = Objects.requireNonNull(key, "key separator cannot be null");
    }

    /**
     * Default separators for the given indent: compact on one line, a space after
     * the colon once entries are placed on their own lines.
     */
    public static Separators forIndent(int indent) {
        return indent > 0 ? INDENTED : COMPACT;
    }

    public String item() {
        return item;
    }

    public String key() {
        return key;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Separators)) return false;
        Separators that = (Separators) o;
        return item.equals(that.item) && key.equals(that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(item, key);
    }

    @Override
    public String toString() {
        return "Separators{item='" + item + "', key='" + key + "'}";
    }
}
