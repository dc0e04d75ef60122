package com.jsonstreams.encoder;

/**
 * Renders a single value as JSON text.
 * <p>
 * The stream calls the encoder once per entry value and once per object key.
 * Implementations must honor the indent contract so that compound values written
 * in a single call line up with the surrounding stream:
 * <ul>
 *   <li>{@code indent == 0}: compact, single-line output.</li>
 *   <li>{@code indent > 0}: multi-line output. The first line carries no leading
 *       whitespace, nested entries are indented by {@code indent * (depth + n)}
 *       spaces and the closing bracket of the value by {@code indent * depth}.</li>
 * </ul>
 * Encoded text must never contain a raw line break except as structural whitespace.
 */
public interface ValueEncoder {

    /**
     * Encodes a value.
     *
     * @param value  the value, possibly {@code null}
     * @param indent spaces per nesting level, 0 for compact output
     * @param depth  nesting level the value is written at
     * @return the JSON text of the value
     */
    String encode(Object value, int indent, int depth);

    /**
     * Encodes a value compactly.
     */
    default String encode(Object value) {
        return encode(value, 0, 0);
    }
}
