package com.jsonstreams.encoder;

import com.jsonstreams.core.InvalidTypeException;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Dependency-free encoder using only JDK classes.
 * <p>
 * Handles strings, characters, numbers, booleans, {@code null}, {@link Map},
 * {@link Iterable}, arrays and {@link Optional}. Any other type is rejected with
 * {@link InvalidTypeException}, as are NaN and infinite numbers.
 */
public final class SimpleValueEncoder implements ValueEncoder {
    public static final SimpleValueEncoder INSTANCE = new SimpleValueEncoder();

    @Override
    public String encode(Object value, int indent, int depth) {
        StringBuilder sb = new StringBuilder();
        append(sb, value, indent, depth);
        return sb.toString();
    }

    private void append(StringBuilder sb, Object value, int indent, int depth) {
        if (value == null) {
            sb.append("null");
        } else if (value instanceof CharSequence || value instanceof Character) {
            appendString(sb, value.toString());
        } else if (value instanceof Boolean) {
            sb.append(value);
        } else if (value instanceof Number) {
            sb.append(formatNumber((Number) value));
        } else if (value instanceof Optional) {
            append(sb, ((Optional<?>) value).orElse(null), indent, depth);
        } else if (value instanceof Map) {
            appendObject(sb, (Map<?, ?>) value, indent, depth);
        } else if (value instanceof Iterable) {
            appendArray(sb, ((Iterable<?>) value).iterator(), indent, depth);
        } else if (value.getClass().isArray()) {
            appendArray(sb, arrayElements(value).iterator(), indent, depth);
        } else {
            throw new InvalidTypeException("Cannot encode value of type " + value.getClass().getName());
        }
    }

    private void appendArray(StringBuilder sb, Iterator<?> items, int indent, int depth) {
        sb.append('[');
        boolean first = true;
        while (items.hasNext()) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            if (indent > 0) {
                sb.append(Indentation.lineStart(indent, depth + 1));
            }
            append(sb, items.next(), indent, depth + 1);
        }
        if (indent > 0 && !first) {
            sb.append(Indentation.lineStart(indent, depth));
        }
        sb.append(']');
    }

    private void appendObject(StringBuilder sb, Map<?, ?> map, int indent, int depth) {
        sb.append('{');
        boolean first = true;
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            if (indent > 0) {
                sb.append(Indentation.lineStart(indent, depth + 1));
            }
            appendString(sb, keyText(entry.getKey()));
            sb.append(indent > 0 ? ": " : ":");
            append(sb, entry.getValue(), indent, depth + 1);
        }
        if (indent > 0 && !first) {
            sb.append(Indentation.lineStart(indent, depth));
        }
        sb.append('}');
    }

    // Scalar map keys are stringified, as JSON object keys are always strings
    private static String keyText(Object key) {
        if (key == null) {
            return "null";
        }
        if (key instanceof CharSequence || key instanceof Character
                || key instanceof Boolean || key instanceof Number) {
            return key.toString();
        }
        throw new InvalidTypeException("Map key of type " + key.getClass().getName() + " is not a valid JSON key");
    }

    private static String formatNumber(Number n) {
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new InvalidTypeException("JSON cannot represent " + d);
            }
            return n.toString();
        }
        if (n instanceof BigDecimal) {
            return ((BigDecimal) n).toString();
        }
        if (n instanceof BigInteger || n instanceof Long || n instanceof Integer
                || n instanceof Short || n instanceof Byte
                || n instanceof AtomicInteger || n instanceof AtomicLong) {
            return n.toString();
        }
        return formatNumber(Double.valueOf(n.doubleValue()));
    }

    private static List<Object> arrayElements(Object array) {
        int length = Array.getLength(array);
        List<Object> elements = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            elements.add(Array.get(array, i));
        }
        return elements;
    }

    static void appendString(StringBuilder sb, String str) {
        sb.append('"');
        for (int i = 0; i < str.length(); i++) {
            char c = str.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20 || c == '\u2028' || c == '\u2029') {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }
}
