package com.jsonstreams.stream;

import com.jsonstreams.core.InvalidTypeException;
import com.jsonstreams.core.ModifyWrongStreamException;
import com.jsonstreams.core.StreamClosedException;
import com.jsonstreams.core.StreamLog;
import com.jsonstreams.encoder.Indentation;

import java.io.Closeable;
import java.io.IOException;
import java.util.Iterator;
import java.util.Map;
import java.util.stream.Stream;

/**
 * One open JSON array or object being streamed.
 * <p>
 * A container is writable while it is open and has no open child. Opening a child
 * with {@link #subarray()} or {@link #subobject()} blocks it until that child is
 * closed. Closing is final: every later call fails with {@link StreamClosedException}.
 * <p>
 * Arrays take bare values ({@link #write(Object)}), objects take text keys and
 * values ({@link #write(Object, Object)}). Calling the other variant's method fails
 * with {@link InvalidTypeException}.
 * <p>
 * Children implement {@link Closeable}, so try-with-resources closes them on the way
 * out even when the body throws:
 * <pre>{@code
 * try (Container rows = stream.subarray("rows")) {
 *     rows.iterwrite(cursor);
 * }
 * }</pre>
 * Errors are not transactional. Output emitted before a failure stays in the sink.
 * Not thread-safe.
 */
public final class Container implements Closeable {
    private final ContainerStack stack;
    private final StreamContext context;
    private final Kind kind;
    private final int depth;

    private boolean closed;
    private boolean openChild;
    private long entries;

    Container(ContainerStack stack, StreamContext context, Kind kind, int depth) {
        this.stack = stack;
        this.context = context;
        this.kind = kind;
        this.depth = depth;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Nesting level, 0 for the root.
     */
    public int depth() {
        return depth;
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean hasOpenChild() {
        return openChild;
    }

    /**
     * Whether this is the topmost container, the only one that accepts writes.
     */
    public boolean isWritable() {
        return !closed && !openChild;
    }

    /**
     * Entries written so far. A child container counts as one entry.
     */
    public long entryCount() {
        return entries;
    }

    /**
     * Appends a value to this array.
     *
     * @throws InvalidTypeException if this is an object
     */
    public void write(Object value) throws IOException {
        checkWritable();
        if (kind == Kind.OBJECT) {
            throw new InvalidTypeException("Object entries require a key; use write(key, value)");
        }
        emitEntry(null, value);
    }

    /**
     * Appends a key and value to this object.
     *
     * @throws InvalidTypeException if this is an array or the key is not text
     */
    public void write(Object key, Object value) throws IOException {
        checkWritable();
        if (kind == Kind.ARRAY) {
            throw new InvalidTypeException("Array entries do not take a key; use write(value)");
        }
        emitEntry(checkKey(key), value);
    }

    /**
     * Writes every element produced by {@code values}, pulling one at a time.
     * <p>
     * For an array each element is a value. For an object each element must be a
     * {@link Map.Entry}, whose key and value are written as by {@link #write(Object, Object)}.
     * On an invalid element the call fails after every earlier element has been written.
     */
    public void iterwrite(Iterator<?> values) throws IOException {
        checkWritable();
        long index = 0;
        while (values.hasNext()) {
            Object element = values.next();
            switch (kind) {
                case ARRAY -> write(element);
                case OBJECT -> {
                    if (!(element instanceof Map.Entry)) {
                        throw new InvalidTypeException("Element " + index + " is not a key/value entry: "
                                + (element == null ? "null" : element.getClass().getName()));
                    }
                    Map.Entry<?, ?> entry = (Map.Entry<?, ?>) element;
                    write(entry.getKey(), entry.getValue());
                }
            }
            index++;
        }
    }

    public void iterwrite(Iterable<?> values) throws IOException {
        iterwrite(values.iterator());
    }

    /**
     * Drains a stream lazily. The stream is not closed.
     */
    public void iterwrite(Stream<?> values) throws IOException {
        iterwrite(values.iterator());
    }

    /**
     * Writes the entries of a map into this object, in the map's iteration order.
     */
    public void iterwrite(Map<?, ?> entries) throws IOException {
        iterwrite(entries.entrySet().iterator());
    }

    /**
     * Opens an array as the next entry of this array.
     */
    public Container subarray() throws IOException {
        return openChild(Kind.ARRAY, null, false);
    }

    /**
     * Opens an array under {@code key} in this object.
     */
    public Container subarray(Object key) throws IOException {
        return openChild(Kind.ARRAY, key, true);
    }

    /**
     * Opens an object as the next entry of this array.
     */
    public Container subobject() throws IOException {
        return openChild(Kind.OBJECT, null, false);
    }

    /**
     * Opens an object under {@code key} in this object.
     */
    public Container subobject(Object key) throws IOException {
        return openChild(Kind.OBJECT, key, true);
    }

    /**
     * Writes the closing bracket and hands control back to the parent.
     *
     * @throws StreamClosedException      if already closed
     * @throws ModifyWrongStreamException if a child is still open
     */
    @Override
    public void close() throws IOException {
        checkWritable();
        StringBuilder out = new StringBuilder(context.indent() * depth + 2);
        if (context.indent() > 0 && entries > 0) {
            out.append(Indentation.lineStart(context.indent(), depth));
        }
        out.append(kind.closeBracket());
        context.append(out);
        closed = true;
        if (stack.pop(this) == null) {
            context.release();
            StreamLog.debug("Document closed after " + context.charsWritten() + " chars");
        }
    }

    void childClosed() {
        openChild = false;
    }

    private Container openChild(Kind childKind, Object key, boolean keyed) throws IOException {
        checkWritable();
        String keyText = null;
        if (keyed) {
            if (kind == Kind.ARRAY) {
                throw new InvalidTypeException("Array entries do not take a key; use sub" + name(childKind) + "()");
            }
            keyText = checkKey(key);
        } else if (kind == Kind.OBJECT) {
            throw new InvalidTypeException("Object entries require a key; use sub" + name(childKind) + "(key)");
        }
        StringBuilder out = entryPrefix(keyText);
        out.append(childKind.openBracket());
        context.append(out);
        entries++;
        openChild = true;
        return stack.push(childKind);
    }

    private void emitEntry(String keyText, Object value) throws IOException {
        // Render before emitting anything so a failing encoder leaves no partial entry
        String valueText = context.encodeValue(value, depth + 1);
        StringBuilder out = entryPrefix(keyText);
        out.append(valueText);
        context.append(out);
        entries++;
    }

    private StringBuilder entryPrefix(String keyText) {
        int indent = context.indent();
        Separators separators = context.separators();
        StringBuilder out = new StringBuilder();
        if (entries > 0) {
            out.append(separators.item());
        }
        if (indent > 0) {
            out.append(Indentation.lineStart(indent, depth + 1));
        }
        if (keyText != null) {
            out.append(keyText).append(separators.key());
        }
        return out;
    }

    private String checkKey(Object key) {
        if (!(key instanceof CharSequence)) {
            throw new InvalidTypeException("Object keys must be text, got "
                    + (key == null ? "null" : key.getClass().getName()));
        }
        return context.encodeKey((CharSequence) key);
    }

    private void checkWritable() {
        if (closed) {
            throw new StreamClosedException("Cannot modify a closed " + name(kind) + " (depth " + depth + ")");
        }
        if (openChild) {
            throw new ModifyWrongStreamException("Cannot modify " + name(kind) + " at depth " + depth
                    + " while a child is open; close the child first");
        }
    }

    private static String name(Kind kind) {
        return kind == Kind.ARRAY ? "array" : "object";
    }

    @Override
    public String toString() {
        return "Container{" +
               "kind=" + kind +
               ", depth=" + depth +
               ", entries=" + entries +
               ", closed=" + closed +
               ", openChild=" + openChild +
               '}';
    }
}
