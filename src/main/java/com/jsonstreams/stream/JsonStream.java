package com.jsonstreams.stream;

import com.jsonstreams.core.StreamLog;
import com.jsonstreams.io.Sinks;

import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;
import java.io.OutputStream;
import java.io.Writer;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Writes one JSON document incrementally, without building it in memory.
 * <p>
 * The stream owns the sink and the root container, and forwards the container
 * calls to the root:
 * <pre>{@code
 * try (JsonStream s = JsonStream.open(path, StreamConfig.defaults(Kind.OBJECT))) {
 *     s.write("name", "export");
 *     try (Container rows = s.subarray("rows")) {
 *         rows.iterwrite(cursor);
 *     }
 * }
 * }</pre>
 * Closing the stream closes the root, flushes the sink and, when the stream owns it,
 * closes the sink. Every descendant must have been closed first; an aborted document
 * is left incomplete.
 */
public final class JsonStream implements Closeable, Flushable {
    private final StreamContext context;
    private final ContainerStack stack;
    private final Container root;
    private final StreamConfig config;

    /**
     * Streams into a caller-supplied writer. The writer is closed on {@link #close()}
     * only if {@link StreamConfig#isCloseSink()} is set; it is always flushed.
     */
    public JsonStream(Writer sink, StreamConfig config) throws IOException {
        this(sink, config.isCloseSink(), config);
    }

    /**
     * Streams UTF-8 into a caller-supplied byte stream. Ownership follows
     * {@link StreamConfig#isCloseSink()}.
     */
    public JsonStream(OutputStream sink, StreamConfig config) throws IOException {
        this(Sinks.wrap(sink), config.isCloseSink(), config);
    }

    private JsonStream(Writer sink, boolean ownsSink, StreamConfig config) throws IOException {
        Objects.requireNonNull(sink, "sink cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.context = new StreamContext(sink, ownsSink, config);
        this.stack = new ContainerStack(context);
        this.root = stack.push(config.getKind());
        context.append(String.valueOf(config.getKind().openBracket()));
        StreamLog.debug("Document opened: " + config);
    }

    /**
     * Creates {@code file} and streams into it. The file is always closed with the stream.
     */
    public static JsonStream open(Path file, StreamConfig config) throws IOException {
        Writer sink = Sinks.openFile(file, config.isGzip());
        try {
            return new JsonStream(sink, true, config);
        } catch (IOException | RuntimeException e) {
            sink.close();
            throw e;
        }
    }

    public static JsonStream open(Path file, Kind kind) throws IOException {
        return open(file, StreamConfig.defaults(kind));
    }

    public StreamConfig getConfig() {
        return config;
    }

    public Container root() {
        return root;
    }

    /**
     * The topmost open container, the only one accepting writes, or {@code null}
     * once the document is closed.
     */
    public Container current() {
        return stack.top();
    }

    /**
     * Nesting level of {@link #current()}, or -1 once the document is closed.
     */
    public int depth() {
        return stack.size() - 1;
    }

    public boolean isClosed() {
        return root.isClosed();
    }

    public void write(Object value) throws IOException {
        root.write(value);
    }

    public void write(Object key, Object value) throws IOException {
        root.write(key, value);
    }

    public void iterwrite(Iterator<?> values) throws IOException {
        root.iterwrite(values);
    }

    public void iterwrite(Iterable<?> values) throws IOException {
        root.iterwrite(values);
    }

    public void iterwrite(Stream<?> values) throws IOException {
        root.iterwrite(values);
    }

    public void iterwrite(Map<?, ?> entries) throws IOException {
        root.iterwrite(entries);
    }

    public Container subarray() throws IOException {
        return root.subarray();
    }

    public Container subarray(Object key) throws IOException {
        return root.subarray(key);
    }

    public Container subobject() throws IOException {
        return root.subobject();
    }

    public Container subobject(Object key) throws IOException {
        return root.subobject(key);
    }

    /**
     * Pushes buffered output to the sink without closing anything.
     */
    @Override
    public void flush() throws IOException {
        context.flush();
    }

    /**
     * Closes the root and releases the sink.
     * <p>
     * If a descendant is still open the call fails with
     * {@link com.jsonstreams.core.ModifyWrongStreamException}. The document is then
     * abandoned: what was written so far is flushed and an owned sink is closed
     * before the exception propagates.
     */
    @Override
    public void close() throws IOException {
        if (root.isClosed()) {
            root.close();
            return;
        }
        if (root.hasOpenChild()) {
            StreamLog.warn("Closing document with " + (stack.size() - 1)
                    + " container(s) still open; output will be incomplete");
        }
        try {
            root.close();
        } catch (IOException | RuntimeException e) {
            if (root.isClosed()) {
                // the root closed and the failure came from releasing the sink itself
                throw e;
            }
            try {
                context.release();
            } catch (IOException releaseFailure) {
                e.addSuppressed(releaseFailure);
            }
            throw e;
        }
    }
}
