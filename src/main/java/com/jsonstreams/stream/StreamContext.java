package com.jsonstreams.stream;

import com.jsonstreams.encoder.ValueEncoder;

import java.io.IOException;
import java.io.Writer;

/**
 * The sink and formatting settings shared by every container of one document.
 * Containers never touch the sink directly; all output goes through here in order.
 */
final class StreamContext {
    private final Writer sink;
    private final boolean ownsSink;
    private final ValueEncoder encoder;
    private final int indent;
    private final boolean pretty;
    private final Separators separators;
    private long charsWritten;

    StreamContext(Writer sink, boolean ownsSink, StreamConfig config) {
        this.sink = sink;
        this.ownsSink = ownsSink;
        this.encoder = config.getEncoder();
        this.indent = config.getIndent();
        this.pretty = config.isPretty();
        this.separators = config.getSeparators();
    }

    int indent() {
        return indent;
    }

    Separators separators() {
        return separators;
    }

    String encodeKey(CharSequence key) {
        return encoder.encode(key.toString());
    }

    /**
     * Renders an entry value. Compound values are only spread over several lines in pretty mode.
     */
    String encodeValue(Object value, int depth) {
        if (pretty && indent > 0) {
            return encoder.encode(value, indent, depth);
        }
        return encoder.encode(value);
    }

    void append(CharSequence text) throws IOException {
        sink.append(text);
        charsWritten += text.length();
    }

    long charsWritten() {
        return charsWritten;
    }

    void flush() throws IOException {
        sink.flush();
    }

    /**
     * Flushes the sink and closes it if owned. Called once the root has written its
     * closing bracket, or when an incomplete document is abandoned.
     */
    void release() throws IOException {
        try {
            sink.flush();
        } finally {
            if (ownsSink) {
                sink.close();
            }
        }
    }
}
