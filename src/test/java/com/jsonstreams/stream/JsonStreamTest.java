package com.jsonstreams.stream;

import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.jsonstreams.core.InvalidTypeException;
import com.jsonstreams.core.ModifyWrongStreamException;
import com.jsonstreams.core.StreamClosedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the document writer and its sink handling.
 */
class JsonStreamTest {

    @TempDir
    Path tempDir;

    /** Records whether the stream flushed or closed it. */
    private static final class TrackingWriter extends StringWriter {
        boolean flushed;
        boolean closed;

        @Override
        public void flush() {
            flushed = true;
            super.flush();
        }

        @Override
        public void close() throws IOException {
            closed = true;
            super.close();
        }
    }

    @Test
    void testWritesFile() throws IOException {
        Path file = tempDir.resolve("foo.json");
        try (JsonStream s = JsonStream.open(file, Kind.OBJECT)) {
            s.write("foo", "bar");
        }
        assertEquals("{\"foo\":\"bar\"}", Files.readString(file));
    }

    @Test
    void testCreatesParentDirectories() throws IOException {
        Path file = tempDir.resolve("a/b/out.json");
        try (JsonStream s = JsonStream.open(file, Kind.ARRAY)) {
            s.write(1);
        }
        assertEquals("[1]", Files.readString(file));
    }

    @Test
    void testGzipFile() throws IOException {
        Path file = tempDir.resolve("out.json.gz");
        StreamConfig config = StreamConfig.builder().kind(Kind.ARRAY).gzip(true).build();
        try (JsonStream s = JsonStream.open(file, config)) {
            s.iterwrite(java.util.Arrays.asList("a", "b"));
        }
        try (InputStream in = new GZIPInputStream(Files.newInputStream(file))) {
            assertEquals("[\"a\",\"b\"]", new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    @Test
    @DisplayName("Caller-supplied sink is flushed but left open by default")
    void testBorrowedSinkNotClosed() throws IOException {
        TrackingWriter sink = new TrackingWriter();
        JsonStream s = new JsonStream(sink, StreamConfig.defaults(Kind.ARRAY));
        s.close();
        assertTrue(sink.flushed);
        assertFalse(sink.closed);
        assertEquals("[]", sink.toString());
    }

    @Test
    void testBorrowedSinkClosedWhenConfigured() throws IOException {
        TrackingWriter sink = new TrackingWriter();
        JsonStream s = new JsonStream(sink, StreamConfig.builder().kind(Kind.ARRAY).closeSink(true).build());
        s.close();
        assertTrue(sink.flushed);
        assertTrue(sink.closed);
    }

    @Test
    void testOutputStreamIsUtf8() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (JsonStream s = new JsonStream(bytes, StreamConfig.defaults(Kind.ARRAY))) {
            s.write("grüß");
        }
        assertEquals("[\"grüß\"]", bytes.toString(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Explicit flush pushes partial output without closing")
    void testFlush() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        JsonStream s = new JsonStream(bytes, StreamConfig.defaults(Kind.ARRAY));
        s.write(1);
        s.flush();
        assertEquals("[1", bytes.toString(StandardCharsets.UTF_8));
        assertFalse(s.isClosed());
        s.close();
        assertEquals("[1]", bytes.toString(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("current() and depth() track the top of the container stack")
    void testCurrentTracksTop() throws IOException {
        JsonStream s = new JsonStream(new StringWriter(), StreamConfig.defaults(Kind.OBJECT));
        assertSame(s.root(), s.current());
        assertEquals(0, s.depth());

        Container child = s.subarray("rows");
        Container grandchild = child.subobject();
        assertSame(grandchild, s.current());
        assertEquals(2, s.depth());
        assertEquals(2, grandchild.depth());
        assertEquals(Kind.OBJECT, grandchild.kind());

        grandchild.close();
        assertSame(child, s.current());
        child.close();
        assertSame(s.root(), s.current());

        s.close();
        assertNull(s.current());
        assertEquals(-1, s.depth());
        assertTrue(s.isClosed());
    }

    @Test
    @DisplayName("Closing the document with an open child fails and keeps it open")
    void testCloseWithOpenChild() throws IOException {
        StringWriter out = new StringWriter();
        JsonStream s = new JsonStream(out, StreamConfig.defaults(Kind.ARRAY));
        Container child = s.subarray();

        assertThrows(ModifyWrongStreamException.class, s::close);
        assertFalse(s.isClosed());

        child.close();
        s.close();
        assertEquals("[[]]", out.toString());
    }

    @Test
    @DisplayName("A failed close still writes the partial document to an owned file and releases it")
    void testFailedCloseReleasesOwnedFile() throws IOException {
        Path file = tempDir.resolve("partial.json");
        JsonStream s = JsonStream.open(file, Kind.ARRAY);
        s.write("row");
        Container child = s.subarray();
        child.write(1);

        assertThrows(ModifyWrongStreamException.class, s::close);

        assertEquals("[\"row\",[1", Files.readString(file));
        // the writer is closed, nothing more reaches the file
        assertThrows(IOException.class, child::close);
        assertEquals("[\"row\",[1", Files.readString(file));
    }

    @Test
    void testFailedCloseFlushesBorrowedSink() throws IOException {
        TrackingWriter sink = new TrackingWriter();
        JsonStream s = new JsonStream(sink, StreamConfig.builder().kind(Kind.OBJECT).closeSink(true).build());
        s.subobject("open");

        assertThrows(ModifyWrongStreamException.class, s::close);
        assertTrue(sink.flushed);
        assertTrue(sink.closed);
        assertEquals("{\"open\":{", sink.toString());
    }

    @Test
    @DisplayName("Non-finite numbers in a Gson tree are rejected before output")
    void testNonFiniteTreeValueRejected() throws IOException {
        StringWriter out = new StringWriter();
        JsonStream s = new JsonStream(out, StreamConfig.defaults(Kind.ARRAY));
        assertThrows(InvalidTypeException.class, () -> s.write(new JsonPrimitive(Double.NaN)));
        s.close();
        assertEquals("[]", out.toString());
    }

    @Test
    void testCloseTwice() throws IOException {
        JsonStream s = new JsonStream(new StringWriter(), StreamConfig.defaults(Kind.OBJECT));
        s.close();
        assertThrows(StreamClosedException.class, s::close);
    }

    @Test
    @DisplayName("An aborted document keeps only the scoped brackets")
    void testAbortLeavesIncompleteDocument() throws IOException {
        StringWriter out = new StringWriter();
        JsonStream s = new JsonStream(out, StreamConfig.defaults(Kind.OBJECT));
        Container outer = s.subarray("outer");
        assertThrows(IllegalStateException.class, () -> {
            try (Container inner = outer.subobject()) {
                inner.write("k", 1);
                throw new IllegalStateException("abort");
            }
        });
        assertEquals("{\"outer\":[{\"k\":1}", out.toString());
    }

    @Test
    @DisplayName("Gson trees are written through unchanged")
    void testJsonElementValue() throws IOException {
        StringWriter out = new StringWriter();
        try (JsonStream s = new JsonStream(out, StreamConfig.defaults(Kind.ARRAY))) {
            s.write(JsonParser.parseString("{\"a\":[1,2],\"b\":null}"));
        }
        assertEquals("[{\"a\":[1,2],\"b\":null}]", out.toString());
    }

    @Test
    void testLargeGeneratedArray() throws IOException {
        Path file = tempDir.resolve("big.json");
        int rows = 10_000;
        try (JsonStream s = JsonStream.open(file, Kind.ARRAY)) {
            s.iterwrite(java.util.stream.IntStream.range(0, rows).boxed());
        }
        var parsed = JsonParser.parseString(Files.readString(file)).getAsJsonArray();
        assertEquals(rows, parsed.size());
        assertEquals(rows - 1, parsed.get(rows - 1).getAsInt());
    }
}
