package com.jsonstreams.io;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPOutputStream;

/**
 * Opens the character sinks a document is streamed into. All sinks are UTF-8 and buffered.
 */
public final class Sinks {

    private Sinks() {
        // Utility class
    }

    /**
     * Creates (or truncates) {@code file}, creating missing parent directories.
     *
     * @param gzip whether to compress the output
     */
    public static Writer openFile(Path file, boolean gzip) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
        OutputStream fos = Files.newOutputStream(file);
        if (gzip) {
            try {
                return wrap(new GZIPOutputStream(fos));
            } catch (IOException e) {
                fos.close();
                throw e;
            }
        }
        return wrap(fos);
    }

    /**
     * Wraps a byte stream. Closing the returned writer closes {@code out}.
     */
    public static Writer wrap(OutputStream out) {
        return new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
    }
}
