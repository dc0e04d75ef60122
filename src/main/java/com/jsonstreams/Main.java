package com.jsonstreams;

import com.jsonstreams.core.StreamLog;
import com.jsonstreams.stream.JsonStream;
import com.jsonstreams.stream.Kind;
import com.jsonstreams.stream.StreamConfig;
import com.jsonstreams.tools.JsonlToJson;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

public final class Main {
    private static final String USAGE = "Usage: java -jar jsonstreams.jar [options]\n"
            + "Streams JSON Lines into a single JSON document.\n"
            + "  --in <file>      input file, .gz is decompressed (default: stdin)\n"
            + "  --out <file>     output file (default: stdout)\n"
            + "  --indent <n>     spaces per nesting level (default: 0)\n"
            + "  --pretty         spread nested records over several lines (needs --indent)\n"
            + "  --gzip           compress the output file\n"
            + "  --key <field>    emit an object keyed by this string field instead of an array\n"
            + "  --verbose        log progress to stderr";

    private Main() {
    }

    public static void main(String[] args) throws Exception {
        int code = run(args, System.in, System.out, System.err);
        if (code != 0) {
            System.exit(code);
        }
    }

    /**
     * Runs the converter. Logger settings changed by the options are restored on return.
     */
    static int run(String[] args, InputStream stdin, OutputStream stdout, PrintStream stderr) throws IOException {
        boolean verbose = StreamLog.isVerbose();
        PrintStream info = StreamLog.infoStream();
        PrintStream warnings = StreamLog.warningStream();
        try {
            return convert(args, stdin, stdout, stderr);
        } finally {
            StreamLog.setVerbose(verbose);
            StreamLog.redirect(info, warnings);
        }
    }

    private static int convert(String[] args, InputStream stdin, OutputStream stdout, PrintStream stderr) throws IOException {
        String in = null;
        String out = null;
        String key = null;
        StreamConfig.Builder config = StreamConfig.builder().kind(Kind.ARRAY);

        for (int i = 0; i < args.length; i++) {
            String k = args[i];
            String v = (i + 1 < args.length && !args[i + 1].startsWith("--")) ? args[++i] : null;
            switch (k) {
                case "--in" -> in = v;
                case "--out" -> out = v;
                case "--key" -> key = v;
                case "--pretty" -> config.pretty(true);
                case "--gzip" -> config.gzip(true);
                case "--verbose" -> StreamLog.setVerbose(true);
                case "--indent" -> {
                    try {
                        config.indent(v == null ? 0 : Integer.parseInt(v));
                    } catch (NumberFormatException e) {
                        stderr.println("--indent requires a number, got: " + v);
                        return 2;
                    }
                }
                case "--help", "-h" -> {
                    stderr.println(USAGE);
                    return 0;
                }
                default -> {
                    stderr.println("Unknown option: " + k);
                    stderr.println(USAGE);
                    return 2;
                }
            }
        }
        if (key != null) {
            config.kind(Kind.OBJECT);
        }
        // The document may own stdout, keep log lines off it
        StreamLog.redirect(stderr, stderr);

        StreamConfig settings;
        try {
            settings = config.build();
        } catch (IllegalArgumentException e) {
            stderr.println(e.getMessage());
            return 2;
        }

        try (BufferedReader reader = openInput(in, stdin);
             JsonStream stream = out == null
                     ? new JsonStream(stdout, settings)
                     : JsonStream.open(Path.of(out), settings)) {
            new JsonlToJson(key).convert(reader, stream.root());
        } catch (IllegalArgumentException e) {
            StreamLog.error("Conversion failed", e);
            stderr.println(e.getMessage());
            return 1;
        }
        return 0;
    }

    private static BufferedReader openInput(String in, InputStream stdin) throws IOException {
        if (in == null) {
            return new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
        }
        Path path = Path.of(in);
        InputStream raw = Files.newInputStream(path);
        if (in.endsWith(".gz")) {
            raw = new GZIPInputStream(raw);
        }
        return new BufferedReader(new InputStreamReader(raw, StandardCharsets.UTF_8));
    }
}
