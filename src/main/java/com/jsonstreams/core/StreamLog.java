package com.jsonstreams.core;

import java.io.PrintStream;

/**
 * Centralized logging utility for jsonstreams.
 * All logging is disabled by default; enable it with {@link #setVerbose(boolean)}
 * or the {@code jsonstreams.verbose} system property.
 */
public final class StreamLog {
    public static final String VERBOSE_PROPERTY = "jsonstreams.verbose";

    private static volatile boolean verbose = Boolean.getBoolean(VERBOSE_PROPERTY);
    private static volatile PrintStream out = System.out;
    private static volatile PrintStream err = System.err;

    private StreamLog() {
        // Utility class
    }

    /**
     * Enable or disable verbose logging.
     */
    public static void setVerbose(boolean enabled) {
        verbose = enabled;
    }

    /**
     * Check if verbose logging is enabled.
     */
    public static boolean isVerbose() {
        return verbose;
    }

    /**
     * Redirects log output. Used by the CLI when the document itself goes to stdout.
     */
    public static void redirect(PrintStream info, PrintStream warnings) {
        out = info;
        err = warnings;
    }

    /**
     * Stream receiving info and debug messages.
     */
    public static PrintStream infoStream() {
        return out;
    }

    /**
     * Stream receiving warnings and errors.
     */
    public static PrintStream warningStream() {
        return err;
    }

    /**
     * Log an informational message (only if verbose mode is enabled).
     */
    public static void info(String msg) {
        if (verbose) {
            out.println("[INFO] " + msg);
        }
    }

    /**
     * Log a debug message (only if verbose mode is enabled).
     */
    public static void debug(String msg) {
        if (verbose) {
            out.println("[DEBUG] " + msg);
        }
    }

    /**
     * Log a warning message (only if verbose mode is enabled).
     */
    public static void warn(String msg) {
        if (verbose) {
            err.println("[WARN] " + msg);
        }
    }

    /**
     * Log an error message with optional exception (only if verbose mode is enabled).
     */
    public static void error(String msg, Throwable t) {
        if (verbose) {
            err.println("[ERROR] " + msg);
            if (t != null) {
                t.printStackTrace(err);
            }
        }
    }

    /**
     * Log an error message without exception (only if verbose mode is enabled).
     */
    public static void error(String msg) {
        error(msg, null);
    }
}
