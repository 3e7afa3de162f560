package com.zen.debug;

import java.io.PrintStream;

/**
 * Process-wide debug hub for the Zen lexer, parser and interpreter.
 *
 * Messages go to the installed {@link DebugSink}. Until one is installed they are dropped,
 * and {@link #isEnabled()} lets hot paths skip building the message at all.
 */
public final class Debug {

    // Must be initialized before INSTANCE so the constructor sees it.
    private static final DebugSink DROP = (level, tag, message, error) -> { };

    private static final Debug INSTANCE = new Debug();

    private volatile DebugSink sink = DROP;

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Installs {@code sink}; {@code null} restores the dropping default. */
    public void setSink(DebugSink sink) {
        this.sink = sink == null ? DROP : sink;
    }

    public DebugSink getSink() {
        return sink;
    }

    public boolean isEnabled() {
        return sink != DROP;
    }

    /**
     * Sink that writes "[LEVEL] tag: message" lines, dropping anything below {@code minLevel}.
     */
    public static DebugSink printSink(PrintStream out, DebugLevel minLevel) {
        return (level, tag, message, error) -> {
            if (!level.isAtLeast(minLevel)) return;
            out.println("[" + level + "] " + tag + ": " + message);
            if (error != null) error.printStackTrace(out);
        };
    }

    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN, tag, msg, null); }
    public void w(String tag, String msg, Throwable err) { log(DebugLevel.WARN, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        sink.log(level, tag, message, error);
    }
}
