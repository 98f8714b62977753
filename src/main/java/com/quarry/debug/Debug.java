package com.quarry.debug;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Global debug hub for the formula engine.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...); no-op until one is installed
 * - A sink that throws never reaches the caller
 */
public final class Debug {

    private static final Debug INSTANCE = new Debug();

    private static final DebugSink NOOP = new DebugSink() {
        @Override
        public void log(DebugLevel level, String tag, String message, Throwable error) {
        }

        @Override
        public boolean accepts(DebugLevel level) {
            return false;
        }
    };

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Installs a console sink writing messages at or above minLevel to stderr. */
    public static void useStdErr(final DebugLevel minLevel) {
        INSTANCE.setSink(new DebugSink() {
            @Override
            public void log(DebugLevel level, String tag, String message, Throwable error) {
                if (!accepts(level)) return;
                PrintStream out = System.err;
                out.println("[" + level + "][" + tag + "] " + message);
                if (error != null) error.printStackTrace(out);
            }

            @Override
            public boolean accepts(DebugLevel level) {
                return level.ordinal() >= minLevel.ordinal();
            }
        });
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    /** True when the installed sink wants messages at this level. */
    public boolean enabled(DebugLevel level) {
        return sinkRef.get().accepts(level);
    }

    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        DebugSink sink = sinkRef.get();
        try {
            if (sink.accepts(level)) sink.log(level, tag, message, error);
        } catch (RuntimeException sinkFailure) {
            System.err.println("[Debug] sink failed: " + sinkFailure);
        }
    }
}
