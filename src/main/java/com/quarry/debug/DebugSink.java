package com.quarry.debug;

/** Pluggable debug output target (stderr, host UI console, file, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);

    /** Lets callers skip building messages the sink would drop. */
    default boolean accepts(DebugLevel level) {
        return true;
    }
}
