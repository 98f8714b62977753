package com.quarry.formula.functions;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import com.quarry.formula.parser.Value;

/**
 * External providers behind the contextual built-ins. Implementations may perform network I/O;
 * the evaluator bounds every returned future with the evaluation timeout, so providers need no
 * timeout of their own. A failed future becomes a RUNTIME_ERROR for the calling function.
 */
public interface ContextualServices {

    /**
     * @param place a mentioned place (MAP) or free text
     * @param date  day the forecast is for
     */
    CompletableFuture<Value> weather(Invocation call, Value place, Instant date);

    /** Route between two places; mode is e.g. "drive", "walk", "bike" or "transit". */
    CompletableFuture<Value> route(Invocation call, Value from, Value to, String mode);

    /** Distance in kilometres. */
    CompletableFuture<Value> distance(Invocation call, Coordinates from, Coordinates to);
}
