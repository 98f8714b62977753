package com.quarry.formula.preview;

import java.time.Duration;
import java.util.Collections;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import com.quarry.debug.Debug;
import com.quarry.formula.FormulaEngine;
import com.quarry.formula.parser.ErrorKind;
import com.quarry.formula.parser.EvaluationResult;
import com.quarry.formula.parser.FormulaContext;
import com.quarry.formula.parser.FormulaException;
import com.quarry.formula.parser.ParseResult;

/**
 * Debounced parse -> evaluate loop behind a formula editor.
 *
 * Every edit bumps a generation counter and restarts the debounce timer. When the timer fires,
 * the current text is parsed and evaluated; the result is published only if no edit happened
 * in the meantime. In-flight evaluations are never aborted: a stale one runs to completion and
 * is reported through {@link PreviewListener#onSuperseded}.
 */
public final class LivePreviewController implements AutoCloseable {

    private static final String TAG = "quarry.formula.preview";

    private final FormulaEngine engine;
    private final PreviewScheduler scheduler;
    private final Supplier<FormulaContext> contextSupplier;
    private final PreviewListener listener;
    private final Duration debounce;

    private final AtomicLong generation = new AtomicLong();

    // guarded by this
    private PreviewState state = PreviewState.IDLE;
    private PreviewScheduler.ScheduledTask pending;
    private PreviewUpdate lastSettled;
    private boolean closed;

    public LivePreviewController(FormulaEngine engine, PreviewScheduler scheduler,
                                 Supplier<FormulaContext> contextSupplier, PreviewListener listener) {
        this(engine, scheduler, contextSupplier, listener, engine.config().previewDebounce());
    }

    public LivePreviewController(FormulaEngine engine, PreviewScheduler scheduler,
                                 Supplier<FormulaContext> contextSupplier, PreviewListener listener, Duration debounce) {
        if (engine == null) throw new IllegalArgumentException("engine must not be null");
        if (scheduler == null) throw new IllegalArgumentException("scheduler must not be null");
        this.engine = engine;
        this.scheduler = scheduler;
        this.contextSupplier = (contextSupplier == null) ? engine::createFormulaContext : contextSupplier;
        this.listener = (listener == null) ? new PreviewListener() {} : listener;
        this.debounce = (debounce == null) ? engine.config().previewDebounce() : debounce;
    }

    /** Feeds the editor's current text. Blank text clears the preview immediately. */
    public void onTextChanged(String text) {
        long gen;
        boolean cleared;
        synchronized (this) {
            if (closed) return;
            gen = generation.incrementAndGet();
            cancelPending();
            cleared = (text == null || text.trim().isEmpty());
            if (cleared) {
                state = PreviewState.IDLE;
            } else {
                state = PreviewState.DEBOUNCING;
                final String formula = text;
                pending = scheduler.schedule(() -> fire(gen, formula), debounce);
            }
        }
        if (cleared) {
            notifyCleared(gen);
        }
    }

    public synchronized PreviewState state() {
        return state;
    }

    /** Latest issued generation. */
    public long generation() {
        return generation.get();
    }

    /** Last published update, or null. */
    public synchronized PreviewUpdate lastSettled() {
        return lastSettled;
    }

    /** Cancels the pending timer; later edits are ignored. In-flight evaluations finish unobserved. */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) return;
            closed = true;
            cancelPending();
            generation.incrementAndGet();
        }
        Debug.get().d(TAG, "live preview closed");
    }

    private void cancelPending() {
        if (pending != null) {
            pending.cancel();
            pending = null;
        }
    }

    void fire(long gen, String formula) {
        synchronized (this) {
            // a timer that lost a race with cancel() still runs; ignore it
            if (closed || gen != generation.get()) return;
            pending = null;
            state = PreviewState.EVALUATING;
        }
        notifyStarted(gen);

        ParseResult parsed = engine.parseFormula(formula);
        CompletableFuture<EvaluationResult> future;
        try {
            FormulaContext ctx = contextSupplier.get();
            future = engine.evaluate(parsed, ctx, engine.config().evaluationTimeout());
        } catch (RuntimeException e) {
            Debug.get().e(TAG, "context supplier failed", e);
            EvaluationResult failed = EvaluationResult.failure(
                    new FormulaException(ErrorKind.RUNTIME_ERROR, "Context unavailable: " + e.getMessage(), -1, null, -1, e).toError(),
                    parsed.dependencies(), 0);
            future = CompletableFuture.completedFuture(failed);
        }
        future.whenComplete((result, err) -> {
            EvaluationResult r = result;
            if (err != null) {
                Debug.get().e(TAG, "evaluation future failed for generation " + gen, err);
                r = EvaluationResult.failure(
                        new FormulaException(ErrorKind.RUNTIME_ERROR, "Evaluation failed: " + err, -1, null, -1, err).toError(),
                        parsed.dependencies(), 0);
            }
            complete(gen, parsed, r);
        });
    }

    private void complete(long gen, ParseResult parsed, EvaluationResult result) {
        PreviewUpdate update;
        synchronized (this) {
            if (closed) return;
            boolean current = gen == generation.get();
            update = new PreviewUpdate(gen, parsed.formula(), result,
                    parsed.isSuccess() ? parsed.dependencies() : Collections.<String>emptySet(),
                    current ? PreviewState.SETTLED : PreviewState.SUPERSEDED);
            if (current) {
                state = PreviewState.SETTLED;
                lastSettled = update;
            }
        }
        if (update.outcome() == PreviewState.SETTLED) {
            notifyPreview(update);
        } else {
            Debug.get().d(TAG, "discarding stale result for generation " + gen + " (latest " + generation.get() + ")");
            notifySuperseded(update);
        }
    }

    private void notifyStarted(long gen) {
        try {
            listener.onEvaluationStarted(gen);
        } catch (RuntimeException e) {
            Debug.get().e(TAG, "listener.onEvaluationStarted threw", e);
        }
    }

    private void notifyPreview(PreviewUpdate update) {
        try {
            listener.onPreview(update);
        } catch (RuntimeException e) {
            Debug.get().e(TAG, "listener.onPreview threw", e);
        }
    }

    private void notifySuperseded(PreviewUpdate update) {
        try {
            listener.onSuperseded(update);
        } catch (RuntimeException e) {
            Debug.get().e(TAG, "listener.onSuperseded threw", e);
        }
    }

    private void notifyCleared(long gen) {
        try {
            listener.onCleared(gen);
        } catch (RuntimeException e) {
            Debug.get().e(TAG, "listener.onCleared threw", e);
        }
    }
}
