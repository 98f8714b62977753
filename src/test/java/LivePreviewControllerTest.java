import com.quarry.formula.FormulaEngine;
import com.quarry.formula.FormulaEngineConfig;
import com.quarry.formula.functions.Coordinates;
import com.quarry.formula.functions.Invocation;
import com.quarry.formula.functions.OfflineContextualServices;
import com.quarry.formula.parser.FormulaContext;
import com.quarry.formula.parser.Value;
import com.quarry.formula.preview.LivePreviewController;
import com.quarry.formula.preview.PreviewListener;
import com.quarry.formula.preview.PreviewScheduler;
import com.quarry.formula.preview.PreviewState;
import com.quarry.formula.preview.PreviewUpdate;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

public class LivePreviewControllerTest {

    /** Scheduler driven by the test: nothing runs until {@link #runPending()}. */
    static final class ManualScheduler implements PreviewScheduler {
        final List<Task> tasks = new ArrayList<>();

        final class Task implements ScheduledTask {
            final Runnable body;
            final Duration delay;
            boolean cancelled;
            boolean ran;

            Task(Runnable body, Duration delay) {
                this.body = body;
                this.delay = delay;
            }

            @Override
            public void cancel() {
                cancelled = true;
            }
        }

        @Override
        public ScheduledTask schedule(Runnable task, Duration delay) {
            Task t = new Task(task, delay);
            tasks.add(t);
            return t;
        }

        int live() {
            int n = 0;
            for (Task t : tasks) if (!t.cancelled && !t.ran) n++;
            return n;
        }

        void runPending() {
            for (Task t : new ArrayList<>(tasks)) {
                if (!t.cancelled && !t.ran) {
                    t.ran = true;
                    t.body.run();
                }
            }
        }
    }

    static final class RecordingListener implements PreviewListener {
        final List<Long> started = new ArrayList<>();
        final List<PreviewUpdate> published = new ArrayList<>();
        final List<PreviewUpdate> superseded = new ArrayList<>();
        final List<Long> cleared = new ArrayList<>();

        @Override public void onEvaluationStarted(long generation) { started.add(generation); }
        @Override public void onPreview(PreviewUpdate update) { published.add(update); }
        @Override public void onSuperseded(PreviewUpdate discarded) { superseded.add(discarded); }
        @Override public void onCleared(long generation) { cleared.add(generation); }
    }

    static final class PendingServices extends OfflineContextualServices {
        final List<CompletableFuture<Value>> distances = new ArrayList<>();

        @Override
        public CompletableFuture<Value> distance(Invocation call, Coordinates from, Coordinates to) {
            CompletableFuture<Value> f = new CompletableFuture<>();
            distances.add(f);
            return f;
        }
    }

    private static FormulaContext places() {
        return FormulaContext.builder()
                .field("a", Value.map(Map.of("latitude", Value.number(0), "longitude", Value.number(0))))
                .field("b", Value.map(Map.of("latitude", Value.number(0), "longitude", Value.number(1))))
                .build();
    }

    @Test
    public void rapid_edits_publish_only_the_final_formula() {
        ManualScheduler scheduler = new ManualScheduler();
        RecordingListener listener = new RecordingListener();
        LivePreviewController c = new LivePreviewController(new FormulaEngine(), scheduler, FormulaContext::empty, listener);

        c.onTextChanged("S");
        c.onTextChanged("SU");
        c.onTextChanged("SUM(1,2)");
        assertEquals(PreviewState.DEBOUNCING, c.state());
        assertEquals(1, scheduler.live());

        scheduler.runPending();

        assertEquals(1, listener.published.size());
        PreviewUpdate u = listener.published.get(0);
        assertEquals("SUM(1,2)", u.formula());
        assertTrue(u.result().isSuccess());
        assertEquals(Value.number(3), u.result().value());
        assertEquals(3, u.generation());
        assertEquals(PreviewState.SETTLED, u.outcome());
        assertEquals(List.of(3L), listener.started);
        assertTrue(listener.superseded.isEmpty());
        assertEquals(PreviewState.SETTLED, c.state());
        assertSame(u, c.lastSettled());
    }

    @Test
    public void debounce_interval_comes_from_config() {
        ManualScheduler scheduler = new ManualScheduler();
        FormulaEngine engine = new FormulaEngine(FormulaEngineConfig.builder().previewDebounce(Duration.ofMillis(120)).build());
        LivePreviewController c = new LivePreviewController(engine, scheduler, null, null);

        c.onTextChanged("NOW()");
        assertEquals(Duration.ofMillis(120), scheduler.tasks.get(0).delay);
    }

    @Test
    public void parse_error_of_settled_text_is_published() {
        ManualScheduler scheduler = new ManualScheduler();
        RecordingListener listener = new RecordingListener();
        LivePreviewController c = new LivePreviewController(new FormulaEngine(), scheduler, FormulaContext::empty, listener);

        c.onTextChanged("SUM(1,");
        scheduler.runPending();

        assertEquals(1, listener.published.size());
        assertFalse(listener.published.get(0).result().isSuccess());
        assertEquals("UnbalancedParentheses", listener.published.get(0).result().error().code());
        assertTrue(listener.published.get(0).dependencies().isEmpty());
    }

    @Test
    public void older_evaluation_finishing_late_is_discarded() {
        ManualScheduler scheduler = new ManualScheduler();
        RecordingListener listener = new RecordingListener();
        PendingServices services = new PendingServices();
        FormulaEngine engine = new FormulaEngine(FormulaEngineConfig.defaults(), null, services);
        LivePreviewController c = new LivePreviewController(engine, scheduler, LivePreviewControllerTest::places, listener);

        c.onTextChanged("DISTANCE(a, b)");
        scheduler.runPending();
        assertEquals(PreviewState.EVALUATING, c.state());
        assertEquals(1, services.distances.size());

        // edit while the slow evaluation is in flight
        c.onTextChanged("SUM(1,2)");
        assertEquals(PreviewState.DEBOUNCING, c.state());
        scheduler.runPending();
        assertEquals(PreviewState.SETTLED, c.state());
        assertEquals(1, listener.published.size());
        assertEquals(2, listener.published.get(0).generation());

        // generation 1 completes after generation 2 settled
        services.distances.get(0).complete(Value.number(111.2));

        assertEquals(1, listener.published.size());
        assertEquals(1, listener.superseded.size());
        assertEquals(1, listener.superseded.get(0).generation());
        assertEquals(PreviewState.SUPERSEDED, listener.superseded.get(0).outcome());
        assertEquals(PreviewState.SETTLED, c.state());
        assertEquals(Value.number(3), c.lastSettled().result().value());
    }

    @Test
    public void async_result_with_current_generation_settles() {
        ManualScheduler scheduler = new ManualScheduler();
        RecordingListener listener = new RecordingListener();
        PendingServices services = new PendingServices();
        FormulaEngine engine = new FormulaEngine(FormulaEngineConfig.defaults(), null, services);
        LivePreviewController c = new LivePreviewController(engine, scheduler, LivePreviewControllerTest::places, listener);

        c.onTextChanged("DISTANCE(a, b)");
        scheduler.runPending();
        assertTrue(listener.published.isEmpty());

        services.distances.get(0).complete(Value.number(111.2));

        assertEquals(1, listener.published.size());
        assertEquals(Value.number(111.2), listener.published.get(0).result().value());
        assertEquals(Set.of("a", "b"), listener.published.get(0).dependencies());
        assertEquals(PreviewState.SETTLED, c.state());
    }

    @Test
    public void blank_text_clears_and_cancels_pending_timer() {
        ManualScheduler scheduler = new ManualScheduler();
        RecordingListener listener = new RecordingListener();
        LivePreviewController c = new LivePreviewController(new FormulaEngine(), scheduler, FormulaContext::empty, listener);

        c.onTextChanged("SUM(1,2)");
        c.onTextChanged("   ");

        assertEquals(PreviewState.IDLE, c.state());
        assertEquals(0, scheduler.live());
        assertEquals(List.of(2L), listener.cleared);

        scheduler.runPending();
        assertTrue(listener.published.isEmpty());
        assertTrue(listener.started.isEmpty());
    }

    @Test
    public void timer_that_fires_after_a_newer_edit_does_nothing() {
        ManualScheduler scheduler = new ManualScheduler();
        RecordingListener listener = new RecordingListener();
        LivePreviewController c = new LivePreviewController(new FormulaEngine(), scheduler, FormulaContext::empty, listener);

        c.onTextChanged("SUM(1)");
        ManualScheduler.Task first = scheduler.tasks.get(0);
        c.onTextChanged("SUM(2)");

        // simulate the race where cancel() arrives too late
        first.body.run();
        assertTrue(listener.started.isEmpty());
        assertEquals(PreviewState.DEBOUNCING, c.state());
    }

    @Test
    public void close_stops_everything() {
        ManualScheduler scheduler = new ManualScheduler();
        RecordingListener listener = new RecordingListener();
        PendingServices services = new PendingServices();
        FormulaEngine engine = new FormulaEngine(FormulaEngineConfig.defaults(), null, services);
        LivePreviewController c = new LivePreviewController(engine, scheduler, LivePreviewControllerTest::places, listener);

        c.onTextChanged("DISTANCE(a, b)");
        scheduler.runPending();
        c.onTextChanged("SUM(1,2)");
        c.close();

        assertEquals(0, scheduler.live());
        c.onTextChanged("SUM(3,4)");
        assertEquals(0, scheduler.live());

        services.distances.get(0).complete(Value.number(1));
        assertTrue(listener.published.isEmpty());
        assertTrue(listener.superseded.isEmpty());
    }

    @Test
    public void listener_exceptions_do_not_escape() {
        ManualScheduler scheduler = new ManualScheduler();
        PreviewListener throwing = new PreviewListener() {
            @Override
            public void onPreview(PreviewUpdate update) {
                throw new IllegalStateException("ui is gone");
            }

            @Override
            public void onCleared(long generation) {
                throw new IllegalStateException("ui is gone");
            }
        };
        LivePreviewController c = new LivePreviewController(new FormulaEngine(), scheduler, FormulaContext::empty, throwing);

        c.onTextChanged("SUM(1,2)");
        assertDoesNotThrow(scheduler::runPending);
        assertEquals(PreviewState.SETTLED, c.state());

        assertDoesNotThrow(() -> c.onTextChanged(""));
        assertEquals(PreviewState.IDLE, c.state());
    }

    @Test
    public void failing_context_supplier_publishes_error() {
        ManualScheduler scheduler = new ManualScheduler();
        RecordingListener listener = new RecordingListener();
        LivePreviewController c = new LivePreviewController(new FormulaEngine(), scheduler, () -> {
            throw new IllegalStateException("document closed");
        }, listener);

        c.onTextChanged("SUM(1,2)");
        scheduler.runPending();

        assertEquals(1, listener.published.size());
        assertFalse(listener.published.get(0).result().isSuccess());
        assertTrue(listener.published.get(0).result().error().message().contains("document closed"));
    }
}
