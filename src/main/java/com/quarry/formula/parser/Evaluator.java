package com.quarry.formula.parser;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.quarry.debug.Debug;
import com.quarry.debug.DebugLevel;
import com.quarry.formula.functions.ContextualServices;
import com.quarry.formula.functions.FunctionDefinition;
import com.quarry.formula.functions.FunctionRegistry;
import com.quarry.formula.functions.Invocation;
import com.quarry.formula.functions.OfflineContextualServices;
import com.quarry.formula.functions.ParameterSpec;
import com.quarry.formula.parser.Expr.ExprInterface;
import com.quarry.formula.parser.Expr.ExprVisitor;
import com.quarry.formula.parser.Expr.FieldRef;
import com.quarry.formula.parser.Expr.FunctionCall;
import com.quarry.formula.parser.Expr.Literal;

/**
 * Tree-walking evaluator.
 *
 * Arguments are evaluated left to right, one after the other; a call is dispatched only when all
 * of its arguments have resolved. Synchronous built-ins complete inline, so a formula without
 * contextual I/O resolves before {@link #evaluate} returns. Asynchronous built-ins are bounded by
 * whatever is left of the evaluation timeout.
 *
 * The evaluator holds no per-evaluation state and may be shared across threads.
 */
public class Evaluator {

    private static final String TAG = "quarry.formula.eval";

    private final FunctionRegistry registry;
    private final ContextualServices services;
    private final ZoneId defaultZone;

    public Evaluator(FunctionRegistry registry) {
        this(registry, null, null);
    }

    public Evaluator(FunctionRegistry registry, ContextualServices services, ZoneId defaultZone) {
        this.registry = (registry == null) ? FunctionRegistry.builtins() : registry;
        this.services = (services == null) ? new OfflineContextualServices() : services;
        this.defaultZone = (defaultZone == null) ? ZoneId.of("UTC") : defaultZone;
    }

    /**
     * Evaluates the tree against the context. The returned future never completes exceptionally:
     * every failure is reported as a failed {@link EvaluationResult}.
     *
     * @param timeout bound for asynchronous calls; null or non-positive means unbounded
     */
    public CompletableFuture<EvaluationResult> evaluate(ExprInterface ast, FormulaContext context, Duration timeout) {
        final long started = System.nanoTime();
        final Set<String> deps = DependencyAnalyzer.dependencies(ast);
        final FormulaContext ctx = (context == null) ? FormulaContext.empty() : context;

        CompletableFuture<Value> value;
        try {
            if (ast == null) throw FormulaException.runtime("Nothing to evaluate");
            value = ast.accept(new Run(ctx, timeout, started));
        } catch (RuntimeException e) {
            value = failed(e);
        }

        return value.handle((v, err) -> {
            double elapsedMs = (System.nanoTime() - started) / 1_000_000.0;
            if (err == null) {
                return EvaluationResult.success(v, deps, elapsedMs);
            }
            Throwable cause = unwrap(err);
            FormulaException fe;
            if (cause instanceof FormulaException) {
                fe = (FormulaException) cause;
            } else {
                Debug.get().e(TAG, "unexpected failure evaluating " + ast, cause);
                fe = new FormulaException(ErrorKind.RUNTIME_ERROR, "Evaluation failed: " + cause, -1, null, -1, cause);
            }
            Debug.get().w(TAG, "evaluation failed: " + fe.toError().describe());
            return EvaluationResult.failure(fe.toError(), deps, elapsedMs);
        });
    }

    static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }

    private static <T> CompletableFuture<T> failed(Throwable t) {
        CompletableFuture<T> f = new CompletableFuture<>();
        f.completeExceptionally(t);
        return f;
    }

    /** State of one evaluation: its context and deadline. */
    private final class Run implements ExprVisitor<CompletableFuture<Value>> {
        private final FormulaContext context;
        private final long timeoutMillis;
        private final long deadlineNanos;

        Run(FormulaContext context, Duration timeout, long startedNanos) {
            this.context = context;
            boolean bounded = timeout != null && !timeout.isNegative() && !timeout.isZero();
            this.timeoutMillis = bounded ? timeout.toMillis() : -1;
            this.deadlineNanos = bounded ? startedNanos + timeout.toNanos() : Long.MAX_VALUE;
        }

        @Override
        public CompletableFuture<Value> visitLiteralExpr(Literal expr) {
            return CompletableFuture.completedFuture(expr.value);
        }

        @Override
        public CompletableFuture<Value> visitFieldRefExpr(FieldRef expr) {
            return CompletableFuture.completedFuture(context.field(expr.name));
        }

        @Override
        public CompletableFuture<Value> visitFunctionCallExpr(FunctionCall expr) {
            CompletableFuture<List<Value>> args = CompletableFuture.completedFuture(new ArrayList<>());
            for (ExprInterface arg : expr.arguments) {
                args = args.thenCompose(done -> arg.accept(this).thenApply(v -> {
                    done.add(v);
                    return done;
                }));
            }
            return args.thenCompose(values -> dispatch(expr, values));
        }

        private CompletableFuture<Value> dispatch(FunctionCall expr, List<Value> args) {
            String name = expr.canonicalName();
            int pos = expr.position();

            FunctionDefinition def = registry.find(name);
            if (def == null) {
                return failed(new FormulaException(ErrorKind.RUNTIME_ERROR, "Unknown function: " + expr.name, pos, name, -1, null));
            }
            if (!def.acceptsArgumentCount(args.size())) {
                return failed(new FormulaException(ErrorKind.RUNTIME_ERROR,
                        def.signature() + " does not take " + args.size() + " argument(s)", pos, name, -1, null));
            }
            for (int i = 0; i < args.size(); i++) {
                ParameterSpec p = def.parameterFor(i);
                Value v = args.get(i);
                if (p != null && !p.type.accepts(v, p.variadic)) {
                    return failed(new FormulaException(ErrorKind.TYPE_ERROR,
                            "Argument " + (i + 1) + " (" + p.name + ") must be " + p.type.label() + ", got " + v.getType(),
                            pos, name, i, null));
                }
            }

            if (Debug.get().enabled(DebugLevel.TRACE)) {
                Debug.get().t(TAG, "call " + name + args + " at " + pos);
            }
            Invocation call = new Invocation(name, pos, context, services, defaultZone);
            CompletableFuture<Value> result;
            try {
                result = def.invoke(call, args);
            } catch (FormulaException e) {
                return failed(e.attribute(name, pos));
            } catch (RuntimeException e) {
                return failed(new FormulaException(ErrorKind.RUNTIME_ERROR, name + "() failed: " + e.getMessage(), pos, name, -1, e));
            }
            if (result == null) {
                return failed(new FormulaException(ErrorKind.RUNTIME_ERROR, name + "() returned no result", pos, name, -1, null));
            }

            if (def.isAsync()) {
                long remaining = deadlineNanos - System.nanoTime();
                if (remaining <= 0) {
                    return failed(timedOut(name, pos));
                }
                if (deadlineNanos != Long.MAX_VALUE) {
                    // copy, so the provider's own future is left untouched on timeout
                    result = result.copy().orTimeout(remaining, TimeUnit.NANOSECONDS);
                }
            }

            CompletableFuture<Value> out = new CompletableFuture<>();
            result.whenComplete((v, err) -> {
                if (err == null) {
                    out.complete(v == null ? Value.nil() : v);
                } else {
                    out.completeExceptionally(translate(unwrap(err), name, pos));
                }
            });
            return out;
        }

        private FormulaException translate(Throwable cause, String name, int pos) {
            if (cause instanceof FormulaException) {
                return ((FormulaException) cause).attribute(name, pos);
            }
            if (cause instanceof TimeoutException) {
                return timedOut(name, pos);
            }
            String detail = (cause.getMessage() == null) ? cause.getClass().getSimpleName() : cause.getMessage();
            return new FormulaException(ErrorKind.RUNTIME_ERROR, name + "() failed: " + detail, pos, name, -1, cause);
        }

        private FormulaException timedOut(String name, int pos) {
            return new FormulaException(ErrorKind.TIMEOUT_ERROR,
                    name + "() timed out after " + timeoutMillis + " ms", pos, name, -1, null);
        }
    }
}
