package com.quarry.formula;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import com.quarry.debug.Debug;
import com.quarry.formula.functions.Category;
import com.quarry.formula.functions.ContextualServices;
import com.quarry.formula.functions.FunctionDefinition;
import com.quarry.formula.functions.FunctionRegistry;
import com.quarry.formula.functions.OfflineContextualServices;
import com.quarry.formula.parser.DependencyAnalyzer;
import com.quarry.formula.parser.EntityRef;
import com.quarry.formula.parser.ErrorKind;
import com.quarry.formula.parser.EvaluationResult;
import com.quarry.formula.parser.Evaluator;
import com.quarry.formula.parser.Expr.FunctionCall;
import com.quarry.formula.parser.FormulaContext;
import com.quarry.formula.parser.FormulaError;
import com.quarry.formula.parser.FormulaException;
import com.quarry.formula.parser.Lexer;
import com.quarry.formula.parser.ParseResult;
import com.quarry.formula.parser.Parser;
import com.quarry.formula.parser.Token;
import com.quarry.formula.parser.Value;

/**
 * Host-facing formula engine.
 *
 * - parseFormula: text -> AST + dependencies, or a structured parse error
 * - createFormulaContext: per-evaluation snapshot of fields, mentions and siblings
 * - evaluateFormula: parse + evaluate, always completing with an {@link EvaluationResult}
 * - hasFunction / listFunctions / listFunctionsByCategory: catalog discovery
 *
 * No public method throws for a bad formula; failures come back as {@link FormulaError}s.
 * An engine is immutable and may be shared across threads.
 */
public class FormulaEngine {

    private static final String TAG = "quarry.formula";

    private final FormulaEngineConfig config;
    private final FunctionRegistry registry;
    private final Evaluator evaluator;

    public FormulaEngine() {
        this(FormulaEngineConfig.defaults());
    }

    public FormulaEngine(FormulaEngineConfig config) {
        this(config, FunctionRegistry.builtins(), new OfflineContextualServices());
    }

    public FormulaEngine(FormulaEngineConfig config, FunctionRegistry registry, ContextualServices services) {
        this.config = (config == null) ? FormulaEngineConfig.defaults() : config;
        this.registry = (registry == null) ? FunctionRegistry.builtins() : registry;
        this.evaluator = new Evaluator(this.registry, services, this.config.zoneId());
    }

    public FormulaEngineConfig config() { return config; }

    public FunctionRegistry registry() { return registry; }

    // ===================== PARSE =====================

    public ParseResult parseFormula(String text) {
        String formula = (text == null) ? "" : text.trim();
        try {
            List<Token> tokens = new Lexer(formula).tokenize();
            Parser parser = new Parser(tokens, config.validateFunctions() ? registry : null, config.maxNestingDepth());
            FunctionCall ast = parser.parse();
            return ParseResult.success(formula, ast, DependencyAnalyzer.dependencies(ast));
        } catch (FormulaException e) {
            Debug.get().d(TAG, "parse failed for \"" + formula + "\": " + e.getMessage());
            return ParseResult.failure(formula, e);
        } catch (RuntimeException e) {
            Debug.get().e(TAG, "unexpected failure parsing \"" + formula + "\"", e);
            return ParseResult.failure(formula,
                    new FormulaException(ErrorKind.PARSE_ERROR, "Internal parser error: " + e, -1, null, -1, e));
        }
    }

    // ===================== CONTEXT =====================

    /** Empty context stamped with the current time and the configured zone. */
    public FormulaContext createFormulaContext() {
        return createFormulaContext(FormulaContext.builder());
    }

    /** Builds the host's context, applying the configured zone when the host set none. */
    public FormulaContext createFormulaContext(FormulaContext.Builder options) {
        FormulaContext.Builder b = (options == null) ? FormulaContext.builder() : options;
        if (!b.hasZone()) b.zone(config.zoneId());
        return b.build();
    }

    // ===================== EVALUATE =====================

    /** Parses and evaluates under the configured timeout. */
    public CompletableFuture<EvaluationResult> evaluateFormula(String text, FormulaContext context) {
        return evaluateFormula(text, context, config.evaluationTimeout());
    }

    public CompletableFuture<EvaluationResult> evaluateFormula(String text, FormulaContext context, Duration timeout) {
        return evaluate(parseFormula(text), context, timeout);
    }

    /** Evaluates an already parsed formula; a failed parse completes with its parse error. */
    public CompletableFuture<EvaluationResult> evaluate(ParseResult parsed, FormulaContext context, Duration timeout) {
        if (parsed == null) {
            FormulaError err = FormulaException.runtime("Nothing to evaluate").toError();
            return CompletableFuture.completedFuture(EvaluationResult.failure(err, Collections.emptySet(), 0));
        }
        if (!parsed.isSuccess()) {
            return CompletableFuture.completedFuture(EvaluationResult.failure(parsed.error(), parsed.dependencies(), 0));
        }
        FormulaContext ctx = (context == null) ? createFormulaContext() : context;
        try {
            return evaluator.evaluate(parsed.ast(), ctx, timeout);
        } catch (RuntimeException e) {
            Debug.get().e(TAG, "unexpected failure evaluating \"" + parsed.formula() + "\"", e);
            FormulaError err = new FormulaException(ErrorKind.RUNTIME_ERROR, "Evaluation failed: " + e, -1, null, -1, e).toError();
            return CompletableFuture.completedFuture(EvaluationResult.failure(err, parsed.dependencies(), 0));
        }
    }

    // ===================== CATALOG =====================

    public boolean hasFunction(String name) {
        return registry.hasFunction(name);
    }

    public List<FunctionDefinition> listFunctions() {
        return registry.listFunctions();
    }

    public Map<Category, List<FunctionDefinition>> listFunctionsByCategory() {
        return registry.byCategory();
    }

    /** Formulas worth offering for this context, most generic first. */
    public List<String> suggestFormulas(FormulaContext context) {
        FormulaContext ctx = (context == null) ? FormulaContext.empty() : context;
        List<String> out = new ArrayList<>();
        out.add("NOW()");
        out.add("TODAY()");

        List<String> places = new ArrayList<>();
        for (EntityRef m : ctx.mentions) {
            if ("place".equalsIgnoreCase(m.type)) places.add(m.label);
        }
        if (places.size() >= 2) {
            out.add("DISTANCE(" + quote(places.get(0)) + ", " + quote(places.get(1)) + ")");
            out.add("ROUTE(" + quote(places.get(0)) + ", " + quote(places.get(1)) + ")");
        }

        List<String> numeric = new ArrayList<>();
        for (Map.Entry<String, Value> e : ctx.fields.entrySet()) {
            if (e.getValue().getType() == Value.Type.NUMBER && e.getKey().matches("[A-Za-z_][A-Za-z0-9_]*")) {
                numeric.add(e.getKey());
            }
        }
        if (numeric.size() >= 2) {
            String args = String.join(", ", numeric);
            out.add("SUM(" + args + ")");
            out.add("AVERAGE(" + args + ")");
        }

        if (!ctx.siblings.isEmpty()) {
            out.add("COUNT(\"siblings\")");
        }
        return out;
    }

    static String quote(String s) {
        return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
