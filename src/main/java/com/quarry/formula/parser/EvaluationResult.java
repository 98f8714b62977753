package com.quarry.formula.parser;

import java.time.Instant;
import java.util.Collections;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

public final class EvaluationResult {
    private final boolean success;
    private final Value value;
    private final FormulaError error;
    private final double evaluationTimeMs;
    private final Set<String> dependencies;
    private final Instant evaluatedAt;

    private EvaluationResult(boolean success, Value value, FormulaError error, double evaluationTimeMs,
                             Set<String> dependencies, Instant evaluatedAt) {
        this.success = success;
        this.value = value;
        this.error = error;
        this.evaluationTimeMs = evaluationTimeMs;
        this.dependencies = (dependencies == null) ? Collections.emptySet() : dependencies;
        this.evaluatedAt = (evaluatedAt == null) ? Instant.now() : evaluatedAt;
    }

    public static EvaluationResult success(Value value, Set<String> dependencies, double evaluationTimeMs) {
        return new EvaluationResult(true, value == null ? Value.nil() : value, null, evaluationTimeMs, dependencies, Instant.now());
    }

    public static EvaluationResult failure(FormulaError error, Set<String> dependencies, double evaluationTimeMs) {
        return new EvaluationResult(false, null, error, evaluationTimeMs, dependencies, Instant.now());
    }

    public boolean isSuccess() { return success; }

    /** Value, or null when the evaluation failed. */
    public Value value() { return value; }

    /** Error, or null when the evaluation succeeded. */
    public FormulaError error() { return error; }

    public double evaluationTimeMs() { return evaluationTimeMs; }
    public Set<String> dependencies() { return dependencies; }
    public Instant evaluatedAt() { return evaluatedAt; }

    public ObjectNode toJson() {
        ObjectNode out = ValueJson.mapper().createObjectNode();
        out.put("success", success);
        if (success) {
            out.set("value", ValueJson.toJson(value));
        } else {
            ObjectNode err = out.putObject("error");
            err.put("kind", error.kind().name());
            err.put("code", error.code());
            err.put("message", error.message());
            if (error.position() >= 0) err.put("position", error.position());
            if (error.functionName() != null) err.put("function", error.functionName());
            if (error.argumentIndex() >= 0) err.put("argumentIndex", error.argumentIndex());
        }
        out.put("evaluationTimeMs", evaluationTimeMs);
        ArrayNode deps = out.putArray("dependencies");
        for (String d : dependencies) deps.add(d);
        out.put("evaluatedAt", evaluatedAt.toString());
        return out;
    }

    public String toJsonString() {
        try {
            return ValueJson.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(toJson());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("EvaluationResult is not serializable: " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return success ? "EvaluationResult[ok " + value + "]" : "EvaluationResult[" + error + "]";
    }
}
