package com.quarry.formula;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.quarry.debug.Debug;
import com.quarry.formula.parser.Parser;
import com.quarry.formula.parser.ValueJson;

/**
 * Engine settings. Immutable; build with {@link #builder()} or load from JSON:
 *
 * <pre>
 * {
 *   "evaluationTimeoutMs": 5000,
 *   "maxNestingDepth": 64,
 *   "validateFunctions": true,
 *   "previewDebounceMs": 300,
 *   "zoneId": "UTC"
 * }
 * </pre>
 *
 * Missing keys keep their defaults and unknown keys are ignored.
 */
public final class FormulaEngineConfig {

    public static final String DEFAULT_RESOURCE = "/formula-engine.json";

    private static final String TAG = "quarry.formula";

    private final Duration evaluationTimeout;
    private final int maxNestingDepth;
    private final boolean validateFunctions;
    private final Duration previewDebounce;
    private final ZoneId zoneId;

    private FormulaEngineConfig(Builder b) {
        this.evaluationTimeout = b.evaluationTimeout;
        this.maxNestingDepth = b.maxNestingDepth;
        this.validateFunctions = b.validateFunctions;
        this.previewDebounce = b.previewDebounce;
        this.zoneId = b.zoneId;
    }

    public static FormulaEngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .evaluationTimeout(evaluationTimeout)
                .maxNestingDepth(maxNestingDepth)
                .validateFunctions(validateFunctions)
                .previewDebounce(previewDebounce)
                .zoneId(zoneId);
    }

    public Duration evaluationTimeout() { return evaluationTimeout; }
    public int maxNestingDepth() { return maxNestingDepth; }
    public boolean validateFunctions() { return validateFunctions; }
    public Duration previewDebounce() { return previewDebounce; }
    public ZoneId zoneId() { return zoneId; }

    // ===================== LOADING =====================

    public static FormulaEngineConfig fromJson(String json) {
        if (json == null || json.trim().isEmpty()) return defaults();
        try {
            return fromNode(ValueJson.mapper().readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid engine config JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static FormulaEngineConfig load(InputStream in) throws IOException {
        if (in == null) throw new IllegalArgumentException("input stream must not be null");
        JsonNode root = ValueJson.mapper().readTree(in);
        return (root == null || root.isMissingNode()) ? defaults() : fromNode(root);
    }

    /** Reads {@value #DEFAULT_RESOURCE} from the classpath, or returns the defaults when absent. */
    public static FormulaEngineConfig loadDefault() {
        try (InputStream in = FormulaEngineConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                Debug.get().d(TAG, DEFAULT_RESOURCE + " not found; using default engine config");
                return defaults();
            }
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + DEFAULT_RESOURCE, e);
        }
    }

    static FormulaEngineConfig fromNode(JsonNode root) {
        if (!root.isObject()) throw new IllegalArgumentException("Engine config must be a JSON object");
        Builder b = builder();
        if (root.hasNonNull("evaluationTimeoutMs")) {
            b.evaluationTimeout(Duration.ofMillis(requireLong(root, "evaluationTimeoutMs")));
        }
        if (root.hasNonNull("maxNestingDepth")) {
            b.maxNestingDepth((int) requireLong(root, "maxNestingDepth"));
        }
        if (root.hasNonNull("validateFunctions")) {
            JsonNode n = root.get("validateFunctions");
            if (!n.isBoolean()) throw new IllegalArgumentException("validateFunctions must be a boolean");
            b.validateFunctions(n.booleanValue());
        }
        if (root.hasNonNull("previewDebounceMs")) {
            b.previewDebounce(Duration.ofMillis(requireLong(root, "previewDebounceMs")));
        }
        if (root.hasNonNull("zoneId")) {
            b.zoneId(root.get("zoneId").asText());
        }
        return b.build();
    }

    private static long requireLong(JsonNode root, String key) {
        JsonNode n = root.get(key);
        if (!n.canConvertToLong() || !n.isIntegralNumber()) {
            throw new IllegalArgumentException(key + " must be an integer, got " + n);
        }
        return n.longValue();
    }

    @Override
    public String toString() {
        return "FormulaEngineConfig{timeout=" + evaluationTimeout.toMillis() + "ms, maxDepth=" + maxNestingDepth
                + ", validate=" + validateFunctions + ", debounce=" + previewDebounce.toMillis() + "ms, zone=" + zoneId + "}";
    }

    public static final class Builder {
        private Duration evaluationTimeout = Duration.ofMillis(5000);
        private int maxNestingDepth = Parser.DEFAULT_MAX_DEPTH;
        private boolean validateFunctions = true;
        private Duration previewDebounce = Duration.ofMillis(300);
        private ZoneId zoneId = ZoneId.of("UTC");

        private Builder() {}

        public Builder evaluationTimeout(Duration timeout) {
            if (timeout == null || timeout.isNegative()) {
                throw new IllegalArgumentException("evaluationTimeout must be >= 0");
            }
            this.evaluationTimeout = timeout;
            return this;
        }

        public Builder maxNestingDepth(int depth) {
            if (depth < 1) throw new IllegalArgumentException("maxNestingDepth must be >= 1, got " + depth);
            this.maxNestingDepth = depth;
            return this;
        }

        public Builder validateFunctions(boolean validate) {
            this.validateFunctions = validate;
            return this;
        }

        public Builder previewDebounce(Duration debounce) {
            if (debounce == null || debounce.isNegative()) {
                throw new IllegalArgumentException("previewDebounce must be >= 0");
            }
            this.previewDebounce = debounce;
            return this;
        }

        public Builder zoneId(ZoneId zone) {
            if (zone == null) throw new IllegalArgumentException("zoneId must not be null");
            this.zoneId = zone;
            return this;
        }

        public Builder zoneId(String zone) {
            try {
                return zoneId(ZoneId.of(zone));
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("Unknown zone: " + zone, e);
            }
        }

        public FormulaEngineConfig build() {
            return new FormulaEngineConfig(this);
        }
    }
}
