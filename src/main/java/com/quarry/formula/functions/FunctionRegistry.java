package com.quarry.formula.functions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.quarry.debug.Debug;

/**
 * Immutable catalog of formula functions keyed by upper-cased name.
 *
 * The built-in catalog is created once per process ({@link #builtins()}) and never mutated
 * afterwards, so concurrent evaluations share it without locking.
 */
public final class FunctionRegistry {

    private static final String TAG = "quarry.formula";

    private final Map<String, FunctionDefinition> byName;
    private final List<FunctionDefinition> ordered;

    private FunctionRegistry(Map<String, FunctionDefinition> byName) {
        this.byName = Collections.unmodifiableMap(new LinkedHashMap<>(byName));
        this.ordered = Collections.unmodifiableList(new ArrayList<>(byName.values()));
    }

    private static final class BuiltinsHolder {
        static final FunctionRegistry INSTANCE = buildBuiltins();

        private static FunctionRegistry buildBuiltins() {
            FunctionRegistry r = builder().withBuiltins().build();
            Debug.get().d(TAG, "built-in function registry ready: " + r.size() + " functions");
            return r;
        }
    }

    /** The process-wide built-in catalog. */
    public static FunctionRegistry builtins() {
        return BuiltinsHolder.INSTANCE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Case-insensitive existence check. */
    public boolean hasFunction(String name) {
        return find(name) != null;
    }

    /** Case-insensitive lookup; null when absent. */
    public FunctionDefinition find(String name) {
        if (name == null) return null;
        return byName.get(name.trim().toUpperCase(Locale.ROOT));
    }

    /** All definitions in registration order (grouped by category for the built-ins). */
    public List<FunctionDefinition> listFunctions() {
        return ordered;
    }

    public Map<Category, List<FunctionDefinition>> byCategory() {
        Map<Category, List<FunctionDefinition>> out = new EnumMap<>(Category.class);
        for (FunctionDefinition def : ordered) {
            out.computeIfAbsent(def.category(), c -> new ArrayList<>()).add(def);
        }
        for (Map.Entry<Category, List<FunctionDefinition>> e : out.entrySet()) {
            e.setValue(Collections.unmodifiableList(e.getValue()));
        }
        return Collections.unmodifiableMap(out);
    }

    public int size() {
        return ordered.size();
    }

    public static final class Builder {
        private final Map<String, FunctionDefinition> defs = new LinkedHashMap<>();

        private Builder() {}

        public Builder register(FunctionDefinition def) {
            if (def == null) throw new IllegalArgumentException("definition must not be null");
            String key = def.canonicalName();
            if (defs.containsKey(key)) {
                throw new IllegalArgumentException("Function already registered: " + def.name());
            }
            defs.put(key, def);
            return this;
        }

        /** Adds every built-in category. */
        public Builder withBuiltins() {
            MathFunctions.register(this);
            TextFunctions.register(this);
            DateTimeFunctions.register(this);
            LogicFunctions.register(this);
            AggregateFunctions.register(this);
            ContextualFunctions.register(this);
            return this;
        }

        public FunctionRegistry build() {
            return new FunctionRegistry(defs);
        }
    }
}
