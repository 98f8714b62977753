package com.quarry.formula.functions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

import com.quarry.formula.parser.Value;

/**
 * Immutable catalog entry for one built-in function.
 *
 * Synchronous implementations run inline; asynchronous ones return a future that the evaluator
 * awaits under the evaluation timeout.
 */
public final class FunctionDefinition {

    /** Synchronous built-in. */
    public interface BuiltinFunction {
        Value call(Invocation call, List<Value> args);
    }

    /** Built-in that may perform I/O. */
    public interface AsyncBuiltinFunction {
        CompletableFuture<Value> call(Invocation call, List<Value> args);
    }

    private final String name;
    private final Category category;
    private final String description;
    private final String example;
    private final String returnType;
    private final List<ParameterSpec> parameters;
    private final BuiltinFunction syncImpl;
    private final AsyncBuiltinFunction asyncImpl;
    private final int minArgs;
    private final int maxArgs;

    private FunctionDefinition(Builder b) {
        this.name = b.name;
        this.category = b.category;
        this.description = b.description;
        this.example = b.example;
        this.returnType = b.returnType;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(b.parameters));
        this.syncImpl = b.syncImpl;
        this.asyncImpl = b.asyncImpl;

        int required = 0;
        boolean variadic = false;
        for (ParameterSpec p : parameters) {
            if (p.required) required++;
            if (p.variadic) variadic = true;
        }
        this.minArgs = required;
        this.maxArgs = variadic ? -1 : parameters.size();
    }

    public static Builder builder(String name, Category category) {
        return new Builder(name, category);
    }

    public String name() { return name; }

    /** Registry key: the upper-cased name. */
    public String canonicalName() { return name.toUpperCase(Locale.ROOT); }

    public Category category() { return category; }
    public String description() { return description; }
    public String example() { return example; }
    public String returnType() { return returnType; }
    public List<ParameterSpec> parameters() { return parameters; }
    public boolean isAsync() { return asyncImpl != null; }
    public int minArgs() { return minArgs; }

    /** Maximum argument count, or -1 when the last parameter is variadic. */
    public int maxArgs() { return maxArgs; }

    public boolean acceptsArgumentCount(int count) {
        return count >= minArgs && (maxArgs < 0 || count <= maxArgs);
    }

    /** Parameter governing the argument at the given index, or null if there is none. */
    public ParameterSpec parameterFor(int index) {
        if (index < parameters.size()) return parameters.get(index);
        if (!parameters.isEmpty() && parameters.get(parameters.size() - 1).variadic) {
            return parameters.get(parameters.size() - 1);
        }
        return null;
    }

    /** Signature as shown in autocomplete, e.g. "Round(value, [decimals])". */
    public String signature() {
        StringBuilder sb = new StringBuilder(name).append('(');
        for (int i = 0; i < parameters.size(); i++) {
            ParameterSpec p = parameters.get(i);
            if (i > 0) sb.append(", ");
            if (!p.required) sb.append('[');
            sb.append(p.name);
            if (p.variadic) sb.append("...");
            if (!p.required) sb.append(']');
        }
        return sb.append(')').toString();
    }

    /**
     * Runs the implementation. Omitted optional arguments that declare a default are filled in
     * first, so implementations always see them.
     */
    public CompletableFuture<Value> invoke(Invocation call, List<Value> args) {
        List<Value> full = withDefaults(args);
        if (asyncImpl != null) {
            return asyncImpl.call(call, full);
        }
        return CompletableFuture.completedFuture(syncImpl.call(call, full));
    }

    private List<Value> withDefaults(List<Value> args) {
        if (args.size() >= parameters.size()) return Collections.unmodifiableList(new ArrayList<>(args));
        List<Value> out = new ArrayList<>(args);
        for (int i = args.size(); i < parameters.size(); i++) {
            Value def = parameters.get(i).defaultValue;
            if (def == null) break;
            out.add(def);
        }
        return Collections.unmodifiableList(out);
    }

    @Override
    public String toString() {
        return signature();
    }

    public static final class Builder {
        private final String name;
        private final Category category;
        private String description = "";
        private String example = "";
        private String returnType = "any";
        private final List<ParameterSpec> parameters = new ArrayList<>();
        private BuiltinFunction syncImpl;
        private AsyncBuiltinFunction asyncImpl;

        private Builder(String name, Category category) {
            if (name == null || !name.matches("[A-Za-z_][A-Za-z0-9_]*")) {
                throw new IllegalArgumentException("Invalid function name: " + name);
            }
            if (category == null) throw new IllegalArgumentException("category must not be null");
            this.name = name;
            this.category = category;
        }

        public Builder description(String description) { this.description = description; return this; }
        public Builder example(String example) { this.example = example; return this; }
        public Builder returns(String returnType) { this.returnType = returnType; return this; }

        public Builder param(ParameterSpec spec) {
            if (!parameters.isEmpty() && parameters.get(parameters.size() - 1).variadic) {
                throw new IllegalArgumentException(name + ": variadic parameter must be last");
            }
            if (spec.required && !parameters.isEmpty() && !parameters.get(parameters.size() - 1).required) {
                throw new IllegalArgumentException(name + ": required parameter after optional one");
            }
            parameters.add(spec);
            return this;
        }

        public Builder sync(BuiltinFunction impl) { this.syncImpl = impl; this.asyncImpl = null; return this; }
        public Builder async(AsyncBuiltinFunction impl) { this.asyncImpl = impl; this.syncImpl = null; return this; }

        public FunctionDefinition build() {
            if (syncImpl == null && asyncImpl == null) {
                throw new IllegalStateException(name + ": no implementation");
            }
            return new FunctionDefinition(this);
        }
    }
}
