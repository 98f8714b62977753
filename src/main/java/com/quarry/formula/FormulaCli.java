package com.quarry.formula;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quarry.debug.Debug;
import com.quarry.debug.DebugLevel;
import com.quarry.formula.functions.FunctionDefinition;
import com.quarry.formula.functions.FunctionRegistry;
import com.quarry.formula.functions.ParameterSpec;
import com.quarry.formula.parser.EvaluationResult;
import com.quarry.formula.parser.FormulaContext;
import com.quarry.formula.parser.ValueJson;

/**
 * Command line front end.
 *
 * <pre>
 *   FormulaCli &lt;formula&gt; [context.json]   evaluate and print the result as JSON
 *   FormulaCli --functions                 print the function catalog as JSON
 * </pre>
 *
 * Exit codes: 0 success, 1 formula error, 2 usage error, 3 unreadable context file.
 */
public final class FormulaCli {

    static final int OK = 0;
    static final int FORMULA_ERROR = 1;
    static final int USAGE = 2;
    static final int BAD_CONTEXT = 3;

    public static void main(String[] args) {
        // stdout carries the JSON result; diagnostics go to stderr
        Debug.useStdErr(DebugLevel.WARN);
        System.exit(run(args, System.out, System.err));
    }

    public static int run(String[] args, PrintStream out, PrintStream err) {
        if (args == null || args.length < 1 || args.length > 2) {
            err.println("Usage: FormulaCli <formula> [context.json] | FormulaCli --functions");
            return USAGE;
        }

        FormulaEngine engine = new FormulaEngine(FormulaEngineConfig.loadDefault());

        if ("--functions".equals(args[0])) {
            if (args.length != 1) {
                err.println("Usage: FormulaCli --functions");
                return USAGE;
            }
            out.println(pretty(catalogJson(engine.registry())));
            return OK;
        }

        FormulaContext.Builder options = FormulaContext.builder();
        if (args.length == 2) {
            Path contextPath = Path.of(args[1]);
            try {
                JsonNode root = ValueJson.mapper().readTree(Files.readString(contextPath, StandardCharsets.UTF_8));
                options = FormulaContext.fromJson(root);
            } catch (IOException | IllegalArgumentException e) {
                err.println("Failed to read context file: " + contextPath + " (" + e.getMessage() + ")");
                return BAD_CONTEXT;
            }
        }

        EvaluationResult result = engine.evaluateFormula(args[0], engine.createFormulaContext(options)).join();
        out.println(result.toJsonString());
        return result.isSuccess() ? OK : FORMULA_ERROR;
    }

    /** Catalog as a JSON array, one object per function in registry order. */
    public static ArrayNode catalogJson(FunctionRegistry registry) {
        ArrayNode arr = ValueJson.mapper().createArrayNode();
        for (FunctionDefinition def : registry.listFunctions()) {
            ObjectNode fn = arr.addObject();
            fn.put("name", def.canonicalName());
            fn.put("category", def.category().displayName());
            fn.put("signature", def.signature());
            fn.put("description", def.description());
            fn.put("example", def.example());
            fn.put("returns", def.returnType());
            fn.put("async", def.isAsync());
            ArrayNode params = fn.putArray("parameters");
            for (ParameterSpec p : def.parameters()) {
                ObjectNode pn = params.addObject();
                pn.put("name", p.name);
                pn.put("type", p.typeLabel());
                pn.put("required", p.required);
                pn.put("description", p.description);
                if (p.defaultValue != null) pn.set("default", ValueJson.toJson(p.defaultValue));
            }
        }
        return arr;
    }

    private static String pretty(JsonNode node) {
        try {
            return ValueJson.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("catalog is not serializable", e);
        }
    }

    private FormulaCli() {}
}
