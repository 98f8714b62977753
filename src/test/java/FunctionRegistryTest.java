import com.quarry.formula.functions.Category;
import com.quarry.formula.functions.FunctionDefinition;
import com.quarry.formula.functions.FunctionRegistry;
import com.quarry.formula.functions.ParamType;
import com.quarry.formula.functions.ParameterSpec;
import com.quarry.formula.parser.Value;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FunctionRegistryTest {

    private static FunctionDefinition twice() {
        return FunctionDefinition.builder("Twice", Category.MATH)
                .param(ParameterSpec.required("value", ParamType.NUMBER, "Number to double"))
                .sync((call, args) -> Value.number(args.get(0).asNumber() * 2))
                .build();
    }

    @Test
    public void lookup_is_case_insensitive() {
        FunctionRegistry r = FunctionRegistry.builtins();
        assertTrue(r.hasFunction("sum"));
        assertTrue(r.hasFunction("Sum"));
        assertTrue(r.hasFunction(" SUM "));
        assertFalse(r.hasFunction("SUMM"));
        assertFalse(r.hasFunction(null));
        assertEquals("SUM", r.find("sum").canonicalName());
    }

    @Test
    public void duplicate_registration_is_rejected() {
        FunctionRegistry.Builder b = FunctionRegistry.builder().register(twice());
        assertThrows(IllegalArgumentException.class, () -> b.register(twice()));
        assertThrows(IllegalArgumentException.class, () -> FunctionRegistry.builder().withBuiltins().withBuiltins());
    }

    @Test
    public void custom_registry_extends_builtins() {
        FunctionRegistry r = FunctionRegistry.builder().withBuiltins().register(twice()).build();
        assertEquals(FunctionRegistry.builtins().size() + 1, r.size());
        assertTrue(r.hasFunction("twice"));
        assertFalse(FunctionRegistry.builtins().hasFunction("twice"));
    }

    @Test
    public void categories_group_in_registration_order() {
        Map<Category, List<FunctionDefinition>> byCat = FunctionRegistry.builtins().byCategory();
        assertEquals(6, byCat.size());
        assertEquals("SUM", byCat.get(Category.MATH).get(0).canonicalName());
        for (Map.Entry<Category, List<FunctionDefinition>> e : byCat.entrySet()) {
            for (FunctionDefinition def : e.getValue()) assertEquals(e.getKey(), def.category());
        }
    }

    @Test
    public void signatures_mark_optional_and_variadic_parameters() {
        FunctionRegistry r = FunctionRegistry.builtins();
        assertEquals("Round(value, [decimals])", r.find("ROUND").signature());
        assertEquals("Sum(values...)", r.find("SUM").signature());
        assertEquals("Now()", r.find("NOW").signature());
    }

    @Test
    public void argument_count_bounds() {
        FunctionDefinition round = FunctionRegistry.builtins().find("ROUND");
        assertEquals(1, round.minArgs());
        assertEquals(2, round.maxArgs());
        assertFalse(round.acceptsArgumentCount(0));
        assertTrue(round.acceptsArgumentCount(2));
        assertFalse(round.acceptsArgumentCount(3));

        FunctionDefinition sum = FunctionRegistry.builtins().find("SUM");
        assertEquals(-1, sum.maxArgs());
        assertTrue(sum.acceptsArgumentCount(100));
        assertSame(sum.parameters().get(0), sum.parameterFor(7));
        assertNull(round.parameterFor(5));
    }

    @Test
    public void parameter_ordering_is_validated() {
        assertThrows(IllegalArgumentException.class, () -> FunctionDefinition.builder("Bad", Category.MATH)
                .param(ParameterSpec.variadic("rest", ParamType.ANY, ""))
                .param(ParameterSpec.required("x", ParamType.ANY, "")));
        assertThrows(IllegalArgumentException.class, () -> FunctionDefinition.builder("Bad", Category.MATH)
                .param(ParameterSpec.optional("x", ParamType.ANY, "", Value.nil()))
                .param(ParameterSpec.required("y", ParamType.ANY, "")));
        assertThrows(IllegalArgumentException.class, () -> FunctionDefinition.builder("1bad", Category.MATH));
        assertThrows(IllegalStateException.class, () -> FunctionDefinition.builder("NoImpl", Category.MATH).build());
    }

    @Test
    public void async_flag_follows_implementation() {
        FunctionRegistry r = FunctionRegistry.builtins();
        assertTrue(r.find("WEATHER").isAsync());
        assertTrue(r.find("DISTANCE").isAsync());
        assertFalse(r.find("GET").isAsync());
    }
}
