import com.quarry.formula.parser.DependencyAnalyzer;
import com.quarry.formula.parser.Lexer;
import com.quarry.formula.parser.Parser;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class DependencyAnalyzerTest {

    private static Set<String> deps(String src) {
        return DependencyAnalyzer.dependencies(new Parser(new Lexer(src).tokenize()).parse());
    }

    @Test
    public void get_with_literal_name() {
        assertEquals(Set.of("price"), deps("GET(\"price\")"));
    }

    @Test
    public void bare_field_references() {
        assertEquals(Set.of("price", "tax"), deps("SUM(price, tax)"));
    }

    @Test
    public void literals_only_have_no_dependencies() {
        assertTrue(deps("SUM(1, 2)").isEmpty());
        assertTrue(deps("NOW()").isEmpty());
    }

    @Test
    public void nested_calls_and_mentions() {
        assertEquals(Set.of("price", "Paris", "qty"),
                deps("IF(GT(price, 10), MENTION(\"Paris\"), MULTIPLY(price, qty))"));
    }

    @Test
    public void computed_accessor_argument_depends_on_everything() {
        Set<String> d = deps("GET(CONCAT(\"field_\", n))");
        assertTrue(d.contains(DependencyAnalyzer.ANY_FIELD));
        assertTrue(d.contains("n"));

        assertTrue(deps("get(name)").containsAll(List.of("*", "name")));
    }

    @Test
    public void order_is_first_occurrence() {
        assertEquals(List.of("b", "a"), List.copyOf(deps("SUM(b, a, b)")));
    }

    @Test
    public void null_ast() {
        assertTrue(DependencyAnalyzer.dependencies(null).isEmpty());
    }
}
