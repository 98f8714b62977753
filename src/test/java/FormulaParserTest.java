import com.quarry.formula.functions.FunctionRegistry;
import com.quarry.formula.parser.Expr.FieldRef;
import com.quarry.formula.parser.Expr.FunctionCall;
import com.quarry.formula.parser.Expr.Literal;
import com.quarry.formula.parser.FormulaParseException;
import com.quarry.formula.parser.Lexer;
import com.quarry.formula.parser.ParseErrorType;
import com.quarry.formula.parser.Parser;
import com.quarry.formula.parser.Value;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FormulaParserTest {

    private static FunctionCall parse(String src) {
        return new Parser(new Lexer(src).tokenize(), FunctionRegistry.builtins(), Parser.DEFAULT_MAX_DEPTH).parse();
    }

    private static FormulaParseException parseError(String src) {
        return assertThrows(FormulaParseException.class, () -> parse(src));
    }

    @Test
    public void builds_nested_ast() {
        FunctionCall root = parse("IF(GT(price, 50), \"expensive\", \"cheap\")");

        assertEquals("IF", root.name);
        assertEquals(3, root.arguments.size());

        FunctionCall gt = (FunctionCall) root.arguments.get(0);
        assertEquals("GT", gt.name);
        assertEquals("price", ((FieldRef) gt.arguments.get(0)).name);
        assertEquals(Value.number(50), ((Literal) gt.arguments.get(1)).value);
        assertEquals(Value.text("expensive"), ((Literal) root.arguments.get(1)).value);
    }

    @Test
    public void function_names_are_case_insensitive_and_keep_original_spelling() {
        FunctionCall root = parse("sum(1, 2)");
        assertEquals("sum", root.name);
        assertEquals("SUM", root.canonicalName());
    }

    @Test
    public void zero_argument_call() {
        FunctionCall root = parse("NOW()");
        assertTrue(root.arguments.isEmpty());
    }

    @Test
    public void unbalanced_parentheses_checked_first() {
        FormulaParseException e = parseError("SUM(1, 2");
        assertEquals(ParseErrorType.UNBALANCED_PARENTHESES, e.type());
        assertEquals(3, e.position());

        // the balance check wins over the unknown name
        assertEquals(ParseErrorType.UNBALANCED_PARENTHESES, parseError("FOO(1))").type());
    }

    @Test
    public void unknown_function_reports_name_as_written() {
        FormulaParseException e = parseError("FOO(1)");
        assertEquals(ParseErrorType.UNKNOWN_FUNCTION, e.type());
        assertEquals("FOO", e.functionName());
        assertEquals("UnknownFunction", e.code());

        FormulaParseException nested = parseError("SUM(1, bar(2))");
        assertEquals("bar", nested.functionName());
        assertEquals(7, nested.position());
    }

    @Test
    public void invalid_format_when_not_a_call() {
        assertEquals(ParseErrorType.INVALID_FORMAT, parseError("price").type());
        assertEquals(ParseErrorType.INVALID_FORMAT, parseError("42").type());
        assertEquals(ParseErrorType.INVALID_FORMAT, parseError("\"SUM(1)\"").type());
        assertEquals(ParseErrorType.INVALID_FORMAT, parseError("").type());
    }

    @Test
    public void arity_error_carries_bounds() {
        FormulaParseException e = parseError("ROUND()");
        assertEquals(ParseErrorType.ARITY_ERROR, e.type());
        assertEquals(1, e.expectedMin());
        assertEquals(2, e.expectedMax());
        assertEquals(0, e.actual());

        FormulaParseException tooMany = parseError("ABS(1, 2)");
        assertEquals(1, tooMany.expectedMax());
        assertEquals(2, tooMany.actual());

        FormulaParseException variadic = parseError("SUM()");
        assertEquals(-1, variadic.expectedMax());
        assertTrue(variadic.getMessage().contains("at least 1"));
    }

    @Test
    public void if_requires_both_branches() {
        FormulaParseException e = parseError("IF(true, 1)");
        assertEquals(ParseErrorType.ARITY_ERROR, e.type());
        assertEquals(3, e.expectedMin());
        assertEquals(3, e.expectedMax());
        assertEquals(2, e.actual());
    }

    @Test
    public void trailing_tokens_are_rejected() {
        assertEquals(ParseErrorType.UNEXPECTED_TOKEN, parseError("SUM(1) SUM(2)").type());
        assertEquals(ParseErrorType.UNEXPECTED_TOKEN, parseError("SUM(1,)").type());
        assertEquals(ParseErrorType.UNEXPECTED_TOKEN, parseError("SUM(1 2)").type());
    }

    @Test
    public void nesting_limit() {
        StringBuilder deep = new StringBuilder();
        for (int i = 0; i < 5; i++) deep.append("ABS(");
        deep.append("1");
        for (int i = 0; i < 5; i++) deep.append(")");

        Parser shallow = new Parser(new Lexer(deep.toString()).tokenize(), FunctionRegistry.builtins(), 4);
        FormulaParseException e = assertThrows(FormulaParseException.class, shallow::parse);
        assertEquals(ParseErrorType.NESTING_TOO_DEEP, e.type());

        Parser enough = new Parser(new Lexer(deep.toString()).tokenize(), FunctionRegistry.builtins(), 5);
        assertEquals("ABS", enough.parse().name);
    }

    @Test
    public void without_registry_any_name_parses() {
        FunctionCall root = new Parser(new Lexer("FOO(BAR(1), x)").tokenize()).parse();
        assertEquals("FOO", root.name);
        assertEquals("BAR", ((FunctionCall) root.arguments.get(0)).name);
    }
}
