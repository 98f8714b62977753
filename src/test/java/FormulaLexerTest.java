import com.quarry.formula.parser.ErrorKind;
import com.quarry.formula.parser.FormulaException;
import com.quarry.formula.parser.Lexer;
import com.quarry.formula.parser.Token;
import com.quarry.formula.parser.TokenType;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FormulaLexerTest {

    private static List<TokenType> types(String src) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : new Lexer(src).tokenize()) out.add(t.type);
        return out;
    }

    @Test
    public void tokenizes_call_with_every_literal_kind() {
        List<Token> tokens = new Lexer("IF(flag, \"yes\", -1.5, true)").tokenize();

        assertEquals(List.of(
                TokenType.IDENTIFIER, TokenType.LEFT_PAREN,
                TokenType.IDENTIFIER, TokenType.COMMA,
                TokenType.STRING, TokenType.COMMA,
                TokenType.NUMBER, TokenType.COMMA,
                TokenType.BOOLEAN, TokenType.RIGHT_PAREN,
                TokenType.EOF), types("IF(flag, \"yes\", -1.5, true)"));

        assertEquals("IF", tokens.get(0).lexeme);
        assertEquals("yes", tokens.get(4).literal);
        assertEquals(-1.5, (Double) tokens.get(6).literal, 0.0);
        assertEquals(Boolean.TRUE, tokens.get(8).literal);
    }

    @Test
    public void positions_are_character_offsets() {
        List<Token> tokens = new Lexer("  SUM( a ,b)").tokenize();
        assertEquals(2, tokens.get(0).position);
        assertEquals(5, tokens.get(1).position);
        assertEquals(7, tokens.get(2).position);
        assertEquals(9, tokens.get(3).position);
        assertEquals(10, tokens.get(4).position);
        assertEquals(12, tokens.get(tokens.size() - 1).position);
    }

    @Test
    public void string_escapes() {
        List<Token> tokens = new Lexer("\"say \\\"hi\\\"\\n\"").tokenize();
        assertEquals(TokenType.STRING, tokens.get(0).type);
        assertEquals("say \"hi\"\n", tokens.get(0).literal);
    }

    @Test
    public void true_and_false_are_reserved_but_case_sensitive() {
        assertEquals(TokenType.BOOLEAN, new Lexer("false").tokenize().get(0).type);
        assertEquals(TokenType.IDENTIFIER, new Lexer("True").tokenize().get(0).type);
        assertEquals(TokenType.IDENTIFIER, new Lexer("true_flag").tokenize().get(0).type);
    }

    @Test
    public void invalid_character_is_lex_error_with_position() {
        FormulaException e = assertThrows(FormulaException.class, () -> new Lexer("SUM(1 + 2)").tokenize());
        assertEquals(ErrorKind.LEX_ERROR, e.kind());
        assertEquals(6, e.position());
        assertTrue(e.getMessage().contains("'+'"));
    }

    @Test
    public void lone_minus_is_lex_error() {
        FormulaException e = assertThrows(FormulaException.class, () -> new Lexer("ABS(-x)").tokenize());
        assertEquals(ErrorKind.LEX_ERROR, e.kind());
        assertEquals(4, e.position());
    }

    @Test
    public void unterminated_string_is_lex_error() {
        FormulaException e = assertThrows(FormulaException.class, () -> new Lexer("UPPER(\"abc)").tokenize());
        assertEquals(ErrorKind.LEX_ERROR, e.kind());
        assertEquals(6, e.position());
    }

    @Test
    public void number_needs_digits_after_dot() {
        // "1." lexes as NUMBER 1 followed by an invalid '.'
        FormulaException e = assertThrows(FormulaException.class, () -> new Lexer("ABS(1.)").tokenize());
        assertEquals(5, e.position());
    }
}
