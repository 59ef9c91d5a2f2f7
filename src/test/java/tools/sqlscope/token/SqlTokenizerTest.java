package tools.sqlscope.token;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlTokenizerTest {

    @Test
    void positionsAreOneBasedAcrossCrlf() {
        List<Token> tokens = SqlTokenizer.tokenize("SELECT a\r\n  FROM t");

        assertEquals(4, tokens.size());
        assertEquals(new Token(TokenType.KEYWORD, "SELECT", 1, 1), tokens.get(0));
        assertEquals(new Token(TokenType.IDENTIFIER, "a", 1, 8), tokens.get(1));
        assertEquals(new Token(TokenType.KEYWORD, "FROM", 2, 3), tokens.get(2));
        assertEquals(new Token(TokenType.IDENTIFIER, "t", 2, 8), tokens.get(3));
    }

    @Test
    void loneCarriageReturnCountsAsNewline() {
        List<Token> tokens = SqlTokenizer.tokenize("a\rb\n\nc");

        assertEquals(2, tokens.get(1).line());
        assertEquals(4, tokens.get(2).line());
        assertEquals(1, tokens.get(2).column());
    }

    @Test
    void unterminatedStringRunsToEnd() {
        List<Token> tokens = SqlTokenizer.tokenize("SELECT 'abc");

        Token last = tokens.get(tokens.size() - 1);
        assertEquals(TokenType.STRING, last.type());
        assertEquals("'abc", last.text());
        assertFalse(last.isTerminated());
    }

    @Test
    void escapedQuotesStayInsideString() {
        List<Token> tokens = SqlTokenizer.tokenize("N'it''s' x");

        assertEquals(2, tokens.size());
        assertEquals("N'it''s'", tokens.get(0).text());
        assertTrue(tokens.get(0).isTerminated());
        assertEquals(TokenType.IDENTIFIER, tokens.get(1).type());
    }

    @Test
    void bracketIdentifiersKeepDelimitersInTextOnly() {
        List<Token> tokens = SqlTokenizer.tokenize("[My Table].[My Col]");

        assertEquals(3, tokens.size());
        assertEquals(TokenType.BRACKET_ID, tokens.get(0).type());
        assertEquals("[My Table]", tokens.get(0).text());
        assertEquals("My Table", tokens.get(0).unquotedText());
        assertEquals(TokenType.DOT, tokens.get(1).type());
        assertEquals("My Col", tokens.get(2).unquotedText());
    }

    @Test
    void quotedIdentifierUndoublesEscapes() {
        Token t = SqlTokenizer.tokenize("[a]]b]").get(0);

        assertEquals("a]b", t.unquotedText());
    }

    @Test
    void sessionObjectsAndVariables() {
        List<Token> tokens = SqlTokenizer.tokenize("#t ##g @v @@ROWCOUNT");

        assertEquals(TokenType.TEMP_TABLE, tokens.get(0).type());
        assertEquals("#t", tokens.get(0).text());
        assertEquals(TokenType.TEMP_TABLE, tokens.get(1).type());
        assertEquals("##g", tokens.get(1).text());
        assertEquals(TokenType.VARIABLE, tokens.get(2).type());
        assertEquals(TokenType.GLOBAL_VARIABLE, tokens.get(3).type());
    }

    @Test
    void batchSeparatorIsConfigurable() {
        List<Token> withGo = SqlTokenizer.tokenize("SELECT 1\nGO\nSELECT 2", "GO");
        List<Token> custom = SqlTokenizer.tokenize("SELECT 1\nGO\nSELECT 2", "BATCH");

        assertEquals(TokenType.GO, withGo.get(2).type());
        assertEquals(TokenType.IDENTIFIER, custom.get(2).type());
    }

    @Test
    void nestedBlockCommentIsOneToken() {
        List<Token> tokens = SqlTokenizer.tokenize("/* a /* b */ c */ SELECT");

        assertEquals(2, tokens.size());
        assertEquals(TokenType.COMMENT, tokens.get(0).type());
        assertEquals("/* a /* b */ c */", tokens.get(0).text());
        assertTrue(tokens.get(0).isTerminated());
        assertEquals(TokenType.KEYWORD, tokens.get(1).type());
    }

    @Test
    void minusIsPartOfNumberOnlyWhereAnOperandIsExpected() {
        List<Token> negative = SqlTokenizer.tokenize("x = -5");
        List<Token> subtraction = SqlTokenizer.tokenize("a-5");

        assertEquals(3, negative.size());
        assertEquals(new Token(TokenType.NUMBER, "-5", 1, 5), negative.get(2));
        assertEquals(3, subtraction.size());
        assertEquals(TokenType.OPERATOR, subtraction.get(1).type());
        assertEquals("5", subtraction.get(2).text());
    }

    @Test
    void numbersAndOperators() {
        List<Token> tokens = SqlTokenizer.tokenize("0x1F 1.5e3 .5 a<>b c!=d");

        assertEquals("0x1F", tokens.get(0).text());
        assertEquals("1.5e3", tokens.get(1).text());
        assertEquals(TokenType.NUMBER, tokens.get(2).type());
        assertEquals(new Token(TokenType.OPERATOR, "<>", 1, 16), tokens.get(4));
        assertEquals("!=", tokens.get(7).text());
    }

    @Test
    void keywordsAreCaseInsensitive() {
        List<Token> tokens = SqlTokenizer.tokenize("select * From t");

        assertTrue(tokens.get(0).isKeyword("SELECT"));
        assertEquals(TokenType.STAR, tokens.get(1).type());
        assertTrue(tokens.get(2).isKeyword("from"));
    }

    @Test
    void emptyInputHasNoTokens() {
        assertTrue(SqlTokenizer.tokenize("").isEmpty());
        assertTrue(SqlTokenizer.tokenize(null).isEmpty());
    }
}
