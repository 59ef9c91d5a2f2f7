package tools.sqlscope.context;

import org.junit.jupiter.api.Test;
import tools.sqlscope.Cursor;
import tools.sqlscope.parser.TableReference;
import tools.sqlscope.token.SqlTokenizer;
import tools.sqlscope.token.Token;
import tools.sqlscope.token.TokenNavigator;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SubqueryBoundaryDetectorTest {

    private static SubqueryDetection detect(String marked) {
        Cursor c = Cursor.of(marked);
        return SubqueryBoundaryDetector.detectUnparsed(SqlTokenizer.tokenize(c.text()), c.line(), c.column());
    }

    private static List<String> aliases(List<TableReference> tables) {
        return tables.stream().map(TableReference::alias).toList();
    }

    @Test
    void detectsSubqueryInsideExists() {
        SubqueryDetection d = detect("IF EXISTS (SELECT 1 FROM Orders o WHERE o.|)");

        assertTrue(d.inSubquery());
        assertEquals(1, d.tables().size());
        TableReference orders = d.tables().get(0);
        assertEquals("Orders", orders.name());
        assertEquals("o", orders.alias());
    }

    @Test
    void functionCallParenIsNotASubquery() {
        SubqueryDetection d = detect("SELECT * FROM t WHERE v > AVG(SELECT x FROM u WHERE |)");

        assertFalse(d.inSubquery());
        assertTrue(d.tables().isEmpty());

        Cursor c = Cursor.of("SELECT AVG(SELECT x FROM u WHERE |)");
        assertNull(SubqueryBoundaryDetector.findSubqueryBounds(SqlTokenizer.tokenize(c.text()), c.line(), c.column()));
    }

    @Test
    void cteBodyIsNotAnUnparsedSubquery() {
        assertFalse(detect("WITH c AS (SELECT a FROM t WHERE |) SELECT * FROM c").inSubquery());
    }

    @Test
    void stopsAtStatementStarters() {
        assertFalse(detect("INSERT INTO t VALUES (|").inSubquery());
        assertFalse(detect("SELECT a FROM t WHERE |").inSubquery());
    }

    @Test
    void boundsOfTerminatedAndOpenSubqueries() {
        Cursor closed = Cursor.of("IF EXISTS (SELECT * FROM t WHERE |) PRINT 1");
        Cursor open = Cursor.of("IF EXISTS (SELECT * FROM t WHERE |");

        List<Token> closedTokens = SqlTokenizer.tokenize(closed.text());
        SubquerySpan span = SubqueryBoundaryDetector.findSubqueryBounds(closedTokens, closed.line(), closed.column());
        assertNotNull(span);
        assertEquals(2, span.startIndex());
        assertEquals(8, span.endIndex());
        assertTrue(span.terminated());

        List<Token> openTokens = SqlTokenizer.tokenize(open.text());
        SubquerySpan openSpan = SubqueryBoundaryDetector.findSubqueryBounds(openTokens, open.line(), open.column());
        assertNotNull(openSpan);
        assertEquals(openTokens.size(), openSpan.endIndex());
        assertFalse(openSpan.terminated());
    }

    @Test
    void functionParensInsideSubqueryAreTransparent() {
        Cursor c = Cursor.of("IF EXISTS (SELECT COUNT(|");
        SubquerySpan span = SubqueryBoundaryDetector.findSubqueryBounds(SqlTokenizer.tokenize(c.text()), c.line(), c.column());

        assertNotNull(span);
        assertEquals(2, span.startIndex());
    }

    @Test
    void deeplyNestedInputTerminatesWithAResult() {
        String marked = "SELECT * FROM " + "(SELECT * FROM ".repeat(300) + "t WHERE |" + ") x".repeat(300);

        SubqueryDetection d = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> detect(marked));

        assertNotNull(d);
        assertTrue(d.inSubquery());
        assertEquals(List.of("t"), aliases(d.tables()));
    }

    @Test
    void backwardExtractionKeepsEveryTableInOrder() {
        Cursor c = Cursor.of("SELECT * FROM a x, dbo.b AS y JOIN c ON x.id = c.id LEFT JOIN d WHERE |");
        List<Token> sig = TokenNavigator.significant(SqlTokenizer.tokenize(c.text()));

        List<TableReference> tables = SubqueryBoundaryDetector.extractTablesBackward(sig, sig.size());

        assertEquals(List.of("x", "y", "c", "d"), aliases(tables));
        assertEquals("dbo", tables.get(1).schema());
        assertEquals("b", tables.get(1).name());
        assertEquals("dbo.b", tables.get(1).qualifiedName());
    }

    @Test
    void backwardExtractionNeedsFrom() {
        Cursor c = Cursor.of("SELECT a, |");
        List<Token> sig = TokenNavigator.significant(SqlTokenizer.tokenize(c.text()));

        assertTrue(SubqueryBoundaryDetector.extractTablesBackward(sig, sig.size()).isEmpty());
    }

    @Test
    void forwardExtractionWhenCursorPrecedesFrom() {
        Cursor c = Cursor.of("SELECT | FROM Orders o JOIN Lines l ON o.id = l.oid WHERE o.x = 1");
        List<Token> sig = TokenNavigator.significant(SqlTokenizer.tokenize(c.text()));

        List<TableReference> tables = SubqueryBoundaryDetector.extractTablesForward(sig, 1);

        assertEquals(List.of("o", "l"), aliases(tables));
    }

    @Test
    void fullParseExtractionMatchesFromClauseOrder() {
        Cursor c = Cursor.of("IF EXISTS (SELECT 1 FROM a x, b y JOIN [Sales].[Lines] z ON x.id = z.id WHERE |)");

        List<TableReference> tables = SubqueryBoundaryDetector.extractTables(
                SqlTokenizer.tokenize(c.text()), c.line(), c.column());

        assertEquals(List.of("x", "y", "z"), aliases(tables));
        assertEquals("Sales", tables.get(2).schema());
        assertEquals("Lines", tables.get(2).name());
    }
}
