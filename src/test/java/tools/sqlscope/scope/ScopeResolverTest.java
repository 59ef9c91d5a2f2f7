package tools.sqlscope.scope;

import org.junit.jupiter.api.Test;
import tools.sqlscope.Cursor;
import tools.sqlscope.context.ComparisonOperand;
import tools.sqlscope.context.NameReading;
import tools.sqlscope.parser.StatementKind;
import tools.sqlscope.parser.TableKind;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScopeResolverTest {

    private static final Map<String, List<String>> TABLES = Map.of(
            "Employees", List.of("EmployeeID", "FirstName", "LastName", "DepartmentID"),
            "Orders", List.of("OrderID", "CustomerID", "Total"),
            "Lines", List.of("LineID", "OrderID", "Qty"));

    private static final ColumnCatalog CATALOG = (database, schema, table) -> TABLES.getOrDefault(table, List.of());

    private final ScopeResolver resolver = new ScopeResolver(CATALOG);

    private ScopeContext resolve(String marked) {
        Cursor c = Cursor.of(marked);
        return resolver.resolve(c.text(), c.line(), c.column());
    }

    private static List<String> aliases(ScopeContext ctx) {
        return ctx.visibleTables().stream().map(VisibleTable::alias).toList();
    }

    @Test
    void cteShadowingTableExposesOnlyItsOwnColumns() {
        ScopeContext ctx = resolve(
                "WITH Employees AS (SELECT EmployeeID, FirstName FROM Employees WHERE DepartmentID = 1) "
                        + "SELECT | FROM Employees");

        assertEquals(TriggerKind.COLUMN, ctx.triggerKind());
        assertEquals(1, ctx.visibleTables().size());
        VisibleTable employees = ctx.visibleTables().get(0);
        assertEquals(TableKind.CTE, employees.kind());
        assertEquals(List.of("EmployeeID", "FirstName"), employees.columns());
        assertEquals(List.of("EmployeeID", "FirstName"), ctx.candidateColumns());
    }

    @Test
    void explicitCteColumnListWins() {
        ScopeContext ctx = resolve(
                "WITH Staff (ID, Name, Dept) AS (SELECT EmployeeID, FirstName, DepartmentID FROM Employees) "
                        + "SELECT s.| FROM Staff s");

        assertEquals("s", ctx.qualifierTarget().alias());
        assertEquals(List.of("ID", "Name", "Dept"), ctx.candidateColumns());
    }

    @Test
    void starInShadowingCteExpandsFromTheRealTable() {
        ColumnCatalog catalog = mock(ColumnCatalog.class);
        when(catalog.columnsOf(null, null, "Employees")).thenReturn(TABLES.get("Employees"));

        Cursor c = Cursor.of("WITH Employees AS (SELECT * FROM Employees) SELECT | FROM Employees");
        ScopeContext ctx = new ScopeResolver(catalog).resolve(c.text(), c.line(), c.column());

        assertEquals(TableKind.CTE, ctx.visibleTables().get(0).kind());
        assertEquals(TABLES.get("Employees"), ctx.visibleTables().get(0).columns());
        verify(catalog).columnsOf(null, null, "Employees");
    }

    @Test
    void catalogReceivesQualifiedParts() {
        ColumnCatalog catalog = mock(ColumnCatalog.class);
        when(catalog.columnsOf(null, "dbo", "Employees")).thenReturn(List.of("EmployeeID"));

        Cursor c = Cursor.of("SELECT | FROM dbo.Employees");
        ScopeContext ctx = new ScopeResolver(catalog).resolve(c.text(), c.line(), c.column());

        assertEquals(List.of("EmployeeID"), ctx.candidateColumns());
        verify(catalog).columnsOf(null, "dbo", "Employees");
    }

    @Test
    void derivedTableExposesAliasedColumns() {
        ScopeContext ctx = resolve("SELECT d.| FROM (SELECT e.FirstName AS fn, e.LastName FROM Employees e) AS d");

        VisibleTable d = ctx.qualifierTarget();
        assertNotNull(d);
        assertEquals(TableKind.DERIVED, d.kind());
        assertEquals(List.of("fn", "LastName"), d.columns());
    }

    @Test
    void tempTableVisibleInSameBatch() {
        ScopeContext ctx = resolve("CREATE TABLE #tmp (id INT, qty INT);\nSELECT * FROM #tmp WHERE |");

        assertEquals(0, ctx.batchIndex());
        VisibleTable tmp = ctx.visibleTables().get(0);
        assertEquals(TableKind.TEMP_TABLE, tmp.kind());
        assertEquals(List.of("id", "qty"), tmp.columns());
    }

    @Test
    void batchSeparatorHidesTempTable() {
        ScopeContext ctx = resolve("CREATE TABLE #tmp (id INT);\nGO\nSELECT * FROM #tmp WHERE |");

        assertEquals(1, ctx.batchIndex());
        assertTrue(ctx.visibleTables().isEmpty());
    }

    @Test
    void droppedTempTableIsNoLongerVisible() {
        ScopeContext ctx = resolve("CREATE TABLE #tmp (id INT); DROP TABLE #tmp; SELECT * FROM #tmp WHERE |");

        assertTrue(ctx.visibleTables().isEmpty());
    }

    @Test
    void tableTriggerListsLiveSessionObjects() {
        ScopeContext ctx = resolve(
                "CREATE TABLE #a (x INT); CREATE TABLE #b (y INT); DROP TABLE #a; DECLARE @v TABLE (z INT); SELECT * FROM |");

        assertEquals(TriggerKind.TABLE, ctx.triggerKind());
        assertEquals(List.of("#b", "@v"), ctx.visibleTables().stream().map(VisibleTable::name).toList());
        assertEquals(TableKind.TABLE_VARIABLE, ctx.visibleTables().get(1).kind());
    }

    @Test
    void tableVariableColumnsThroughAlias() {
        ScopeContext ctx = resolve("DECLARE @tv TABLE (a INT, b INT);\nSELECT * FROM @tv v WHERE v.|");

        assertEquals("@tv", ctx.qualifierTarget().name());
        assertEquals(List.of("a", "b"), ctx.candidateColumns());
    }

    @Test
    void unknownTempReferenceIsFiltered() {
        ScopeContext ctx = resolve("SELECT * FROM #missing m JOIN Orders o ON o.OrderID = m.id WHERE |");

        assertEquals(List.of("o"), aliases(ctx));
    }

    @Test
    void recursiveCteSeesItself() {
        ScopeContext ctx = resolve("WITH Nums AS (SELECT 1 AS n UNION ALL SELECT n + 1 FROM Nums WHERE |) SELECT n FROM Nums");

        assertEquals(1, ctx.visibleTables().size());
        VisibleTable nums = ctx.visibleTables().get(0);
        assertEquals(TableKind.CTE, nums.kind());
        assertEquals(List.of("n"), nums.columns());
    }

    @Test
    void cteBodySeesOnlyEarlierCtes() {
        ScopeContext inSecond = resolve("WITH A AS (SELECT 1 AS x), B AS (SELECT * FROM |) SELECT * FROM B");
        assertEquals(List.of("A"), inSecond.visibleTables().stream().map(VisibleTable::name).toList());
        assertEquals(List.of("x"), inSecond.visibleTables().get(0).columns());

        ScopeContext inFirst = resolve("WITH A AS (SELECT * FROM |), B AS (SELECT 1 AS y) SELECT * FROM A");
        assertTrue(inFirst.visibleTables().isEmpty());

        ScopeContext inMain = resolve("WITH A AS (SELECT 1 AS x), B AS (SELECT 2 AS y) SELECT * FROM |");
        assertEquals(List.of("A", "B"), inMain.visibleTables().stream().map(VisibleTable::name).toList());
    }

    @Test
    void correlatedSubquerySeesOuterTables() {
        ScopeContext ctx = resolve("SELECT * FROM Orders o WHERE EXISTS (SELECT 1 FROM Lines l WHERE l.OrderID = |)");

        assertEquals(List.of("l", "o"), aliases(ctx));
        assertEquals(List.of(0, 1), ctx.visibleTables().stream().map(VisibleTable::depth).toList());
    }

    @Test
    void nearestAliasWins() {
        ScopeContext ctx = resolve("SELECT * FROM Orders o WHERE EXISTS (SELECT 1 FROM Lines o WHERE o.|)");

        assertEquals(1, ctx.visibleTables().size());
        assertEquals("Lines", ctx.qualifierTarget().name());
        assertEquals(TABLES.get("Lines"), ctx.candidateColumns());
    }

    @Test
    void derivedTableDoesNotSeeSiblingTables() {
        ScopeContext ctx = resolve("SELECT * FROM Orders o JOIN (SELECT * FROM Lines l WHERE |) x ON x.OrderID = o.OrderID");

        assertEquals(List.of("l"), aliases(ctx));
    }

    @Test
    void unparsedSubqueryFallsBackToDetector() {
        ScopeContext ctx = resolve("IF EXISTS (SELECT 1 FROM Orders o WHERE o.|) PRINT 'x'");

        assertNull(ctx.statementKind());
        assertEquals(TriggerKind.COLUMN, ctx.triggerKind());
        assertEquals(List.of("o"), aliases(ctx));
        assertEquals(TABLES.get("Orders"), ctx.candidateColumns());
    }

    @Test
    void tableTriggers() {
        assertEquals(TriggerKind.TABLE, resolve("SELECT * FROM |").triggerKind());
        assertEquals(TriggerKind.TABLE, resolve("SELECT * FROM Orders o JOIN |").triggerKind());
        assertEquals(TriggerKind.TABLE, resolve("SELECT * FROM Orders o, |").triggerKind());
        assertEquals(TriggerKind.TABLE, resolve("INSERT INTO |").triggerKind());
        assertEquals(TriggerKind.TABLE, resolve("UPDATE |").triggerKind());
    }

    @Test
    void silentPositions() {
        assertEquals(TriggerKind.NONE, resolve("SELECT a AS |").triggerKind());
        assertEquals(TriggerKind.NONE, resolve("SELECT * FROM Orders o |").triggerKind());
        assertEquals(TriggerKind.NONE, resolve("DECLARE @x INT = |").triggerKind());

        ScopeContext inString = resolve("SELECT * FROM Orders WHERE CustomerID = 'ab|c'");
        assertEquals(TriggerKind.NONE, inString.triggerKind());
        assertTrue(inString.visibleTables().isEmpty());
        assertEquals(StatementKind.SELECT, inString.statementKind());

        ScopeContext inComment = resolve("SELECT * FROM Orders -- pick |");
        assertEquals(TriggerKind.NONE, inComment.triggerKind());
    }

    @Test
    void procedureTrigger() {
        assertEquals(TriggerKind.PROCEDURE, resolve("EXEC |").triggerKind());
        assertEquals(TriggerKind.PROCEDURE, resolve("EXECUTE @rc = |").triggerKind());
        assertEquals(TriggerKind.NONE, resolve("EXEC dbo.p @a = |").triggerKind());
    }

    @Test
    void columnClauses() {
        assertEquals(ClausePosition.IN_WHERE, resolve("SELECT a FROM Orders GROUP BY |").clause());

        ScopeContext set = resolve("UPDATE e SET | FROM Employees e");
        assertEquals(ClausePosition.IN_SET, set.clause());
        assertEquals(TriggerKind.COLUMN, set.triggerKind());
        assertEquals(StatementKind.UPDATE, set.statementKind());
        assertEquals(List.of("e"), aliases(set));

        ScopeContext insertColumns = resolve("INSERT INTO Employees (|");
        assertEquals(ClausePosition.IN_VALUES, insertColumns.clause());
        assertEquals(TriggerKind.COLUMN, insertColumns.triggerKind());
        assertEquals(TABLES.get("Employees"), insertColumns.candidateColumns());
    }

    @Test
    void outputPseudoTablesResolveToStatementTarget() {
        ScopeContext update = resolve("UPDATE e SET FirstName = 'x' OUTPUT inserted.| "
                + "FROM Employees e JOIN Orders o ON o.CustomerID = e.EmployeeID");
        assertEquals(ClausePosition.IN_OUTPUT, update.clause());
        assertEquals(TriggerKind.COLUMN, update.triggerKind());
        assertEquals(List.of("e", "o"), aliases(update));
        assertEquals("Employees", update.qualifierTarget().name());
        assertEquals(TABLES.get("Employees"), update.candidateColumns());

        ScopeContext delete = resolve("DELETE o OUTPUT DELETED.| FROM Orders o JOIN Lines l ON l.OrderID = o.OrderID");
        assertEquals("Orders", delete.qualifierTarget().name());
        assertEquals(TABLES.get("Orders"), delete.candidateColumns());

        ScopeContext insert = resolve("INSERT INTO Lines (OrderID, Qty) OUTPUT inserted.| VALUES (1, 2)");
        assertEquals(ClausePosition.IN_OUTPUT, insert.clause());
        assertEquals(TABLES.get("Lines"), insert.candidateColumns());
    }

    @Test
    void finishedCaseExpressionDoesNotChangeClause() {
        ScopeContext ctx = resolve("SELECT CASE WHEN EmployeeID = 1 THEN 'a' ELSE 'b' END AS lbl, | FROM Employees");

        assertEquals(ClausePosition.IN_SELECT_LIST, ctx.clause());
        assertEquals(TriggerKind.COLUMN, ctx.triggerKind());
        assertTrue(ctx.leftOperand().isNoMatch());
        assertEquals(TABLES.get("Employees"), ctx.candidateColumns());
    }

    @Test
    void prefixIsReportedAndExcludedFromClauseScan() {
        ScopeContext ctx = resolve("SELECT Emp| FROM Employees");

        assertEquals("Emp", ctx.prefix());
        assertEquals(TriggerKind.COLUMN, ctx.triggerKind());
        assertEquals(ClausePosition.IN_SELECT_LIST, ctx.clause());
    }

    @Test
    void qualifierReadingIsNarrowedByVisibleTables() {
        ScopeContext column = resolve("SELECT e.| FROM Employees e");
        assertTrue(column.qualifierReading().isMatched());
        assertEquals(NameReading.Role.ALIAS, column.qualifierReading().candidates().get(0).role());
        assertEquals("e", column.qualifierTarget().alias());

        ScopeContext table = resolve("SELECT * FROM dbo.|");
        assertEquals(TriggerKind.TABLE, table.triggerKind());
        assertEquals(NameReading.Role.SCHEMA, table.qualifierReading().value().orElseThrow().role());
    }

    @Test
    void leftOperandInWhere() {
        ScopeContext ctx = resolve("SELECT * FROM Orders o WHERE o.Total > |");

        ComparisonOperand operand = ctx.leftOperand().value().orElseThrow();
        assertEquals("o", operand.tableRef());
        assertEquals("Total", operand.columnName());
    }

    @Test
    void batchAndStatementKind() {
        ScopeContext ctx = resolve("SELECT 1\nGO\nUPDATE Orders SET |");

        assertEquals(1, ctx.batchIndex());
        assertEquals(StatementKind.UPDATE, ctx.statementKind());
    }

    @Test
    void catalogNotConsultedForCtesAndTemps() {
        ColumnCatalog catalog = mock(ColumnCatalog.class);
        Cursor c = Cursor.of("CREATE TABLE #t (a INT);\nWITH c AS (SELECT 1 AS x) SELECT * FROM c, #t WHERE |");

        ScopeContext ctx = new ScopeResolver(catalog).resolve(c.text(), c.line(), c.column());

        assertEquals(List.of("c", "#t"), aliases(ctx));
        verify(catalog, never()).columnsOf(null, null, "c");
        verify(catalog, never()).columnsOf(null, null, "#t");
    }

    @Test
    void cursorOutsideTextIsRejected() {
        CursorOutOfRangeException beyondLines = assertThrows(CursorOutOfRangeException.class,
                () -> resolver.resolve("SELECT 1", 2, 1));
        assertEquals(2, beyondLines.getLine());

        assertThrows(CursorOutOfRangeException.class, () -> resolver.resolve("SELECT 1", 0, 1));
        assertThrows(CursorOutOfRangeException.class, () -> resolver.resolve("SELECT 1", 1, 0));
        CursorOutOfRangeException beyondColumns = assertThrows(CursorOutOfRangeException.class,
                () -> resolver.resolve("SELECT 1", 1, 10));
        assertEquals(10, beyondColumns.getColumn());

        assertDoesNotThrow(() -> resolver.resolve("SELECT 1", 1, 9));
        assertDoesNotThrow(() -> resolver.resolve("SELECT 1\r\n", 2, 1));
    }

    @Test
    void emptyBufferResolvesToNothing() {
        ScopeContext ctx = new ScopeResolver().resolve("", 1, 1);

        assertEquals(TriggerKind.NONE, ctx.triggerKind());
        assertTrue(ctx.visibleTables().isEmpty());
        assertEquals(ClausePosition.BEFORE_FROM, ctx.clause());
    }
}
