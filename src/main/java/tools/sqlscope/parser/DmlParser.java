package tools.sqlscope.parser;

import tools.sqlscope.token.TokenType;

import java.util.List;

/**
 * INSERT / UPDATE / DELETE / MERGE 解析。
 */
final class DmlParser {

    private static final SqlStatementParser.StopCondition SET_END =
            s -> s.currentIsKeyword("FROM", "WHERE", "OUTPUT", "OPTION", "WHEN");

    private static final SqlStatementParser.StopCondition OUTPUT_END =
            s -> s.currentIsKeyword("INTO", "FROM", "WHERE", "VALUES", "SELECT", "WITH", "EXEC", "EXECUTE",
                    "DEFAULT", "OPTION", "WHEN");

    private DmlParser() {
    }

    /**
     * INSERT [INTO] target [(cols)] [OUTPUT ...] { VALUES (...) | SELECT ... | EXEC ... | DEFAULT VALUES }
     */
    static ChunkBuilder parseInsert(ParserState s, int limit, int start) {
        ChunkBuilder b = new ChunkBuilder(StatementKind.INSERT, s.batchIndex, start);
        s.accept("INSERT");
        skipTop(s, limit);
        s.accept("INTO");
        TableReference target = FromClauseParser.readObjectName(s);
        if (target != null) {
            target = classifyCte(s, target);
            b.target = target;
            b.addTable(target);
        }
        if (s.currentIsKeyword("WITH") && SqlStatementParser.nextIs(s, TokenType.PAREN_OPEN)) {
            s.advance();
            s.pos = SqlStatementParser.afterClose(s, s.matchingClose(s.pos, limit), limit);
        }
        if (s.currentIs(TokenType.PAREN_OPEN)) {
            b.insertColumns.addAll(FromClauseParser.readColumnList(s, limit));
        }
        parseOutput(s, limit, b);
        if (s.accept("VALUES")) {
            parseValueRows(s, limit, b);
        } else if (s.currentIsKeyword("SELECT", "WITH") || s.currentIs(TokenType.PAREN_OPEN)) {
            int sourceStart = s.pos;
            Chunk source = SqlStatementParser.parseStatement(s, limit);
            if (source != null) {
                b.addSubquery(new NestedQuery(null, List.of(), Placement.INSERT_SOURCE, source, sourceStart, s.pos));
            }
        } else if (s.currentIsKeyword("EXEC", "EXECUTE")) {
            s.advance();
            SqlStatementParser.skipUntil(s, limit, SqlStatementParser::atSoftBoundary);
        } else if (s.accept("DEFAULT")) {
            s.accept("VALUES");
        }
        return b;
    }

    /**
     * UPDATE target [alias] SET ... [OUTPUT ...] [FROM ...] [WHERE ...]
     */
    static ChunkBuilder parseUpdate(ParserState s, int limit, int start) {
        ChunkBuilder b = new ChunkBuilder(StatementKind.UPDATE, s.batchIndex, start);
        s.accept("UPDATE");
        skipTop(s, limit);
        readTarget(s, limit, b);
        if (s.accept("SET")) {
            SqlStatementParser.scanExpression(s, b, limit, Placement.SET, SET_END);
        }
        parseOutput(s, limit, b);
        if (s.accept("FROM")) {
            FromClauseParser.parseList(s, limit, b);
        }
        parseWhere(s, limit, b);
        b.dropTargetIfAliased();
        return b;
    }

    /**
     * DELETE [FROM] target [OUTPUT ...] [FROM ...] [WHERE ...]
     */
    static ChunkBuilder parseDelete(ParserState s, int limit, int start) {
        ChunkBuilder b = new ChunkBuilder(StatementKind.DELETE, s.batchIndex, start);
        s.accept("DELETE");
        skipTop(s, limit);
        s.accept("FROM");
        readTarget(s, limit, b);
        parseOutput(s, limit, b);
        if (s.accept("FROM")) {
            FromClauseParser.parseList(s, limit, b);
        }
        parseWhere(s, limit, b);
        b.dropTargetIfAliased();
        return b;
    }

    /**
     * MERGE [INTO] target [AS t] USING source [AS s] ON ... WHEN [NOT] MATCHED ... THEN action ... [OUTPUT ...]
     * 动作中的 UPDATE / INSERT / DELETE 属于 MERGE 本身，不开启新语句。
     */
    static ChunkBuilder parseMerge(ParserState s, int limit, int start) {
        ChunkBuilder b = new ChunkBuilder(StatementKind.MERGE, s.batchIndex, start);
        s.accept("MERGE");
        skipTop(s, limit);
        s.accept("INTO");
        int before = b.tables.size();
        FromClauseParser.parseTableSource(s, limit, b);
        if (b.tables.size() > before) {
            b.target = b.tables.get(before);
        }
        if (s.accept("USING")) {
            FromClauseParser.parseTableSource(s, limit, b);
        }
        if (s.accept("ON")) {
            SqlStatementParser.scanExpression(s, b, limit, Placement.ON, st -> st.currentIsKeyword("WHEN"));
        }
        while (s.accept("WHEN")) {
            SqlStatementParser.scanExpression(s, b, limit, Placement.WHERE, st -> st.currentIsKeyword("THEN"));
            if (!s.accept("THEN")) {
                break;
            }
            if (s.accept("UPDATE")) {
                if (s.accept("SET")) {
                    SqlStatementParser.scanExpression(s, b, limit, Placement.SET, SET_END);
                }
            } else if (s.accept("INSERT")) {
                if (s.currentIs(TokenType.PAREN_OPEN)) {
                    b.insertColumns.addAll(FromClauseParser.readColumnList(s, limit));
                }
                if (s.accept("VALUES")) {
                    parseValueRows(s, limit, b);
                } else if (s.accept("DEFAULT")) {
                    s.accept("VALUES");
                }
            } else {
                s.accept("DELETE");
            }
        }
        parseOutput(s, limit, b);
        return b;
    }

    private static void readTarget(ParserState s, int limit, ChunkBuilder b) {
        TableReference target = FromClauseParser.readObjectName(s);
        if (target == null) {
            return;
        }
        target = classifyCte(s, target);
        String alias = null;
        if (!s.currentIsKeyword("SET") && !s.currentIsKeyword("WHERE") && !s.currentIsKeyword("OUTPUT")) {
            alias = FromClauseParser.readAlias(s);
        }
        if (s.currentIsKeyword("WITH") && SqlStatementParser.nextIs(s, TokenType.PAREN_OPEN)) {
            s.advance();
            s.pos = SqlStatementParser.afterClose(s, s.matchingClose(s.pos, limit), limit);
        }
        TableReference ref = new TableReference(target.name(), target.schema(), target.database(), alias, target.kind());
        b.target = ref;
        b.addTable(ref);
    }

    private static TableReference classifyCte(ParserState s, TableReference ref) {
        if (ref.kind() == TableKind.TABLE && ref.schema() == null && ref.database() == null && s.isCteName(ref.name())) {
            return ref.withKind(TableKind.CTE);
        }
        return ref;
    }

    private static void parseValueRows(ParserState s, int limit, ChunkBuilder b) {
        while (s.currentIs(TokenType.PAREN_OPEN)) {
            SqlStatementParser.scanParenthesized(s, b, limit, Placement.VALUES);
            if (!s.acceptType(TokenType.COMMA)) {
                return;
            }
        }
    }

    /**
     * OUTPUT inserted.x, deleted.y [INTO target [(cols)]]
     */
    private static void parseOutput(ParserState s, int limit, ChunkBuilder b) {
        if (!s.accept("OUTPUT")) {
            return;
        }
        SqlStatementParser.scanExpression(s, b, limit, Placement.SELECT_LIST, OUTPUT_END);
        if (s.accept("INTO")) {
            FromClauseParser.readObjectName(s);
            if (s.currentIs(TokenType.PAREN_OPEN)) {
                FromClauseParser.readColumnList(s, limit);
            }
        }
    }

    private static void parseWhere(ParserState s, int limit, ChunkBuilder b) {
        if (s.accept("WHERE")) {
            SqlStatementParser.scanExpression(s, b, limit, Placement.WHERE, SqlStatementParser.CLAUSE_END);
        }
        if (s.accept("OPTION") && s.currentIs(TokenType.PAREN_OPEN)) {
            s.pos = SqlStatementParser.afterClose(s, s.matchingClose(s.pos, limit), limit);
        }
    }

    private static void skipTop(ParserState s, int limit) {
        if (!s.accept("TOP")) {
            return;
        }
        if (s.currentIs(TokenType.PAREN_OPEN)) {
            s.pos = SqlStatementParser.afterClose(s, s.matchingClose(s.pos, limit), limit);
        } else if (s.currentIs(TokenType.NUMBER)) {
            s.advance();
        }
        s.accept("PERCENT");
    }
}
