package tools.sqlscope.parser;

import tools.sqlscope.token.SqlKeywords;
import tools.sqlscope.token.Token;
import tools.sqlscope.token.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * FROM 列表解析：逗号/JOIN/APPLY 分隔的表、派生表、表值函数、括号内的连接，以及别名与表提示。
 */
final class FromClauseParser {

    private FromClauseParser() {
    }

    static void parseList(ParserState s, int limit, ChunkBuilder b) {
        parseTableSource(s, limit, b);
        while (!s.atHardBoundary(limit)) {
            if (s.acceptType(TokenType.COMMA)) {
                parseTableSource(s, limit, b);
                continue;
            }
            if (isJoinStart(s)) {
                consumeJoinKeywords(s);
                parseTableSource(s, limit, b);
                if (s.accept("ON")) {
                    SqlStatementParser.scanExpression(s, b, limit, Placement.ON, FromClauseParser::endsJoinCondition);
                }
                continue;
            }
            return;
        }
    }

    /**
     * 解析单个表来源并加入 b.tables；派生表同时加入 b.subqueries。
     */
    static void parseTableSource(ParserState s, int limit, ChunkBuilder b) {
        Token t = s.current();
        if (t == null || s.atHardBoundary(limit)) {
            return;
        }
        if (t.is(TokenType.PAREN_OPEN)) {
            parseParenthesizedSource(s, limit, b);
            return;
        }
        if (!t.isObjectName()) {
            return;
        }
        TableReference ref = readObjectName(s);
        if (ref == null) {
            return;
        }
        TableKind kind = ref.kind();
        if (kind == TableKind.TABLE && s.currentIs(TokenType.PAREN_OPEN)) {
            kind = TableKind.TABLE_FUNCTION;
            SqlStatementParser.scanParenthesized(s, b, limit, Placement.ON);
        } else if (kind == TableKind.TABLE && ref.schema() == null && ref.database() == null && s.isCteName(ref.name())) {
            kind = TableKind.CTE;
        }
        String alias = readAlias(s);
        skipTableHints(s, limit);
        if (alias == null) {
            alias = readAlias(s);
        }
        b.addTable(new TableReference(ref.name(), ref.schema(), ref.database(), alias, kind));
        skipPivot(s, limit, b);
    }

    private static void parseParenthesizedSource(ParserState s, int limit, ChunkBuilder b) {
        int open = s.pos;
        int close = s.matchingClose(open, limit);
        Token next = s.at(open + 1);
        if (next != null && next.isKeyword("SELECT", "WITH", "VALUES")) {
            NestedQuery nested = null;
            ChunkBuilder valuesRows = null;
            if (next.isKeyword("VALUES")) {
                valuesRows = new ChunkBuilder(StatementKind.SELECT, s.batchIndex, open + 1);
                s.pos = open + 2;
                SqlStatementParser.scanExpression(s, valuesRows, close, Placement.VALUES, SqlStatementParser.NEVER);
            } else {
                nested = SqlStatementParser.parseNested(s, open, close, Placement.DERIVED_TABLE, null, List.of());
            }
            s.pos = SqlStatementParser.afterClose(s, close, limit);
            String alias = readAlias(s);
            List<String> declared = s.currentIs(TokenType.PAREN_OPEN) ? readColumnList(s, limit) : List.of();
            Chunk body = nested != null ? nested.chunk() : valuesRows != null ? valuesRows.build(close) : null;
            if (body != null) {
                b.addSubquery(new NestedQuery(alias, declared, Placement.DERIVED_TABLE, body, open, close));
            }
            if (alias != null) {
                b.addTable(new TableReference(alias, null, null, alias, TableKind.DERIVED));
            }
            return;
        }
        // (a JOIN b ON ...) 这类括号内的连接
        s.pos = open + 1;
        parseList(s, close, b);
        s.pos = SqlStatementParser.afterClose(s, close, limit);
        readAlias(s);
    }

    /**
     * 读取 [server.][database.][schema.]name，支持 db..name、#temp、@var；末尾悬空的点号视为未完成，返回 null。
     */
    static TableReference readObjectName(ParserState s) {
        Token first = s.current();
        if (first == null || !first.isObjectName()) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        parts.add(first.unquotedText());
        s.advance();
        boolean dangling = false;
        while (s.currentIs(TokenType.DOT)) {
            s.advance();
            if (s.currentIs(TokenType.DOT)) {
                parts.add(null);
                continue;
            }
            Token part = s.current();
            if (part != null && part.isObjectName()) {
                parts.add(part.unquotedText());
                s.advance();
            } else {
                dangling = true;
                break;
            }
        }
        if (dangling) {
            return null;
        }
        int n = parts.size();
        String name = parts.get(n - 1);
        if (name == null) {
            return null;
        }
        String schema = n >= 2 ? parts.get(n - 2) : null;
        String database = n >= 3 ? parts.get(n - 3) : null;
        return new TableReference(name, schema, database, null, TableKind.fromName(name));
    }

    /**
     * [AS] alias；alias 可以是标识符、带引号标识符或（AS 之后的）字符串。
     */
    static String readAlias(ParserState s) {
        Token t = s.current();
        if (t == null) {
            return null;
        }
        if (t.isKeyword("AS")) {
            Token next = s.peek(1);
            if (next != null && (next.isName() || next.is(TokenType.STRING))) {
                s.advance();
                s.advance();
                return SelectListParser.unquote(next);
            }
            return null;
        }
        if (t.isName()) {
            s.advance();
            return t.unquotedText();
        }
        return null;
    }

    /**
     * 读取 (a, b, c) 形式的名字列表，当前位置必须是左括号；结束后位于右括号之后。
     */
    static List<String> readColumnList(ParserState s, int limit) {
        int open = s.pos;
        int close = s.matchingClose(open, limit);
        List<String> names = new ArrayList<>();
        boolean expectName = true;
        for (int i = open + 1; i < close; i++) {
            Token t = s.at(i);
            if (t.is(TokenType.COMMA)) {
                expectName = true;
            } else if (expectName && t.isName()) {
                names.add(t.unquotedText());
                expectName = false;
            }
        }
        s.pos = SqlStatementParser.afterClose(s, close, limit);
        return names;
    }

    private static void skipTableHints(ParserState s, int limit) {
        if (s.currentIsKeyword("WITH") && SqlStatementParser.nextIs(s, TokenType.PAREN_OPEN)) {
            s.advance();
            s.pos = SqlStatementParser.afterClose(s, s.matchingClose(s.pos, limit), limit);
        } else if (s.currentIs(TokenType.PAREN_OPEN)) {
            Token hint = s.peek(1);
            if (hint != null && hint.is(TokenType.IDENTIFIER)) {
                s.pos = SqlStatementParser.afterClose(s, s.matchingClose(s.pos, limit), limit);
            }
        }
    }

    private static void skipPivot(ParserState s, int limit, ChunkBuilder b) {
        if (!s.currentIsKeyword("PIVOT", "UNPIVOT")) {
            return;
        }
        s.advance();
        if (s.currentIs(TokenType.PAREN_OPEN)) {
            s.pos = SqlStatementParser.afterClose(s, s.matchingClose(s.pos, limit), limit);
        }
        String alias = readAlias(s);
        if (alias != null) {
            b.addTable(new TableReference(alias, null, null, alias, TableKind.DERIVED));
        }
    }

    static boolean isJoinStart(ParserState s) {
        Token t = s.current();
        if (!SqlKeywords.isJoinKeyword(t)) {
            return false;
        }
        // LEFT(...) / RIGHT(...) 是函数调用
        return !(t.isKeyword("LEFT", "RIGHT") && SqlStatementParser.nextIs(s, TokenType.PAREN_OPEN));
    }

    private static void consumeJoinKeywords(ParserState s) {
        while (s.currentIsKeyword("INNER", "LEFT", "RIGHT", "FULL", "OUTER", "CROSS")) {
            s.advance();
        }
        s.accept("JOIN", "APPLY");
    }

    private static boolean endsJoinCondition(ParserState s) {
        Token t = s.current();
        return t.is(TokenType.COMMA) || isJoinStart(s) || (SqlKeywords.isClauseKeyword(t) && !t.isKeyword("ON"));
    }
}
