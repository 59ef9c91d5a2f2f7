package tools.sqlscope.parser;

import tools.sqlscope.token.Token;
import tools.sqlscope.token.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * CREATE / ALTER / DROP / TRUNCATE / DECLARE 解析，负责临时表与表变量的登记和删除标记。
 */
final class DdlParser {

    private DdlParser() {
    }

    /**
     * CREATE [OR ALTER] TABLE name (col defs)：临时表登记列清单。
     * CREATE/ALTER VIEW | PROC | FUNCTION | TRIGGER ... AS：停在 AS 之后，主体按后续语句解析。
     */
    static ChunkBuilder parseCreateOrAlter(ParserState s, int limit, int start) {
        boolean alter = s.currentIsKeyword("ALTER");
        ChunkBuilder b = new ChunkBuilder(alter ? StatementKind.ALTER : StatementKind.CREATE, s.batchIndex, start);
        s.advance();
        if (s.accept("OR")) {
            s.accept("ALTER");
        }
        if (s.accept("TABLE")) {
            int nameIndex = s.pos;
            TableReference table = FromClauseParser.readObjectName(s);
            if (table != null) {
                b.target = table;
                b.addTable(table);
            }
            if (!alter && table != null && s.currentIs(TokenType.PAREN_OPEN)) {
                int open = s.pos;
                int close = s.matchingClose(open, limit);
                List<String> columns = readColumnDefinitions(s, open, close);
                if (table.kind() == TableKind.TEMP_TABLE) {
                    s.registerTempTable(new TempTable(table.name(), columns, s.batchIndex, nameIndex, -1,
                            table.name().startsWith("##"), TableKind.TEMP_TABLE));
                }
                s.pos = SqlStatementParser.afterClose(s, close, limit);
            }
            if (alter) {
                // ALTER TABLE t DROP COLUMN / ALTER COLUMN 中的 DROP、ALTER 不是新语句
                SqlStatementParser.skipUntil(s, limit, st -> SqlStatementParser.atSoftBoundary(st)
                        && !st.currentIsKeyword("DROP", "ALTER", "SET"));
            } else {
                SqlStatementParser.skipUntil(s, limit, SqlStatementParser::atSoftBoundary);
            }
            return b;
        }
        if (s.currentIsKeyword("VIEW", "PROCEDURE", "PROC", "FUNCTION", "TRIGGER")) {
            s.advance();
            TableReference object = FromClauseParser.readObjectName(s);
            if (object != null) {
                b.target = object;
            }
            // 参数、RETURNS、触发器事件列表中可能出现 INSERT/UPDATE 等关键字，一直跳到 AS
            SqlStatementParser.skipUntil(s, limit, st -> st.currentIsKeyword("AS"));
            s.accept("AS");
            return b;
        }
        if (s.currentIsKeyword("UNIQUE", "INDEX") || s.currentIs(TokenType.IDENTIFIER)) {
            // CREATE [UNIQUE] [CLUSTERED] INDEX ix ON table (cols)
            SqlStatementParser.skipUntil(s, limit, st -> st.currentIsKeyword("ON") || SqlStatementParser.atSoftBoundary(st));
            if (s.accept("ON")) {
                TableReference table = FromClauseParser.readObjectName(s);
                if (table != null) {
                    b.target = table;
                    b.addTable(table);
                }
            }
        }
        SqlStatementParser.skipUntil(s, limit, SqlStatementParser::atSoftBoundary);
        return b;
    }

    /**
     * DROP TABLE [IF EXISTS] a [, b ...]：临时表从 DROP 关键字处开始不可见。
     */
    static ChunkBuilder parseDrop(ParserState s, int limit, int start) {
        ChunkBuilder b = new ChunkBuilder(StatementKind.DROP, s.batchIndex, start);
        int dropIndex = s.pos;
        s.accept("DROP");
        if (s.accept("TABLE")) {
            if (s.currentIsKeyword("IF") && s.peek(1) != null && s.peek(1).isKeyword("EXISTS")) {
                s.advance();
                s.advance();
            }
            while (!s.atHardBoundary(limit)) {
                TableReference table = FromClauseParser.readObjectName(s);
                if (table == null) {
                    break;
                }
                b.addTable(table);
                if (table.kind() == TableKind.TEMP_TABLE) {
                    s.markDropped(table.name(), dropIndex);
                }
                if (!s.acceptType(TokenType.COMMA)) {
                    break;
                }
            }
        }
        SqlStatementParser.skipUntil(s, limit, SqlStatementParser::atSoftBoundary);
        return b;
    }

    static ChunkBuilder parseTruncate(ParserState s, int limit, int start) {
        ChunkBuilder b = new ChunkBuilder(StatementKind.TRUNCATE, s.batchIndex, start);
        s.accept("TRUNCATE");
        s.accept("TABLE");
        TableReference table = FromClauseParser.readObjectName(s);
        if (table != null) {
            b.target = table;
            b.addTable(table);
        }
        SqlStatementParser.skipUntil(s, limit, SqlStatementParser::atSoftBoundary);
        return b;
    }

    /**
     * DECLARE @a INT = ..., @t TABLE (col defs)：表变量按临时对象登记。
     */
    static ChunkBuilder parseDeclare(ParserState s, int limit, int start) {
        ChunkBuilder b = new ChunkBuilder(StatementKind.DECLARE, s.batchIndex, start);
        s.accept("DECLARE");
        while (!s.atHardBoundary(limit)) {
            Token variable = s.current();
            if (!variable.is(TokenType.VARIABLE)) {
                break;
            }
            int nameIndex = s.pos;
            s.advance();
            s.accept("AS");
            if (s.accept("TABLE") && s.currentIs(TokenType.PAREN_OPEN)) {
                int open = s.pos;
                int close = s.matchingClose(open, limit);
                List<String> columns = readColumnDefinitions(s, open, close);
                s.registerTempTable(new TempTable(variable.text(), columns, s.batchIndex, nameIndex, -1,
                        false, TableKind.TABLE_VARIABLE));
                s.pos = SqlStatementParser.afterClose(s, close, limit);
            } else {
                SqlStatementParser.scanExpression(s, null, limit, null, st -> st.currentIs(TokenType.COMMA));
            }
            if (!s.acceptType(TokenType.COMMA)) {
                break;
            }
        }
        return b;
    }

    /**
     * 列定义列表中每个顶层逗号分隔项的首个名字；约束、索引等以关键字开头的项被忽略。
     */
    static List<String> readColumnDefinitions(ParserState s, int open, int close) {
        List<String> columns = new ArrayList<>();
        int level = 0;
        boolean itemStart = true;
        for (int i = open + 1; i < close; i++) {
            Token t = s.at(i);
            if (t.is(TokenType.PAREN_OPEN)) {
                level++;
            } else if (t.is(TokenType.PAREN_CLOSE)) {
                level--;
            } else if (level == 0 && t.is(TokenType.COMMA)) {
                itemStart = true;
                continue;
            }
            if (itemStart && level == 0) {
                if (t.isName()) {
                    columns.add(t.unquotedText());
                }
                itemStart = false;
            }
        }
        return columns;
    }
}
