package tools.sqlscope.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.sqlscope.token.SqlKeywords;
import tools.sqlscope.token.SqlTokenizer;
import tools.sqlscope.token.Token;
import tools.sqlscope.token.TokenNavigator;
import tools.sqlscope.token.TokenType;
import tools.sqlscope.util.Config;
import tools.sqlscope.util.OperationLog;

import java.util.ArrayList;
import java.util.List;

/**
 * 轻量级语句解析器：把 token 流切成语句，并提取表引用、CTE、输出列与子查询。
 * 不做语法校验，遇到不完整或无法识别的内容就跳到下一个语句边界，始终返回尽力而为的结果。
 * 可在任意 token 片段上重入调用（子查询边界检测会对截取的片段再次解析）。
 */
public final class SqlStatementParser {
    private static final Logger log = LoggerFactory.getLogger(SqlStatementParser.class);

    /**
     * 表达式扫描的终止条件，基于当前解析位置判断。
     */
    @FunctionalInterface
    interface StopCondition {
        boolean test(ParserState s);
    }

    static final StopCondition NEVER = s -> false;

    /** WHERE / GROUP BY / HAVING / ORDER BY 等子句在这些关键字处结束 */
    static final StopCondition CLAUSE_END = s -> SqlKeywords.isClauseKeyword(s.current());

    private SqlStatementParser() {
    }

    public static ParseResult parse(String text) {
        return parse(SqlTokenizer.tokenize(text));
    }

    public static ParseResult parse(List<Token> rawTokens) {
        List<Token> raw = rawTokens == null ? List.of() : rawTokens;
        List<Token> tokens = TokenNavigator.significant(raw);
        ParserState s = new ParserState(tokens, Config.maxNestingDepth());
        List<Chunk> chunks = new ArrayList<>();
        int limit = tokens.size();
        while (!s.atEnd(limit)) {
            Token t = s.current();
            if (t.is(TokenType.GO)) {
                s.batchIndex++;
                s.advance();
                continue;
            }
            if (t.is(TokenType.SEMICOLON) || t.is(TokenType.PAREN_CLOSE)) {
                s.advance();
                continue;
            }
            int before = s.pos;
            Chunk chunk = parseStatement(s, limit);
            if (chunk != null) {
                chunks.add(chunk);
            }
            if (s.pos == before) {
                s.advance();
            }
        }
        log.debug("解析完成: {} 个 token, {} 条语句, {} 个临时对象", tokens.size(), chunks.size(), s.tempTables.size());
        return new ParseResult(chunks, s.tempTables, tokens, raw);
    }

    /**
     * 从当前位置解析一条语句；控制流语句（IF、BEGIN、SET @x 等）不产生 Chunk，返回 null。
     */
    static Chunk parseStatement(ParserState s, int limit) {
        int start = s.pos;
        Token t = s.current();
        if (t == null) {
            return null;
        }
        if (t.isKeyword("WITH") && !nextIs(s, TokenType.PAREN_OPEN)) {
            List<CteDefinition> ctes = CteClauseParser.parse(s, limit);
            s.pushCteScope(ParserState.cteNames(ctes));
            ChunkBuilder b;
            try {
                b = parseBody(s, limit, start);
            } finally {
                s.popCteScope();
            }
            if (b == null) {
                b = new ChunkBuilder(StatementKind.OTHER, s.batchIndex, start);
            }
            b.ctes.addAll(0, ctes);
            return b.build(s.pos);
        }
        ChunkBuilder b = parseBody(s, limit, start);
        return b == null ? null : b.build(s.pos);
    }

    private static ChunkBuilder parseBody(ParserState s, int limit, int start) {
        Token t = s.current();
        if (t == null) {
            return null;
        }
        if (t.is(TokenType.PAREN_OPEN)) {
            Token next = s.peek(1);
            if (next != null && next.isKeyword("SELECT", "WITH")) {
                s.advance();
                if (next.isKeyword("WITH")) {
                    return wrap(parseStatement(s, limit), s, start);
                }
                return parseBody(s, limit, start);
            }
        }
        if (t.type() != TokenType.KEYWORD) {
            skipStatement(s, limit);
            return null;
        }
        return switch (t.upper()) {
            case "SELECT" -> {
                ChunkBuilder b = new ChunkBuilder(StatementKind.SELECT, s.batchIndex, start);
                parseSelect(s, limit, b, true);
                yield b;
            }
            case "INSERT" -> DmlParser.parseInsert(s, limit, start);
            case "UPDATE" -> DmlParser.parseUpdate(s, limit, start);
            case "DELETE" -> DmlParser.parseDelete(s, limit, start);
            case "MERGE" -> DmlParser.parseMerge(s, limit, start);
            case "CREATE", "ALTER" -> DdlParser.parseCreateOrAlter(s, limit, start);
            case "DROP" -> DdlParser.parseDrop(s, limit, start);
            case "TRUNCATE" -> DdlParser.parseTruncate(s, limit, start);
            case "DECLARE" -> DdlParser.parseDeclare(s, limit, start);
            case "EXEC", "EXECUTE" -> {
                ChunkBuilder b = new ChunkBuilder(StatementKind.EXEC, s.batchIndex, start);
                s.advance();
                skipUntil(s, limit, SqlStatementParser::atSoftBoundary);
                yield b;
            }
            default -> {
                skipStatement(s, limit);
                yield null;
            }
        };
    }

    private static ChunkBuilder wrap(Chunk chunk, ParserState s, int start) {
        if (chunk == null) {
            return null;
        }
        ChunkBuilder b = new ChunkBuilder(chunk.kind(), chunk.batchIndex(), start);
        b.tables.addAll(chunk.tables());
        b.ctes.addAll(chunk.ctes());
        b.producedColumns.addAll(chunk.producedColumns());
        b.subqueries.addAll(chunk.subqueries());
        b.insertColumns.addAll(chunk.insertColumns());
        b.target = chunk.target();
        return b;
    }

    /**
     * SELECT [DISTINCT|TOP n] 列表 [INTO t] [FROM ...] [WHERE ...] [GROUP BY ...] [HAVING ...] [ORDER BY ...]，
     * allowSetOperations 为 true 时继续收集 UNION/INTERSECT/EXCEPT 分支。
     */
    static void parseSelect(ParserState s, int limit, ChunkBuilder b, boolean allowSetOperations) {
        s.accept("SELECT");
        skipSelectModifiers(s, limit);
        SelectListParser.parse(s, limit, b);

        TableReference into = null;
        int intoIndex = -1;
        if (s.accept("INTO")) {
            intoIndex = s.pos;
            into = FromClauseParser.readObjectName(s);
            if (into != null) {
                b.kind = StatementKind.SELECT_INTO;
                b.target = into;
            }
        }
        if (s.accept("FROM")) {
            FromClauseParser.parseList(s, limit, b);
        }
        if (into != null && into.kind() == TableKind.TEMP_TABLE) {
            s.registerTempTable(new TempTable(into.name(), b.producedColumnNamesSoFar(), s.batchIndex,
                    intoIndex, -1, into.name().startsWith("##"), TableKind.TEMP_TABLE));
        }

        while (!s.atHardBoundary(limit)) {
            Token t = s.current();
            if (s.accept("WHERE")) {
                scanExpression(s, b, limit, Placement.WHERE, CLAUSE_END);
            } else if (t.isKeyword("GROUP", "ORDER")) {
                s.advance();
                s.accept("BY");
                scanExpression(s, b, limit, Placement.ORDER_BY, CLAUSE_END);
            } else if (s.accept("HAVING")) {
                scanExpression(s, b, limit, Placement.HAVING, CLAUSE_END);
            } else if (t.isKeyword("OPTION", "OFFSET", "FETCH", "LIMIT", "FOR")) {
                s.advance();
                scanExpression(s, null, limit, null, CLAUSE_END);
            } else if (allowSetOperations && SqlKeywords.isSetOperator(t)) {
                if (!parseSetOperationBranch(s, limit, b)) {
                    break;
                }
            } else {
                break;
            }
        }
    }

    private static boolean parseSetOperationBranch(ParserState s, int limit, ChunkBuilder b) {
        int operatorIndex = s.pos;
        s.advance();
        s.accept("ALL", "DISTINCT");
        if (s.currentIsKeyword("SELECT")) {
            ChunkBuilder branch = new ChunkBuilder(StatementKind.SELECT, s.batchIndex, s.pos);
            parseSelect(s, limit, branch, false);
            b.addSubquery(new NestedQuery(null, List.of(), Placement.SET_OPERATION, branch.build(s.pos), operatorIndex, s.pos));
            return true;
        }
        if (s.currentIs(TokenType.PAREN_OPEN)) {
            int open = s.pos;
            int close = s.matchingClose(open, limit);
            b.addSubquery(parseNested(s, open, close, Placement.SET_OPERATION, null, List.of()));
            s.pos = afterClose(s, close, limit);
            return true;
        }
        return false;
    }

    private static void skipSelectModifiers(ParserState s, int limit) {
        while (!s.atHardBoundary(limit)) {
            if (s.accept("DISTINCT", "ALL")) {
                continue;
            }
            if (s.accept("TOP")) {
                if (s.currentIs(TokenType.PAREN_OPEN)) {
                    s.pos = afterClose(s, s.matchingClose(s.pos, limit), limit);
                } else if (s.currentIs(TokenType.NUMBER) || s.currentIs(TokenType.VARIABLE)) {
                    s.advance();
                }
                s.accept("PERCENT");
                if (s.currentIsKeyword("WITH") && s.peek(1) != null && s.peek(1).isKeyword("TIES")) {
                    s.advance();
                    s.advance();
                }
                continue;
            }
            return;
        }
    }

    /**
     * 解析 [open, close] 括号内的查询，返回子查询节点；嵌套过深或不是查询时返回 null。
     * 调用结束后解析位置恢复到调用前，由调用方负责跳过整个括号。
     */
    static NestedQuery parseNested(ParserState s, int open, int close, Placement placement,
                                   String alias, List<String> declaredColumns) {
        if (s.depth >= s.maxDepth) {
            log.debug("子查询嵌套超过 {} 层，跳过位置 {}", s.maxDepth, open);
            OperationLog.log("子查询嵌套超过 " + s.maxDepth + " 层，内部不再解析");
            return null;
        }
        int saved = s.pos;
        s.pos = open + 1;
        s.depth++;
        try {
            Chunk chunk = parseStatement(s, close);
            if (chunk == null) {
                return null;
            }
            return new NestedQuery(alias, declaredColumns, placement, chunk, open, close);
        } finally {
            s.depth--;
            s.pos = saved;
        }
    }

    /**
     * 扫描表达式直到终止条件、语句边界或所在括号结束；括号内的 SELECT 记录为 placement 位置的子查询。
     * b 为 null 时只跳过，不记录子查询。
     */
    static void scanExpression(ParserState s, ChunkBuilder b, int limit, Placement placement, StopCondition stop) {
        int caseDepth = 0;
        while (!s.atHardBoundary(limit)) {
            Token t = s.current();
            if (t.is(TokenType.PAREN_OPEN)) {
                scanParenthesized(s, b, limit, placement);
                continue;
            }
            if (t.is(TokenType.PAREN_CLOSE)) {
                return;
            }
            if (t.isKeyword("CASE")) {
                caseDepth++;
                s.advance();
                continue;
            }
            if (caseDepth > 0) {
                if (t.isKeyword("END")) {
                    caseDepth--;
                }
                s.advance();
                continue;
            }
            if (stop.test(s) || s.atStatementBoundary(limit)) {
                return;
            }
            s.advance();
        }
    }

    /**
     * 当前位于左括号：括号内是查询时解析为子查询，否则递归扫描其中的子查询。结束后位于右括号之后。
     */
    static void scanParenthesized(ParserState s, ChunkBuilder b, int limit, Placement placement) {
        int open = s.pos;
        int close = s.matchingClose(open, limit);
        Token next = s.at(open + 1);
        if (b != null && placement != null && open + 1 < close && next != null && next.isKeyword("SELECT", "WITH")) {
            b.addSubquery(parseNested(s, open, close, placement, null, List.of()));
        } else if (s.depth < s.maxDepth) {
            s.pos = open + 1;
            s.depth++;
            try {
                while (s.pos < close) {
                    int before = s.pos;
                    scanExpression(s, b, close, placement, NEVER);
                    if (s.pos == before) {
                        s.advance();
                    }
                }
            } finally {
                s.depth--;
            }
        }
        s.pos = afterClose(s, close, limit);
    }

    /**
     * 只跳过 token，直到终止条件或硬边界（分号、批次分隔符、范围末尾），括号整体跳过。
     */
    static void skipUntil(ParserState s, int limit, StopCondition stop) {
        while (!s.atHardBoundary(limit)) {
            if (s.currentIs(TokenType.PAREN_OPEN)) {
                s.pos = afterClose(s, s.matchingClose(s.pos, limit), limit);
                continue;
            }
            if (s.currentIs(TokenType.PAREN_CLOSE) || stop.test(s)) {
                return;
            }
            s.advance();
        }
    }

    /**
     * 控制流及无法识别的语句：跳过起始 token，再跳到下一条语句开始处。
     */
    static void skipStatement(ParserState s, int limit) {
        s.advance();
        int caseDepth = 0;
        while (!s.atHardBoundary(limit)) {
            Token t = s.current();
            if (t.is(TokenType.PAREN_OPEN)) {
                s.pos = afterClose(s, s.matchingClose(s.pos, limit), limit);
                continue;
            }
            if (t.is(TokenType.PAREN_CLOSE)) {
                return;
            }
            if (t.isKeyword("CASE")) {
                caseDepth++;
            } else if (caseDepth > 0 && t.isKeyword("END")) {
                caseDepth--;
            } else if (caseDepth == 0 && s.atStatementBoundary(limit)) {
                return;
            }
            s.advance();
        }
    }

    static boolean atSoftBoundary(ParserState s) {
        return s.atStatementBoundary(s.tokens.size());
    }

    /**
     * 右括号之后的位置；未闭合时停在范围末尾。
     */
    static int afterClose(ParserState s, int close, int limit) {
        Token t = s.at(close);
        if (close < Math.min(limit, s.tokens.size()) && t != null && t.is(TokenType.PAREN_CLOSE)) {
            return close + 1;
        }
        return close;
    }

    static boolean nextIs(ParserState s, TokenType type) {
        Token next = s.peek(1);
        return next != null && next.is(type);
    }
}
