package tools.sqlscope.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.sqlscope.parser.Chunk;
import tools.sqlscope.parser.ParseResult;
import tools.sqlscope.parser.SqlStatementParser;
import tools.sqlscope.parser.TableKind;
import tools.sqlscope.parser.TableReference;
import tools.sqlscope.token.Token;
import tools.sqlscope.token.TokenNavigator;
import tools.sqlscope.token.TokenType;
import tools.sqlscope.util.Config;

import java.util.ArrayList;
import java.util.List;

/**
 * 识别光标是否位于语句解析器没有展开的 ( SELECT ... ) 中（例如 IF EXISTS (...)、SET @x = (...)），
 * 并提取该子查询 FROM 子句中的表。
 * <p>
 * 所有扫描都是线性的，嵌套再深也不会回溯或递归。
 */
public final class SubqueryBoundaryDetector {
    private static final Logger log = LoggerFactory.getLogger(SubqueryBoundaryDetector.class);

    private SubqueryBoundaryDetector() {
    }

    /**
     * 反向扫描光标前的窗口：
     * 右括号进入一个已闭合的组，左括号退出；在当前层已见过 SELECT 时遇到未闭合的左括号即为子查询开头，
     * 但左括号前紧挨标识符（函数调用）或 AS（CTE 定义）时不算。
     * 遇到 INSERT / UPDATE / DELETE / MERGE / WITH 停止。
     */
    public static SubqueryDetection detectUnparsed(List<Token> tokens, int line, int column) {
        List<Token> prev = TokenNavigator.tokensBeforeCursor(tokens, line, column, Config.subqueryWindow());
        if (prev.isEmpty()) {
            return SubqueryDetection.NONE;
        }
        int depth = 0;
        boolean foundSelect = false;
        boolean detected = false;
        for (int i = 0; i < prev.size(); i++) {
            Token t = prev.get(i);
            if (t.is(TokenType.PAREN_CLOSE)) {
                depth++;
            } else if (t.is(TokenType.PAREN_OPEN)) {
                if (depth > 0) {
                    depth--;
                    continue;
                }
                // 未闭合的左括号：没见过 SELECT 时是值列表或函数参数，继续向外找
                if (foundSelect) {
                    Token before = i + 1 < prev.size() ? prev.get(i + 1) : null;
                    if (!isCallOrCteParen(before)) {
                        detected = true;
                        break;
                    }
                    foundSelect = false;
                }
            } else if (t.is(TokenType.KEYWORD) && depth == 0) {
                if (t.isKeyword("SELECT")) {
                    foundSelect = true;
                } else if (t.isKeyword("INSERT", "UPDATE", "DELETE", "MERGE", "WITH")) {
                    break;
                }
            }
        }
        if (!detected) {
            return SubqueryDetection.NONE;
        }
        List<TableReference> tables = extractTables(tokens, line, column);
        log.debug("光标位于未解析子查询中，提取到 {} 个表", tables.size());
        return new SubqueryDetection(true, tables);
    }

    /**
     * 包含光标的 ( SELECT ... ) 范围，下标基于去掉注释后的 token 序列；找不到返回 null。
     * 没有配对右括号时范围延伸到序列末尾。
     */
    public static SubquerySpan findSubqueryBounds(List<Token> tokens, int line, int column) {
        List<Token> sig = TokenNavigator.significant(tokens);
        return findSubqueryBounds(sig, TokenNavigator.cursorIndex(sig, line, column));
    }

    static SubquerySpan findSubqueryBounds(List<Token> sig, int cursorIndex) {
        int depth = 0;
        int start = -1;
        for (int i = Math.min(cursorIndex, sig.size()) - 1; i >= 0; i--) {
            Token t = sig.get(i);
            if (t.is(TokenType.PAREN_CLOSE)) {
                depth++;
            } else if (t.is(TokenType.PAREN_OPEN)) {
                if (depth > 0) {
                    depth--;
                    continue;
                }
                Token next = i + 1 < sig.size() ? sig.get(i + 1) : null;
                Token before = i > 0 ? sig.get(i - 1) : null;
                if (next != null && next.isKeyword("SELECT") && !isCallOrCteParen(before)) {
                    start = i;
                    break;
                }
            }
        }
        if (start < 0) {
            return null;
        }
        int level = 0;
        for (int i = start + 1; i < sig.size(); i++) {
            Token t = sig.get(i);
            if (t.is(TokenType.PAREN_OPEN)) {
                level++;
            } else if (t.is(TokenType.PAREN_CLOSE)) {
                if (level == 0) {
                    return new SubquerySpan(start, i, true);
                }
                level--;
            }
        }
        return new SubquerySpan(start, sig.size(), false);
    }

    /**
     * 子查询的 FROM 表。依次尝试：对子查询片段完整解析、从光标反向收集 FROM 子句、从光标正向查找 FROM。
     * 找不到时返回空列表。
     */
    public static List<TableReference> extractTables(List<Token> tokens, int line, int column) {
        List<Token> sig = TokenNavigator.significant(tokens);
        int cursorIndex = TokenNavigator.cursorIndex(sig, line, column);

        SubquerySpan span = findSubqueryBounds(sig, cursorIndex);
        if (span != null && span.startIndex() + 1 < span.endIndex()) {
            List<TableReference> parsed = parseSpan(sig.subList(span.startIndex() + 1, span.endIndex()));
            if (!parsed.isEmpty()) {
                return parsed;
            }
        }
        List<TableReference> backward = extractTablesBackward(sig, cursorIndex);
        if (!backward.isEmpty()) {
            return backward;
        }
        return extractTablesForward(sig, cursorIndex);
    }

    private static List<TableReference> parseSpan(List<Token> slice) {
        ParseResult result = SqlStatementParser.parse(slice);
        if (result.chunks().isEmpty()) {
            return List.of();
        }
        Chunk first = result.chunks().get(0);
        return first.tables();
    }

    /**
     * 在当前括号层内从光标向回走，直到子查询自身的左括号或 SELECT；
     * 遇到 FROM 时把其后的 token 按 "name [AS] alias, ... JOIN name ..." 解析，ON 条件整体跳过。
     */
    public static List<TableReference> extractTablesBackward(List<Token> sig, int cursorIndex) {
        List<Token> afterFrom = new ArrayList<>();
        boolean foundFrom = false;
        int depth = 0;
        for (int i = Math.min(cursorIndex, sig.size()) - 1; i >= 0; i--) {
            Token t = sig.get(i);
            if (t.is(TokenType.PAREN_CLOSE)) {
                depth++;
            } else if (t.is(TokenType.PAREN_OPEN)) {
                if (depth == 0) {
                    break;
                }
                depth--;
            } else if (depth == 0) {
                if (t.isKeyword("FROM")) {
                    foundFrom = true;
                    break;
                }
                if (t.isKeyword("SELECT")) {
                    break;
                }
                afterFrom.add(0, t);
            }
        }
        if (!foundFrom) {
            return List.of();
        }
        List<TableReference> tables = new ArrayList<>();
        int i = 0;
        while (i < afterFrom.size()) {
            Token t = afterFrom.get(i);
            if (t.isKeyword("WHERE", "GROUP", "HAVING", "ORDER")) {
                break;
            }
            if (t.isKeyword("ON")) {
                i = skipJoinCondition(afterFrom, i + 1);
                continue;
            }
            if (t.isObjectName()) {
                i = readTable(afterFrom, i, tables);
                continue;
            }
            i++;
        }
        return tables;
    }

    /**
     * "SELECT | FROM t" 的情况：光标之后在同一括号层内找 FROM，直到子查询的右括号。
     */
    static List<TableReference> extractTablesForward(List<Token> sig, int cursorIndex) {
        List<TableReference> tables = new ArrayList<>();
        boolean inFrom = false;
        int depth = 0;
        int i = Math.max(0, cursorIndex);
        while (i < sig.size()) {
            Token t = sig.get(i);
            if (t.is(TokenType.PAREN_OPEN)) {
                depth++;
                i++;
            } else if (t.is(TokenType.PAREN_CLOSE)) {
                if (depth == 0) {
                    break;
                }
                depth--;
                i++;
            } else if (depth > 0) {
                i++;
            } else if (t.isKeyword("FROM")) {
                inFrom = true;
                i++;
            } else if (inFrom && t.isKeyword("WHERE", "GROUP", "HAVING", "ORDER", "UNION")) {
                break;
            } else if (inFrom && t.isKeyword("ON")) {
                i = skipJoinCondition(sig, i + 1);
            } else if (inFrom && t.isObjectName()) {
                i = readTable(sig, i, tables);
            } else {
                i++;
            }
        }
        return tables;
    }

    /**
     * 从 i 开始读取 [db.][schema.]name [[AS] alias]，结果加入 out，返回其后的位置。
     */
    private static int readTable(List<Token> list, int i, List<TableReference> out) {
        List<String> parts = new ArrayList<>();
        parts.add(list.get(i).unquotedText());
        int j = i + 1;
        while (parts.size() < 3 && j + 1 < list.size()
                && list.get(j).is(TokenType.DOT) && list.get(j + 1).isObjectName()) {
            parts.add(list.get(j + 1).unquotedText());
            j += 2;
        }
        String alias = null;
        if (j < list.size()) {
            Token a = list.get(j);
            if (a.isKeyword("AS") && j + 1 < list.size() && list.get(j + 1).isName()) {
                alias = list.get(j + 1).unquotedText();
                j += 2;
            } else if (a.isName()) {
                alias = a.unquotedText();
                j++;
            }
        }
        int n = parts.size();
        String name = parts.get(n - 1);
        String schema = n >= 2 ? parts.get(n - 2) : null;
        String database = n >= 3 ? parts.get(n - 3) : null;
        out.add(new TableReference(name, schema, database, alias, TableKind.fromName(name)));
        return j;
    }

    /**
     * 跳过 ON 条件直到下一个连接关键字或子句关键字，括号内容不参与判断。
     */
    private static int skipJoinCondition(List<Token> list, int from) {
        int depth = 0;
        int i = from;
        while (i < list.size()) {
            Token t = list.get(i);
            if (t.is(TokenType.PAREN_OPEN)) {
                depth++;
            } else if (t.is(TokenType.PAREN_CLOSE)) {
                if (depth == 0) {
                    return i;
                }
                depth--;
            } else if (depth == 0 && (t.is(TokenType.COMMA) || t.isKeyword("JOIN", "INNER", "LEFT", "RIGHT",
                    "FULL", "CROSS", "OUTER", "WHERE", "GROUP", "HAVING", "ORDER", "UNION"))) {
                return i;
            }
            i++;
        }
        return i;
    }

    private static boolean isCallOrCteParen(Token before) {
        return before != null && (before.isName() || before.isKeyword("AS"));
    }
}
