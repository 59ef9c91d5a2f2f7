package tools.sqlscope.scope;

import tools.sqlscope.token.Token;
import tools.sqlscope.token.TokenType;

import java.util.List;

/**
 * 从光标向回做有界扫描，确定所在子句与补全类别。
 * 已闭合的括号与 CASE ... END 整体跳过；包住光标的左括号与 CASE 是透明的，继续向外找（函数参数、IN 列表、子查询开头），
 * 唯一例外是 INSERT [INTO] t ( 的列清单。
 */
final class ClauseDetector {

    private ClauseDetector() {
    }

    /**
     * @param tokens 去掉注释后的 token 序列
     * @param from   扫描起点（不含），一般为光标下标减去正在输入的半截单词
     * @param window 最多检查的 token 数，超出时返回 {@link ClausePosition#UNKNOWN}
     */
    static ClausePosition detect(List<Token> tokens, int from, int window) {
        int depth = 0;
        int caseDepth = 0;
        int scanned = 0;
        for (int i = Math.min(from, tokens.size()) - 1; i >= 0; i--) {
            if (++scanned > window) {
                return ClausePosition.UNKNOWN;
            }
            Token t = tokens.get(i);
            if (t.is(TokenType.PAREN_CLOSE)) {
                depth++;
                continue;
            }
            if (t.is(TokenType.PAREN_OPEN)) {
                if (depth > 0) {
                    depth--;
                } else if (isInsertColumnList(tokens, i)) {
                    return ClausePosition.IN_VALUES;
                }
                continue;
            }
            if (depth > 0) {
                continue;
            }
            if (t.is(TokenType.SEMICOLON) || t.is(TokenType.GO)) {
                return ClausePosition.BEFORE_FROM;
            }
            // 已结束的 CASE ... END 与括号一样整体跳过；BEGIN ... END 块同样配对
            if (t.isKeyword("END")) {
                caseDepth++;
                continue;
            }
            if (t.isKeyword("CASE")) {
                if (caseDepth > 0) {
                    caseDepth--;
                }
                continue;
            }
            if (caseDepth > 0) {
                if (t.isKeyword("BEGIN")) {
                    caseDepth--;
                }
                continue;
            }
            if (t.is(TokenType.KEYWORD)) {
                ClausePosition p = classify(tokens, i);
                if (p != null) {
                    return p;
                }
            }
        }
        return ClausePosition.BEFORE_FROM;
    }

    /**
     * 关键字决定的子句；返回 null 表示继续向回扫描（AND、BY、THEN、END 等）。
     */
    private static ClausePosition classify(List<Token> tokens, int i) {
        Token t = tokens.get(i);
        return switch (t.upper()) {
            case "FROM", "JOIN", "APPLY", "INTO", "UPDATE", "DELETE", "MERGE", "USING", "TABLE", "INSERT",
                    "INNER", "FULL", "CROSS", "OUTER" -> ClausePosition.IN_FROM;
            // LEFT(...) / RIGHT(...) 是字符串函数
            case "LEFT", "RIGHT" -> followedBy(tokens, i, TokenType.PAREN_OPEN) ? null : ClausePosition.IN_FROM;
            case "WHERE", "HAVING", "ON", "WHEN", "GROUP", "ORDER" -> ClausePosition.IN_WHERE;
            case "SELECT" -> ClausePosition.IN_SELECT_LIST;
            case "SET" -> ClausePosition.IN_SET;
            case "VALUES" -> ClausePosition.IN_VALUES;
            case "OUTPUT" -> ClausePosition.IN_OUTPUT;
            case "EXEC", "EXECUTE" -> ClausePosition.IN_EXEC;
            case "CREATE", "ALTER", "DROP", "DECLARE", "TRUNCATE" -> ClausePosition.UNKNOWN;
            case "IF", "WHILE", "BEGIN", "RETURN" -> ClausePosition.BEFORE_FROM;
            // WITH (NOLOCK) 之类的表提示不影响子句
            case "WITH" -> followedBy(tokens, i, TokenType.PAREN_OPEN) ? null : ClausePosition.UNKNOWN;
            default -> null;
        };
    }

    /**
     * 限定名链之前的 token 下标：跳过 "name." 的重复，例如 FROM dbo.| 得到 FROM 的下标。
     */
    static int previousIndex(List<Token> tokens, int from) {
        int i = Math.min(from, tokens.size()) - 1;
        while (i >= 0 && tokens.get(i).is(TokenType.DOT)) {
            i--;
            if (i >= 0 && tokens.get(i).isObjectName()) {
                i--;
            }
        }
        return i;
    }

    static TriggerKind trigger(ClausePosition clause, List<Token> tokens, int previousIndex) {
        Token prev = previousIndex >= 0 && previousIndex < tokens.size() ? tokens.get(previousIndex) : null;
        if (prev != null && prev.isKeyword("AS")) {
            return TriggerKind.NONE;
        }
        return switch (clause) {
            case IN_FROM -> introducesTable(prev) ? TriggerKind.TABLE : TriggerKind.NONE;
            case IN_EXEC -> isProcedurePosition(tokens, previousIndex) ? TriggerKind.PROCEDURE : TriggerKind.NONE;
            case BEFORE_FROM, UNKNOWN -> TriggerKind.NONE;
            default -> clause.expectsColumns() ? TriggerKind.COLUMN : TriggerKind.NONE;
        };
    }

    private static boolean introducesTable(Token prev) {
        if (prev == null) {
            return false;
        }
        return prev.is(TokenType.COMMA)
                || prev.isKeyword("FROM", "JOIN", "APPLY", "INTO", "UPDATE", "DELETE", "USING", "MERGE", "TABLE",
                "INSERT");
    }

    /**
     * EXEC | 或 EXEC @ret = |
     */
    private static boolean isProcedurePosition(List<Token> tokens, int prevIndex) {
        if (prevIndex < 0) {
            return false;
        }
        Token prev = tokens.get(prevIndex);
        if (prev.isKeyword("EXEC", "EXECUTE")) {
            return true;
        }
        return prev.is(TokenType.OPERATOR) && "=".equals(prev.text())
                && prevIndex >= 2
                && tokens.get(prevIndex - 1).is(TokenType.VARIABLE)
                && tokens.get(prevIndex - 2).isKeyword("EXEC", "EXECUTE");
    }

    /**
     * INSERT [INTO] [schema.]t ( 或 MERGE ... THEN INSERT (：括号内是目标表的列清单。
     */
    private static boolean isInsertColumnList(List<Token> tokens, int open) {
        int j = open - 1;
        int names = 0;
        while (j >= 0 && tokens.get(j).isObjectName()) {
            names++;
            j--;
            if (j >= 0 && tokens.get(j).is(TokenType.DOT)) {
                j--;
            } else {
                break;
            }
        }
        if (j < 0) {
            return false;
        }
        Token before = tokens.get(j);
        if (names == 0) {
            return before.isKeyword("INSERT");
        }
        return before.isKeyword("INTO", "INSERT");
    }

    private static boolean followedBy(List<Token> tokens, int i, TokenType type) {
        return i + 1 < tokens.size() && tokens.get(i + 1).is(type);
    }
}
