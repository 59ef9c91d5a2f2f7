package tools.sqlscope.token;

import java.util.Locale;
import java.util.Set;

/**
 * 关键字表。只收录影响结构识别的保留字，函数名、类型名按标识符处理。
 */
public final class SqlKeywords {

    private static final Set<String> KEYWORDS = Set.of(
            "SELECT", "FROM", "WHERE", "GROUP", "BY", "HAVING", "ORDER", "ASC", "DESC",
            "JOIN", "INNER", "LEFT", "RIGHT", "FULL", "OUTER", "CROSS", "APPLY", "ON",
            "AND", "OR", "NOT", "IN", "EXISTS", "IS", "NULL", "LIKE", "BETWEEN", "ANY", "SOME",
            "AS", "WITH", "RECURSIVE", "UNION", "ALL", "INTERSECT", "EXCEPT", "DISTINCT", "TOP",
            "PERCENT", "TIES",
            "INSERT", "INTO", "VALUES", "DEFAULT", "UPDATE", "SET", "DELETE", "OUTPUT",
            "MERGE", "USING", "WHEN", "MATCHED", "THEN",
            "CREATE", "ALTER", "DROP", "TRUNCATE", "TABLE", "VIEW", "PROCEDURE", "PROC",
            "FUNCTION", "TRIGGER", "INDEX", "RETURNS", "RETURN",
            "PRIMARY", "FOREIGN", "REFERENCES", "CONSTRAINT", "UNIQUE", "CHECK",
            "DECLARE", "EXEC", "EXECUTE", "USE", "IF", "ELSE", "BEGIN", "END", "WHILE",
            "CASE", "OVER", "PARTITION", "LIMIT", "OFFSET", "FETCH", "NEXT", "ROWS", "ONLY",
            "LATERAL", "PIVOT", "UNPIVOT", "OPTION", "COLLATE", "FOR"
    );

    /**
     * 在括号深度 0 处出现时开启一条新语句的关键字。
     * SET / SELECT / WITH 需要结合上下文判断，由解析器处理。
     */
    private static final Set<String> STATEMENT_STARTERS = Set.of(
            "SELECT", "INSERT", "UPDATE", "DELETE", "MERGE", "CREATE", "ALTER", "DROP",
            "TRUNCATE", "DECLARE", "EXEC", "EXECUTE", "WITH", "USE", "SET", "IF", "ELSE",
            "BEGIN", "END", "WHILE", "RETURN"
    );

    /**
     * 子句起始关键字，在 FROM 列表中遇到即结束表引用的收集。
     */
    private static final Set<String> CLAUSE_KEYWORDS = Set.of(
            "WHERE", "GROUP", "HAVING", "ORDER", "UNION", "INTERSECT", "EXCEPT", "OPTION",
            "OUTPUT", "SET", "WHEN", "ON", "LIMIT", "OFFSET", "FETCH", "VALUES", "FOR"
    );

    /**
     * 连接关键字。
     */
    private static final Set<String> JOIN_KEYWORDS = Set.of(
            "JOIN", "INNER", "LEFT", "RIGHT", "FULL", "OUTER", "CROSS", "APPLY"
    );

    private SqlKeywords() {
    }

    public static boolean isKeyword(String word) {
        return word != null && KEYWORDS.contains(word.toUpperCase(Locale.ROOT));
    }

    public static boolean isStatementStarter(Token token) {
        return token != null && token.type() == TokenType.KEYWORD && STATEMENT_STARTERS.contains(token.upper());
    }

    public static boolean isClauseKeyword(Token token) {
        return token != null && token.type() == TokenType.KEYWORD && CLAUSE_KEYWORDS.contains(token.upper());
    }

    public static boolean isJoinKeyword(Token token) {
        return token != null && token.type() == TokenType.KEYWORD && JOIN_KEYWORDS.contains(token.upper());
    }

    public static boolean isSetOperator(Token token) {
        return token != null && token.isKeyword("UNION", "INTERSECT", "EXCEPT");
    }
}
