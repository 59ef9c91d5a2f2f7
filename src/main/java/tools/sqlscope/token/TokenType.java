package tools.sqlscope.token;

/**
 * 词法单元类型。空白不产生 token，位置信息由 line/column 携带。
 */
public enum TokenType {
    IDENTIFIER,
    /** [name]、"name"、`name` 三种带引号的标识符 */
    BRACKET_ID,
    DOT,
    KEYWORD,
    OPERATOR,
    PAREN_OPEN,
    PAREN_CLOSE,
    COMMA,
    SEMICOLON,
    STAR,
    STRING,
    NUMBER,
    COMMENT,
    LINE_COMMENT,
    /** 批次分隔符（默认 GO） */
    GO,
    VARIABLE,
    GLOBAL_VARIABLE,
    /** #temp / ##temp */
    TEMP_TABLE
}
