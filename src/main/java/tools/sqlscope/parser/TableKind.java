package tools.sqlscope.parser;

/**
 * 表引用的来源。
 */
public enum TableKind {
    TABLE,
    CTE,
    TEMP_TABLE,
    TABLE_VARIABLE,
    /** FROM 中带别名的子查询 */
    DERIVED,
    TABLE_FUNCTION;

    /**
     * 按名字前缀推断：#x 为临时表，@x 为表变量，其余按普通表处理。
     */
    public static TableKind fromName(String name) {
        if (name == null || name.isEmpty()) {
            return TABLE;
        }
        return switch (name.charAt(0)) {
            case '#' -> TEMP_TABLE;
            case '@' -> TABLE_VARIABLE;
            default -> TABLE;
        };
    }

    public boolean isSessionScoped() {
        return this == TEMP_TABLE || this == TABLE_VARIABLE;
    }
}
