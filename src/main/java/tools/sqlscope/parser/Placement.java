package tools.sqlscope.parser;

/**
 * 嵌套查询在父查询中的位置，决定能否看到父查询的表（相关子查询）。
 */
public enum Placement {
    DERIVED_TABLE(false),
    SELECT_LIST(true),
    WHERE(true),
    HAVING(true),
    ON(true),
    ORDER_BY(true),
    SET(true),
    VALUES(true),
    SET_OPERATION(false),
    INSERT_SOURCE(false);

    private final boolean correlated;

    Placement(boolean correlated) {
        this.correlated = correlated;
    }

    public boolean isCorrelated() {
        return correlated;
    }
}
