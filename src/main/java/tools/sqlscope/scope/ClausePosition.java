package tools.sqlscope.scope;

/**
 * 光标所处的子句。
 */
public enum ClausePosition {
    BEFORE_FROM,
    IN_FROM,
    /** WHERE / HAVING / ON / GROUP BY / ORDER BY / WHEN */
    IN_WHERE,
    IN_SELECT_LIST,
    /** UPDATE ... SET */
    IN_SET,
    /** VALUES 以及 INSERT 的列清单 */
    IN_VALUES,
    IN_OUTPUT,
    IN_EXEC,
    UNKNOWN;

    /**
     * 该子句中期望补全列名。
     */
    public boolean expectsColumns() {
        return switch (this) {
            case IN_WHERE, IN_SELECT_LIST, IN_SET, IN_VALUES, IN_OUTPUT -> true;
            default -> false;
        };
    }
}
