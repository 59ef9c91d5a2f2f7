package tools.sqlscope.context;

/**
 * 比较运算符左侧的列引用，例如 {@code t.col >= } 中的 {@code t.col}。
 *
 * @param qualified  原样拼接的限定名
 * @param tableRef   表名或别名，未限定时为 null
 * @param columnName 列名
 * @param schema     三段以上时的 schema
 */
public record ComparisonOperand(String qualified, String tableRef, String columnName, String schema) {
}
