package tools.sqlscope.scope;

import tools.sqlscope.parser.TableKind;

import java.util.List;

/**
 * 光标处可引用的一个表及其列。depth 为所在查询层级，0 表示最内层。
 */
public record VisibleTable(String name,
                           String schema,
                           String database,
                           String alias,
                           TableKind kind,
                           List<String> columns,
                           int depth) {

    public VisibleTable {
        alias = alias == null || alias.isBlank() ? name : alias;
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public boolean hasAlias(String candidate) {
        return candidate != null && alias != null && alias.equalsIgnoreCase(candidate);
    }

    public boolean hasName(String candidate) {
        return candidate != null && name != null && name.equalsIgnoreCase(candidate);
    }

    public boolean hasSchema(String candidate) {
        return candidate != null && schema != null && schema.equalsIgnoreCase(candidate);
    }

    public boolean hasDatabase(String candidate) {
        return candidate != null && database != null && database.equalsIgnoreCase(candidate);
    }
}
