package tools.sqlscope.context;

import java.util.List;

/**
 * 限定名的一种解释：path 中的各段依次对应 {@link Role} 描述的层级。
 */
public record NameReading(Role role, List<String> path) {

    public enum Role {
        /** alias.column 或单独的 alias */
        ALIAS,
        /** schema 或 schema.table */
        SCHEMA,
        /** database.schema 或 database.schema.table */
        DATABASE,
        /** database.schema.table.column */
        FULL_COLUMN
    }

    public NameReading {
        path = path == null ? List.of() : List.copyOf(path);
    }

    public String head() {
        return path.isEmpty() ? null : path.get(0);
    }
}
