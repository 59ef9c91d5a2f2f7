package tools.sqlscope.parser;

import java.util.Objects;

/**
 * FROM/JOIN 等位置上的一个表引用。alias 缺省等于 name，按别名查找时未起别名的表也能命中。
 */
public record TableReference(String name, String schema, String database, String alias, TableKind kind) {

    public TableReference {
        Objects.requireNonNull(name, "name");
        alias = alias == null || alias.isBlank() ? name : alias;
        kind = kind == null ? TableKind.fromName(name) : kind;
    }

    public static TableReference of(String name) {
        return new TableReference(name, null, null, null, null);
    }

    /**
     * database.schema.name 形式的完整名，缺失的层级省略。
     */
    public String qualifiedName() {
        StringBuilder sb = new StringBuilder();
        if (database != null) {
            sb.append(database).append('.');
        }
        if (schema != null) {
            sb.append(schema).append('.');
        } else if (database != null) {
            sb.append('.');
        }
        return sb.append(name).toString();
    }

    public boolean hasAlias(String candidate) {
        return candidate != null && alias.equalsIgnoreCase(candidate);
    }

    public boolean hasName(String candidate) {
        return candidate != null && name.equalsIgnoreCase(candidate);
    }

    public TableReference withKind(TableKind newKind) {
        return new TableReference(name, schema, database, alias, newKind);
    }
}
