package tools.sqlscope.context;

import java.util.List;

/**
 * 点号分隔的限定名解析结果。字段按段数填充，歧义时同时给出两种解释：
 * <pre>
 * 段数 | 无尾随点                          | 有尾随点
 * 0    | 全部为空                          | 全部为空
 * 1    | alias                             | schema + alias
 * 2    | schema+table 以及 alias+column    | database+schema
 * 3    | database+schema+table             | 同左
 * &gt;=4  | 前四段依次为 database/schema/table/column，其余忽略
 * </pre>
 */
public record QualifiedName(String database,
                            String schema,
                            String table,
                            String column,
                            String alias,
                            List<String> parts,
                            boolean hasTrailingDot) {

    public static final QualifiedName EMPTY = new QualifiedName(null, null, null, null, null, List.of(), false);

    public QualifiedName {
        parts = parts == null ? List.of() : List.copyOf(parts);
    }

    public static QualifiedName of(List<String> parts, boolean hasTrailingDot) {
        if (parts == null || parts.isEmpty()) {
            return hasTrailingDot
                    ? new QualifiedName(null, null, null, null, null, List.of(), true)
                    : EMPTY;
        }
        return switch (parts.size()) {
            case 1 -> hasTrailingDot
                    ? new QualifiedName(null, parts.get(0), null, null, parts.get(0), parts, true)
                    : new QualifiedName(null, null, null, null, parts.get(0), parts, false);
            case 2 -> hasTrailingDot
                    ? new QualifiedName(parts.get(0), parts.get(1), null, null, null, parts, true)
                    : new QualifiedName(null, parts.get(0), parts.get(1), parts.get(1), parts.get(0), parts, false);
            case 3 -> new QualifiedName(parts.get(0), parts.get(1), parts.get(2), null, null, parts, hasTrailingDot);
            default -> new QualifiedName(parts.get(0), parts.get(1), parts.get(2), parts.get(3), null, parts, hasTrailingDot);
        };
    }

    public int partCount() {
        return parts.size();
    }

    public boolean isEmpty() {
        return parts.isEmpty();
    }

    public String dotted() {
        return String.join(".", parts);
    }

    public String lastPart() {
        return parts.isEmpty() ? null : parts.get(parts.size() - 1);
    }

    /**
     * 把字段上的歧义展开成候选解释，交给作用域分析按可见表消歧。
     */
    public Resolution<NameReading> readings() {
        int n = parts.size();
        if (n == 0) {
            return Resolution.noMatch();
        }
        if (n == 1) {
            NameReading asAlias = new NameReading(NameReading.Role.ALIAS, List.of(alias));
            if (!hasTrailingDot) {
                return Resolution.matched(asAlias);
            }
            return Resolution.ambiguous(List.of(
                    new NameReading(NameReading.Role.SCHEMA, List.of(schema)),
                    asAlias));
        }
        if (n == 2) {
            if (hasTrailingDot) {
                return Resolution.matched(new NameReading(NameReading.Role.DATABASE, List.of(database, schema)));
            }
            return Resolution.ambiguous(List.of(
                    new NameReading(NameReading.Role.SCHEMA, List.of(schema, table)),
                    new NameReading(NameReading.Role.ALIAS, List.of(alias, column))));
        }
        if (n == 3) {
            return Resolution.matched(new NameReading(NameReading.Role.DATABASE, List.of(database, schema, table)));
        }
        return Resolution.matched(new NameReading(NameReading.Role.FULL_COLUMN, List.of(database, schema, table, column)));
    }
}
