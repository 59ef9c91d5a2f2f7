package tools.sqlscope.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * 解析过程中逐步填充的 {@link Chunk}，结束时一次性生成不可变结果。
 */
final class ChunkBuilder {
    StatementKind kind;
    final List<TableReference> tables = new ArrayList<>();
    final List<CteDefinition> ctes = new ArrayList<>();
    final List<SelectColumn> producedColumns = new ArrayList<>();
    final List<NestedQuery> subqueries = new ArrayList<>();
    final List<String> insertColumns = new ArrayList<>();
    TableReference target;
    final int batchIndex;
    final int startIndex;

    ChunkBuilder(StatementKind kind, int batchIndex, int startIndex) {
        this.kind = kind;
        this.batchIndex = batchIndex;
        this.startIndex = startIndex;
    }

    void addTable(TableReference ref) {
        if (ref != null) {
            tables.add(ref);
        }
    }

    void addSubquery(NestedQuery nested) {
        if (nested != null) {
            subqueries.add(nested);
        }
    }

    /**
     * UPDATE e ... FROM Employees e 这类写法中目标只是 FROM 表的别名，去掉重复的目标引用。
     */
    void dropTargetIfAliased() {
        if (target == null || target.schema() != null || target.database() != null) {
            return;
        }
        for (TableReference t : tables) {
            if (t != target && t.hasAlias(target.name())) {
                tables.remove(target);
                target = t;
                return;
            }
        }
    }

    List<String> producedColumnNamesSoFar() {
        List<String> names = new ArrayList<>();
        for (SelectColumn c : producedColumns) {
            if (!c.star() && c.name() != null) {
                names.add(c.name());
            }
        }
        return names;
    }

    Chunk build(int endIndex) {
        return new Chunk(kind, tables, ctes, producedColumns, subqueries, insertColumns,
                target, batchIndex, startIndex, endIndex);
    }
}
