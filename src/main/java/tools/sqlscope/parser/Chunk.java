package tools.sqlscope.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * 一条语句（或一个子查询片段）的解析摘要。子查询与 CTE 主体以子节点形式独占持有。
 * startIndex 为首个 token 下标，endIndex 为语句之后第一个 token 的下标（子查询则为右括号下标）。
 */
public record Chunk(StatementKind kind,
                    List<TableReference> tables,
                    List<CteDefinition> ctes,
                    List<SelectColumn> producedColumns,
                    List<NestedQuery> subqueries,
                    List<String> insertColumns,
                    TableReference target,
                    int batchIndex,
                    int startIndex,
                    int endIndex) {

    public Chunk {
        tables = tables == null ? List.of() : List.copyOf(tables);
        ctes = ctes == null ? List.of() : List.copyOf(ctes);
        producedColumns = producedColumns == null ? List.of() : List.copyOf(producedColumns);
        subqueries = subqueries == null ? List.of() : List.copyOf(subqueries);
        insertColumns = insertColumns == null ? List.of() : List.copyOf(insertColumns);
    }

    public boolean contains(int cursorIndex) {
        return startIndex < cursorIndex && cursorIndex <= endIndex;
    }

    /**
     * 输出列名（别名优先），不含 * 项。
     */
    public List<String> producedColumnNames() {
        List<String> names = new ArrayList<>();
        for (SelectColumn c : producedColumns) {
            if (!c.star() && c.name() != null) {
                names.add(c.name());
            }
        }
        return names;
    }

    public TableReference findByAlias(String alias) {
        for (TableReference t : tables) {
            if (t.hasAlias(alias)) {
                return t;
            }
        }
        return null;
    }

    public NestedQuery derivedTable(String alias) {
        for (NestedQuery q : subqueries) {
            if (q.placement() == Placement.DERIVED_TABLE && q.alias() != null && q.alias().equalsIgnoreCase(alias)) {
                return q;
            }
        }
        return null;
    }
}
