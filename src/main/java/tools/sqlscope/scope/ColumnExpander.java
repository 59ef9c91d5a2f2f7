package tools.sqlscope.scope;

import tools.sqlscope.parser.Chunk;
import tools.sqlscope.parser.CteDefinition;
import tools.sqlscope.parser.NestedQuery;
import tools.sqlscope.parser.SelectColumn;
import tools.sqlscope.parser.TableKind;
import tools.sqlscope.parser.TableReference;
import tools.sqlscope.parser.TempTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 计算表引用对外可见的列。
 * CTE 与派生表优先使用显式列清单，否则取主体的输出列（别名生效），其中的 * 递归展开；
 * 临时对象取登记时的列；真实表询问 {@link ColumnCatalog}。
 */
final class ColumnExpander {
    private final ColumnCatalog catalog;
    private final List<TempTable> visibleTemps;
    private final int maxDepth;

    ColumnExpander(ColumnCatalog catalog, List<TempTable> visibleTemps, int maxDepth) {
        this.catalog = catalog == null ? ColumnCatalog.NONE : catalog;
        this.visibleTemps = visibleTemps == null ? List.of() : visibleTemps;
        this.maxDepth = maxDepth;
    }

    /**
     * @param ref   表引用
     * @param owner 引用所在的语句片段，用于查找派生表
     * @param ctes  引用处可见的 CTE，键为大写名
     */
    List<String> columnsOf(TableReference ref, Chunk owner, Map<String, CteDefinition> ctes) {
        Set<Object> visiting = Collections.newSetFromMap(new IdentityHashMap<>());
        return columnsOf(ref, owner, ctes, visiting, 0);
    }

    List<String> columnsOf(CteDefinition cte, Map<String, CteDefinition> ctes) {
        Set<Object> visiting = Collections.newSetFromMap(new IdentityHashMap<>());
        return cteColumns(cte, ctes, visiting, 0);
    }

    /**
     * 未经语句解析器分类的引用（子查询检测得到的表）：没有限定的普通表名与可见 CTE 同名时按 CTE 处理。
     */
    static TableReference classify(TableReference ref, Map<String, CteDefinition> ctes) {
        if (ref.kind() == TableKind.TABLE && ref.schema() == null && ref.database() == null
                && ctes.containsKey(key(ref.name()))) {
            return ref.withKind(TableKind.CTE);
        }
        return ref;
    }

    TempTable tempFor(String name) {
        TempTable found = null;
        for (TempTable t : visibleTemps) {
            if (t.hasName(name)) {
                found = t;
            }
        }
        return found;
    }

    static String key(String name) {
        return name == null ? "" : name.toUpperCase(Locale.ROOT);
    }

    private List<String> columnsOf(TableReference ref, Chunk owner, Map<String, CteDefinition> ctes,
                                   Set<Object> visiting, int depth) {
        if (depth > maxDepth) {
            return List.of();
        }
        return switch (ref.kind()) {
            case CTE -> {
                CteDefinition cte = ctes.get(key(ref.name()));
                yield cte == null ? List.of() : cteColumns(cte, ctes, visiting, depth);
            }
            case DERIVED -> {
                NestedQuery nested = owner == null ? null : owner.derivedTable(ref.alias());
                if (nested == null) {
                    yield List.of();
                }
                if (!nested.declaredColumns().isEmpty()) {
                    yield nested.declaredColumns();
                }
                yield produced(nested.chunk(), ctes, visiting, depth + 1);
            }
            case TEMP_TABLE, TABLE_VARIABLE -> {
                TempTable temp = tempFor(ref.name());
                yield temp == null ? List.of() : temp.columns();
            }
            default -> {
                List<String> columns = catalog.columnsOf(ref.database(), ref.schema(), ref.name());
                yield columns == null ? List.of() : List.copyOf(columns);
            }
        };
    }

    private List<String> cteColumns(CteDefinition cte, Map<String, CteDefinition> ctes,
                                    Set<Object> visiting, int depth) {
        if (!cte.declaredColumns().isEmpty()) {
            return cte.declaredColumns();
        }
        if (cte.body() == null || !visiting.add(cte)) {
            return List.of();
        }
        try {
            return produced(cte.body(), ctes, visiting, depth + 1);
        } finally {
            visiting.remove(cte);
        }
    }

    /**
     * 片段的输出列；* 与 t.* 按片段内的表展开。
     */
    private List<String> produced(Chunk chunk, Map<String, CteDefinition> ctes, Set<Object> visiting, int depth) {
        List<String> names = new ArrayList<>();
        if (chunk == null || depth > maxDepth || !visiting.add(chunk)) {
            return names;
        }
        try {
            for (SelectColumn c : chunk.producedColumns()) {
                if (!c.star()) {
                    if (c.name() != null) {
                        names.add(c.name());
                    }
                } else if (c.qualifier() != null) {
                    TableReference t = chunk.findByAlias(c.qualifier());
                    if (t != null) {
                        names.addAll(columnsOf(t, chunk, ctes, visiting, depth + 1));
                    }
                } else {
                    for (TableReference t : chunk.tables()) {
                        names.addAll(columnsOf(t, chunk, ctes, visiting, depth + 1));
                    }
                }
            }
        } finally {
            visiting.remove(chunk);
        }
        return names;
    }
}
