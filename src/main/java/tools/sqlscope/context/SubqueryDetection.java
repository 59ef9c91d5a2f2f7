package tools.sqlscope.context;

import tools.sqlscope.parser.TableReference;

import java.util.List;

/**
 * 未解析子查询的检测结果；不在子查询中时 tables 为空。
 */
public record SubqueryDetection(boolean inSubquery, List<TableReference> tables) {

    public static final SubqueryDetection NONE = new SubqueryDetection(false, List.of());

    public SubqueryDetection {
        tables = tables == null ? List.of() : List.copyOf(tables);
    }
}
