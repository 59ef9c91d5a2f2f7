package tools.sqlscope.scope;

import java.util.List;

/**
 * 真实表的列元数据来源，由外部的元数据缓存实现。
 * 引擎每次解析都重新询问，不缓存结果；未知的表返回空列表。
 */
@FunctionalInterface
public interface ColumnCatalog {

    ColumnCatalog NONE = (database, schema, table) -> List.of();

    /**
     * @param database 可能为 null
     * @param schema   可能为 null
     * @param table    不带定界符的表名
     */
    List<String> columnsOf(String database, String schema, String table);
}
