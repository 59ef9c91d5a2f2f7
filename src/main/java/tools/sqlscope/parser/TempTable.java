package tools.sqlscope.parser;

import java.util.List;

/**
 * 会话内临时对象：#temp、##temp 以及 DECLARE @t TABLE 表变量。
 * createdIndex/droppedIndex 为创建、删除语句中对象名（或 DROP 关键字）的 token 下标，未删除时为 -1。
 */
public record TempTable(String name,
                        List<String> columns,
                        int batchIndex,
                        int createdIndex,
                        int droppedIndex,
                        boolean global,
                        TableKind kind) {

    public TempTable {
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    /**
     * 可见条件：同一批次、创建在光标之前、尚未删除（DROP 语句本身之后即不可见）。
     */
    public boolean isVisibleAt(int batch, int cursorIndex) {
        return batchIndex == batch
                && createdIndex < cursorIndex
                && (droppedIndex < 0 || cursorIndex <= droppedIndex);
    }

    public TempTable dropped(int index) {
        return new TempTable(name, columns, batchIndex, createdIndex, index, global, kind);
    }

    public boolean hasName(String candidate) {
        return candidate != null && name.equalsIgnoreCase(candidate);
    }
}
