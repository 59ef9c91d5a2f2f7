package tools.sqlscope.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * WITH name [(col, ...)] AS (body) 中的一项。
 * startIndex/endIndex 为主体左右括号的 token 下标。
 */
public record CteDefinition(String name,
                            List<String> declaredColumns,
                            Chunk body,
                            boolean recursive,
                            int startIndex,
                            int endIndex) {

    public CteDefinition {
        declaredColumns = declaredColumns == null ? List.of() : List.copyOf(declaredColumns);
    }

    /**
     * 对外可见的列：有显式列清单时用清单，否则取主体的输出列名（不展开 *）。
     */
    public List<String> visibleColumns() {
        if (!declaredColumns.isEmpty()) {
            return declaredColumns;
        }
        if (body == null) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        for (SelectColumn c : body.producedColumns()) {
            if (!c.star() && c.name() != null) {
                names.add(c.name());
            }
        }
        return names;
    }

    public boolean bodyContains(int cursorIndex) {
        return startIndex < cursorIndex && cursorIndex <= endIndex;
    }
}
