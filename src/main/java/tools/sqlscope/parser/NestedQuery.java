package tools.sqlscope.parser;

import java.util.List;

/**
 * 子查询节点，由父 {@link Chunk} 独占，没有指回父节点的引用。
 * startIndex 为开启它的 token（左括号、集合运算符或 SELECT）下标，endIndex 为右括号下标，
 * 未闭合或无括号时为其后第一个 token 的下标。
 */
public record NestedQuery(String alias,
                          List<String> declaredColumns,
                          Placement placement,
                          Chunk chunk,
                          int startIndex,
                          int endIndex) {

    public NestedQuery {
        declaredColumns = declaredColumns == null ? List.of() : List.copyOf(declaredColumns);
    }

    public boolean contains(int cursorIndex) {
        return startIndex < cursorIndex && cursorIndex <= endIndex;
    }
}
