package tools.sqlscope.context;

/**
 * 子查询在 token 序列中的范围：startIndex 为左括号下标，endIndex 为配对的右括号下标，
 * 未闭合时 endIndex 等于 token 总数，terminated 为 false。
 */
public record SubquerySpan(int startIndex, int endIndex, boolean terminated) {

    public boolean contains(int cursorIndex) {
        return startIndex < cursorIndex && cursorIndex <= endIndex;
    }
}
