package tools.sqlscope.scope;

/**
 * 光标位置超出文本范围，属于调用方违反约定。
 */
public class CursorOutOfRangeException extends RuntimeException {
    private final int line;
    private final int column;

    public CursorOutOfRangeException(int line, int column, String message) {
        super(message);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
