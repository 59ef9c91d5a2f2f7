package tools.sqlscope;

/**
 * 测试用：文本中的 | 标记光标位置，解析出去掉标记后的文本与 1 起始的行列号。
 */
public record Cursor(String text, int line, int column) {

    public static Cursor of(String marked) {
        int at = marked.indexOf('|');
        if (at < 0) {
            throw new IllegalArgumentException("缺少光标标记 |");
        }
        String text = marked.substring(0, at) + marked.substring(at + 1);
        int line = 1;
        int column = 1;
        for (int i = 0; i < at; i++) {
            char c = marked.charAt(i);
            if (c == '\n') {
                line++;
                column = 1;
            } else if (c != '\r') {
                column++;
            }
        }
        return new Cursor(text, line, column);
    }
}
