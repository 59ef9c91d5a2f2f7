package tools.sqlscope.token;

import java.util.Locale;

/**
 * 不可变的词法单元，line/column 均从 1 开始，column 为词素首字符所在列。
 * text 保留原始词素（包括方括号、引号）。
 */
public record Token(TokenType type, String text, int line, int column) {

    public Token {
        if (type == null) {
            throw new IllegalArgumentException("type 不能为空");
        }
        text = text == null ? "" : text;
    }

    public String upper() {
        return text.toUpperCase(Locale.ROOT);
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * 是否为给定关键字之一（大小写不敏感）。
     */
    public boolean isKeyword(String... words) {
        if (type != TokenType.KEYWORD) {
            return false;
        }
        if (words == null || words.length == 0) {
            return true;
        }
        for (String w : words) {
            if (text.equalsIgnoreCase(w)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 普通标识符或带引号的标识符，限定名链只由这两类组成。
     */
    public boolean isName() {
        return type == TokenType.IDENTIFIER || type == TokenType.BRACKET_ID;
    }

    /**
     * 可以作为表引用出现的名字：标识符、临时表、表变量。
     */
    public boolean isObjectName() {
        return isName() || type == TokenType.TEMP_TABLE || type == TokenType.VARIABLE;
    }

    public boolean isComment() {
        return type == TokenType.COMMENT || type == TokenType.LINE_COMMENT;
    }

    /**
     * 去掉 [ ]、" "、` ` 定界符并还原转义后的名字；其他类型原样返回。
     */
    public String unquotedText() {
        if (type != TokenType.BRACKET_ID || text.isEmpty()) {
            return text;
        }
        char open = text.charAt(0);
        char close = switch (open) {
            case '[' -> ']';
            case '"' -> '"';
            case '`' -> '`';
            default -> 0;
        };
        if (close == 0) {
            return text;
        }
        String inner = text.substring(1);
        if (!inner.isEmpty() && inner.charAt(inner.length() - 1) == close) {
            inner = inner.substring(0, inner.length() - 1);
        }
        String doubled = String.valueOf(close) + close;
        return inner.replace(doubled, String.valueOf(close));
    }

    /**
     * 词素最后一行的行号。
     */
    public int endLine() {
        int lineNo = line;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                lineNo++;
            } else if (c == '\r') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                lineNo++;
            }
        }
        return lineNo;
    }

    /**
     * 词素结束后的第一列（不含），即光标紧贴词素末尾时的列号。
     */
    public int endColumn() {
        int lastBreak = Math.max(text.lastIndexOf('\n'), text.lastIndexOf('\r'));
        if (lastBreak < 0) {
            return column + text.length();
        }
        return text.length() - lastBreak;
    }

    /**
     * 词素起点严格位于光标之前。
     */
    public boolean startsBefore(int cursorLine, int cursorColumn) {
        return line < cursorLine || (line == cursorLine && column < cursorColumn);
    }

    /**
     * 光标处于 (起点, 终点] 区间内：光标在词素内部或紧贴词素末尾。
     */
    public boolean touches(int cursorLine, int cursorColumn) {
        if (!startsBefore(cursorLine, cursorColumn)) {
            return false;
        }
        int el = endLine();
        return cursorLine < el || (cursorLine == el && cursorColumn <= endColumn());
    }

    /**
     * 光标严格位于词素内部（不含紧贴末尾）。
     */
    public boolean contains(int cursorLine, int cursorColumn) {
        if (!startsBefore(cursorLine, cursorColumn)) {
            return false;
        }
        int el = endLine();
        return cursorLine < el || (cursorLine == el && cursorColumn < endColumn());
    }

    /**
     * 字符串、带引号标识符、块注释是否已正常闭合。
     */
    public boolean isTerminated() {
        return switch (type) {
            case STRING -> {
                int start = text.indexOf('\'');
                yield start >= 0 && closesAt(text, start + 1, '\'');
            }
            case BRACKET_ID -> {
                char open = text.isEmpty() ? 0 : text.charAt(0);
                char close = open == '[' ? ']' : open;
                yield open != 0 && closesAt(text, 1, close);
            }
            case COMMENT -> commentCloses(text);
            default -> true;
        };
    }

    private static boolean closesAt(String s, int from, char close) {
        int i = from;
        while (i < s.length()) {
            if (s.charAt(i) == close) {
                if (i + 1 < s.length() && s.charAt(i + 1) == close) {
                    i += 2;
                    continue;
                }
                return i == s.length() - 1;
            }
            i++;
        }
        return false;
    }

    private static boolean commentCloses(String s) {
        int depth = 0;
        int i = 0;
        while (i + 1 < s.length()) {
            char c = s.charAt(i);
            char n = s.charAt(i + 1);
            if (c == '/' && n == '*') {
                depth++;
                i += 2;
            } else if (c == '*' && n == '/') {
                depth--;
                i += 2;
                if (depth == 0) {
                    return i == s.length();
                }
            } else {
                i++;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + line + ":" + column;
    }
}
