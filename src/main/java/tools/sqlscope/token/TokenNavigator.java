package tools.sqlscope.token;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于光标位置的 token 导航工具。
 * 光标 (line, column) 为插入点：column 之前的字符已经输入。
 */
public final class TokenNavigator {

    private TokenNavigator() {
    }

    /**
     * 光标之前的 token，最近的在前，跳过注释，最多 limit 个。
     * 只收录起点严格位于光标之前的 token，因此正在输入的半截标识符也在其中。
     */
    public static List<Token> tokensBeforeCursor(List<Token> tokens, int line, int column, int limit) {
        List<Token> result = new ArrayList<>();
        if (tokens == null || tokens.isEmpty() || limit <= 0) {
            return result;
        }
        int idx = lastIndexStartingBefore(tokens, line, column);
        for (int i = idx; i >= 0 && result.size() < limit; i--) {
            Token t = tokens.get(i);
            if (!t.isComment()) {
                result.add(t);
            }
        }
        return result;
    }

    /**
     * 光标所在（或紧贴其末尾）的 token，找不到返回 null。
     */
    public static Token tokenAtCursor(List<Token> tokens, int line, int column) {
        if (tokens == null) {
            return null;
        }
        int idx = lastIndexStartingBefore(tokens, line, column);
        if (idx < 0) {
            return null;
        }
        Token t = tokens.get(idx);
        return t.touches(line, column) ? t : null;
    }

    /**
     * 起点在光标之前的 token 数量，也就是光标在 token 序列中的插入下标。
     */
    public static int cursorIndex(List<Token> tokens, int line, int column) {
        if (tokens == null) {
            return 0;
        }
        return lastIndexStartingBefore(tokens, line, column) + 1;
    }

    /**
     * 去掉注释后的 token 序列，解析器与作用域分析都基于它的下标工作。
     */
    public static List<Token> significant(List<Token> tokens) {
        List<Token> result = new ArrayList<>();
        if (tokens == null) {
            return result;
        }
        for (Token t : tokens) {
            if (!t.isComment()) {
                result.add(t);
            }
        }
        return result;
    }

    /**
     * 光标是否位于字符串或注释内部。
     * 紧贴已闭合字符串末尾算作外部；行注释与未闭合的字符串/注释一直延伸到末尾。
     */
    public static boolean isInsideStringOrComment(List<Token> tokens, int line, int column) {
        Token t = tokenAtCursor(tokens, line, column);
        if (t == null) {
            return false;
        }
        return switch (t.type()) {
            case LINE_COMMENT -> true;
            case STRING, COMMENT -> t.contains(line, column) || !t.isTerminated();
            default -> false;
        };
    }

    /**
     * 光标前正在输入的半截单词；光标不在单词上时返回空串。
     */
    public static String prefixAt(List<Token> tokens, int line, int column) {
        Token t = partialWord(tokens, line, column);
        if (t == null || t.line() != line) {
            return "";
        }
        int length = Math.min(t.text().length(), column - t.column());
        String raw = t.text().substring(0, Math.max(0, length));
        if (t.type() == TokenType.BRACKET_ID && !raw.isEmpty()) {
            raw = raw.substring(1);
        }
        return raw;
    }

    /**
     * 光标处正在输入的单词 token（标识符、关键字、临时表、变量），没有则返回 null。
     */
    public static Token partialWord(List<Token> tokens, int line, int column) {
        Token t = tokenAtCursor(tokens, line, column);
        if (t == null) {
            return null;
        }
        return switch (t.type()) {
            case IDENTIFIER, BRACKET_ID, KEYWORD, TEMP_TABLE, VARIABLE -> t;
            default -> null;
        };
    }

    private static int lastIndexStartingBefore(List<Token> tokens, int line, int column) {
        int lo = 0;
        int hi = tokens.size() - 1;
        int found = -1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (tokens.get(mid).startsBefore(line, column)) {
                found = mid;
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        return found;
    }
}
