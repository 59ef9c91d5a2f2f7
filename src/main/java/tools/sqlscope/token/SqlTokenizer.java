package tools.sqlscope.token;

import tools.sqlscope.util.Config;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 单趟字符扫描的 SQL 分词器，容忍未闭合的字符串、标识符与注释（延伸到文本末尾）。
 * 不产生空白 token；\r\n、\r、\n 都视为一次换行，制表符按一列计算。
 */
public final class SqlTokenizer {

    private static final Set<String> TWO_CHAR_OPERATORS = Set.of(
            "<>", "<=", ">=", "!=", "!<", "!>", "::", "||", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^="
    );
    private static final String SINGLE_CHAR_OPERATORS = "=<>+-/%&|^~!:?";

    private SqlTokenizer() {
    }

    public static List<Token> tokenize(String text) {
        return tokenize(text, Config.batchSeparator());
    }

    public static List<Token> tokenize(String text, String batchSeparator) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return new Scanner(text, batchSeparator).run();
    }

    private static final class Scanner {
        private final String text;
        private final String separator;
        private final List<Token> tokens = new ArrayList<>();
        private int pos = 0;
        private int line = 1;
        private int column = 1;

        Scanner(String text, String separator) {
            this.text = text;
            this.separator = separator == null ? "" : separator;
        }

        List<Token> run() {
            while (pos < text.length()) {
                char c = text.charAt(pos);
                char next = peek(1);
                if (c == '\r' || c == '\n' || Character.isWhitespace(c)) {
                    advance(1);
                    continue;
                }
                int startLine = line;
                int startCol = column;
                int start = pos;

                if (c == '-' && next == '-') {
                    int end = pos;
                    while (end < text.length() && text.charAt(end) != '\n' && text.charAt(end) != '\r') {
                        end++;
                    }
                    emit(TokenType.LINE_COMMENT, start, end, startLine, startCol);
                } else if (c == '/' && next == '*') {
                    emit(TokenType.COMMENT, start, blockCommentEnd(pos), startLine, startCol);
                } else if ((c == 'N' || c == 'n') && next == '\'') {
                    emit(TokenType.STRING, start, quotedEnd(pos + 1, '\''), startLine, startCol);
                } else if (c == '\'') {
                    emit(TokenType.STRING, start, quotedEnd(pos, '\''), startLine, startCol);
                } else if (c == '[') {
                    emit(TokenType.BRACKET_ID, start, quotedEnd(pos, ']'), startLine, startCol);
                } else if (c == '"') {
                    emit(TokenType.BRACKET_ID, start, quotedEnd(pos, '"'), startLine, startCol);
                } else if (c == '`') {
                    emit(TokenType.BRACKET_ID, start, quotedEnd(pos, '`'), startLine, startCol);
                } else if (Character.isDigit(c) || (c == '.' && Character.isDigit(next) && !followsName())) {
                    emit(TokenType.NUMBER, start, numberEnd(pos), startLine, startCol);
                } else if (c == '-' && Character.isDigit(next) && expectsOperand()) {
                    emit(TokenType.NUMBER, start, numberEnd(pos + 1), startLine, startCol);
                } else if (c == '@' && next == '@') {
                    emit(TokenType.GLOBAL_VARIABLE, start, wordEnd(pos + 2), startLine, startCol);
                } else if (c == '@' && isWordStart(next)) {
                    emit(TokenType.VARIABLE, start, wordEnd(pos + 1), startLine, startCol);
                } else if (c == '#') {
                    int from = next == '#' ? pos + 2 : pos + 1;
                    emit(TokenType.TEMP_TABLE, start, wordEnd(from), startLine, startCol);
                } else if (isWordStart(c)) {
                    int end = wordEnd(pos);
                    String word = text.substring(start, end);
                    TokenType type;
                    if (!separator.isEmpty() && word.equalsIgnoreCase(separator)) {
                        type = TokenType.GO;
                    } else if (SqlKeywords.isKeyword(word)) {
                        type = TokenType.KEYWORD;
                    } else {
                        type = TokenType.IDENTIFIER;
                    }
                    emit(type, start, end, startLine, startCol);
                } else {
                    emitPunctuation(c, next, startLine, startCol);
                }
            }
            return tokens;
        }

        private void emitPunctuation(char c, char next, int startLine, int startCol) {
            int start = pos;
            switch (c) {
                case '(' -> emit(TokenType.PAREN_OPEN, start, start + 1, startLine, startCol);
                case ')' -> emit(TokenType.PAREN_CLOSE, start, start + 1, startLine, startCol);
                case ',' -> emit(TokenType.COMMA, start, start + 1, startLine, startCol);
                case ';' -> emit(TokenType.SEMICOLON, start, start + 1, startLine, startCol);
                case '.' -> emit(TokenType.DOT, start, start + 1, startLine, startCol);
                default -> {
                    String pair = next == '\0' ? "" : "" + c + next;
                    if (TWO_CHAR_OPERATORS.contains(pair)) {
                        emit(TokenType.OPERATOR, start, start + 2, startLine, startCol);
                    } else if (c == '*') {
                        emit(TokenType.STAR, start, start + 1, startLine, startCol);
                    } else {
                        // 未识别的字符也按单字符运算符输出，保证扫描前进
                        emit(TokenType.OPERATOR, start, start + 1, startLine, startCol);
                    }
                }
            }
        }

        private void emit(TokenType type, int start, int end, int startLine, int startCol) {
            tokens.add(new Token(type, text.substring(start, end), startLine, startCol));
            advance(end - start);
        }

        private void advance(int count) {
            for (int i = 0; i < count && pos < text.length(); i++) {
                char c = text.charAt(pos);
                pos++;
                if (c == '\r') {
                    if (pos < text.length() && text.charAt(pos) == '\n') {
                        pos++;
                        i++;
                    }
                    line++;
                    column = 1;
                } else if (c == '\n') {
                    line++;
                    column = 1;
                } else {
                    column++;
                }
            }
        }

        private char peek(int offset) {
            int idx = pos + offset;
            return idx < text.length() ? text.charAt(idx) : '\0';
        }

        private int quotedEnd(int openIdx, char close) {
            int i = openIdx + 1;
            while (i < text.length()) {
                if (text.charAt(i) == close) {
                    if (i + 1 < text.length() && text.charAt(i + 1) == close) {
                        i += 2;
                        continue;
                    }
                    return i + 1;
                }
                i++;
            }
            return text.length();
        }

        private int blockCommentEnd(int openIdx) {
            int depth = 0;
            int i = openIdx;
            while (i < text.length()) {
                char c = text.charAt(i);
                char n = i + 1 < text.length() ? text.charAt(i + 1) : '\0';
                if (c == '/' && n == '*') {
                    depth++;
                    i += 2;
                } else if (c == '*' && n == '/') {
                    depth--;
                    i += 2;
                    if (depth == 0) {
                        return i;
                    }
                } else {
                    i++;
                }
            }
            return text.length();
        }

        private int numberEnd(int from) {
            int i = from;
            if (i + 1 < text.length() && text.charAt(i) == '0'
                    && (text.charAt(i + 1) == 'x' || text.charAt(i + 1) == 'X')) {
                i += 2;
                while (i < text.length() && Character.digit(text.charAt(i), 16) >= 0) {
                    i++;
                }
                return i;
            }
            boolean seenDot = false;
            while (i < text.length()) {
                char c = text.charAt(i);
                if (Character.isDigit(c)) {
                    i++;
                } else if (c == '.' && !seenDot) {
                    seenDot = true;
                    i++;
                } else {
                    break;
                }
            }
            if (i < text.length() && (text.charAt(i) == 'e' || text.charAt(i) == 'E')) {
                int j = i + 1;
                if (j < text.length() && (text.charAt(j) == '+' || text.charAt(j) == '-')) {
                    j++;
                }
                if (j < text.length() && Character.isDigit(text.charAt(j))) {
                    i = j;
                    while (i < text.length() && Character.isDigit(text.charAt(i))) {
                        i++;
                    }
                }
            }
            return i;
        }

        private int wordEnd(int from) {
            int i = from;
            while (i < text.length() && isWordPart(text.charAt(i))) {
                i++;
            }
            return i;
        }

        private boolean followsName() {
            if (tokens.isEmpty()) {
                return false;
            }
            Token last = tokens.get(tokens.size() - 1);
            return last.isObjectName() || last.type() == TokenType.PAREN_CLOSE;
        }

        /**
         * 负号前面是运算符、逗号、左括号、关键字或文本开头时，'-' 属于数字。
         */
        private boolean expectsOperand() {
            if (tokens.isEmpty()) {
                return true;
            }
            Token last = tokens.get(tokens.size() - 1);
            return switch (last.type()) {
                case OPERATOR, COMMA, PAREN_OPEN, KEYWORD -> true;
                default -> false;
            };
        }

        private static boolean isWordStart(char c) {
            return Character.isLetter(c) || c == '_';
        }

        private static boolean isWordPart(char c) {
            return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '#' || c == '@';
        }
    }
}
