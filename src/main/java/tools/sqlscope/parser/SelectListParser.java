package tools.sqlscope.parser;

import tools.sqlscope.token.Token;
import tools.sqlscope.token.TokenType;

import java.util.List;

/**
 * SELECT 列表解析：按顶层逗号切分列项，推断每一项对外暴露的列名。
 */
final class SelectListParser {

    private SelectListParser() {
    }

    static void parse(ParserState s, int limit, ChunkBuilder b) {
        while (!s.atHardBoundary(limit)) {
            int itemStart = s.pos;
            SqlStatementParser.scanExpression(s, b, limit, Placement.SELECT_LIST, SelectListParser::endsItem);
            SelectColumn column = deriveColumn(s.tokens.subList(itemStart, s.pos));
            if (column != null) {
                b.producedColumns.add(column);
            }
            if (!s.acceptType(TokenType.COMMA)) {
                return;
            }
        }
    }

    private static boolean endsItem(ParserState s) {
        Token t = s.current();
        return t.is(TokenType.COMMA) || t.isKeyword("FROM", "INTO", "WHERE", "GROUP", "HAVING", "ORDER",
                "UNION", "INTERSECT", "EXCEPT", "OPTION", "FOR");
    }

    /**
     * 列名推断规则：
     * - {@code *} / {@code t.*} 为星号项；
     * - {@code alias = expr}、{@code expr AS alias}、{@code expr alias} 取别名；
     * - 纯限定名链取最后一段；
     * - 其它无名表达式与变量赋值返回 null。
     */
    static SelectColumn deriveColumn(List<Token> item) {
        int n = item.size();
        if (n == 0) {
            return null;
        }
        Token first = item.get(0);
        Token last = item.get(n - 1);
        if (last.is(TokenType.STAR)) {
            if (n == 1) {
                return SelectColumn.star(null);
            }
            if (n >= 3 && item.get(n - 2).is(TokenType.DOT) && item.get(n - 3).isName()) {
                return SelectColumn.star(item.get(n - 3).unquotedText());
            }
            return null;
        }
        if (n >= 3 && item.get(1).is(TokenType.OPERATOR) && "=".equals(item.get(1).text())) {
            if (first.is(TokenType.VARIABLE)) {
                return null;
            }
            if (first.isName() || first.is(TokenType.STRING)) {
                return SelectColumn.named(unquote(first));
            }
        }
        if (n >= 2) {
            Token beforeLast = item.get(n - 2);
            if (beforeLast.isKeyword("AS") && (last.isName() || last.is(TokenType.STRING))) {
                return SelectColumn.named(unquote(last));
            }
            if (last.isName() && !beforeLast.is(TokenType.DOT) && !beforeLast.is(TokenType.OPERATOR)
                    && !beforeLast.is(TokenType.STAR) && !beforeLast.isKeyword()) {
                return SelectColumn.named(last.unquotedText());
            }
            if (last.isName() && beforeLast.isKeyword("END")) {
                return SelectColumn.named(last.unquotedText());
            }
        }
        if (isNameChain(item)) {
            return SelectColumn.named(last.unquotedText());
        }
        return null;
    }

    private static boolean isNameChain(List<Token> item) {
        for (int i = 0; i < item.size(); i++) {
            Token t = item.get(i);
            boolean expectName = i % 2 == 0;
            if (expectName ? !t.isName() : !t.is(TokenType.DOT)) {
                return false;
            }
        }
        return item.size() % 2 == 1;
    }

    /**
     * 去掉字符串或带引号标识符的定界符。
     */
    static String unquote(Token t) {
        if (t.is(TokenType.STRING)) {
            String text = t.text();
            int start = text.indexOf('\'');
            String inner = text.substring(start + 1);
            if (inner.endsWith("'")) {
                inner = inner.substring(0, inner.length() - 1);
            }
            return inner.replace("''", "'");
        }
        return t.unquotedText();
    }
}
