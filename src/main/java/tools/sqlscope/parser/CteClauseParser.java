package tools.sqlscope.parser;

import tools.sqlscope.token.SqlKeywords;
import tools.sqlscope.token.Token;
import tools.sqlscope.token.TokenType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * WITH [RECURSIVE] name [(cols)] AS (body) [, ...] 解析。
 * 每个主体只能看到在它之前声明的 CTE；递归 CTE 还能看到自己。
 */
final class CteClauseParser {

    private CteClauseParser() {
    }

    static List<CteDefinition> parse(ParserState s, int limit) {
        s.accept("WITH");
        boolean recursiveKeyword = s.accept("RECURSIVE");
        List<CteDefinition> defs = new ArrayList<>();
        while (!s.atHardBoundary(limit)) {
            Token nameToken = s.current();
            if (!nameToken.isName()) {
                break;
            }
            String name = nameToken.unquotedText();
            s.advance();
            List<String> declared = s.currentIs(TokenType.PAREN_OPEN)
                    ? FromClauseParser.readColumnList(s, limit)
                    : List.of();
            if (!s.accept("AS") || !s.currentIs(TokenType.PAREN_OPEN)) {
                break;
            }
            int open = s.pos;
            int close = s.matchingClose(open, limit);
            boolean recursive = recursiveKeyword || isSelfReferencing(s, open, close, name);

            Set<String> visible = new HashSet<>(ParserState.cteNames(defs));
            if (recursive) {
                visible.add(name.toUpperCase(Locale.ROOT));
            }
            s.pushCteScope(visible);
            NestedQuery body;
            try {
                body = SqlStatementParser.parseNested(s, open, close, Placement.DERIVED_TABLE, name, declared);
            } finally {
                s.popCteScope();
            }
            defs.add(new CteDefinition(name, declared, body == null ? null : body.chunk(), recursive, open, close));
            s.pos = SqlStatementParser.afterClose(s, close, limit);
            if (!s.acceptType(TokenType.COMMA)) {
                break;
            }
        }
        return defs;
    }

    /**
     * 主体中既有集合运算又在 FROM/JOIN 后引用了自身名字，视为递归 CTE。
     */
    static boolean isSelfReferencing(ParserState s, int open, int close, String name) {
        boolean setOperation = false;
        boolean selfReference = false;
        for (int i = open + 1; i < close; i++) {
            Token t = s.at(i);
            if (SqlKeywords.isSetOperator(t)) {
                setOperation = true;
            } else if (t.isKeyword("FROM", "JOIN")) {
                Token next = s.at(i + 1);
                if (next != null && next.isName() && next.unquotedText().equalsIgnoreCase(name)) {
                    selfReference = true;
                }
            }
        }
        return setOperation && selfReference;
    }
}
