package tools.sqlscope.parser;

import tools.sqlscope.token.SqlKeywords;
import tools.sqlscope.token.Token;
import tools.sqlscope.token.TokenType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 单次解析的游标与上下文。每次 parse 新建一个实例，解析器本身不持有状态。
 */
final class ParserState {
    final List<Token> tokens;
    final int maxDepth;
    final List<TempTable> tempTables = new ArrayList<>();
    private final Deque<Set<String>> cteScopes = new ArrayDeque<>();
    int pos;
    int batchIndex;
    int depth;

    ParserState(List<Token> tokens, int maxDepth) {
        this.tokens = tokens;
        this.maxDepth = maxDepth;
    }

    Token current() {
        return pos < tokens.size() ? tokens.get(pos) : null;
    }

    Token peek(int offset) {
        int idx = pos + offset;
        return idx >= 0 && idx < tokens.size() ? tokens.get(idx) : null;
    }

    Token at(int index) {
        return index >= 0 && index < tokens.size() ? tokens.get(index) : null;
    }

    void advance() {
        pos++;
    }

    boolean atEnd(int limit) {
        return pos >= Math.min(limit, tokens.size());
    }

    boolean currentIs(TokenType type) {
        Token t = current();
        return t != null && t.is(type);
    }

    boolean currentIsKeyword(String... words) {
        Token t = current();
        return t != null && t.isKeyword(words);
    }

    /**
     * 当前为给定关键字时前进一步并返回 true。
     */
    boolean accept(String... words) {
        if (currentIsKeyword(words)) {
            pos++;
            return true;
        }
        return false;
    }

    boolean acceptType(TokenType type) {
        if (currentIs(type)) {
            pos++;
            return true;
        }
        return false;
    }

    /**
     * 语句边界：分号、批次分隔符、范围末尾。
     */
    boolean atHardBoundary(int limit) {
        if (atEnd(limit)) {
            return true;
        }
        Token t = current();
        return t.is(TokenType.SEMICOLON) || t.is(TokenType.GO);
    }

    /**
     * 硬边界或新语句的起始关键字。WITH 后跟左括号是表提示，不算新语句。
     */
    boolean atStatementBoundary(int limit) {
        if (atHardBoundary(limit)) {
            return true;
        }
        Token t = current();
        if (t.isKeyword("WITH")) {
            Token next = peek(1);
            return next == null || !next.is(TokenType.PAREN_OPEN);
        }
        return SqlKeywords.isStatementStarter(t);
    }

    /**
     * 与 openIndex 处左括号配对的右括号下标；未闭合时返回 limit。
     */
    int matchingClose(int openIndex, int limit) {
        int end = Math.min(limit, tokens.size());
        int level = 0;
        for (int i = openIndex; i < end; i++) {
            Token t = tokens.get(i);
            if (t.is(TokenType.PAREN_OPEN)) {
                level++;
            } else if (t.is(TokenType.PAREN_CLOSE)) {
                level--;
                if (level == 0) {
                    return i;
                }
            }
        }
        return end;
    }

    void pushCteScope(Set<String> names) {
        cteScopes.push(names);
    }

    void popCteScope() {
        cteScopes.pop();
    }

    boolean isCteName(String name) {
        if (name == null) {
            return false;
        }
        String key = name.toUpperCase(Locale.ROOT);
        for (Set<String> scope : cteScopes) {
            if (scope.contains(key)) {
                return true;
            }
        }
        return false;
    }

    static Set<String> cteNames(List<CteDefinition> ctes) {
        Set<String> names = new HashSet<>();
        for (CteDefinition cte : ctes) {
            names.add(cte.name().toUpperCase(Locale.ROOT));
        }
        return names;
    }

    void registerTempTable(TempTable table) {
        tempTables.add(table);
    }

    /**
     * DROP 时把同批次中最近创建、尚未删除的同名对象标记为已删除。
     */
    void markDropped(String name, int dropIndex) {
        for (int i = tempTables.size() - 1; i >= 0; i--) {
            TempTable t = tempTables.get(i);
            if (t.hasName(name) && t.batchIndex() == batchIndex && t.droppedIndex() < 0 && t.createdIndex() < dropIndex) {
                tempTables.set(i, t.dropped(dropIndex));
                return;
            }
        }
    }
}
