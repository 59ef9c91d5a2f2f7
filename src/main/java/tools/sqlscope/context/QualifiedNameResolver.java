package tools.sqlscope.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.sqlscope.token.Token;
import tools.sqlscope.token.TokenNavigator;
import tools.sqlscope.token.TokenType;
import tools.sqlscope.util.Config;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;

/**
 * 从光标前的 token 窗口解析点号限定名（db.schema.table.column）。
 * 只做反向有界扫描，歧义保留给 {@link QualifiedName#readings()}。
 */
public final class QualifiedNameResolver {
    private static final Logger log = LoggerFactory.getLogger(QualifiedNameResolver.class);

    /** 左操作数前最多向回查找运算符的 token 数 */
    private static final int OPERATOR_SEARCH_LIMIT = 5;

    private QualifiedNameResolver() {
    }

    /**
     * 解析限定名，tokens 为最近在前的顺序。
     * 可选地消费一个开头的点号（尾随点），然后交替收集标识符和点号，遇到其它 token 停止。
     */
    public static QualifiedName parse(List<Token> tokensRecentFirst) {
        if (tokensRecentFirst == null || tokensRecentFirst.isEmpty()) {
            return QualifiedName.EMPTY;
        }
        int i = 0;
        boolean trailingDot = false;
        if (tokensRecentFirst.get(0).is(TokenType.DOT)) {
            trailingDot = true;
            i++;
        }
        LinkedList<String> parts = new LinkedList<>();
        i = collectChain(tokensRecentFirst, i, parts);
        return QualifiedName.of(parts, trailingDot);
    }

    /**
     * 判断光标前是否为点号触发：
     * 紧跟点号时 afterDot=true；正在点号后输入半截标识符时 afterDot=false，但仍返回限定名用于过滤。
     */
    public static DotTrigger detectDotTrigger(List<Token> tokens, int line, int column) {
        List<Token> prev = TokenNavigator.tokensBeforeCursor(tokens, line, column, Config.qualifiedNameWindow());
        if (prev.isEmpty()) {
            return DotTrigger.NONE;
        }
        Token first = prev.get(0);
        if (first.is(TokenType.DOT)) {
            return new DotTrigger(true, parse(prev));
        }
        if (first.isName() && prev.size() >= 2 && prev.get(1).is(TokenType.DOT)) {
            return new DotTrigger(false, parse(prev));
        }
        return DotTrigger.NONE;
    }

    /**
     * 点号之前的引用（"e." -&gt; "e"，"dbo.Employees.Fi" -&gt; "dbo.Employees"），不在点号之后返回 null。
     */
    public static String referenceBeforeDot(List<Token> tokens, int line, int column) {
        List<Token> prev = TokenNavigator.tokensBeforeCursor(tokens, line, column, Config.referenceWindow());
        if (prev.isEmpty()) {
            return null;
        }
        int i = skipPartialName(tokens, prev, line, column);
        if (i >= prev.size() || !prev.get(i).is(TokenType.DOT)) {
            return null;
        }
        LinkedList<String> parts = new LinkedList<>();
        collectChain(prev, i + 1, parts);
        return parts.isEmpty() ? null : String.join(".", parts);
    }

    /**
     * 光标所在片段之前的限定部分；存在限定时 hasTrailingDot 恒为 true，否则返回 {@link QualifiedName#EMPTY}。
     */
    public static QualifiedName qualifierAt(List<Token> tokens, int line, int column) {
        List<Token> prev = TokenNavigator.tokensBeforeCursor(tokens, line, column, Config.qualifiedNameWindow());
        if (prev.isEmpty()) {
            return QualifiedName.EMPTY;
        }
        int i = skipPartialName(tokens, prev, line, column);
        if (i >= prev.size() || !prev.get(i).is(TokenType.DOT)) {
            return QualifiedName.EMPTY;
        }
        QualifiedName qualifier = parse(prev.subList(i, prev.size()));
        return qualifier.isEmpty() ? QualifiedName.EMPTY : qualifier;
    }

    /**
     * 提取比较表达式左侧的列（"t1.col = "、"amount &gt;= "），用于右侧按类型推荐。
     */
    public static Resolution<ComparisonOperand> extractLeftOperand(List<Token> tokens, int line, int column) {
        List<Token> prev = TokenNavigator.tokensBeforeCursor(tokens, line, column, Config.leftOperandWindow());
        if (prev.isEmpty()) {
            return Resolution.noMatch();
        }
        int i = skipPartialName(tokens, prev, line, column);
        boolean foundOperator = false;
        int searched = 0;
        while (i < prev.size() && searched < OPERATOR_SEARCH_LIMIT) {
            Token t = prev.get(i);
            i++;
            searched++;
            if (t.is(TokenType.OPERATOR)) {
                foundOperator = true;
                break;
            }
        }
        if (!foundOperator) {
            return Resolution.noMatch();
        }
        LinkedList<String> parts = new LinkedList<>();
        collectChain(prev, i, parts);
        if (parts.isEmpty()) {
            return Resolution.noMatch();
        }
        List<String> ordered = new ArrayList<>(parts);
        String qualified = String.join(".", ordered);
        int n = ordered.size();
        ComparisonOperand operand;
        if (n == 1) {
            operand = new ComparisonOperand(qualified, null, ordered.get(0), null);
        } else if (n == 2) {
            operand = new ComparisonOperand(qualified, ordered.get(0), ordered.get(1), null);
        } else {
            operand = new ComparisonOperand(qualified, ordered.get(n - 2), ordered.get(n - 1), ordered.get(n - 3));
        }
        log.debug("左操作数: {}", qualified);
        return Resolution.matched(operand);
    }

    /**
     * 从 start 开始收集 "名字 [点 名字]*"（反向），结果按从左到右顺序放入 parts，返回停止位置。
     * 关键字和其它 token 都会终止收集。
     */
    private static int collectChain(List<Token> recentFirst, int start, LinkedList<String> parts) {
        int i = start;
        while (i < recentFirst.size()) {
            Token t = recentFirst.get(i);
            if (!t.isName()) {
                break;
            }
            parts.addFirst(t.unquotedText());
            i++;
            if (i < recentFirst.size() && recentFirst.get(i).is(TokenType.DOT)) {
                i++;
            } else {
                break;
            }
        }
        return i;
    }

    /**
     * 光标正处在半截标识符上时跳过它，返回下一个待检查的位置。
     */
    private static int skipPartialName(List<Token> tokens, List<Token> prev, int line, int column) {
        Token at = TokenNavigator.tokenAtCursor(tokens, line, column);
        if (at != null && at.isName() && !prev.isEmpty() && prev.get(0).equals(at)) {
            return 1;
        }
        return 0;
    }
}
