package tools.sqlscope.scope;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.sqlscope.context.ComparisonOperand;
import tools.sqlscope.context.NameReading;
import tools.sqlscope.context.QualifiedName;
import tools.sqlscope.context.QualifiedNameResolver;
import tools.sqlscope.context.Resolution;
import tools.sqlscope.context.SubqueryBoundaryDetector;
import tools.sqlscope.context.SubqueryDetection;
import tools.sqlscope.context.SubquerySpan;
import tools.sqlscope.parser.Chunk;
import tools.sqlscope.parser.CteDefinition;
import tools.sqlscope.parser.NestedQuery;
import tools.sqlscope.parser.ParseResult;
import tools.sqlscope.parser.SqlStatementParser;
import tools.sqlscope.parser.StatementKind;
import tools.sqlscope.parser.TableKind;
import tools.sqlscope.parser.TableReference;
import tools.sqlscope.parser.TempTable;
import tools.sqlscope.token.SqlTokenizer;
import tools.sqlscope.token.Token;
import tools.sqlscope.token.TokenNavigator;
import tools.sqlscope.util.Config;
import tools.sqlscope.util.OperationLog;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 作用域分析入口：给定缓冲区文本与光标，计算光标处可见的表、列以及期望的补全类别。
 * <p>
 * 光标所在的顶层语句按子查询逐层向下展开成一条层级链；列补全从最内层向外收集表，
 * 只有相关子查询（WHERE、SELECT 列表、ON 等位置）才继续看到外层的表，同名别名以最近的一层为准。
 * 每次调用都从头分词和解析，实例本身无状态，可在多线程间共享。
 */
public class ScopeResolver {
    private static final Logger log = LoggerFactory.getLogger(ScopeResolver.class);

    private final ColumnCatalog catalog;

    public ScopeResolver() {
        this(ColumnCatalog.NONE);
    }

    public ScopeResolver(ColumnCatalog catalog) {
        this.catalog = catalog == null ? ColumnCatalog.NONE : catalog;
    }

    /**
     * @throws CursorOutOfRangeException 光标不在文本范围内（行 1..行数，列 1..行长+1）
     */
    public ScopeContext resolve(String text, int line, int column) {
        String source = text == null ? "" : text;
        validateCursor(source, line, column);
        List<Token> tokens = SqlTokenizer.tokenize(source);
        return resolve(SqlStatementParser.parse(tokens), line, column);
    }

    /**
     * 基于已有的解析结果计算作用域，调用方负责保证光标合法。
     */
    public ScopeContext resolve(ParseResult parsed, int line, int column) {
        List<Token> raw = parsed.rawTokens();
        List<Token> tokens = parsed.tokens();
        int cursorIndex = TokenNavigator.cursorIndex(tokens, line, column);
        int batchIndex = parsed.batchIndexAt(cursorIndex);
        Chunk top = parsed.chunkAt(cursorIndex);
        StatementKind statementKind = top == null ? null : top.kind();

        if (TokenNavigator.isInsideStringOrComment(raw, line, column)) {
            log.debug("光标位于字符串或注释中 ({}:{})", line, column);
            return ScopeContext.silent(statementKind, batchIndex);
        }

        Token partial = TokenNavigator.partialWord(tokens, line, column);
        int scanFrom = partial == null ? cursorIndex : cursorIndex - 1;
        ClausePosition clause = ClauseDetector.detect(tokens, scanFrom, Config.clauseWindow());
        TriggerKind trigger = ClauseDetector.trigger(clause, tokens, ClauseDetector.previousIndex(tokens, scanFrom));

        List<Level> chain = buildChain(top, cursorIndex);
        Map<String, CteDefinition> ctes = chain.isEmpty() ? Map.of() : chain.get(chain.size() - 1).ctes();
        List<TempTable> temps = parsed.tempTablesVisibleAt(cursorIndex);
        ColumnExpander expander = new ColumnExpander(catalog, temps, Config.maxNestingDepth());

        List<VisibleTable> visible;
        if (trigger == TriggerKind.TABLE) {
            visible = sessionObjects(ctes, temps, expander);
        } else {
            List<TableReference> unparsed = unparsedSubqueryTables(raw, line, column, chain);
            visible = unparsed != null
                    ? fromDetector(unparsed, ctes, expander)
                    : fromChain(chain, expander);
        }

        QualifiedName qualifier = QualifiedNameResolver.qualifierAt(raw, line, column);
        Resolution<NameReading> reading = disambiguate(qualifier, visible, trigger);
        VisibleTable target = null;
        if (trigger == TriggerKind.COLUMN) {
            target = clause == ClausePosition.IN_OUTPUT && isOutputPseudoTable(qualifier) && top != null
                    ? dmlTarget(top.target(), visible)
                    : qualifierTarget(qualifier, visible);
        }
        Resolution<ComparisonOperand> leftOperand = clause == ClausePosition.IN_WHERE || clause == ClausePosition.IN_SET
                ? QualifiedNameResolver.extractLeftOperand(raw, line, column)
                : Resolution.noMatch();
        String prefix = TokenNavigator.prefixAt(raw, line, column);

        ScopeContext context = new ScopeContext(visible, trigger, qualifier, reading, target, clause, prefix,
                leftOperand, statementKind, batchIndex);
        log.debug("作用域 ({}:{}): 触发={}, 子句={}, 可见表={}, 限定={}", line, column, trigger, clause,
                visible.size(), qualifier.dotted());
        return context;
    }

    /**
     * 查询层级：chunk 为该层的语句片段，correlated 表示能否看到外层的表，ctes 为该层可见的 CTE（键为大写名）。
     */
    private record Level(Chunk chunk, boolean correlated, Map<String, CteDefinition> ctes) {
    }

    /**
     * 从顶层语句向下找到包含光标的最内层片段。CTE 主体只看到在它之前声明的 CTE（递归时包括自己），
     * 且看不到主语句的表。
     */
    private static List<Level> buildChain(Chunk top, int cursorIndex) {
        List<Level> chain = new ArrayList<>();
        Chunk current = top;
        boolean correlated = false;
        Map<String, CteDefinition> env = new LinkedHashMap<>();
        int guard = 0;
        int maxSteps = Config.maxNestingDepth() * 2 + 2;
        while (current != null && guard++ < maxSteps) {
            CteDefinition enclosing = null;
            for (CteDefinition cte : current.ctes()) {
                if (cte.bodyContains(cursorIndex)) {
                    enclosing = cte;
                    break;
                }
            }
            if (enclosing != null) {
                Map<String, CteDefinition> bodyEnv = new LinkedHashMap<>(env);
                for (CteDefinition cte : current.ctes()) {
                    if (cte == enclosing) {
                        if (cte.recursive()) {
                            bodyEnv.put(ColumnExpander.key(cte.name()), cte);
                        }
                        break;
                    }
                    bodyEnv.put(ColumnExpander.key(cte.name()), cte);
                }
                env = bodyEnv;
                current = enclosing.body();
                correlated = false;
                continue;
            }
            Map<String, CteDefinition> levelEnv = new LinkedHashMap<>(env);
            for (CteDefinition cte : current.ctes()) {
                levelEnv.put(ColumnExpander.key(cte.name()), cte);
            }
            env = levelEnv;
            chain.add(new Level(current, correlated, levelEnv));

            NestedQuery inner = null;
            for (NestedQuery q : current.subqueries()) {
                if (q.contains(cursorIndex)) {
                    inner = q;
                    break;
                }
            }
            if (inner == null) {
                break;
            }
            current = inner.chunk();
            correlated = inner.placement().isCorrelated();
        }
        return chain;
    }

    /**
     * 光标位于解析器没有展开的 ( SELECT ... ) 中时，返回子查询检测得到的表；否则返回 null。
     */
    private static List<TableReference> unparsedSubqueryTables(List<Token> raw, int line, int column, List<Level> chain) {
        SubquerySpan span = SubqueryBoundaryDetector.findSubqueryBounds(raw, line, column);
        if (span == null) {
            return null;
        }
        if (!chain.isEmpty() && span.startIndex() <= chain.get(chain.size() - 1).chunk().startIndex()) {
            return null;
        }
        SubqueryDetection detection = SubqueryBoundaryDetector.detectUnparsed(raw, line, column);
        if (!detection.inSubquery()) {
            return null;
        }
        log.debug("使用子查询检测结果: {} 个表", detection.tables().size());
        return detection.tables();
    }

    /**
     * TABLE 触发：CTE 与同批次内仍然存在的临时表、表变量，真实表由元数据缓存补充。
     */
    private static List<VisibleTable> sessionObjects(Map<String, CteDefinition> ctes, List<TempTable> temps,
                                                     ColumnExpander expander) {
        List<VisibleTable> result = new ArrayList<>();
        for (CteDefinition cte : ctes.values()) {
            result.add(new VisibleTable(cte.name(), null, null, cte.name(), TableKind.CTE,
                    expander.columnsOf(cte, ctes), 0));
        }
        for (TempTable temp : temps) {
            result.add(new VisibleTable(temp.name(), null, null, temp.name(), temp.kind(), temp.columns(), 0));
        }
        return result;
    }

    private static List<VisibleTable> fromDetector(List<TableReference> tables, Map<String, CteDefinition> ctes,
                                                   ColumnExpander expander) {
        List<VisibleTable> result = new ArrayList<>();
        for (TableReference t : tables) {
            TableReference ref = ColumnExpander.classify(t, ctes);
            if (ref.kind().isSessionScoped() && expander.tempFor(ref.name()) == null) {
                continue;
            }
            result.add(toVisible(ref, expander.columnsOf(ref, null, ctes), 0));
        }
        return result;
    }

    /**
     * 从最内层向外收集表，遇到非相关层停止；同名别名只保留最近的一层。
     * 已删除或不在本批次的临时对象不可见。
     */
    private static List<VisibleTable> fromChain(List<Level> chain, ColumnExpander expander) {
        List<VisibleTable> result = new ArrayList<>();
        Set<String> seenAliases = new HashSet<>();
        int depth = 0;
        for (int i = chain.size() - 1; i >= 0; i--, depth++) {
            Level level = chain.get(i);
            for (TableReference ref : level.chunk().tables()) {
                if (!seenAliases.add(ColumnExpander.key(ref.alias()))) {
                    continue;
                }
                if (ref.kind().isSessionScoped() && expander.tempFor(ref.name()) == null) {
                    continue;
                }
                result.add(toVisible(ref, expander.columnsOf(ref, level.chunk(), level.ctes()), depth));
            }
            if (!level.correlated()) {
                break;
            }
        }
        return result;
    }

    private static VisibleTable toVisible(TableReference ref, List<String> columns, int depth) {
        return new VisibleTable(ref.name(), ref.schema(), ref.database(), ref.alias(), ref.kind(), columns, depth);
    }

    /**
     * 用可见表过滤限定名的候选解释；全部不匹配时保留原始候选，交给调用方决定。
     */
    static Resolution<NameReading> disambiguate(QualifiedName qualifier, List<VisibleTable> visible, TriggerKind trigger) {
        Resolution<NameReading> readings = qualifier.readings();
        if (readings.isNoMatch()) {
            return readings;
        }
        List<NameReading> kept = new ArrayList<>();
        for (NameReading r : readings.candidates()) {
            if (matches(r, visible, trigger)) {
                kept.add(r);
            }
        }
        return kept.isEmpty() ? readings : Resolution.of(kept);
    }

    private static boolean matches(NameReading reading, List<VisibleTable> visible, TriggerKind trigger) {
        List<String> path = reading.path();
        boolean objectTrigger = trigger == TriggerKind.TABLE || trigger == TriggerKind.PROCEDURE;
        return switch (reading.role()) {
            case ALIAS -> !objectTrigger && visible.stream().anyMatch(t -> t.hasAlias(reading.head()));
            case SCHEMA -> objectTrigger || visible.stream().anyMatch(t -> t.hasSchema(reading.head()));
            case DATABASE -> objectTrigger || visible.stream().anyMatch(t -> path.size() == 2
                    ? t.hasSchema(path.get(0)) && t.hasName(path.get(1))
                    : t.hasDatabase(path.get(0)) && t.hasSchema(path.get(1)) && t.hasName(path.get(2)));
            case FULL_COLUMN -> true;
        };
    }

    /**
     * COLUMN 触发时限定名指向的表：一段按别名（再按表名），两段按 schema.表，三段按 database.schema.表。
     */
    static VisibleTable qualifierTarget(QualifiedName qualifier, List<VisibleTable> visible) {
        List<String> parts = qualifier.parts();
        switch (parts.size()) {
            case 1 -> {
                for (VisibleTable t : visible) {
                    if (t.hasAlias(parts.get(0))) {
                        return t;
                    }
                }
                for (VisibleTable t : visible) {
                    if (t.hasName(parts.get(0))) {
                        return t;
                    }
                }
                return null;
            }
            case 2 -> {
                for (VisibleTable t : visible) {
                    if (t.hasSchema(parts.get(0)) && t.hasName(parts.get(1))) {
                        return t;
                    }
                }
                return null;
            }
            case 3 -> {
                for (VisibleTable t : visible) {
                    if (t.hasDatabase(parts.get(0)) && t.hasSchema(parts.get(1)) && t.hasName(parts.get(2))) {
                        return t;
                    }
                }
                return null;
            }
            default -> {
                return null;
            }
        }
    }

    /**
     * OUTPUT 子句中的 inserted / deleted 伪表。
     */
    static boolean isOutputPseudoTable(QualifiedName qualifier) {
        if (qualifier.partCount() != 1) {
            return false;
        }
        String name = qualifier.lastPart();
        return "inserted".equalsIgnoreCase(name) || "deleted".equalsIgnoreCase(name);
    }

    /**
     * 语句目标表对应的可见表，先按别名加表名匹配，再只按表名。
     */
    static VisibleTable dmlTarget(TableReference target, List<VisibleTable> visible) {
        if (target == null) {
            return null;
        }
        for (VisibleTable t : visible) {
            if (t.hasAlias(target.alias()) && t.hasName(target.name())) {
                return t;
            }
        }
        for (VisibleTable t : visible) {
            if (t.hasName(target.name())) {
                return t;
            }
        }
        return null;
    }

    private static void validateCursor(String text, int line, int column) {
        String[] lines = text.split("\r\n|\r|\n", -1);
        boolean lineOk = line >= 1 && line <= lines.length;
        if (!lineOk || column < 1 || column > lines[line - 1].length() + 1) {
            OperationLog.log("光标 " + line + ":" + column + " 超出文本范围: " + OperationLog.abbreviate(text, 80));
        }
        if (!lineOk) {
            throw new CursorOutOfRangeException(line, column,
                    "光标行号 " + line + " 超出范围 1.." + lines.length);
        }
        int maxColumn = lines[line - 1].length() + 1;
        if (column < 1 || column > maxColumn) {
            throw new CursorOutOfRangeException(line, column,
                    "光标列号 " + column + " 超出第 " + line + " 行的范围 1.." + maxColumn);
        }
    }
}
