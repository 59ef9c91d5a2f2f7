package tools.sqlscope.scope;

import tools.sqlscope.context.ComparisonOperand;
import tools.sqlscope.context.NameReading;
import tools.sqlscope.context.QualifiedName;
import tools.sqlscope.context.Resolution;
import tools.sqlscope.parser.StatementKind;

import java.util.ArrayList;
import java.util.List;

/**
 * 光标处的作用域分析结果，交给元数据缓存映射为具体的补全项。
 *
 * @param visibleTables    可引用的表，最内层在前；TABLE 触发时只含 CTE 与临时对象
 * @param qualifier        光标所在片段之前的限定部分，没有时为 {@link QualifiedName#EMPTY}
 * @param qualifierReading 按可见表消歧后的限定名解释
 * @param qualifierTarget  COLUMN 触发时限定名指向的表，无法确定时为 null
 * @param statementKind    光标所在顶层语句的类型，不在任何语句中时为 null
 */
public record ScopeContext(List<VisibleTable> visibleTables,
                           TriggerKind triggerKind,
                           QualifiedName qualifier,
                           Resolution<NameReading> qualifierReading,
                           VisibleTable qualifierTarget,
                           ClausePosition clause,
                           String prefix,
                           Resolution<ComparisonOperand> leftOperand,
                           StatementKind statementKind,
                           int batchIndex) {

    public ScopeContext {
        visibleTables = visibleTables == null ? List.of() : List.copyOf(visibleTables);
        triggerKind = triggerKind == null ? TriggerKind.NONE : triggerKind;
        qualifier = qualifier == null ? QualifiedName.EMPTY : qualifier;
        qualifierReading = qualifierReading == null ? Resolution.noMatch() : qualifierReading;
        clause = clause == null ? ClausePosition.UNKNOWN : clause;
        prefix = prefix == null ? "" : prefix;
        leftOperand = leftOperand == null ? Resolution.noMatch() : leftOperand;
    }

    /**
     * 光标在字符串或注释中：不做任何补全。
     */
    static ScopeContext silent(StatementKind statementKind, int batchIndex) {
        return new ScopeContext(List.of(), TriggerKind.NONE, QualifiedName.EMPTY, Resolution.noMatch(), null,
                ClausePosition.UNKNOWN, "", Resolution.noMatch(), statementKind, batchIndex);
    }

    public VisibleTable findByAlias(String alias) {
        for (VisibleTable t : visibleTables) {
            if (t.hasAlias(alias)) {
                return t;
            }
        }
        return null;
    }

    /**
     * 补全候选列：有限定目标时只取目标表的列，否则取全部可见表的列（保持顺序，可能重复）。
     */
    public List<String> candidateColumns() {
        if (qualifierTarget != null) {
            return qualifierTarget.columns();
        }
        List<String> columns = new ArrayList<>();
        for (VisibleTable t : visibleTables) {
            columns.addAll(t.columns());
        }
        return columns;
    }
}
