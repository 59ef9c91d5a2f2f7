package tools.sqlscope.context;

/**
 * 点号触发检测结果。
 *
 * @param afterDot  光标紧跟在点号之后（新的限定补全）
 * @param qualified 限定名；不在限定上下文时为 null
 */
public record DotTrigger(boolean afterDot, QualifiedName qualified) {

    public static final DotTrigger NONE = new DotTrigger(false, null);

    public boolean inQualifiedContext() {
        return qualified != null;
    }
}
