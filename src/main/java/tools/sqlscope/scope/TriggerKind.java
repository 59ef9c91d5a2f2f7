package tools.sqlscope.scope;

/**
 * 光标处期望的补全类别。
 */
public enum TriggerKind {
    NONE,
    TABLE,
    COLUMN,
    PROCEDURE
}
