package tools.sqlscope.parser;

public enum StatementKind {
    SELECT,
    SELECT_INTO,
    INSERT,
    UPDATE,
    DELETE,
    MERGE,
    CREATE,
    ALTER,
    DROP,
    TRUNCATE,
    DECLARE,
    EXEC,
    OTHER
}
