package dev.ionfusion.fuusak.cst;

/**
 * Kinds of concrete syntax tree nodes.
 */
public enum ExprKind {
    BLOB,
    BOOLEAN,
    CLOB,
    COMMENT_BLOCK,
    COMMENT_LINE,
    INTEGER,
    LIST,
    MULTILINE_STRING,
    NEWLINES,
    NULL,
    QUOTED_STRING,
    REAL,
    SEXPR,
    STRUCT,
    STRUCT_KEY,
    STRUCT_MEMBER,
    SYMBOL,
    TIMESTAMP;

    public boolean isAtomic() {
        return switch (this) {
            case BLOB, BOOLEAN, INTEGER, NULL, QUOTED_STRING, REAL, SYMBOL, TIMESTAMP -> true;
            default -> false;
        };
    }

    public boolean isSequence() {
        return this == LIST || this == SEXPR || this == STRUCT || this == CLOB || this == STRUCT_MEMBER;
    }
}
