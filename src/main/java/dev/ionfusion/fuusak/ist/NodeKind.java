package dev.ionfusion.fuusak.ist;

public enum NodeKind {
    ATOM,
    BLOCK_COMMENT,
    CLOB,
    LINE_COMMENT,
    LIST,
    MULTILINE_STRING,
    NEWLINES,
    SEXPR,
    STRUCT,
    STRUCT_KEY
}
