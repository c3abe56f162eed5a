package dev.ionfusion.fuusak.grammar;

/**
 * Rule tags of the generic parse tree produced by {@link FusionGrammar}.
 */
public enum Rule {
    FILE,
    EXPR,
    ANNOTATIONS,
    ANNOTATION,
    NULL,
    BOOLEAN,
    TIMESTAMP,
    REAL,
    INTEGER,
    SYMBOL,
    /** Either string form; only used as an entry rule, matches produce {@link #SHORT_STRING} or {@link #LONG_STRING}. */
    STRING,
    SHORT_STRING,
    LONG_STRING,
    CLOB,
    BLOB,
    STRUCTURE,
    STRUCT_MEMBER,
    STRUCT_KEY,
    LIST,
    SEXPR,
    WHITESPACE,
    /** Either comment form; only used as an entry rule. */
    ANY_COMMENT,
    LINE_COMMENT,
    BLOCK_COMMENT
}
