package dev.ionfusion.fuusak.ist;

public enum AtomicType {
    BLOB,
    BOOLEAN,
    INTEGER,
    NULL,
    QUOTED_STRING,
    REAL,
    SYMBOL,
    TIMESTAMP
}
