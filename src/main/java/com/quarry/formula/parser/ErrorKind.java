package com.quarry.formula.parser;

/** Top-level error taxonomy surfaced to the host. */
public enum ErrorKind {
    LEX_ERROR,
    PARSE_ERROR,
    TYPE_ERROR,
    RUNTIME_ERROR,
    TIMEOUT_ERROR
}
