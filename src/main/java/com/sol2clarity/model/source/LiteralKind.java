package com.sol2clarity.model.source;

public enum LiteralKind {
    NUMBER,
    STRING,
    BOOL
}
