package com.sol2clarity.model.target;

public enum ScalarKind {
    UINT,
    INT,
    BOOL,
    PRINCIPAL,
    STRING_ASCII,
    BUFF
}
