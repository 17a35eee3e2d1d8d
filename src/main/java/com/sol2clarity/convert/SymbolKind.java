package com.sol2clarity.convert;

enum SymbolKind {
    DATA_VAR,
    CONSTANT,
    MAP
}
