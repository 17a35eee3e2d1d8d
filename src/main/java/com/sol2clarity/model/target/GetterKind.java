package com.sol2clarity.model.target;

/**
 * What a synthesized getter reads.
 */
public enum GetterKind {
    DATA_VAR,
    CONSTANT,
    MAP
}
