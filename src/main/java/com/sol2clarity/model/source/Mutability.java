package com.sol2clarity.model.source;

import java.util.Locale;

/**
 * Solidity state mutability hints.
 */
public enum Mutability {
    PURE,
    VIEW,
    PAYABLE;

    public static Mutability fromKeyword(String keyword) {
        return valueOf(keyword.toUpperCase(Locale.ROOT));
    }

    public boolean isReadOnly() {
        return this == PURE || this == VIEW;
    }
}
