package com.sol2clarity.model.source;

import java.util.Locale;

/**
 * Solidity visibility keywords.
 */
public enum Visibility {
    PUBLIC,
    PRIVATE,
    INTERNAL,
    EXTERNAL;

    public static Visibility fromKeyword(String keyword) {
        return valueOf(keyword.toUpperCase(Locale.ROOT));
    }

    /**
     * Callable from outside the contract.
     */
    public boolean isExposed() {
        return this == PUBLIC || this == EXTERNAL;
    }
}
