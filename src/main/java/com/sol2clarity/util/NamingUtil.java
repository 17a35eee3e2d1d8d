package com.sol2clarity.util;

import java.util.Locale;

/**
 * Utility for Clarity naming conventions.
 */
public class NamingUtil {

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts camelCase, PascalCase or snake_case to lower kebab-case.
     *
     * <p>{@code TokenA -> token-a}, {@code ERC20Token -> erc20-token},
     * {@code MAX_SUPPLY -> max-supply}, {@code _owner -> owner}.
     */
    public static String toKebabCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        String result = name.replaceAll("([a-z0-9])([A-Z])", "$1-$2");
        // Acronym followed by a word: HTTPServer -> HTTP-Server
        result = result.replaceAll("([A-Z]+)([A-Z][a-z])", "$1-$2");
        result = result.replaceAll("[_\\s-]+", "-");
        result = result.replaceAll("^-+|-+$", "");
        return result.toLowerCase(Locale.ROOT);
    }

    /**
     * Output file name for a contract, e.g. {@code TokenA -> token-a.clar}.
     */
    public static String toUnitFileName(String contractName) {
        return toKebabCase(contractName) + ".clar";
    }
}
