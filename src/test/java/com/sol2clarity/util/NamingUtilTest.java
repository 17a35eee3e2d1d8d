package com.sol2clarity.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class NamingUtilTest {

    @ParameterizedTest
    @CsvSource({
            "count, count",
            "totalSupply, total-supply",
            "TokenA, token-a",
            "ERC20Token, erc20-token",
            "MAX_SUPPLY, max-supply",
            "_owner, owner",
            "HTTPServer, http-server",
            "balance_of_owner, balance-of-owner",
            "already-kebab, already-kebab"
    })
    void testToKebabCase(String input, String expected) {
        assertThat(NamingUtil.toKebabCase(input)).isEqualTo(expected);
    }

    @Test
    void testKebabCaseIsIdempotent() {
        String once = NamingUtil.toKebabCase("SimpleStorageV2");
        assertThat(NamingUtil.toKebabCase(once)).isEqualTo(once);
    }

    @Test
    void testUnitFileName() {
        assertThat(NamingUtil.toUnitFileName("SimpleToken")).isEqualTo("simple-token.clar");
    }
}
