package com.sol2clarity.parser;

import com.sol2clarity.exception.SyntaxException;
import com.sol2clarity.parser.grammar.SolidityParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SoliditySourceParserTest {

    private final SoliditySourceParser parser = new SoliditySourceParser();

    @Test
    void testParsesEveryContractOfAFile() {
        String source = """
            contract TokenA { uint256 supply; }
            contract TokenB { bool paused; }
            """;

        SolidityParser.SourceUnitContext tree = parser.parse(source);

        assertThat(tree.contractDefinition()).hasSize(2);
        assertThat(tree.contractDefinition(0).identifier().getText()).isEqualTo("TokenA");
        assertThat(tree.contractDefinition(1).identifier().getText()).isEqualTo("TokenB");
    }

    @Test
    void testSkipsPragmaAndComments() {
        String source = """
            // SPDX-License-Identifier: MIT
            pragma solidity ^0.8.0;

            /* a counter
               spanning lines */
            contract Counter {
                uint256 count; // trailing comment
            }
            """;

        SolidityParser.SourceUnitContext tree = parser.parse(source);

        assertThat(tree.contractDefinition()).hasSize(1);
        assertThat(tree.contractDefinition(0).contractPart()).hasSize(1);
    }

    @Test
    void testAcceptsNestedMappingsOfAnyDepth() {
        String source = """
            contract Deep {
                mapping(address => mapping(uint256 => mapping(address => bool))) flags;
            }
            """;

        SolidityParser.SourceUnitContext tree = parser.parse(source);

        SolidityParser.TypeNameContext type = tree.contractDefinition(0).contractPart(0)
                .stateVariableDeclaration().typeName();
        assertThat(type.mappingType()).isNotNull();
        assertThat(type.mappingType().typeName().mappingType().typeName().mappingType()).isNotNull();
    }

    @Test
    void testMissingSemicolonReportsPositionAndExpectedTokens() {
        String source = """
            contract Broken {
                uint256 count
            }
            """;

        assertThatThrownBy(() -> parser.parse(source))
                .isInstanceOf(SyntaxException.class)
                .satisfies(e -> {
                    SyntaxException syntax = (SyntaxException) e;
                    assertThat(syntax.getLine()).isEqualTo(3);
                    assertThat(syntax.getOffendingText()).isEqualTo("}");
                    assertThat(syntax.getExpectedTokens()).contains("';'");
                });
    }

    @Test
    void testUnknownCharacterIsASyntaxError() {
        String source = "contract A { uint256 x = 1 # 2; }";

        assertThatThrownBy(() -> parser.parse(source))
                .isInstanceOf(SyntaxException.class)
                .hasMessageContaining("line 1");
    }

    @Test
    void testEmptyInputIsRejected() {
        assertThatThrownBy(() -> parser.parse("   "))
                .isInstanceOf(SyntaxException.class);
    }

    @Test
    void testNullInputIsRejected() {
        assertThatThrownBy(() -> parser.parse(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
