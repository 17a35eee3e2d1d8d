package com.sol2clarity.model.source;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for MappingType.
 */
class MappingTypeTest {

    @Test
    void testSingleLevel() {
        MappingType mapping = new MappingType(new BasicType("address"), new BasicType("uint256"));

        assertThat(mapping.getDepth()).isEqualTo(1);
        assertThat(mapping.getKeyChain()).containsExactly(new BasicType("address"));
        assertThat(mapping.getTerminalValueType()).isEqualTo(new BasicType("uint256"));
        assertThat(mapping.describe()).isEqualTo("mapping(address => uint256)");
    }

    @Test
    void testNestedChain() {
        MappingType mapping = new MappingType(new BasicType("address"),
                new MappingType(new BasicType("uint256"),
                        new MappingType(new BasicType("bytes32"), new BasicType("bool"))));

        assertThat(mapping.getDepth()).isEqualTo(3);
        assertThat(mapping.getKeyChain())
                .extracting(BasicType::getName)
                .containsExactly("address", "uint256", "bytes32");
        assertThat(mapping.getTerminalValueType().getName()).isEqualTo("bool");
        assertThat(mapping.describe())
                .isEqualTo("mapping(address => mapping(uint256 => mapping(bytes32 => bool)))");
    }

    @Test
    void testKeyChainIsUnmodifiable() {
        MappingType mapping = new MappingType(new BasicType("address"), new BasicType("bool"));

        assertThatThrownBy(() -> mapping.getKeyChain().add(new BasicType("uint256")))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
