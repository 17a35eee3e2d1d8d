package com.sol2clarity.model.target;

import java.util.List;
import java.util.stream.Collectors;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One output unit: the lowered form of a single Solidity contract.
 */
@Value
@Builder
public class ClarityContract {

    /**
     * Contract identifier as written in Solidity.
     */
    @NonNull
    String sourceName;

    /**
     * Kebab-cased unit name, also the output file stem.
     */
    @NonNull
    String unitName;

    @NonNull
    @Singular
    List<ClarityDefinition> definitions;

    public <T extends ClarityDefinition> List<T> definitionsOfType(Class<T> type) {
        return definitions.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }
}
