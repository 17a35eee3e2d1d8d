package com.sol2clarity.model.source;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One parsed input file: the contracts it declares, in source order.
 */
@Value
@Builder
public class SourceUnit implements SourceNode {

    @NonNull
    @Singular
    List<ContractDefinition> contracts;
}
