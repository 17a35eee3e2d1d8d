package com.sol2clarity.model.target;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * {@code (define-data-var name type initial)}.
 */
@Value
@Builder
public class DataVarDefinition implements ClarityDefinition {

    @NonNull
    String name;

    @NonNull
    ScalarType type;

    @NonNull
    ClarityExpression initialValue;
}
