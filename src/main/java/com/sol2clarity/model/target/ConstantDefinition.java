package com.sol2clarity.model.target;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * {@code (define-constant name value)}. The type is kept for documentation and getters.
 */
@Value
@Builder
public class ConstantDefinition implements ClarityDefinition {

    @NonNull
    String name;

    @NonNull
    ScalarType type;

    @NonNull
    ClarityExpression value;
}
