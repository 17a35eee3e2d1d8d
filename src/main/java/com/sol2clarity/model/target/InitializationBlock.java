package com.sol2clarity.model.target;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * Top-level {@code (begin ...)} run once at deployment, lowered from a parameterless constructor.
 */
@Value
public class InitializationBlock implements ClarityDefinition {

    @NonNull
    List<ClarityExpression> expressions;

    @Override
    public String getName() {
        return null;
    }
}
