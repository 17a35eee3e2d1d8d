package com.sol2clarity.model.target;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A lowered Solidity function. The body always evaluates to an {@code (ok ...)} response.
 */
@Value
@Builder
public class ClarityFunction implements ClarityDefinition {

    @NonNull
    String name;

    @NonNull
    FunctionKind kind;

    @NonNull
    @Singular
    List<ClarityParameter> parameters;

    /**
     * Success type of the response: the declared return type, or {@code bool} when none.
     */
    @NonNull
    ClarityType returnType;

    @NonNull
    ClarityExpression body;

    /**
     * Set when the function was lowered from a constructor with parameters.
     */
    boolean initializer;
}
