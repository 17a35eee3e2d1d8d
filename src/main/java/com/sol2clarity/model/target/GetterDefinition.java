package com.sol2clarity.model.target;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Read-only accessor synthesized for a public state variable.
 */
@Value
@Builder
public class GetterDefinition implements ClarityDefinition {

    @NonNull
    String name;

    @NonNull
    GetterKind kind;

    /**
     * Clarity name of the variable, constant or map being read.
     */
    @NonNull
    String target;

    /**
     * Empty for variables and constants, a single key argument for maps.
     */
    @NonNull
    @Singular
    List<ClarityParameter> parameters;

    /**
     * Success type of the response, already wrapped in {@code optional} for maps.
     */
    @NonNull
    ClarityType returnType;

    @NonNull
    ClarityExpression body;
}
