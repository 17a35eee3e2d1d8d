package com.sol2clarity.model.source;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A named function or the contract constructor.
 */
@Value
@Builder
public class FunctionDefinition implements ContractMember {

    /**
     * {@code null} for the constructor.
     */
    String name;

    boolean constructor;

    @NonNull
    @Singular
    List<Parameter> parameters;

    /**
     * {@code null} when no visibility keyword was written.
     */
    Visibility visibility;

    /**
     * {@code null} when no mutability keyword was written.
     */
    Mutability mutability;

    /**
     * {@code null} when the function declares no {@code returns} clause.
     */
    TypeRef returnType;

    @NonNull
    @Singular("statement")
    List<Statement> body;

    int line;
}
