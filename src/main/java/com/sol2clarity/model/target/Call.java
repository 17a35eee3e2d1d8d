package com.sol2clarity.model.target;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * Prefix application {@code (function arg...)}, used for operators.
 */
@Value
public class Call implements ClarityExpression {

    @NonNull
    String function;

    @NonNull
    List<ClarityExpression> arguments;

    public static Call of(String function, ClarityExpression... arguments) {
        return new Call(function, List.of(arguments));
    }
}
