package com.sol2clarity.model.source;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code left operator right}. Operands nest to the left because the
 * grammar has a single precedence tier.
 */
@Value
public class BinaryOperation implements Expression {

    @NonNull
    String operator;

    @NonNull
    Expression left;

    @NonNull
    Expression right;

    @Override
    public String describe() {
        return "(" + left.describe() + " " + operator + " " + right.describe() + ")";
    }
}
