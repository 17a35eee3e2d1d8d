package com.sol2clarity.model.source;

import lombok.NonNull;
import lombok.Value;

@Value
public class ExpressionStatement implements Statement {

    @NonNull
    Expression expression;

    int line;
}
