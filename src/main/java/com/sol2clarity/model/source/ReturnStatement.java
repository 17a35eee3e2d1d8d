package com.sol2clarity.model.source;

import lombok.Value;

@Value
public class ReturnStatement implements Statement {

    /**
     * {@code null} for a bare {@code return;}.
     */
    Expression value;

    int line;
}
