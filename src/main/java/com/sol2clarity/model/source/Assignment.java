package com.sol2clarity.model.source;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code target = value;} where the target is a {@link MemberAccess} or an {@link IndexAccess}.
 */
@Value
public class Assignment implements Statement {

    @NonNull
    Expression target;

    @NonNull
    Expression value;

    int line;
}
