package com.sol2clarity.model.source;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code emit Event(args...);}
 */
@Value
public class EmitStatement implements Statement {

    @NonNull
    String eventName;

    @NonNull
    List<Expression> arguments;

    int line;
}
