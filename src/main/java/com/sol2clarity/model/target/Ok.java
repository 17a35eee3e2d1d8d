package com.sol2clarity.model.target;

import lombok.NonNull;
import lombok.Value;

/**
 * Success wrapping {@code (ok value)}; marks the value a function returns.
 */
@Value
public class Ok implements ClarityExpression {

    @NonNull
    ClarityExpression value;
}
