package com.sol2clarity.model.target;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code (default-to fallback optional)}.
 */
@Value
public class DefaultTo implements ClarityExpression {

    @NonNull
    ClarityExpression fallback;

    @NonNull
    ClarityExpression optional;
}
