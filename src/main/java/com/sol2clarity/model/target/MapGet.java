package com.sol2clarity.model.target;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code (map-get? map key)}, which yields an optional.
 */
@Value
public class MapGet implements ClarityExpression {

    @NonNull
    String map;

    @NonNull
    ClarityExpression key;
}
