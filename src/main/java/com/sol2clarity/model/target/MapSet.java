package com.sol2clarity.model.target;

import lombok.NonNull;
import lombok.Value;

@Value
public class MapSet implements ClarityExpression {

    @NonNull
    String map;

    @NonNull
    ClarityExpression key;

    @NonNull
    ClarityExpression value;
}
