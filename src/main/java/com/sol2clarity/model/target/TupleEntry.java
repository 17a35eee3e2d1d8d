package com.sol2clarity.model.target;

import lombok.NonNull;
import lombok.Value;

@Value
public class TupleEntry {

    @NonNull
    String name;

    @NonNull
    ClarityExpression value;
}
