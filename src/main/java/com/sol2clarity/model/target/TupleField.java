package com.sol2clarity.model.target;

import lombok.NonNull;
import lombok.Value;

@Value
public class TupleField {

    @NonNull
    String name;

    @NonNull
    ScalarType type;
}
