package com.sol2clarity.model.target;

import lombok.NonNull;
import lombok.Value;

@Value
public class EventField {

    @NonNull
    String name;

    @NonNull
    ScalarType type;

    boolean indexed;
}
