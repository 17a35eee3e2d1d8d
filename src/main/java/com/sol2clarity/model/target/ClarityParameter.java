package com.sol2clarity.model.target;

import lombok.NonNull;
import lombok.Value;

@Value
public class ClarityParameter {

    @NonNull
    String name;

    @NonNull
    ClarityType type;
}
