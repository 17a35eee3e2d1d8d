package com.sol2clarity.model.target;

import lombok.NonNull;
import lombok.Value;

@Value
public class VarGet implements ClarityExpression {

    @NonNull
    String variable;
}
