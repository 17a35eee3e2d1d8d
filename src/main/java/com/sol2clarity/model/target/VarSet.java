package com.sol2clarity.model.target;

import lombok.NonNull;
import lombok.Value;

@Value
public class VarSet implements ClarityExpression {

    @NonNull
    String variable;

    @NonNull
    ClarityExpression value;
}
