package com.sol2clarity.model.target;

import lombok.NonNull;
import lombok.Value;

@Value
public class Print implements ClarityExpression {

    @NonNull
    ClarityExpression payload;
}
