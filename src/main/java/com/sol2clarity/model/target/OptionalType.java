package com.sol2clarity.model.target;

import lombok.NonNull;
import lombok.Value;

@Value
public class OptionalType implements ClarityType {

    @NonNull
    ClarityType inner;

    @Override
    public String render() {
        return "(optional " + inner.render() + ")";
    }
}
