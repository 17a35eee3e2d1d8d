package com.sol2clarity.model.source;

import lombok.NonNull;
import lombok.Value;

/**
 * A non-mapping type such as {@code address}, {@code uint256} or {@code bool}.
 */
@Value
public class BasicType implements TypeRef {

    @NonNull
    String name;

    @Override
    public boolean isMapping() {
        return false;
    }

    @Override
    public String describe() {
        return name;
    }
}
