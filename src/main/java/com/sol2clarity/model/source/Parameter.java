package com.sol2clarity.model.source;

import lombok.NonNull;
import lombok.Value;

/**
 * A function or constructor parameter.
 */
@Value
public class Parameter implements SourceNode {

    @NonNull
    TypeRef type;

    @NonNull
    String name;
}
