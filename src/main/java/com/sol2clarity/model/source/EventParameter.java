package com.sol2clarity.model.source;

import lombok.NonNull;
import lombok.Value;

/**
 * A parameter of an event declaration.
 */
@Value
public class EventParameter implements SourceNode {

    @NonNull
    TypeRef type;

    boolean indexed;

    @NonNull
    String name;
}
