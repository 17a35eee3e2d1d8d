package com.sol2clarity.model.target;

import java.util.List;
import java.util.stream.Collectors;

import lombok.NonNull;
import lombok.Value;

/**
 * Composite key of a flattened mapping: one field per nesting level, outermost first.
 */
@Value
public class TupleType implements ClarityType {

    @NonNull
    List<TupleField> fields;

    @Override
    public String render() {
        return fields.stream()
                .map(field -> field.getName() + ": " + field.getType().render())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
