package com.sol2clarity.model.target;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code {name: value, ...}}, used for composite map keys and print payloads.
 */
@Value
public class TupleLiteral implements ClarityExpression {

    @NonNull
    List<TupleEntry> entries;
}
