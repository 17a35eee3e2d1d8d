package com.sol2clarity.model.source;

import java.util.List;
import java.util.stream.Collectors;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code base[i0][i1]...}; one index per mapping dimension, never empty.
 */
@Value
public class IndexAccess implements Expression {

    @NonNull
    MemberAccess base;

    @NonNull
    List<Expression> indices;

    @Override
    public String describe() {
        return base.describe() + indices.stream()
                .map(index -> "[" + index.describe() + "]")
                .collect(Collectors.joining());
    }
}
