package com.sol2clarity.model.source;

import lombok.NonNull;
import lombok.Value;

/**
 * A number, string or boolean literal. String literals keep their quotes as written.
 */
@Value
public class Literal implements Expression {

    @NonNull
    LiteralKind kind;

    @NonNull
    String text;

    @Override
    public String describe() {
        return text;
    }
}
