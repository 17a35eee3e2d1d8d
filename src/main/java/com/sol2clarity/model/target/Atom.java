package com.sol2clarity.model.target;

import lombok.NonNull;
import lombok.Value;

/**
 * A literal or symbol rendered verbatim, e.g. {@code u1}, {@code "abc"}, {@code tx-sender}.
 */
@Value
public class Atom implements ClarityExpression {

    public static final Atom TRUE = new Atom("true");

    @NonNull
    String text;
}
