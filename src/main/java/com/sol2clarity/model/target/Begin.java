package com.sol2clarity.model.target;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * Sequencing; the value is the value of the last expression.
 */
@Value
public class Begin implements ClarityExpression {

    @NonNull
    List<ClarityExpression> expressions;
}
