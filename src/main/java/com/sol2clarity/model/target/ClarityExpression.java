package com.sol2clarity.model.target;

/**
 * Node of a lowered Clarity expression tree.
 */
public interface ClarityExpression {
}
