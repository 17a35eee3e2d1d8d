package com.sol2clarity.model.source;

/**
 * Marker for every node of the Solidity syntax tree produced by the AST builder.
 */
public interface SourceNode {
}
