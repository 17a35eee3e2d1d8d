package com.sol2clarity.model.source;

/**
 * Expression tree node. Trees are strictly owned: no node is shared between parents.
 */
public interface Expression extends SourceNode {

    /**
     * Renders the expression back in Solidity notation, for diagnostics.
     */
    String describe();
}
