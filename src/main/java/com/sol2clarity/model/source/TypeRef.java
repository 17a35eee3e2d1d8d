package com.sol2clarity.model.source;

/**
 * A written type: either a basic type name or a (possibly nested) mapping.
 */
public interface TypeRef extends SourceNode {

    boolean isMapping();

    /**
     * Renders the type back in Solidity notation, for diagnostics.
     */
    String describe();
}
