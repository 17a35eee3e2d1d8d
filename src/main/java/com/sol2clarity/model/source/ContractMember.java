package com.sol2clarity.model.source;

/**
 * A declaration that can appear in a contract body.
 */
public interface ContractMember extends SourceNode {

    /**
     * Declared name, or {@code null} for a constructor.
     */
    String getName();
}
