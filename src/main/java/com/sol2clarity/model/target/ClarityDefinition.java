package com.sol2clarity.model.target;

/**
 * A top-level entry of a generated Clarity contract.
 */
public interface ClarityDefinition {

    /**
     * Clarity name the entry defines, or {@code null} when it defines none
     * (initialization blocks and event documentation).
     */
    String getName();
}
