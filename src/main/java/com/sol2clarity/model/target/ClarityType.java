package com.sol2clarity.model.target;

/**
 * A Clarity type as it appears in declarations and documentation.
 */
public interface ClarityType {

    /**
     * Concrete Clarity syntax, e.g. {@code uint} or {@code (string-ascii 256)}.
     */
    String render();
}
