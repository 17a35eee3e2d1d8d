package com.sol2clarity.model.source;

/**
 * A statement inside a function or constructor body.
 */
public interface Statement extends SourceNode {

    int getLine();
}
