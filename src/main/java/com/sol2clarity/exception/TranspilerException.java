package com.sol2clarity.exception;

/**
 * Root of every error raised by the translation pipeline.
 */
public abstract class TranspilerException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected TranspilerException(String message) {
        super(message);
    }

    protected TranspilerException(String message, Throwable cause) {
        super(message, cause);
    }
}
