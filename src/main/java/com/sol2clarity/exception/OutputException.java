package com.sol2clarity.exception;

import java.nio.file.Path;

/**
 * Writing a generated unit failed.
 */
public class OutputException extends TranspilerException {

    private static final long serialVersionUID = 1L;

    private final transient Path path;

    public OutputException(Path path, Throwable cause) {
        super("Failed to write " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
