package com.sol2clarity.exception;

/**
 * A syntactically valid construct that has no Clarity lowering.
 */
public class UnsupportedConstructException extends TranspilerException {

    private static final long serialVersionUID = 1L;

    private final String construct;

    public UnsupportedConstructException(String construct, String detail) {
        super("Unsupported construct '" + construct + "': " + detail);
        this.construct = construct;
    }

    public String getConstruct() {
        return construct;
    }
}
