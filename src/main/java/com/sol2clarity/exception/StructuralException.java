package com.sol2clarity.exception;

/**
 * A parse tree node whose shape the AST builder cannot reconcile with the
 * grammar. Indicates an internal inconsistency between grammar and builder.
 */
public class StructuralException extends TranspilerException {

    private static final long serialVersionUID = 1L;

    private final String rule;
    private final int line;

    public StructuralException(String rule, int line, String detail) {
        super("Malformed '" + rule + "' at line " + line + ": " + detail);
        this.rule = rule;
        this.line = line;
    }

    public String getRule() {
        return rule;
    }

    public int getLine() {
        return line;
    }
}
