package com.sol2clarity.exception;

import java.util.List;

/**
 * Source text does not match the grammar. Carries the position of the first
 * offending token and the tokens that would have been accepted there.
 */
public class SyntaxException extends TranspilerException {

    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;
    private final String offendingText;
    private final List<String> expectedTokens;

    public SyntaxException(int line, int column, String offendingText, List<String> expectedTokens, String detail) {
        super(format(line, column, offendingText, expectedTokens, detail));
        this.line = line;
        this.column = column;
        this.offendingText = offendingText;
        this.expectedTokens = List.copyOf(expectedTokens);
    }

    private static String format(int line, int column, String offendingText, List<String> expected, String detail) {
        StringBuilder sb = new StringBuilder();
        sb.append("Syntax error at line ").append(line).append(':').append(column);
        if (offendingText != null) {
            sb.append(" near '").append(offendingText).append('\'');
        }
        sb.append(": ").append(detail);
        if (!expected.isEmpty()) {
            sb.append(" (expected one of ").append(String.join(", ", expected)).append(')');
        }
        return sb.toString();
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getOffendingText() {
        return offendingText;
    }

    public List<String> getExpectedTokens() {
        return expectedTokens;
    }
}
