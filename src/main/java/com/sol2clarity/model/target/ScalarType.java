package com.sol2clarity.model.target;

import lombok.NonNull;
import lombok.Value;

/**
 * A non-composite Clarity type. Sized kinds carry their length, others carry zero.
 */
@Value
public class ScalarType implements ClarityType {

    public static final ScalarType UINT = new ScalarType(ScalarKind.UINT, 0);
    public static final ScalarType INT = new ScalarType(ScalarKind.INT, 0);
    public static final ScalarType BOOL = new ScalarType(ScalarKind.BOOL, 0);
    public static final ScalarType PRINCIPAL = new ScalarType(ScalarKind.PRINCIPAL, 0);

    @NonNull
    ScalarKind kind;

    int length;

    public static ScalarType stringAscii(int length) {
        return new ScalarType(ScalarKind.STRING_ASCII, length);
    }

    public static ScalarType buff(int length) {
        return new ScalarType(ScalarKind.BUFF, length);
    }

    public boolean isNumeric() {
        return kind == ScalarKind.UINT || kind == ScalarKind.INT;
    }

    @Override
    public String render() {
        return switch (kind) {
            case UINT -> "uint";
            case INT -> "int";
            case BOOL -> "bool";
            case PRINCIPAL -> "principal";
            case STRING_ASCII -> "(string-ascii " + length + ")";
            case BUFF -> "(buff " + length + ")";
        };
    }
}
