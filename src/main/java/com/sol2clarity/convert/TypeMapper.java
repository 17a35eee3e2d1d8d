package com.sol2clarity.convert;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.sol2clarity.exception.UnsupportedConstructException;
import com.sol2clarity.model.source.BasicType;
import com.sol2clarity.model.source.MappingType;
import com.sol2clarity.model.source.TypeRef;
import com.sol2clarity.model.target.Atom;
import com.sol2clarity.model.target.ClarityExpression;
import com.sol2clarity.model.target.ScalarType;

import lombok.experimental.UtilityClass;

/**
 * Solidity basic type names to Clarity scalar types, plus the zero value of each.
 */
@UtilityClass
public class TypeMapper {

    private static final Map<String, ScalarType> FIXED_TYPES = Map.of(
            "address", ScalarType.PRINCIPAL,
            "bool", ScalarType.BOOL,
            "uint", ScalarType.UINT,
            "int", ScalarType.INT);

    private static final Pattern SIZED_UINT = Pattern.compile("uint(\\d+)");
    private static final Pattern SIZED_INT = Pattern.compile("int(\\d+)");
    private static final Pattern FIXED_BYTES = Pattern.compile("bytes(\\d+)");

    /**
     * Maps a basic type.
     *
     * @throws UnsupportedConstructException for names outside the table
     */
    public ScalarType toClarityType(BasicType type, int stringAsciiLength) {
        String name = type.getName();
        ScalarType fixed = FIXED_TYPES.get(name);
        if (fixed != null) {
            return fixed;
        }
        if ("string".equals(name)) {
            return ScalarType.stringAscii(stringAsciiLength);
        }

        Matcher uint = SIZED_UINT.matcher(name);
        if (uint.matches() && isIntegerWidth(uint.group(1))) {
            return ScalarType.UINT;
        }
        Matcher sint = SIZED_INT.matcher(name);
        if (sint.matches() && isIntegerWidth(sint.group(1))) {
            return ScalarType.INT;
        }
        Matcher bytes = FIXED_BYTES.matcher(name);
        if (bytes.matches()) {
            int length = Integer.parseInt(bytes.group(1));
            if (length >= 1 && length <= 32) {
                return ScalarType.buff(length);
            }
        }
        throw new UnsupportedConstructException("type " + name, "no Clarity equivalent for Solidity type '" + name + "'");
    }

    /**
     * Maps a type that must not be a mapping, such as a parameter, return or event field type.
     */
    public ScalarType toScalarType(TypeRef type, int stringAsciiLength, String usage) {
        if (type instanceof MappingType) {
            throw new UnsupportedConstructException("mapping type",
                    type.describe() + " cannot be used as " + usage);
        }
        return toClarityType((BasicType) type, stringAsciiLength);
    }

    /**
     * Zero value used for uninitialized data-vars and absent map entries.
     */
    public ClarityExpression defaultValue(ScalarType type) {
        return new Atom(switch (type.getKind()) {
            case UINT -> "u0";
            case INT -> "0";
            case BOOL -> "false";
            case STRING_ASCII -> "\"\"";
            case BUFF -> "0x" + "00".repeat(type.getLength());
            case PRINCIPAL -> "tx-sender";
        });
    }

    private boolean isIntegerWidth(String digits) {
        if (digits.length() > 3) {
            return false;
        }
        int width = Integer.parseInt(digits);
        return width >= 8 && width <= 256 && width % 8 == 0;
    }
}
