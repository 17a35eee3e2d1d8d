package com.sol2clarity.convert;

import java.util.ArrayList;
import java.util.List;

import com.sol2clarity.exception.UnsupportedConstructException;
import com.sol2clarity.model.source.BinaryOperation;
import com.sol2clarity.model.source.Expression;
import com.sol2clarity.model.source.IndexAccess;
import com.sol2clarity.model.source.Literal;
import com.sol2clarity.model.source.LiteralKind;
import com.sol2clarity.model.source.MemberAccess;
import com.sol2clarity.model.target.Atom;
import com.sol2clarity.model.target.ClarityExpression;
import com.sol2clarity.model.target.DefaultTo;
import com.sol2clarity.model.target.MapDefinition;
import com.sol2clarity.model.target.MapGet;
import com.sol2clarity.model.target.ScalarKind;
import com.sol2clarity.model.target.ScalarType;
import com.sol2clarity.model.target.TupleEntry;
import com.sol2clarity.model.target.TupleField;
import com.sol2clarity.model.target.TupleLiteral;
import com.sol2clarity.model.target.TupleType;
import com.sol2clarity.model.target.VarGet;
import com.sol2clarity.util.NamingUtil;

/**
 * Lowers source expressions to Clarity expressions within a {@link ConversionScope}.
 *
 * <p>The expected type passed to {@link #lower(Expression, ScalarType)} only
 * decides how number literals are written: bare for {@code int}, {@code u}-prefixed
 * otherwise.
 */
public class ExpressionLowering {

    private final ConversionScope scope;

    public ExpressionLowering(ConversionScope scope) {
        this.scope = scope;
    }

    /**
     * @param expected type the surrounding context expects, or {@code null} when unknown
     */
    public ClarityExpression lower(Expression expression, ScalarType expected) {
        if (expression instanceof Literal literal) {
            return lowerLiteral(literal, expected);
        }
        if (expression instanceof MemberAccess access) {
            return lowerMemberAccess(access);
        }
        if (expression instanceof IndexAccess access) {
            StateSymbol map = resolveMap(access);
            ClarityExpression fallback = TypeMapper.defaultValue(map.getValueType());
            return new DefaultTo(fallback, new MapGet(map.getClarityName(), lowerKey(map, access)));
        }
        if (expression instanceof BinaryOperation operation) {
            return lowerBinary(operation, expected);
        }
        throw new UnsupportedConstructException(expression.getClass().getSimpleName(),
                "no Clarity lowering for expression " + expression.describe());
    }

    /**
     * Resolves the mapping an index access reads or writes and checks the index count.
     */
    StateSymbol resolveMap(IndexAccess access) {
        MemberAccess base = access.getBase();
        StateSymbol symbol = base.isSimpleName() ? scope.stateSymbol(base.getFirst()) : null;
        if (symbol == null || symbol.getKind() != SymbolKind.MAP) {
            throw new UnsupportedConstructException("index access",
                    base.describe() + " is not a mapping state variable in " + access.describe());
        }
        int depth = symbol.getMap().getDepth();
        if (access.getIndices().size() != depth) {
            throw new UnsupportedConstructException("index access",
                    access.describe() + " uses " + access.getIndices().size()
                            + " index(es) but " + base.getFirst() + " has " + depth + " key level(s)");
        }
        return symbol;
    }

    /**
     * Builds the map key: the single index for a one-level mapping, otherwise a tuple
     * whose fields follow the map's key order.
     */
    ClarityExpression lowerKey(StateSymbol symbol, IndexAccess access) {
        MapDefinition map = symbol.getMap();
        if (!(map.getKeyType() instanceof TupleType tuple)) {
            return lower(access.getIndices().get(0), (ScalarType) map.getKeyType());
        }
        List<TupleEntry> entries = new ArrayList<>();
        for (int i = 0; i < tuple.getFields().size(); i++) {
            TupleField field = tuple.getFields().get(i);
            entries.add(new TupleEntry(field.getName(), lower(access.getIndices().get(i), field.getType())));
        }
        return new TupleLiteral(List.copyOf(entries));
    }

    /**
     * Best-effort static type, used to pick literal hints. {@code null} when unknown.
     */
    ScalarType staticType(Expression expression) {
        if (expression instanceof Literal literal) {
            return literal.getKind() == LiteralKind.BOOL ? ScalarType.BOOL : null;
        }
        if (expression instanceof MemberAccess access) {
            if (access.isSimpleName()) {
                String name = access.getFirst();
                if (scope.isParameter(name)) {
                    return scope.parameterType(name);
                }
                StateSymbol symbol = scope.stateSymbol(name);
                return symbol != null && symbol.getKind() != SymbolKind.MAP ? symbol.getValueType() : null;
            }
            return MemberAccessRewriter.knownType(access);
        }
        if (expression instanceof IndexAccess access) {
            MemberAccess base = access.getBase();
            StateSymbol symbol = base.isSimpleName() ? scope.stateSymbol(base.getFirst()) : null;
            return symbol != null && symbol.getKind() == SymbolKind.MAP ? symbol.getValueType() : null;
        }
        if (expression instanceof BinaryOperation operation) {
            String operator = operation.getOperator();
            if (OperatorTable.isComparison(operator) || OperatorTable.isLogical(operator)) {
                return ScalarType.BOOL;
            }
            return firstKnown(staticType(operation.getLeft()), staticType(operation.getRight()), null);
        }
        return null;
    }

    private ClarityExpression lowerLiteral(Literal literal, ScalarType expected) {
        return switch (literal.getKind()) {
            case NUMBER -> new Atom(expected != null && expected.getKind() == ScalarKind.INT
                    ? literal.getText()
                    : "u" + literal.getText());
            case STRING -> new Atom(toDoubleQuoted(literal.getText()));
            case BOOL -> new Atom(literal.getText());
        };
    }

    private ClarityExpression lowerMemberAccess(MemberAccess access) {
        if (!access.isSimpleName()) {
            return new Atom(MemberAccessRewriter.rewrite(access));
        }
        String name = access.getFirst();
        if (scope.isParameter(name)) {
            return new Atom(scope.parameterName(name));
        }
        StateSymbol symbol = scope.stateSymbol(name);
        if (symbol == null) {
            return new Atom(NamingUtil.toKebabCase(name));
        }
        return switch (symbol.getKind()) {
            case DATA_VAR -> new VarGet(symbol.getClarityName());
            case CONSTANT -> new Atom(symbol.getClarityName());
            case MAP -> throw new UnsupportedConstructException("mapping value",
                    "mapping " + name + " is used without an index");
        };
    }

    private ClarityExpression lowerBinary(BinaryOperation operation, ScalarType expected) {
        String operator = operation.getOperator();
        ScalarType operandType;
        if (OperatorTable.isLogical(operator)) {
            operandType = ScalarType.BOOL;
        } else if (OperatorTable.isComparison(operator)) {
            operandType = firstKnown(staticType(operation.getLeft()), staticType(operation.getRight()), null);
        } else {
            operandType = firstKnown(staticType(operation.getLeft()), staticType(operation.getRight()), expected);
        }
        ClarityExpression left = lower(operation.getLeft(), operandType);
        ClarityExpression right = lower(operation.getRight(), operandType);
        return OperatorTable.apply(operator, left, right);
    }

    private static ScalarType firstKnown(ScalarType first, ScalarType second, ScalarType third) {
        if (first != null) {
            return first;
        }
        return second != null ? second : third;
    }

    /**
     * Clarity string literals are double-quoted only.
     */
    static String toDoubleQuoted(String text) {
        if (text.startsWith("\"")) {
            return text;
        }
        String inner = text.substring(1, text.length() - 1);
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < inner.length(); i++) {
            char c = inner.charAt(i);
            if (c == '\\' && i + 1 < inner.length()) {
                char next = inner.charAt(++i);
                if (next == '\'') {
                    sb.append('\'');
                } else {
                    sb.append(c).append(next);
                }
            } else if (c == '"') {
                sb.append("\\\"");
            } else {
                sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
