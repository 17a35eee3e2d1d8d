package com.sol2clarity.convert;

import java.util.Map;
import java.util.Set;

import com.sol2clarity.exception.UnsupportedConstructException;
import com.sol2clarity.model.target.Call;
import com.sol2clarity.model.target.ClarityExpression;

import lombok.experimental.UtilityClass;

/**
 * Infix Solidity operators to prefix Clarity applications.
 */
@UtilityClass
public class OperatorTable {

    private static final Map<String, String> FUNCTIONS = Map.ofEntries(
            Map.entry("+", "+"),
            Map.entry("-", "-"),
            Map.entry("*", "*"),
            Map.entry("/", "/"),
            Map.entry("%", "mod"),
            Map.entry("**", "pow"),
            Map.entry("==", "is-eq"),
            Map.entry("<", "<"),
            Map.entry(">", ">"),
            Map.entry("<=", "<="),
            Map.entry(">=", ">="),
            Map.entry("&&", "and"),
            Map.entry("||", "or"));

    private static final Set<String> COMPARISONS = Set.of("==", "!=", "<", ">", "<=", ">=");
    private static final Set<String> LOGICAL = Set.of("&&", "||");

    public ClarityExpression apply(String operator, ClarityExpression left, ClarityExpression right) {
        if ("!=".equals(operator)) {
            return Call.of("not", Call.of("is-eq", left, right));
        }
        String function = FUNCTIONS.get(operator);
        if (function == null) {
            throw new UnsupportedConstructException("operator " + operator,
                    "no Clarity lowering for binary operator '" + operator + "'");
        }
        return Call.of(function, left, right);
    }

    public boolean isComparison(String operator) {
        return COMPARISONS.contains(operator);
    }

    public boolean isLogical(String operator) {
        return LOGICAL.contains(operator);
    }
}
