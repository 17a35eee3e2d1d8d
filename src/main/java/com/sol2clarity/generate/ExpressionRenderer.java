package com.sol2clarity.generate;

import java.util.List;
import java.util.stream.Collectors;

import com.sol2clarity.model.target.Atom;
import com.sol2clarity.model.target.Begin;
import com.sol2clarity.model.target.Call;
import com.sol2clarity.model.target.ClarityExpression;
import com.sol2clarity.model.target.DefaultTo;
import com.sol2clarity.model.target.MapGet;
import com.sol2clarity.model.target.MapSet;
import com.sol2clarity.model.target.Ok;
import com.sol2clarity.model.target.Print;
import com.sol2clarity.model.target.TupleLiteral;
import com.sol2clarity.model.target.VarGet;
import com.sol2clarity.model.target.VarSet;

import lombok.experimental.UtilityClass;

/**
 * Renders an expression tree on a single line.
 */
@UtilityClass
public class ExpressionRenderer {

    public String render(ClarityExpression expression) {
        if (expression instanceof Atom atom) {
            return atom.getText();
        }
        if (expression instanceof VarGet get) {
            return list("var-get", get.getVariable());
        }
        if (expression instanceof VarSet set) {
            return list("var-set", set.getVariable(), render(set.getValue()));
        }
        if (expression instanceof MapGet get) {
            return list("map-get?", get.getMap(), render(get.getKey()));
        }
        if (expression instanceof MapSet set) {
            return list("map-set", set.getMap(), render(set.getKey()), render(set.getValue()));
        }
        if (expression instanceof DefaultTo defaultTo) {
            return list("default-to", render(defaultTo.getFallback()), render(defaultTo.getOptional()));
        }
        if (expression instanceof TupleLiteral tuple) {
            return tuple.getEntries().stream()
                    .map(entry -> entry.getName() + ": " + render(entry.getValue()))
                    .collect(Collectors.joining(", ", "{", "}"));
        }
        if (expression instanceof Call call) {
            return "(" + call.getFunction() + " " + renderAll(call.getArguments()) + ")";
        }
        if (expression instanceof Begin begin) {
            return "(begin " + renderAll(begin.getExpressions()) + ")";
        }
        if (expression instanceof Print print) {
            return list("print", render(print.getPayload()));
        }
        if (expression instanceof Ok ok) {
            return list("ok", render(ok.getValue()));
        }
        throw new IllegalArgumentException("Unknown expression node: " + expression.getClass().getName());
    }

    private String renderAll(List<ClarityExpression> expressions) {
        return expressions.stream()
                .map(ExpressionRenderer::render)
                .collect(Collectors.joining(" "));
    }

    private String list(String head, String... items) {
        return "(" + head + " " + String.join(" ", items) + ")";
    }
}
