package com.sol2clarity.convert;

import java.util.ArrayList;
import java.util.List;

import com.sol2clarity.exception.UnsupportedConstructException;
import com.sol2clarity.model.target.Atom;
import com.sol2clarity.model.target.Begin;
import com.sol2clarity.model.target.ClarityExpression;
import com.sol2clarity.model.target.Ok;

import lombok.experimental.UtilityClass;

/**
 * Turns a lowered statement list into a function body whose value is the result.
 *
 * <p>Clarity returns the value of the last expression. Earlier statements run for
 * their effect only and the last one is wrapped in {@code ok} unless it already
 * came from an explicit {@code return}.
 */
@UtilityClass
public class ImplicitReturnPass {

    /**
     * @param functionName used in the error message only
     * @throws UnsupportedConstructException when a {@code return} is not the last statement
     */
    public ClarityExpression toBody(List<ClarityExpression> statements, String functionName) {
        if (statements.isEmpty()) {
            return new Ok(Atom.TRUE);
        }

        int lastIndex = statements.size() - 1;
        for (int i = 0; i < lastIndex; i++) {
            if (statements.get(i) instanceof Ok) {
                throw new UnsupportedConstructException("early return",
                        "return must be the last statement of " + functionName);
            }
        }

        ClarityExpression last = statements.get(lastIndex);
        ClarityExpression result = last instanceof Ok ? last : new Ok(last);
        if (lastIndex == 0) {
            return result;
        }

        List<ClarityExpression> sequence = new ArrayList<>(statements.subList(0, lastIndex));
        sequence.add(result);
        return new Begin(List.copyOf(sequence));
    }
}
