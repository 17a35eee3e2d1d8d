package com.sol2clarity.convert;

import java.util.ArrayList;
import java.util.List;

import com.sol2clarity.exception.UnsupportedConstructException;
import com.sol2clarity.model.source.Assignment;
import com.sol2clarity.model.source.EmitStatement;
import com.sol2clarity.model.source.EventDefinition;
import com.sol2clarity.model.source.EventParameter;
import com.sol2clarity.model.source.ExpressionStatement;
import com.sol2clarity.model.source.IndexAccess;
import com.sol2clarity.model.source.MemberAccess;
import com.sol2clarity.model.source.ReturnStatement;
import com.sol2clarity.model.source.Statement;
import com.sol2clarity.model.target.Atom;
import com.sol2clarity.model.target.ClarityExpression;
import com.sol2clarity.model.target.MapSet;
import com.sol2clarity.model.target.Ok;
import com.sol2clarity.model.target.Print;
import com.sol2clarity.model.target.ScalarType;
import com.sol2clarity.model.target.TupleEntry;
import com.sol2clarity.model.target.TupleLiteral;
import com.sol2clarity.model.target.VarSet;
import com.sol2clarity.util.NamingUtil;

/**
 * Lowers one statement at a time. Only {@code return} produces an {@link Ok};
 * making the last statement the function result is left to {@link ImplicitReturnPass}.
 */
public class StatementLowering {

    private final ConversionScope scope;
    private final ExpressionLowering expressions;

    public StatementLowering(ConversionScope scope) {
        this.scope = scope;
        this.expressions = new ExpressionLowering(scope);
    }

    /**
     * @param returnType declared return type of the enclosing function, or {@code null}
     */
    public ClarityExpression lower(Statement statement, ScalarType returnType) {
        if (statement instanceof Assignment assignment) {
            return lowerAssignment(assignment);
        }
        if (statement instanceof ReturnStatement ret) {
            return ret.getValue() == null
                    ? new Ok(Atom.TRUE)
                    : new Ok(expressions.lower(ret.getValue(), returnType));
        }
        if (statement instanceof EmitStatement emit) {
            return lowerEmit(emit);
        }
        if (statement instanceof ExpressionStatement expression) {
            return expressions.lower(expression.getExpression(), null);
        }
        throw new UnsupportedConstructException(statement.getClass().getSimpleName(),
                "no Clarity lowering for statement at line " + statement.getLine());
    }

    public List<ClarityExpression> lowerAll(List<Statement> statements, ScalarType returnType) {
        List<ClarityExpression> lowered = new ArrayList<>();
        for (Statement statement : statements) {
            lowered.add(lower(statement, returnType));
        }
        return lowered;
    }

    private ClarityExpression lowerAssignment(Assignment assignment) {
        if (assignment.getTarget() instanceof IndexAccess access) {
            StateSymbol map = expressions.resolveMap(access);
            return new MapSet(map.getClarityName(),
                    expressions.lowerKey(map, access),
                    expressions.lower(assignment.getValue(), map.getValueType()));
        }

        MemberAccess target = (MemberAccess) assignment.getTarget();
        if (!target.isSimpleName()) {
            throw unsupportedAssignment(assignment, "cannot assign to member access " + target.describe());
        }
        String name = target.getFirst();
        if (scope.isParameter(name)) {
            throw unsupportedAssignment(assignment, "cannot assign to parameter " + name);
        }
        StateSymbol symbol = scope.stateSymbol(name);
        if (symbol == null) {
            throw unsupportedAssignment(assignment, name + " is not a declared state variable");
        }
        return switch (symbol.getKind()) {
            case DATA_VAR -> new VarSet(symbol.getClarityName(),
                    expressions.lower(assignment.getValue(), symbol.getValueType()));
            case CONSTANT -> throw unsupportedAssignment(assignment, "cannot assign to constant " + name);
            case MAP -> throw unsupportedAssignment(assignment, "cannot assign to mapping " + name + " without an index");
        };
    }

    private ClarityExpression lowerEmit(EmitStatement emit) {
        EventDefinition event = scope.event(emit.getEventName());
        if (event == null) {
            throw new UnsupportedConstructException("emit",
                    "event " + emit.getEventName() + " is not declared (line " + emit.getLine() + ")");
        }
        List<EventParameter> parameters = event.getParameters();
        if (parameters.size() != emit.getArguments().size()) {
            throw new UnsupportedConstructException("emit",
                    "event " + event.getName() + " declares " + parameters.size()
                            + " parameter(s) but is emitted with " + emit.getArguments().size()
                            + " (line " + emit.getLine() + ")");
        }

        List<TupleEntry> payload = new ArrayList<>();
        payload.add(new TupleEntry(ContractConverter.EVENT_KEY, new Atom("\"" + event.getName() + "\"")));
        for (int i = 0; i < parameters.size(); i++) {
            EventParameter parameter = parameters.get(i);
            ScalarType type = TypeMapper.toScalarType(parameter.getType(), scope.getStringAsciiLength(),
                    "an event field");
            payload.add(new TupleEntry(NamingUtil.toKebabCase(parameter.getName()),
                    expressions.lower(emit.getArguments().get(i), type)));
        }
        return new Print(new TupleLiteral(List.copyOf(payload)));
    }

    private static UnsupportedConstructException unsupportedAssignment(Assignment assignment, String detail) {
        return new UnsupportedConstructException("assignment", detail + " (line " + assignment.getLine() + ")");
    }
}
