package com.sol2clarity.parser;

import java.util.ArrayList;
import java.util.List;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sol2clarity.exception.StructuralException;
import com.sol2clarity.model.source.Assignment;
import com.sol2clarity.model.source.BasicType;
import com.sol2clarity.model.source.BinaryOperation;
import com.sol2clarity.model.source.ContractDefinition;
import com.sol2clarity.model.source.EmitStatement;
import com.sol2clarity.model.source.EventDefinition;
import com.sol2clarity.model.source.EventParameter;
import com.sol2clarity.model.source.Expression;
import com.sol2clarity.model.source.ExpressionStatement;
import com.sol2clarity.model.source.FunctionDefinition;
import com.sol2clarity.model.source.IndexAccess;
import com.sol2clarity.model.source.Literal;
import com.sol2clarity.model.source.LiteralKind;
import com.sol2clarity.model.source.MappingType;
import com.sol2clarity.model.source.MemberAccess;
import com.sol2clarity.model.source.Mutability;
import com.sol2clarity.model.source.Parameter;
import com.sol2clarity.model.source.ReturnStatement;
import com.sol2clarity.model.source.SourceNode;
import com.sol2clarity.model.source.SourceUnit;
import com.sol2clarity.model.source.StateVariable;
import com.sol2clarity.model.source.Statement;
import com.sol2clarity.model.source.TypeRef;
import com.sol2clarity.model.source.Visibility;
import com.sol2clarity.parser.grammar.SolidityBaseVisitor;
import com.sol2clarity.parser.grammar.SolidityParser;

/**
 * Visitor that converts the ANTLR parse tree into the typed source AST.
 *
 * <p>Besides restructuring, it double-checks shapes the grammar should already
 * guarantee (missing children, operator/operand counts, empty index lists) and
 * reports any mismatch as a {@link StructuralException}.
 */
public class SourceAstBuilder extends SolidityBaseVisitor<SourceNode> {

    private static final Logger log = LoggerFactory.getLogger(SourceAstBuilder.class);

    public SourceUnit build(SolidityParser.SourceUnitContext ctx) {
        return visitAs(ctx, SourceUnit.class, "sourceUnit");
    }

    // ========== STRUCTURE ==========

    @Override
    public SourceNode visitSourceUnit(SolidityParser.SourceUnitContext ctx) {
        SourceUnit.SourceUnitBuilder unit = SourceUnit.builder();
        for (SolidityParser.ContractDefinitionContext contract : ctx.contractDefinition()) {
            unit.contract(visitAs(contract, ContractDefinition.class, "contractDefinition"));
        }
        return unit.build();
    }

    @Override
    public SourceNode visitContractDefinition(SolidityParser.ContractDefinitionContext ctx) {
        String name = identifier(ctx.identifier(), ctx, "contractDefinition");
        log.debug("Visiting contract {}", name);

        ContractDefinition.ContractDefinitionBuilder contract = ContractDefinition.builder()
                .name(name)
                .line(ctx.getStart().getLine());

        if (ctx.inheritanceSpecifier() != null) {
            for (SolidityParser.IdentifierContext base : ctx.inheritanceSpecifier().identifier()) {
                contract.baseContract(identifier(base, ctx, "inheritanceSpecifier"));
            }
        }

        for (SolidityParser.ContractPartContext part : ctx.contractPart()) {
            SourceNode member = visit(part);
            if (member instanceof StateVariable variable) {
                contract.member(variable);
            } else if (member instanceof FunctionDefinition function) {
                contract.member(function);
            } else if (member instanceof EventDefinition event) {
                contract.member(event);
            } else {
                throw structural("contractPart", part, "expected a state variable, function or event");
            }
        }
        return contract.build();
    }

    @Override
    public SourceNode visitContractPart(SolidityParser.ContractPartContext ctx) {
        if (ctx.getChildCount() != 1 || !(ctx.getChild(0) instanceof ParserRuleContext child)) {
            throw structural("contractPart", ctx, "expected exactly one declaration");
        }
        return visit(child);
    }

    @Override
    public SourceNode visitStateVariableDeclaration(SolidityParser.StateVariableDeclarationContext ctx) {
        StateVariable.StateVariableBuilder variable = StateVariable.builder()
                .name(identifier(ctx.identifier(), ctx, "stateVariableDeclaration"))
                .type(visitAs(ctx.typeName(), TypeRef.class, "typeName"))
                .line(ctx.getStart().getLine());

        for (SolidityParser.StateVariableModifierContext modifier : ctx.stateVariableModifier()) {
            if (modifier.visibility() != null) {
                variable.visibility(Visibility.fromKeyword(modifier.visibility().getText()));
            } else if (modifier.CONSTANT() != null) {
                variable.constant(true);
            } else {
                throw structural("stateVariableModifier", modifier, "unknown modifier " + modifier.getText());
            }
        }

        if (ctx.expression() != null) {
            variable.initialValue(visitAs(ctx.expression(), Expression.class, "expression"));
        }
        return variable.build();
    }

    @Override
    public SourceNode visitConstructorDefinition(SolidityParser.ConstructorDefinitionContext ctx) {
        FunctionDefinition.FunctionDefinitionBuilder function = FunctionDefinition.builder()
                .constructor(true)
                .line(ctx.getStart().getLine());
        applyModifiers(function, ctx.functionModifier());
        return function
                .parameters(parameters(ctx.parameterList()))
                .body(statements(ctx.block()))
                .build();
    }

    @Override
    public SourceNode visitFunctionDefinition(SolidityParser.FunctionDefinitionContext ctx) {
        String name = identifier(ctx.identifier(), ctx, "functionDefinition");
        log.debug("Visiting function {}", name);

        FunctionDefinition.FunctionDefinitionBuilder function = FunctionDefinition.builder()
                .name(name)
                .line(ctx.getStart().getLine());
        applyModifiers(function, ctx.functionModifier());

        if (ctx.returnParameters() != null) {
            function.returnType(visitAs(ctx.returnParameters().typeName(), TypeRef.class, "returnParameters"));
        }
        return function
                .parameters(parameters(ctx.parameterList()))
                .body(statements(ctx.block()))
                .build();
    }

    @Override
    public SourceNode visitEventDefinition(SolidityParser.EventDefinitionContext ctx) {
        EventDefinition.EventDefinitionBuilder event = EventDefinition.builder()
                .name(identifier(ctx.identifier(), ctx, "eventDefinition"))
                .line(ctx.getStart().getLine());
        for (SolidityParser.EventParameterContext parameter : ctx.eventParameter()) {
            event.parameter(visitAs(parameter, EventParameter.class, "eventParameter"));
        }
        return event.build();
    }

    @Override
    public SourceNode visitParameter(SolidityParser.ParameterContext ctx) {
        return new Parameter(
                visitAs(ctx.typeName(), TypeRef.class, "typeName"),
                identifier(ctx.identifier(), ctx, "parameter"));
    }

    @Override
    public SourceNode visitEventParameter(SolidityParser.EventParameterContext ctx) {
        return new EventParameter(
                visitAs(ctx.typeName(), TypeRef.class, "typeName"),
                ctx.INDEXED() != null,
                identifier(ctx.identifier(), ctx, "eventParameter"));
    }

    // ========== TYPES ==========

    @Override
    public SourceNode visitTypeName(SolidityParser.TypeNameContext ctx) {
        if (ctx.mappingType() != null) {
            return visitAs(ctx.mappingType(), MappingType.class, "mappingType");
        }
        return visitAs(ctx.elementaryTypeName(), BasicType.class, "elementaryTypeName");
    }

    @Override
    public SourceNode visitMappingType(SolidityParser.MappingTypeContext ctx) {
        BasicType key = visitAs(ctx.elementaryTypeName(), BasicType.class, "elementaryTypeName");
        TypeRef value = visitAs(ctx.typeName(), TypeRef.class, "typeName");
        return new MappingType(key, value);
    }

    @Override
    public SourceNode visitElementaryTypeName(SolidityParser.ElementaryTypeNameContext ctx) {
        return new BasicType(identifier(ctx.identifier(), ctx, "elementaryTypeName"));
    }

    // ========== STATEMENTS ==========

    @Override
    public SourceNode visitStatement(SolidityParser.StatementContext ctx) {
        if (ctx.getChildCount() != 1 || !(ctx.getChild(0) instanceof ParserRuleContext child)) {
            throw structural("statement", ctx, "expected exactly one statement form");
        }
        return visit(child);
    }

    @Override
    public SourceNode visitAssignmentStatement(SolidityParser.AssignmentStatementContext ctx) {
        Expression target = visitAs(ctx.indexAccess(), Expression.class, "indexAccess");
        Expression value = visitAs(ctx.expression(), Expression.class, "expression");
        return new Assignment(target, value, ctx.getStart().getLine());
    }

    @Override
    public SourceNode visitReturnStatement(SolidityParser.ReturnStatementContext ctx) {
        Expression value = ctx.expression() != null
                ? visitAs(ctx.expression(), Expression.class, "expression")
                : null;
        return new ReturnStatement(value, ctx.getStart().getLine());
    }

    @Override
    public SourceNode visitEmitStatement(SolidityParser.EmitStatementContext ctx) {
        List<Expression> arguments = new ArrayList<>();
        if (ctx.expressionList() != null) {
            for (SolidityParser.ExpressionContext argument : ctx.expressionList().expression()) {
                arguments.add(visitAs(argument, Expression.class, "expression"));
            }
        }
        return new EmitStatement(identifier(ctx.identifier(), ctx, "emitStatement"),
                List.copyOf(arguments), ctx.getStart().getLine());
    }

    @Override
    public SourceNode visitExpressionStatement(SolidityParser.ExpressionStatementContext ctx) {
        return new ExpressionStatement(visitAs(ctx.expression(), Expression.class, "expression"),
                ctx.getStart().getLine());
    }

    // ========== EXPRESSIONS ==========

    /**
     * Folds {@code t0 op1 t1 op2 t2 ...} strictly left to right.
     */
    @Override
    public SourceNode visitExpression(SolidityParser.ExpressionContext ctx) {
        List<SolidityParser.TermContext> terms = ctx.term();
        List<SolidityParser.BinaryOperatorContext> operators = ctx.binaryOperator();
        if (terms.isEmpty() || operators.size() != terms.size() - 1) {
            throw structural("expression", ctx,
                    terms.size() + " operand(s) for " + operators.size() + " operator(s)");
        }

        Expression result = visitAs(terms.get(0), Expression.class, "term");
        for (int i = 0; i < operators.size(); i++) {
            Expression right = visitAs(terms.get(i + 1), Expression.class, "term");
            result = new BinaryOperation(operators.get(i).getText(), result, right);
        }
        return result;
    }

    @Override
    public SourceNode visitTerm(SolidityParser.TermContext ctx) {
        if (ctx.primary() != null) {
            return visitAs(ctx.primary(), Expression.class, "primary");
        }
        return visitAs(ctx.expression(), Expression.class, "expression");
    }

    @Override
    public SourceNode visitPrimary(SolidityParser.PrimaryContext ctx) {
        if (ctx.literal() != null) {
            return visitAs(ctx.literal(), Literal.class, "literal");
        }
        return visitAs(ctx.indexAccess(), Expression.class, "indexAccess");
    }

    @Override
    public SourceNode visitIndexAccess(SolidityParser.IndexAccessContext ctx) {
        MemberAccess base = visitAs(ctx.memberAccess(), MemberAccess.class, "memberAccess");
        if (ctx.expression().isEmpty()) {
            return base;
        }

        List<Expression> indices = new ArrayList<>();
        for (SolidityParser.ExpressionContext index : ctx.expression()) {
            indices.add(visitAs(index, Expression.class, "expression"));
        }
        if (indices.isEmpty()) {
            throw structural("indexAccess", ctx, "index access without an index");
        }
        return new IndexAccess(base, List.copyOf(indices));
    }

    @Override
    public SourceNode visitMemberAccess(SolidityParser.MemberAccessContext ctx) {
        List<String> path = new ArrayList<>();
        for (SolidityParser.IdentifierContext segment : ctx.identifier()) {
            path.add(identifier(segment, ctx, "memberAccess"));
        }
        if (path.isEmpty()) {
            throw structural("memberAccess", ctx, "empty identifier chain");
        }
        return new MemberAccess(List.copyOf(path));
    }

    @Override
    public SourceNode visitLiteral(SolidityParser.LiteralContext ctx) {
        if (ctx.NumberLiteral() != null) {
            return new Literal(LiteralKind.NUMBER, ctx.NumberLiteral().getText());
        }
        if (ctx.StringLiteral() != null) {
            return new Literal(LiteralKind.STRING, ctx.StringLiteral().getText());
        }
        if (ctx.TRUE() != null || ctx.FALSE() != null) {
            return new Literal(LiteralKind.BOOL, ctx.getText());
        }
        throw structural("literal", ctx, "unknown literal " + ctx.getText());
    }

    // ========== HELPERS ==========

    private void applyModifiers(FunctionDefinition.FunctionDefinitionBuilder function,
                                List<SolidityParser.FunctionModifierContext> modifiers) {
        for (SolidityParser.FunctionModifierContext modifier : modifiers) {
            if (modifier.visibility() != null) {
                function.visibility(Visibility.fromKeyword(modifier.visibility().getText()));
            } else if (modifier.stateMutability() != null) {
                function.mutability(Mutability.fromKeyword(modifier.stateMutability().getText()));
            } else {
                throw structural("functionModifier", modifier, "unknown modifier " + modifier.getText());
            }
        }
    }

    private List<Parameter> parameters(SolidityParser.ParameterListContext ctx) {
        if (ctx == null) {
            throw new StructuralException("parameterList", -1, "missing parameter list");
        }
        List<Parameter> parameters = new ArrayList<>();
        for (SolidityParser.ParameterContext parameter : ctx.parameter()) {
            parameters.add(visitAs(parameter, Parameter.class, "parameter"));
        }
        return parameters;
    }

    private List<Statement> statements(SolidityParser.BlockContext ctx) {
        if (ctx == null) {
            throw new StructuralException("block", -1, "missing function body");
        }
        List<Statement> statements = new ArrayList<>();
        for (SolidityParser.StatementContext statement : ctx.statement()) {
            statements.add(visitAs(statement, Statement.class, "statement"));
        }
        return statements;
    }

    private String identifier(SolidityParser.IdentifierContext ctx, ParserRuleContext owner, String rule) {
        if (ctx == null) {
            throw structural(rule, owner, "missing identifier");
        }
        TerminalNode token = ctx.Identifier();
        if (token == null) {
            throw structural(rule, owner, "identifier without a token");
        }
        return token.getText();
    }

    private <T extends SourceNode> T visitAs(ParserRuleContext ctx, Class<T> type, String rule) {
        if (ctx == null) {
            throw new StructuralException(rule, -1, "missing child node");
        }
        SourceNode node = visit(ctx);
        if (!type.isInstance(node)) {
            throw structural(rule, ctx, "expected " + type.getSimpleName() + " but built "
                    + (node == null ? "nothing" : node.getClass().getSimpleName()));
        }
        return type.cast(node);
    }

    private static StructuralException structural(String rule, ParserRuleContext ctx, String detail) {
        int line = ctx != null && ctx.getStart() != null ? ctx.getStart().getLine() : -1;
        return new StructuralException(rule, line, detail);
    }
}
