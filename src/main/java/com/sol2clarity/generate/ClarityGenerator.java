package com.sol2clarity.generate;

import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sol2clarity.config.TranspilerConfig;
import com.sol2clarity.model.output.GeneratedFile;
import com.sol2clarity.model.target.Begin;
import com.sol2clarity.model.target.ClarityContract;
import com.sol2clarity.model.target.ClarityDefinition;
import com.sol2clarity.model.target.ClarityExpression;
import com.sol2clarity.model.target.ClarityFunction;
import com.sol2clarity.model.target.ClarityParameter;
import com.sol2clarity.model.target.ConstantDefinition;
import com.sol2clarity.model.target.DataVarDefinition;
import com.sol2clarity.model.target.EventDocumentation;
import com.sol2clarity.model.target.GetterDefinition;
import com.sol2clarity.model.target.InitializationBlock;
import com.sol2clarity.model.target.MapDefinition;
import com.sol2clarity.util.NamingUtil;

/**
 * Renders a {@link ClarityContract} to Clarity source text.
 *
 * <p>Layout: the header block, then every definition preceded by a blank line and
 * its {@code ;; @desc} documentation, in model order. Function bodies that sequence
 * several expressions are written one expression per line inside {@code begin}.
 * Output depends only on the model and the configuration, so it is byte-stable.
 */
public class ClarityGenerator {

    private static final Logger log = LoggerFactory.getLogger(ClarityGenerator.class);

    private static final String INDENT = "  ";

    private final TranspilerConfig config;
    private final HeaderRenderer headerRenderer;

    public ClarityGenerator(TranspilerConfig config) {
        this.config = config;
        this.headerRenderer = new HeaderRenderer();
    }

    public GeneratedFile generate(ClarityContract contract) {
        StringBuilder sb = new StringBuilder(headerRenderer.render(contract, config));
        for (ClarityDefinition definition : contract.getDefinitions()) {
            sb.append('\n').append(renderDefinition(definition));
        }

        log.debug("Generated {} definition(s) for {}", contract.getDefinitions().size(), contract.getSourceName());
        return GeneratedFile.builder()
                .contractName(contract.getSourceName())
                .fileName(NamingUtil.toUnitFileName(contract.getSourceName()))
                .contents(sb.toString())
                .build();
    }

    String renderDefinition(ClarityDefinition definition) {
        if (definition instanceof DataVarDefinition dataVar) {
            return new DocCommentBuilder()
                    .desc("Stores the " + dataVar.getName() + " value")
                    .build()
                    + "(define-data-var " + dataVar.getName() + " " + dataVar.getType().render() + " "
                    + ExpressionRenderer.render(dataVar.getInitialValue()) + ")\n";
        }
        if (definition instanceof ConstantDefinition constant) {
            return new DocCommentBuilder()
                    .desc("Constant value for " + constant.getName())
                    .build()
                    + "(define-constant " + constant.getName() + " "
                    + ExpressionRenderer.render(constant.getValue()) + ")\n";
        }
        if (definition instanceof MapDefinition map) {
            return new DocCommentBuilder()
                    .desc("Map storing " + map.getName() + " values")
                    .key(map.getKeyType().render())
                    .value(map.getValueType().render())
                    .build()
                    + "(define-map " + map.getName() + " " + map.getKeyType().render() + " "
                    + map.getValueType().render() + ")\n";
        }
        if (definition instanceof GetterDefinition getter) {
            return renderGetter(getter);
        }
        if (definition instanceof ClarityFunction function) {
            return renderFunction(function);
        }
        if (definition instanceof EventDocumentation event) {
            return renderEvent(event);
        }
        if (definition instanceof InitializationBlock init) {
            return renderInitialization(init);
        }
        throw new IllegalArgumentException("Unknown definition: " + definition.getClass().getName());
    }

    private String renderGetter(GetterDefinition getter) {
        String description = switch (getter.getKind()) {
            case DATA_VAR -> "Getter for public variable " + getter.getTarget();
            case CONSTANT -> "Getter for public constant " + getter.getTarget();
            case MAP -> "Getter for map " + getter.getTarget();
        };
        DocCommentBuilder docs = new DocCommentBuilder().desc(description);
        getter.getParameters().forEach(p -> docs.param(p.getName(), p.getType().render()));
        docs.returns(getter.getReturnType().render());

        return docs.build()
                + "(define-read-only " + signature(getter.getName(), getter.getParameters()) + "\n"
                + renderBody(getter.getBody()) + ")\n";
    }

    private String renderFunction(ClarityFunction function) {
        String description = function.isInitializer()
                ? "Initialization function lowered from the constructor"
                : function.getKind().getDescription() + " " + function.getName();
        DocCommentBuilder docs = new DocCommentBuilder().desc(description);
        function.getParameters().forEach(p -> docs.param(p.getName(), p.getType().render()));
        docs.returns(function.getReturnType().render());

        return docs.build()
                + "(" + function.getKind().getKeyword() + " " + signature(function.getName(), function.getParameters())
                + "\n" + renderBody(function.getBody()) + ")\n";
    }

    private String renderEvent(EventDocumentation event) {
        String fields = event.getFields().isEmpty()
                ? "none"
                : event.getFields().stream()
                        .map(f -> (f.isIndexed() ? "(indexed) " : "") + f.getName() + ": " + f.getType().render())
                        .collect(Collectors.joining(", "));
        return new DocCommentBuilder()
                .desc("Event " + event.getEventName() + ", emitted through print")
                .fields(fields)
                .build();
    }

    private String renderInitialization(InitializationBlock init) {
        String docs = new DocCommentBuilder()
                .desc("Deployment-time initialization from the constructor")
                .build();
        if (init.getExpressions().isEmpty()) {
            return docs + "(begin true)\n";
        }
        return docs + "(begin\n" + renderLines(init.getExpressions(), INDENT) + ")\n";
    }

    private static String signature(String name, List<ClarityParameter> parameters) {
        StringBuilder sb = new StringBuilder("(").append(name);
        for (ClarityParameter parameter : parameters) {
            sb.append(" (").append(parameter.getName()).append(' ').append(parameter.getType().render()).append(')');
        }
        return sb.append(')').toString();
    }

    private static String renderBody(ClarityExpression body) {
        if (body instanceof Begin begin) {
            return INDENT + "(begin\n" + renderLines(begin.getExpressions(), INDENT + INDENT) + ")";
        }
        return INDENT + ExpressionRenderer.render(body);
    }

    private static String renderLines(List<ClarityExpression> expressions, String indent) {
        return expressions.stream()
                .map(expression -> indent + ExpressionRenderer.render(expression))
                .collect(Collectors.joining("\n"));
    }
}
