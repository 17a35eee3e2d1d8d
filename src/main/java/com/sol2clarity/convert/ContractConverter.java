package com.sol2clarity.convert;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sol2clarity.config.TranspilerConfig;
import com.sol2clarity.exception.UnsupportedConstructException;
import com.sol2clarity.model.source.BasicType;
import com.sol2clarity.model.source.ContractDefinition;
import com.sol2clarity.model.source.ContractMember;
import com.sol2clarity.model.source.EventDefinition;
import com.sol2clarity.model.source.EventParameter;
import com.sol2clarity.model.source.FunctionDefinition;
import com.sol2clarity.model.source.MappingType;
import com.sol2clarity.model.source.Parameter;
import com.sol2clarity.model.source.ReturnStatement;
import com.sol2clarity.model.source.Statement;
import com.sol2clarity.model.source.StateVariable;
import com.sol2clarity.model.source.Visibility;
import com.sol2clarity.model.target.ClarityContract;
import com.sol2clarity.model.target.ClarityDefinition;
import com.sol2clarity.model.target.ClarityExpression;
import com.sol2clarity.model.target.ClarityFunction;
import com.sol2clarity.model.target.ClarityParameter;
import com.sol2clarity.model.target.ConstantDefinition;
import com.sol2clarity.model.target.DataVarDefinition;
import com.sol2clarity.model.target.EventDocumentation;
import com.sol2clarity.model.target.EventField;
import com.sol2clarity.model.target.FunctionKind;
import com.sol2clarity.model.target.GetterDefinition;
import com.sol2clarity.model.target.InitializationBlock;
import com.sol2clarity.model.target.MapDefinition;
import com.sol2clarity.model.target.ScalarType;
import com.sol2clarity.util.NamingUtil;

/**
 * Lowers one Solidity contract to one Clarity contract.
 *
 * <p>Declarations are emitted in source order. A public state variable is followed
 * directly by its getter. Contracts are converted independently: nothing is cached
 * between calls, so one instance can serve parallel conversions.
 */
public class ContractConverter {

    private static final Logger log = LoggerFactory.getLogger(ContractConverter.class);

    static final String INIT_FUNCTION_NAME = "init";

    /**
     * Tuple key that carries the event name in a {@code print} payload.
     */
    static final String EVENT_KEY = "event";

    private static final String GETTER_ORIGIN = "getter for ";

    private final TranspilerConfig config;

    public ContractConverter(TranspilerConfig config) {
        this.config = config;
    }

    /**
     * @throws UnsupportedConstructException for the first construct without a Clarity lowering
     */
    public ClarityContract convert(ContractDefinition contract) {
        log.debug("Converting contract {}", contract.getName());
        if (!contract.getBaseContracts().isEmpty()) {
            throw new UnsupportedConstructException("inheritance",
                    "contract " + contract.getName() + " is " + String.join(", ", contract.getBaseContracts()));
        }

        ConversionScope scope = buildScope(contract);
        NameRegistry names = new NameRegistry(contract.getName());
        ClarityContract.ClarityContractBuilder result = ClarityContract.builder()
                .sourceName(contract.getName())
                .unitName(NamingUtil.toKebabCase(contract.getName()));

        boolean initialized = false;
        for (ContractMember member : contract.getMembers()) {
            if (member instanceof StateVariable variable) {
                for (ClarityDefinition definition : convertStateVariable(variable, scope)) {
                    names.register(definition.getName(), definition instanceof GetterDefinition
                            ? GETTER_ORIGIN + variable.getName()
                            : "state variable " + variable.getName());
                    result.definition(definition);
                }
            } else if (member instanceof FunctionDefinition function && function.isConstructor()) {
                if (initialized) {
                    throw new UnsupportedConstructException("constructor",
                            "contract " + contract.getName() + " declares more than one constructor");
                }
                initialized = true;
                ClarityDefinition definition = convertConstructor(function, scope);
                if (definition.getName() != null) {
                    names.register(definition.getName(), "constructor");
                }
                result.definition(definition);
            } else if (member instanceof FunctionDefinition function) {
                ClarityFunction converted = convertFunction(function, scope);
                names.register(converted.getName(), "function " + function.getName());
                result.definition(converted);
            } else if (member instanceof EventDefinition event) {
                result.definition(convertEvent(event));
            }
        }
        return result.build();
    }

    /**
     * Resolves every state variable up front so bodies can reference variables declared later.
     * Also collects every top-level Clarity name so function arguments can avoid them.
     */
    private ConversionScope buildScope(ContractDefinition contract) {
        Map<String, List<String>> keyFields = new KeyFieldNamer().nameKeyFields(contract);
        int stringLength = config.getStringAsciiLength();

        Map<String, StateSymbol> symbols = new LinkedHashMap<>();
        for (StateVariable variable : contract.getStateVariables()) {
            String clarityName = NamingUtil.toKebabCase(variable.getName());
            StateSymbol symbol;
            if (variable.getType() instanceof MappingType mapping) {
                MapDefinition map = MappingFlattener.flatten(clarityName, mapping,
                        keyFields.get(variable.getName()), stringLength);
                symbol = new StateSymbol(clarityName, SymbolKind.MAP, map.getValueType(), map);
            } else {
                ScalarType type = TypeMapper.toClarityType((BasicType) variable.getType(), stringLength);
                SymbolKind kind = variable.isConstant() ? SymbolKind.CONSTANT : SymbolKind.DATA_VAR;
                symbol = new StateSymbol(clarityName, kind, type, null);
            }
            symbols.put(variable.getName(), symbol);
        }

        Map<String, EventDefinition> events = new LinkedHashMap<>();
        for (EventDefinition event : contract.getEvents()) {
            if (events.put(event.getName(), event) != null) {
                throw new UnsupportedConstructException("event overloading",
                        "event " + event.getName() + " is declared more than once");
            }
            checkEventFieldNames(event);
        }
        return new ConversionScope(symbols, events, topLevelNames(contract), stringLength);
    }

    private static Set<String> topLevelNames(ContractDefinition contract) {
        Set<String> names = new LinkedHashSet<>();
        for (ContractMember member : contract.getMembers()) {
            if (member instanceof StateVariable variable) {
                String clarityName = NamingUtil.toKebabCase(variable.getName());
                names.add(clarityName);
                if (variable.isPublic()) {
                    names.add(GetterSynthesizer.GETTER_PREFIX + clarityName);
                }
            } else if (member instanceof FunctionDefinition function && function.isConstructor()) {
                if (!function.getParameters().isEmpty()) {
                    names.add(INIT_FUNCTION_NAME);
                }
            } else if (member instanceof FunctionDefinition function) {
                names.add(NamingUtil.toKebabCase(function.getName()));
            }
        }
        return names;
    }

    /**
     * Field names become tuple keys next to {@value #EVENT_KEY}, so they must stay distinct once kebab-cased.
     */
    private static void checkEventFieldNames(EventDefinition event) {
        Map<String, String> fields = new HashMap<>();
        fields.put(EVENT_KEY, "the event name key");
        for (EventParameter parameter : event.getParameters()) {
            String clarityName = NamingUtil.toKebabCase(parameter.getName());
            String previous = fields.putIfAbsent(clarityName, "field " + parameter.getName());
            if (previous != null) {
                throw new UnsupportedConstructException("name collision",
                        previous + " and field " + parameter.getName() + " of event " + event.getName()
                                + " both map to tuple key '" + clarityName + "'; rename one of them");
            }
        }
    }

    private List<ClarityDefinition> convertStateVariable(StateVariable variable, ConversionScope scope) {
        StateSymbol symbol = scope.stateSymbol(variable.getName());
        ExpressionLowering expressions = new ExpressionLowering(scope);

        if (symbol.getKind() == SymbolKind.MAP) {
            if (variable.isConstant()) {
                throw new UnsupportedConstructException("constant mapping",
                        "mapping " + variable.getName() + " cannot be constant");
            }
            if (variable.getInitialValue() != null) {
                throw new UnsupportedConstructException("mapping initializer",
                        "mapping " + variable.getName() + " cannot have an initial value");
            }
            MapDefinition map = symbol.getMap();
            if (!variable.isPublic()) {
                return List.of(map);
            }
            String keyParameter = scope.localName(GetterSynthesizer.MAP_KEY_PARAMETER,
                    "the getter for " + variable.getName());
            return List.of(map, GetterSynthesizer.forMap(map, keyParameter));
        }

        if (symbol.getKind() == SymbolKind.CONSTANT) {
            if (variable.getInitialValue() == null) {
                throw new UnsupportedConstructException("constant without value",
                        "constant " + variable.getName() + " has no initializer");
            }
            ConstantDefinition constant = ConstantDefinition.builder()
                    .name(symbol.getClarityName())
                    .type(symbol.getValueType())
                    .value(expressions.lower(variable.getInitialValue(), symbol.getValueType()))
                    .build();
            return variable.isPublic() ? List.of(constant, GetterSynthesizer.forConstant(constant)) : List.of(constant);
        }

        ClarityExpression initial = variable.getInitialValue() != null
                ? expressions.lower(variable.getInitialValue(), symbol.getValueType())
                : TypeMapper.defaultValue(symbol.getValueType());
        DataVarDefinition dataVar = DataVarDefinition.builder()
                .name(symbol.getClarityName())
                .type(symbol.getValueType())
                .initialValue(initial)
                .build();
        return variable.isPublic() ? List.of(dataVar, GetterSynthesizer.forDataVar(dataVar)) : List.of(dataVar);
    }

    private ClarityDefinition convertConstructor(FunctionDefinition constructor, ConversionScope scope) {
        if (constructor.getBody().stream().anyMatch(ReturnStatement.class::isInstance)) {
            throw new UnsupportedConstructException("return in constructor",
                    "constructors cannot return a value (line " + constructor.getLine() + ")");
        }

        if (constructor.getParameters().isEmpty()) {
            StatementLowering statements = new StatementLowering(scope);
            return new InitializationBlock(List.copyOf(statements.lowerAll(constructor.getBody(), null)));
        }

        ClarityFunction.ClarityFunctionBuilder function = ClarityFunction.builder()
                .name(INIT_FUNCTION_NAME)
                .kind(FunctionKind.PUBLIC)
                .returnType(ScalarType.BOOL)
                .initializer(true);
        ConversionScope functionScope = scope.withParameters(parameterSymbols(constructor, "the constructor",
                function, scope));
        List<ClarityExpression> body = new StatementLowering(functionScope).lowerAll(constructor.getBody(), null);
        return function.body(ImplicitReturnPass.toBody(body, "constructor")).build();
    }

    private ClarityFunction convertFunction(FunctionDefinition source, ConversionScope scope) {
        Visibility visibility = source.getVisibility() != null ? source.getVisibility() : Visibility.PUBLIC;
        FunctionKind kind;
        if (!visibility.isExposed()) {
            kind = FunctionKind.PRIVATE;
        } else if (source.getMutability() != null && source.getMutability().isReadOnly()) {
            kind = FunctionKind.READ_ONLY;
        } else {
            kind = FunctionKind.PUBLIC;
        }

        ScalarType returnType = source.getReturnType() == null
                ? null
                : TypeMapper.toScalarType(source.getReturnType(), config.getStringAsciiLength(), "a return type");

        ClarityFunction.ClarityFunctionBuilder function = ClarityFunction.builder()
                .name(NamingUtil.toKebabCase(source.getName()))
                .kind(kind)
                .returnType(returnType != null ? returnType : ScalarType.BOOL);
        ConversionScope functionScope = scope.withParameters(parameterSymbols(source,
                "function " + source.getName(), function, scope));

        List<ClarityExpression> body = new StatementLowering(functionScope).lowerAll(source.getBody(), returnType);
        ClarityExpression result = ImplicitReturnPass.toBody(body, "function " + source.getName());
        if (returnType != null && !endsWithValueReturn(source.getBody())) {
            throw new UnsupportedConstructException("missing return",
                    "function " + source.getName() + " declares returns (" + source.getReturnType().describe()
                            + ") but its last statement is not a return with a value (line " + source.getLine() + ")");
        }
        log.debug("Lowered function {} as {}", source.getName(), kind);
        return function.body(result).build();
    }

    private static boolean endsWithValueReturn(List<Statement> body) {
        return !body.isEmpty()
                && body.get(body.size() - 1) instanceof ReturnStatement ret
                && ret.getValue() != null;
    }

    /**
     * Adds the Clarity parameters to the builder and returns the symbols for the body scope.
     * Names are checked after kebab-casing, since {@code aB} and {@code a_b} both become {@code a-b}.
     */
    private Map<String, ParameterSymbol> parameterSymbols(FunctionDefinition source, String owner,
                                                          ClarityFunction.ClarityFunctionBuilder function,
                                                          ConversionScope scope) {
        Map<String, ParameterSymbol> symbols = new LinkedHashMap<>();
        Map<String, String> declaredAs = new HashMap<>();
        for (Parameter parameter : source.getParameters()) {
            if (symbols.containsKey(parameter.getName())) {
                throw new UnsupportedConstructException("duplicate parameter",
                        "parameter " + parameter.getName() + " is declared twice (line " + source.getLine() + ")");
            }
            ScalarType type = TypeMapper.toScalarType(parameter.getType(), config.getStringAsciiLength(),
                    "a function parameter");
            String clarityName = scope.localName(NamingUtil.toKebabCase(parameter.getName()), owner);
            String previous = declaredAs.putIfAbsent(clarityName, parameter.getName());
            if (previous != null) {
                throw new UnsupportedConstructException("duplicate parameter",
                        "parameters " + previous + " and " + parameter.getName() + " of " + owner
                                + " both map to Clarity name '" + clarityName + "' (line " + source.getLine() + ")");
            }
            if (!clarityName.equals(NamingUtil.toKebabCase(parameter.getName()))) {
                log.debug("Parameter {} of {} renamed to {}", parameter.getName(), owner, clarityName);
            }
            symbols.put(parameter.getName(), new ParameterSymbol(clarityName, type));
            function.parameter(new ClarityParameter(clarityName, type));
        }
        return symbols;
    }

    private EventDocumentation convertEvent(EventDefinition event) {
        EventDocumentation.EventDocumentationBuilder documentation = EventDocumentation.builder()
                .eventName(event.getName());
        for (EventParameter parameter : event.getParameters()) {
            ScalarType type = TypeMapper.toScalarType(parameter.getType(), config.getStringAsciiLength(),
                    "an event field");
            documentation.field(new EventField(NamingUtil.toKebabCase(parameter.getName()), type,
                    parameter.isIndexed()));
        }
        return documentation.build();
    }

    /**
     * Tracks Clarity names already defined in the contract being converted.
     */
    private static final class NameRegistry {

        private final String contractName;
        private final Map<String, String> origins = new LinkedHashMap<>();

        private NameRegistry(String contractName) {
            this.contractName = contractName;
        }

        void register(String clarityName, String origin) {
            String previous = origins.putIfAbsent(clarityName, origin);
            if (previous != null) {
                throw new UnsupportedConstructException("name collision",
                        previous + " and " + origin + " both map to Clarity name '" + clarityName
                                + "' in contract " + contractName + "; " + renameHint(previous, origin));
            }
        }

        private static String renameHint(String previous, String origin) {
            if (previous.startsWith(GETTER_ORIGIN) || origin.startsWith(GETTER_ORIGIN)) {
                return "public variables get a " + GetterSynthesizer.GETTER_PREFIX
                        + "<name> getter, so rename the function or make the variable non-public";
            }
            return "rename one of them";
        }
    }
}
