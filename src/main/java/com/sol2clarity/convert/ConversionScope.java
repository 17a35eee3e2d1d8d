package com.sol2clarity.convert;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.sol2clarity.exception.UnsupportedConstructException;
import com.sol2clarity.model.source.EventDefinition;
import com.sol2clarity.model.target.ScalarType;

/**
 * Names visible while lowering one contract: its state variables and events,
 * plus the parameters of the function currently being lowered. Parameters
 * shadow state variables of the same name.
 *
 * Immutable; {@link #withParameters(Map)} returns a new scope.
 */
public class ConversionScope {

    static final String LOCAL_NAME_SUFFIX = "-param";

    private final Map<String, StateSymbol> stateSymbols;
    private final Map<String, EventDefinition> events;
    private final Set<String> topLevelNames;
    private final Map<String, ParameterSymbol> parameters;
    private final int stringAsciiLength;

    ConversionScope(Map<String, StateSymbol> stateSymbols, Map<String, EventDefinition> events,
                    Set<String> topLevelNames, int stringAsciiLength) {
        this(stateSymbols, events, topLevelNames, Map.of(), stringAsciiLength);
    }

    private ConversionScope(Map<String, StateSymbol> stateSymbols, Map<String, EventDefinition> events,
                            Set<String> topLevelNames, Map<String, ParameterSymbol> parameters,
                            int stringAsciiLength) {
        this.stateSymbols = Collections.unmodifiableMap(new LinkedHashMap<>(stateSymbols));
        this.events = Collections.unmodifiableMap(new LinkedHashMap<>(events));
        this.topLevelNames = Collections.unmodifiableSet(new LinkedHashSet<>(topLevelNames));
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.stringAsciiLength = stringAsciiLength;
    }

    /**
     * @param parameters Solidity parameter name to its Clarity symbol, in declaration order
     */
    ConversionScope withParameters(Map<String, ParameterSymbol> parameters) {
        return new ConversionScope(stateSymbols, events, topLevelNames, parameters, stringAsciiLength);
    }

    public boolean isParameter(String name) {
        return parameters.containsKey(name);
    }

    public ScalarType parameterType(String name) {
        ParameterSymbol parameter = parameters.get(name);
        return parameter != null ? parameter.getType() : null;
    }

    public String parameterName(String name) {
        ParameterSymbol parameter = parameters.get(name);
        return parameter != null ? parameter.getClarityName() : null;
    }

    /**
     * Clarity name for a function argument. Clarity rejects arguments that reuse a
     * top-level name, so such names get the {@value #LOCAL_NAME_SUFFIX} suffix.
     *
     * @param clarityName kebab-cased argument name
     * @param owner       what declares the argument, for the error message
     * @throws UnsupportedConstructException when the suffixed name is taken as well
     */
    String localName(String clarityName, String owner) {
        if (!topLevelNames.contains(clarityName)) {
            return clarityName;
        }
        String renamed = clarityName + LOCAL_NAME_SUFFIX;
        if (topLevelNames.contains(renamed)) {
            throw new UnsupportedConstructException("name collision",
                    "parameter " + clarityName + " of " + owner + " clashes with top-level names '"
                            + clarityName + "' and '" + renamed + "'; rename the parameter");
        }
        return renamed;
    }

    /**
     * State symbol for a name, or {@code null} when the name is unknown or shadowed by a parameter.
     */
    StateSymbol stateSymbol(String name) {
        if (isParameter(name)) {
            return null;
        }
        return stateSymbols.get(name);
    }

    public EventDefinition event(String name) {
        return events.get(name);
    }

    public int getStringAsciiLength() {
        return stringAsciiLength;
    }
}
