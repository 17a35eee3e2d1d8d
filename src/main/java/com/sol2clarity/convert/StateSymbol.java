package com.sol2clarity.convert;

import com.sol2clarity.model.target.MapDefinition;
import com.sol2clarity.model.target.ScalarType;

import lombok.NonNull;
import lombok.Value;

/**
 * What a state variable name resolves to inside function bodies.
 */
@Value
class StateSymbol {

    @NonNull
    String clarityName;

    @NonNull
    SymbolKind kind;

    /**
     * Stored type; the terminal value type for maps.
     */
    @NonNull
    ScalarType valueType;

    /**
     * Set only for {@link SymbolKind#MAP}.
     */
    MapDefinition map;
}
