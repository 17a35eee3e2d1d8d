package com.sol2clarity.convert;

import com.sol2clarity.model.target.ScalarType;

import lombok.NonNull;
import lombok.Value;

/**
 * A function parameter as seen from the body: its Clarity name, possibly suffixed
 * to stay clear of top-level names, and its type.
 */
@Value
class ParameterSymbol {

    @NonNull
    String clarityName;

    @NonNull
    ScalarType type;
}
