package com.sol2clarity.model.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code mapping(K => V)} where {@code V} may itself be a mapping.
 */
@Value
public class MappingType implements TypeRef {

    @NonNull
    BasicType keyType;

    @NonNull
    TypeRef valueType;

    @Override
    public boolean isMapping() {
        return true;
    }

    @Override
    public String describe() {
        return "mapping(" + keyType.describe() + " => " + valueType.describe() + ")";
    }

    /**
     * Key types along the nesting chain, outermost first.
     */
    public List<BasicType> getKeyChain() {
        List<BasicType> keys = new ArrayList<>();
        TypeRef current = this;
        while (current instanceof MappingType mapping) {
            keys.add(mapping.getKeyType());
            current = mapping.getValueType();
        }
        return Collections.unmodifiableList(keys);
    }

    /**
     * The first non-mapping value type reached by following the chain.
     */
    public BasicType getTerminalValueType() {
        TypeRef current = valueType;
        while (current instanceof MappingType mapping) {
            current = mapping.getValueType();
        }
        return (BasicType) current;
    }

    public int getDepth() {
        return getKeyChain().size();
    }
}
