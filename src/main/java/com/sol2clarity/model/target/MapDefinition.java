package com.sol2clarity.model.target;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * {@code (define-map name key-type value-type)}.
 *
 * <p>The key type is a {@link ScalarType} for a single-level mapping and a
 * {@link TupleType} with one field per level for a flattened nested mapping.
 */
@Value
@Builder
public class MapDefinition implements ClarityDefinition {

    @NonNull
    String name;

    @NonNull
    ClarityType keyType;

    @NonNull
    ScalarType valueType;

    /**
     * Number of key dimensions in the source mapping.
     */
    public int getDepth() {
        return keyType instanceof TupleType tuple ? tuple.getFields().size() : 1;
    }

    public boolean isFlattened() {
        return keyType instanceof TupleType;
    }
}
