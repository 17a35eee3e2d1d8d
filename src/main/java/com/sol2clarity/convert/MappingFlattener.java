package com.sol2clarity.convert;

import java.util.ArrayList;
import java.util.List;

import com.sol2clarity.model.source.BasicType;
import com.sol2clarity.model.source.MappingType;
import com.sol2clarity.model.target.ClarityType;
import com.sol2clarity.model.target.MapDefinition;
import com.sol2clarity.model.target.TupleField;
import com.sol2clarity.model.target.TupleType;

import lombok.experimental.UtilityClass;

/**
 * Collapses {@code mapping(K1 => mapping(K2 => ... V))} into one map keyed by
 * a tuple {@code {f1: K1, f2: K2, ...}} and valued by {@code V}.
 */
@UtilityClass
public class MappingFlattener {

    /**
     * @param clarityName kebab-cased map name
     * @param fieldNames one name per key level; ignored for single-level mappings
     */
    public MapDefinition flatten(String clarityName, MappingType mapping, List<String> fieldNames,
                                 int stringAsciiLength) {
        List<BasicType> keyChain = mapping.getKeyChain();
        ClarityType keyType;
        if (keyChain.size() == 1) {
            keyType = TypeMapper.toClarityType(keyChain.get(0), stringAsciiLength);
        } else {
            if (fieldNames == null || fieldNames.size() != keyChain.size()) {
                throw new IllegalArgumentException("Expected " + keyChain.size() + " key field names for "
                        + clarityName + " but got " + fieldNames);
            }
            List<TupleField> fields = new ArrayList<>();
            for (int i = 0; i < keyChain.size(); i++) {
                fields.add(new TupleField(fieldNames.get(i),
                        TypeMapper.toClarityType(keyChain.get(i), stringAsciiLength)));
            }
            keyType = new TupleType(List.copyOf(fields));
        }

        return MapDefinition.builder()
                .name(clarityName)
                .keyType(keyType)
                .valueType(TypeMapper.toClarityType(mapping.getTerminalValueType(), stringAsciiLength))
                .build();
    }
}
