package com.sol2clarity.convert;

import com.sol2clarity.model.target.Atom;
import com.sol2clarity.model.target.ClarityParameter;
import com.sol2clarity.model.target.ConstantDefinition;
import com.sol2clarity.model.target.DataVarDefinition;
import com.sol2clarity.model.target.GetterDefinition;
import com.sol2clarity.model.target.GetterKind;
import com.sol2clarity.model.target.MapDefinition;
import com.sol2clarity.model.target.MapGet;
import com.sol2clarity.model.target.Ok;
import com.sol2clarity.model.target.OptionalType;
import com.sol2clarity.model.target.VarGet;

import lombok.experimental.UtilityClass;

/**
 * Read-only accessors for public state variables, named {@code get-<name>}.
 */
@UtilityClass
public class GetterSynthesizer {

    public static final String GETTER_PREFIX = "get-";
    public static final String MAP_KEY_PARAMETER = "key";

    public GetterDefinition forDataVar(DataVarDefinition variable) {
        return GetterDefinition.builder()
                .name(GETTER_PREFIX + variable.getName())
                .kind(GetterKind.DATA_VAR)
                .target(variable.getName())
                .returnType(variable.getType())
                .body(new Ok(new VarGet(variable.getName())))
                .build();
    }

    public GetterDefinition forConstant(ConstantDefinition constant) {
        return GetterDefinition.builder()
                .name(GETTER_PREFIX + constant.getName())
                .kind(GetterKind.CONSTANT)
                .target(constant.getName())
                .returnType(constant.getType())
                .body(new Ok(new Atom(constant.getName())))
                .build();
    }

    /**
     * The getter takes the whole key, a tuple for flattened maps, and keeps
     * {@code map-get?}'s optional result.
     *
     * @param keyParameter argument name, normally {@value #MAP_KEY_PARAMETER}
     */
    public GetterDefinition forMap(MapDefinition map, String keyParameter) {
        return GetterDefinition.builder()
                .name(GETTER_PREFIX + map.getName())
                .kind(GetterKind.MAP)
                .target(map.getName())
                .parameter(new ClarityParameter(keyParameter, map.getKeyType()))
                .returnType(new OptionalType(map.getValueType()))
                .body(new Ok(new MapGet(map.getName(), new Atom(keyParameter))))
                .build();
    }
}
