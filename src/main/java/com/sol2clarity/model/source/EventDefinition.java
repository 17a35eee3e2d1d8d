package com.sol2clarity.model.source;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class EventDefinition implements ContractMember {

    @NonNull
    String name;

    @NonNull
    @Singular
    List<EventParameter> parameters;

    int line;
}
