package com.sol2clarity.model.source;

import java.util.List;
import java.util.stream.Collectors;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A contract with its declarations kept in the order they were written.
 */
@Value
@Builder
public class ContractDefinition implements SourceNode {

    @NonNull
    String name;

    /**
     * Names listed after {@code is}. Always empty for supported contracts.
     */
    @NonNull
    @Singular
    List<String> baseContracts;

    @NonNull
    @Singular
    List<ContractMember> members;

    int line;

    public List<StateVariable> getStateVariables() {
        return membersOfType(StateVariable.class);
    }

    public List<FunctionDefinition> getFunctions() {
        return membersOfType(FunctionDefinition.class);
    }

    public List<EventDefinition> getEvents() {
        return membersOfType(EventDefinition.class);
    }

    private <T extends ContractMember> List<T> membersOfType(Class<T> type) {
        return members.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }
}
