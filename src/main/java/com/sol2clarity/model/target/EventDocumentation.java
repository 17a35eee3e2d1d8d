package com.sol2clarity.model.target;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Comment-only entry describing an event. Clarity has no event declarations;
 * emits become {@code print} calls whose payload follows these fields.
 */
@Value
@Builder
public class EventDocumentation implements ClarityDefinition {

    /**
     * Event name as declared in Solidity.
     */
    @NonNull
    String eventName;

    @NonNull
    @Singular
    List<EventField> fields;

    @Override
    public String getName() {
        return null;
    }
}
