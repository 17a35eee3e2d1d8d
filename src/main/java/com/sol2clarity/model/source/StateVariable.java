package com.sol2clarity.model.source;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A contract-level storage declaration.
 */
@Value
@Builder
public class StateVariable implements ContractMember {

    @NonNull
    String name;

    @NonNull
    TypeRef type;

    @NonNull
    @Builder.Default
    Visibility visibility = Visibility.INTERNAL;

    boolean constant;

    /**
     * Initializer expression, or {@code null} when none was written.
     */
    Expression initialValue;

    int line;

    public boolean isPublic() {
        return visibility == Visibility.PUBLIC;
    }
}
