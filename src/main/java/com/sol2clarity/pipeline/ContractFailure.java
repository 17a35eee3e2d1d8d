package com.sol2clarity.pipeline;

import lombok.NonNull;
import lombok.Value;

/**
 * A contract skipped because it uses a construct without a Clarity lowering.
 */
@Value
public class ContractFailure {

    @NonNull
    String contractName;

    @NonNull
    String construct;

    @NonNull
    String message;
}
