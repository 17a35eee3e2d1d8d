package com.sol2clarity.model.output;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A generated Clarity unit (file name + contents), not yet written anywhere.
 *
 * Pure structure only.
 */
@Value
@Builder(toBuilder = true)
public class GeneratedFile {

    /**
     * Solidity contract the unit was generated from.
     */
    @NonNull
    String contractName;

    /**
     * File name relative to the output directory, e.g. {@code token-a.clar}.
     */
    @NonNull
    String fileName;

    @NonNull
    String contents;
}
