package com.sol2clarity.pipeline;

import java.util.List;

import com.sol2clarity.model.output.GeneratedFile;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Result of transpiling one source file.
 */
@Data
@Builder
public class TranspileResult {
    private boolean success;
    private String errorMessage;

    @Singular
    private List<GeneratedFile> outputs;

    @Singular
    private List<ContractFailure> failures;

    private int contractsParsed;
    private int contractsConverted;
    private int gettersSynthesized;
    private int mapsFlattened;
    private int definitionsGenerated;

    public static TranspileResult failure(String errorMessage) {
        return TranspileResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
