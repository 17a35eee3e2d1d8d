package com.sol2clarity.pipeline;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sol2clarity.config.TranspilerConfig;
import com.sol2clarity.convert.ContractConverter;
import com.sol2clarity.exception.UnsupportedConstructException;
import com.sol2clarity.generate.ClarityGenerator;
import com.sol2clarity.model.output.GeneratedFile;
import com.sol2clarity.model.source.ContractDefinition;
import com.sol2clarity.model.source.SourceUnit;
import com.sol2clarity.model.target.ClarityContract;
import com.sol2clarity.model.target.GetterDefinition;
import com.sol2clarity.model.target.MapDefinition;
import com.sol2clarity.parser.SoliditySourceParser;
import com.sol2clarity.parser.SourceAstBuilder;
import com.sol2clarity.parser.grammar.SolidityParser;

/**
 * Parser, AST builder, converter and generator wired into one run over a source file.
 *
 * <p>Syntax and structural errors abort the whole file. An unsupported construct
 * aborts the file too, unless {@link TranspilerConfig#isContinueOnError()} is set,
 * in which case that contract is reported and skipped. Outputs are always in
 * source order, also when contracts are converted in parallel.
 */
public class TranspilerPipeline {

    private static final Logger log = LoggerFactory.getLogger(TranspilerPipeline.class);

    private final TranspilerConfig config;
    private final SoliditySourceParser parser;
    private final ContractConverter converter;
    private final ClarityGenerator generator;

    public TranspilerPipeline(TranspilerConfig config) {
        this.config = config;
        this.parser = new SoliditySourceParser();
        this.converter = new ContractConverter(config);
        this.generator = new ClarityGenerator(config);
    }

    /**
     * @throws com.sol2clarity.exception.SyntaxException on malformed input
     * @throws com.sol2clarity.exception.StructuralException on a parse tree the builder cannot read
     * @throws UnsupportedConstructException for the first failing contract when not continuing on error
     */
    public TranspileResult transpile(String source) {
        log.info("Step 1: Parsing Solidity source...");
        SolidityParser.SourceUnitContext tree = parser.parse(source);

        log.info("Step 2: Building syntax tree...");
        SourceUnit unit = new SourceAstBuilder().build(tree);
        List<ContractDefinition> contracts = unit.getContracts();

        log.info("Step 3: Converting {} contract(s){}...", contracts.size(), config.isParallel() ? " in parallel" : "");
        Stream<ContractDefinition> stream = config.isParallel() ? contracts.parallelStream() : contracts.stream();
        List<ContractOutcome> outcomes = stream.map(this::convertAndGenerate).toList();

        log.info("Step 4: Collecting generated units...");
        TranspileResult.TranspileResultBuilder result = TranspileResult.builder()
                .contractsParsed(contracts.size());
        Map<String, String> fileOwners = new HashMap<>();
        int converted = 0;
        int getters = 0;
        int flattened = 0;
        int definitions = 0;

        for (ContractOutcome outcome : outcomes) {
            if (outcome.error != null) {
                if (!config.isContinueOnError()) {
                    throw outcome.error;
                }
                log.warn("Skipping contract {}: {}", outcome.contractName, outcome.error.getMessage());
                result.failure(new ContractFailure(outcome.contractName, outcome.error.getConstruct(),
                        outcome.error.getMessage()));
                continue;
            }

            String previous = fileOwners.putIfAbsent(outcome.file.getFileName(), outcome.contractName);
            if (previous != null) {
                throw new UnsupportedConstructException("unit name collision",
                        "contracts " + previous + " and " + outcome.contractName
                                + " both map to " + outcome.file.getFileName());
            }

            ClarityContract contract = outcome.contract;
            converted++;
            getters += contract.definitionsOfType(GetterDefinition.class).size();
            flattened += (int) contract.definitionsOfType(MapDefinition.class).stream()
                    .filter(MapDefinition::isFlattened)
                    .count();
            definitions += contract.getDefinitions().size();
            result.output(outcome.file);
        }

        TranspileResult built = result
                .contractsConverted(converted)
                .gettersSynthesized(getters)
                .mapsFlattened(flattened)
                .definitionsGenerated(definitions)
                .build();
        built.setSuccess(built.getFailures().isEmpty());
        if (!built.isSuccess()) {
            built.setErrorMessage(built.getFailures().size() + " contract(s) could not be converted");
        }
        return built;
    }

    private ContractOutcome convertAndGenerate(ContractDefinition definition) {
        try {
            ClarityContract contract = converter.convert(definition);
            GeneratedFile file = generator.generate(contract);
            log.debug("Generated {} for contract {}", file.getFileName(), definition.getName());
            return new ContractOutcome(definition.getName(), contract, file, null);
        } catch (UnsupportedConstructException e) {
            return new ContractOutcome(definition.getName(), null, null, e);
        }
    }

    /**
     * Either a converted contract with its file, or the error that stopped it.
     */
    private static final class ContractOutcome {

        private final String contractName;
        private final ClarityContract contract;
        private final GeneratedFile file;
        private final UnsupportedConstructException error;

        private ContractOutcome(String contractName, ClarityContract contract, GeneratedFile file,
                                UnsupportedConstructException error) {
            this.contractName = contractName;
            this.contract = contract;
            this.file = file;
            this.error = error;
        }
    }
}
