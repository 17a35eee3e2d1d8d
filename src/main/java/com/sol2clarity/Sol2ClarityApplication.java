package com.sol2clarity;

import com.sol2clarity.cli.TranspileCommand;

import picocli.CommandLine;

/**
 * Main entry point for sol2clarity.
 * Translates the contracts of one Solidity file into Clarity units, one file per contract.
 */
public class Sol2ClarityApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TranspileCommand()).execute(args);
        System.exit(exitCode);
    }
}
