package com.sol2clarity.parser;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sol2clarity.parser.grammar.SolidityLexer;
import com.sol2clarity.parser.grammar.SolidityParser;

/**
 * Thin wrapper around the generated ANTLR lexer and parser.
 * This is the only class that instantiates them.
 *
 * Stateless; safe to share across threads because every call builds its own
 * lexer, token stream and parser.
 */
public class SoliditySourceParser {

    private static final Logger log = LoggerFactory.getLogger(SoliditySourceParser.class);

    /**
     * Parses a whole source file.
     *
     * @param source Solidity source text
     * @return the parse tree rooted at {@code sourceUnit}
     * @throws com.sol2clarity.exception.SyntaxException on the first lexical or syntactic error
     */
    public SolidityParser.SourceUnitContext parse(String source) {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        log.debug("Parsing {} characters of Solidity source", source.length());

        CharStream input = CharStreams.fromString(source);
        SolidityLexer lexer = new SolidityLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(FailFastErrorListener.INSTANCE);

        SolidityParser parser = new SolidityParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(FailFastErrorListener.INSTANCE);

        SolidityParser.SourceUnitContext tree = parser.sourceUnit();
        log.debug("Parsed {} contract definition(s)", tree.contractDefinition().size());
        return tree;
    }
}
