package com.sol2clarity.parser;

import java.util.List;
import java.util.stream.Collectors;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.misc.IntervalSet;

import com.sol2clarity.exception.SyntaxException;

/**
 * Turns the first lexer or parser error into a {@link SyntaxException}.
 * There is no recovery: a partial tree is never handed to the AST builder.
 */
class FailFastErrorListener extends BaseErrorListener {

    static final FailFastErrorListener INSTANCE = new FailFastErrorListener();

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                            int line, int charPositionInLine, String msg,
                            RecognitionException e) {
        String offendingText = offendingSymbol instanceof Token token ? token.getText() : null;
        throw new SyntaxException(line, charPositionInLine, offendingText, expectedTokens(recognizer, e), msg);
    }

    private List<String> expectedTokens(Recognizer<?, ?> recognizer, RecognitionException e) {
        if (!(recognizer instanceof Parser parser)) {
            return List.of();
        }
        IntervalSet expected = e != null ? e.getExpectedTokens() : parser.getExpectedTokens();
        if (expected == null) {
            return List.of();
        }
        Vocabulary vocabulary = parser.getVocabulary();
        return expected.toList().stream()
                .map(vocabulary::getDisplayName)
                .collect(Collectors.toList());
    }
}
