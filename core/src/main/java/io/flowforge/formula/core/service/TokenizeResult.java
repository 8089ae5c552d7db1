package io.flowforge.formula.core.service;

import io.flowforge.formula.core.parser.ParseError;
import java.util.List;

/**
 * Highlighting tokens of a formula, or the lexical error that stopped tokenizing.
 *
 * @param tokens tokens without the end marker; empty on failure
 * @param error  the lexical error, or {@code null}
 */
public record TokenizeResult(List<HighlightToken> tokens, ParseError error) {

    public TokenizeResult {
        tokens = List.copyOf(tokens);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
