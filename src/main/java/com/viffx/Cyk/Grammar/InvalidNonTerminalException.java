package com.viffx.Cyk.Grammar;

/**
 * A nonterminal name breaks the naming rules: it must start with an uppercase
 * letter and be at most three characters long.
 */
public class InvalidNonTerminalException extends GrammarException {
    public InvalidNonTerminalException(String message) {
        super(message);
    }
}
