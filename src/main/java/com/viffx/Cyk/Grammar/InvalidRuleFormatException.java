package com.viffx.Cyk.Grammar;

/**
 * The rule text does not split into exactly one left and one right part around {@code ->}.
 */
public class InvalidRuleFormatException extends GrammarException {
    public InvalidRuleFormatException(String message) {
        super(message);
    }
}
