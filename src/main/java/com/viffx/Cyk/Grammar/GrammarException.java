package com.viffx.Cyk.Grammar;

/**
 * Raised while building a {@link Grammar} from rule text. A grammar is never
 * modified by a call that ends in this exception.
 */
public class GrammarException extends IllegalArgumentException {
    public GrammarException(String message) {
        super(message);
    }

    public GrammarException(String message, Throwable cause) {
        super(message, cause);
    }
}
