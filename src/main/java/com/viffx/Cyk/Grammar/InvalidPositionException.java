package com.viffx.Cyk.Grammar;

public class InvalidPositionException extends GrammarException {
    public InvalidPositionException(int position) {
        super("Rule position must be 1 or greater, got: " + position);
    }
}
