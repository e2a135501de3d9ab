package com.viffx.Cyk.Symbols;

/**
 * A grammar symbol. Epsilon is not a symbol; it is an empty right hand side.
 */
public sealed interface Symbol permits Terminal, NonTerminal {
    String value();
}
