package com.viffx.Cyk.Normalizer;

import com.viffx.Cyk.Grammar.Grammar;

/**
 * One step of the normalization pipeline. A pass never modifies its input and
 * returns a grammar whose start symbol is set explicitly.
 */
@FunctionalInterface
public interface GrammarPass {
    Grammar apply(Grammar grammar);
}
