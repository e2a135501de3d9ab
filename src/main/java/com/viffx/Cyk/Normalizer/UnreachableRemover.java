package com.viffx.Cyk.Normalizer;

import com.viffx.Cyk.Grammar.Grammar;
import com.viffx.Cyk.Grammar.GrammarRule;
import com.viffx.Cyk.Symbols.NonTerminal;
import com.viffx.Cyk.Symbols.Symbol;

import java.util.HashSet;
import java.util.Set;

/**
 * Removes every rule whose left hand side cannot be reached from the start symbol.
 */
public class UnreachableRemover implements GrammarPass {

    @Override
    public Grammar apply(Grammar grammar) {
        NonTerminal start = grammar.start();
        Grammar result = new Grammar(start);
        if (start == null) return result;

        Set<NonTerminal> reachable = reachable(grammar, start);
        for (GrammarRule rule : grammar) {
            if (reachable.contains(rule.lhs())) result.add(rule);
        }
        return result;
    }

    /**
     * Computes the nonterminals reachable from {@code start} by fixed point iteration.
     */
    public static Set<NonTerminal> reachable(Grammar grammar, NonTerminal start) {
        Set<NonTerminal> reachable = new HashSet<>();
        reachable.add(start);
        boolean change;
        do {
            change = false;
            for (GrammarRule rule : grammar) {
                if (!reachable.contains(rule.lhs())) continue;
                for (Symbol symbol : rule.rhs()) {
                    if (symbol instanceof NonTerminal nonTerminal) change |= reachable.add(nonTerminal);
                }
            }
        } while (change);
        return reachable;
    }
}
