package com.viffx.Cyk.Normalizer;

import com.viffx.Cyk.Grammar.Grammar;
import com.viffx.Cyk.Grammar.GrammarRule;
import com.viffx.Cyk.Symbols.NonTerminal;
import com.viffx.Cyk.Symbols.Symbol;

import java.util.HashSet;
import java.util.Set;

/**
 * Removes every rule that mentions a nonterminal unable to derive a string of terminals.
 */
public class NonProductiveRemover implements GrammarPass {

    @Override
    public Grammar apply(Grammar grammar) {
        Set<NonTerminal> productive = productive(grammar);

        Grammar result = new Grammar(grammar.start());
        for (GrammarRule rule : grammar) {
            if (productive.contains(rule.lhs()) && allProductive(rule, productive)) {
                result.add(rule);
            }
        }
        return result;
    }

    /**
     * Computes the productive nonterminals by fixed point iteration. A rule makes
     * its left hand side productive once every nonterminal on its right hand side
     * is productive; terminals always are.
     */
    public static Set<NonTerminal> productive(Grammar grammar) {
        Set<NonTerminal> productive = new HashSet<>();
        boolean change;
        do {
            change = false;
            for (GrammarRule rule : grammar) {
                if (productive.contains(rule.lhs())) continue;
                if (allProductive(rule, productive)) {
                    change |= productive.add(rule.lhs());
                }
            }
        } while (change);
        return productive;
    }

    private static boolean allProductive(GrammarRule rule, Set<NonTerminal> productive) {
        for (Symbol symbol : rule.rhs()) {
            if (symbol instanceof NonTerminal nonTerminal && !productive.contains(nonTerminal)) return false;
        }
        return true;
    }
}
