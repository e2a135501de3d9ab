package com.viffx.Cyk.Normalizer;

import com.viffx.Cyk.Grammar.Grammar;
import com.viffx.Cyk.Grammar.GrammarRule;
import com.viffx.Cyk.Symbols.NonTerminal;
import com.viffx.Cyk.Symbols.Symbol;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Removes epsilon rules while keeping the language, the empty word included.
 * <p>
 * Every rule is replaced by all its variants with any subset of its nullable
 * occurrences dropped. When the start symbol is nullable and also used on a
 * right hand side, a new start {@code S1} with {@code S1 -> S} and {@code S1 -> ε}
 * takes its place; a nullable start used nowhere else keeps a single
 * {@code S -> ε}.
 */
public class EpsilonEliminator implements GrammarPass {
    private static final String START_SUFFIXES = "123456789'";

    // a rule with more nullable occurrences than this would expand to over 2^30 variants
    private static final int MAX_NULLABLE_OCCURRENCES = 30;

    @Override
    public Grammar apply(Grammar grammar) {
        NonTerminal start = grammar.start();
        Set<NonTerminal> nullable = nullable(grammar);

        Grammar result;
        if (start != null && nullable.contains(start) && occursOnRightHandSide(grammar, start)) {
            NonTerminal newStart = newStart(grammar, start);
            result = new Grammar(newStart);
            result.add(newStart, List.of(start));
            result.add(newStart, List.of());
        } else {
            result = new Grammar(start);
            if (start != null && nullable.contains(start)) result.add(start, List.of());
        }

        for (GrammarRule rule : grammar) {
            if (rule.isEpsilon()) continue;

            List<Integer> positions = new ArrayList<>();
            for (int i = 0; i < rule.rhs().size(); i++) {
                if (rule.rhs().get(i) instanceof NonTerminal nonTerminal && nullable.contains(nonTerminal)) positions.add(i);
            }
            if (positions.size() > MAX_NULLABLE_OCCURRENCES) {
                throw new IllegalStateException("Too many nullable symbols in rule: " + rule);
            }

            // a set bit keeps the occurrence, so the unchanged rule comes first
            for (int mask = (1 << positions.size()) - 1; mask >= 0; mask--) {
                List<Symbol> rhs = new ArrayList<>(rule.rhs().size());
                int next = 0;
                for (int i = 0; i < rule.rhs().size(); i++) {
                    if (next < positions.size() && positions.get(next) == i) {
                        boolean keep = (mask & (1 << next)) != 0;
                        next++;
                        if (!keep) continue;
                    }
                    rhs.add(rule.rhs().get(i));
                }
                if (!rhs.isEmpty()) result.add(rule.lhs(), rhs);
            }
        }
        return result;
    }

    /**
     * Computes the nullable nonterminals: the left hand sides of epsilon rules,
     * closed under rules whose right hand side is made only of nullable nonterminals.
     */
    public static Set<NonTerminal> nullable(Grammar grammar) {
        Set<NonTerminal> nullable = new HashSet<>();
        boolean change;
        do {
            change = false;
            for (GrammarRule rule : grammar) {
                if (nullable.contains(rule.lhs())) continue;
                boolean allNullable = true;
                for (Symbol symbol : rule.rhs()) {
                    if (!(symbol instanceof NonTerminal nonTerminal) || !nullable.contains(nonTerminal)) {
                        allNullable = false;
                        break;
                    }
                }
                if (allNullable) change |= nullable.add(rule.lhs());
            }
        } while (change);
        return nullable;
    }

    private static boolean occursOnRightHandSide(Grammar grammar, NonTerminal nonTerminal) {
        for (GrammarRule rule : grammar) {
            if (rule.rhs().contains(nonTerminal)) return true;
        }
        return false;
    }

    private static NonTerminal newStart(Grammar grammar, NonTerminal start) {
        NameAllocator names = new NameAllocator(grammar.nonTerminals());
        for (char suffix : START_SUFFIXES.toCharArray()) {
            NonTerminal candidate = names.claim(start.value() + suffix);
            if (candidate != null) return candidate;
        }
        return names.fresh();
    }
}
