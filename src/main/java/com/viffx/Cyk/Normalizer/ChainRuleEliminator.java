package com.viffx.Cyk.Normalizer;

import com.viffx.Cyk.Grammar.Grammar;
import com.viffx.Cyk.Grammar.GrammarRule;
import com.viffx.Cyk.Symbols.NonTerminal;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Removes chain rules {@code A -> B}. Every nonterminal {@code A} receives the
 * non-chain rules of each nonterminal in {@code CHAIN(A)}.
 */
public class ChainRuleEliminator implements GrammarPass {

    @Override
    public Grammar apply(Grammar grammar) {
        Map<NonTerminal, List<GrammarRule>> rulesByLhs = new LinkedHashMap<>();
        for (NonTerminal lhs : grammar.leftHandSides()) {
            rulesByLhs.put(lhs, grammar.rules(lhs));
        }

        Grammar result = new Grammar(grammar.start());
        for (NonTerminal a : rulesByLhs.keySet()) {
            for (NonTerminal b : chain(a, rulesByLhs)) {
                for (GrammarRule rule : rulesByLhs.getOrDefault(b, List.of())) {
                    if (!rule.isUnit()) result.add(a, rule.rhs());
                }
            }
        }
        return result;
    }

    /**
     * Returns {@code CHAIN(a)}: {@code a} and every nonterminal reachable from it
     * through chain rules, in discovery order.
     */
    public static Set<NonTerminal> chain(NonTerminal a, Map<NonTerminal, List<GrammarRule>> rulesByLhs) {
        Set<NonTerminal> visited = new LinkedHashSet<>();
        Deque<NonTerminal> worklist = new ArrayDeque<>();
        visited.add(a);
        worklist.add(a);
        while (!worklist.isEmpty()) {
            NonTerminal current = worklist.poll();
            for (GrammarRule rule : rulesByLhs.getOrDefault(current, List.of())) {
                if (!rule.isUnit()) continue;
                NonTerminal target = (NonTerminal) rule.rhs().get(0);
                if (visited.add(target)) worklist.add(target);
            }
        }
        return visited;
    }
}
