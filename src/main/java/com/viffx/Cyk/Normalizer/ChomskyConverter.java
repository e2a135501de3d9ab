package com.viffx.Cyk.Normalizer;

import com.viffx.Cyk.Grammar.Grammar;
import com.viffx.Cyk.Grammar.GrammarRule;
import com.viffx.Cyk.Symbols.NonTerminal;
import com.viffx.Cyk.Symbols.Symbol;
import com.viffx.Cyk.Symbols.Terminal;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Brings a grammar without chain rules and without epsilon rules (apart from
 * {@code S -> ε} for a start symbol used on no right hand side) into Chomsky
 * Normal Form.
 * <p>
 * Rules of length one are kept. In longer rules each terminal is replaced by a
 * nonterminal dedicated to it, then the right hand side is folded from the
 * right, two symbols at a time, into helper nonterminals until two remain:
 * <pre>
 *   A -> B c D E    becomes    A -> B X3,  X3 -> X1 X2,  X2 -> D E,  X1 -> c
 * </pre>
 * Helper nonterminals are shared: one per terminal and one per symbol pair.
 * The rewritten rule is emitted before the helper rules it caused, and the
 * result is numbered {@code 1..N}.
 */
public class ChomskyConverter implements GrammarPass {

    @Override
    public Grammar apply(Grammar grammar) {
        NameAllocator names = new NameAllocator(grammar.nonTerminals());
        Map<Terminal, NonTerminal> terminalNames = new HashMap<>();
        Map<List<Symbol>, NonTerminal> pairNames = new HashMap<>();

        Grammar result = new Grammar(grammar.start());
        for (GrammarRule rule : grammar) {
            if (rule.rhs().size() < 2) {
                result.add(rule.lhs(), rule.rhs());
                continue;
            }

            List<GrammarRule> helpers = new ArrayList<>();

            // terminal isolation
            List<Symbol> rhs = new ArrayList<>(rule.rhs().size());
            for (Symbol symbol : rule.rhs()) {
                if (symbol instanceof Terminal terminal) {
                    rhs.add(terminalNames.computeIfAbsent(terminal, t -> {
                        NonTerminal name = names.fresh();
                        helpers.add(new GrammarRule(name, List.of(t)));
                        return name;
                    }));
                } else {
                    rhs.add(symbol);
                }
            }

            // binarization, rightmost pair first
            List<GrammarRule> pairs = new ArrayList<>();
            while (rhs.size() > 2) {
                List<Symbol> pair = List.copyOf(rhs.subList(rhs.size() - 2, rhs.size()));
                NonTerminal name = pairNames.computeIfAbsent(pair, p -> {
                    NonTerminal fresh = names.fresh();
                    pairs.add(new GrammarRule(fresh, p));
                    return fresh;
                });
                rhs.subList(rhs.size() - 2, rhs.size()).clear();
                rhs.add(name);
            }

            result.add(rule.lhs(), rhs);
            // innermost pairs were created first, list the outermost first
            for (int i = pairs.size() - 1; i >= 0; i--) result.add(pairs.get(i));
            helpers.forEach(result::add);
        }
        return result.renumbered();
    }
}
