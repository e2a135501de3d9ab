package com.viffx.Cyk.Normalizer;

import com.viffx.Cyk.Grammar.Grammar;
import com.viffx.Cyk.Grammar.GrammarRule;
import com.viffx.Cyk.Symbols.NonTerminal;
import org.testng.annotations.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.testng.AssertJUnit.assertEquals;

public class ChainRuleEliminatorTest {
    private final ChainRuleEliminator eliminator = new ChainRuleEliminator();

    @Test
    public void replacesChainsWithTheRulesAtTheirEnd() {
        Grammar grammar = Grammar.parse("S -> A\nA -> B\nB -> b\nA -> a a");
        assertEquals("1. S -> a a\n2. S -> b\n3. A -> a a\n4. A -> b\n5. B -> b", eliminator.apply(grammar).toString());
    }

    @Test
    public void chainIsListedInDiscoveryOrder() {
        Grammar grammar = Grammar.parse("S -> A\nS -> C\nA -> B\nB -> b\nC -> c");
        Map<NonTerminal, List<GrammarRule>> rulesByLhs = new LinkedHashMap<>();
        for (NonTerminal lhs : grammar.leftHandSides()) rulesByLhs.put(lhs, grammar.rules(lhs));

        List<NonTerminal> chain = List.copyOf(ChainRuleEliminator.chain(new NonTerminal("S"), rulesByLhs));
        assertEquals(List.of(new NonTerminal("S"), new NonTerminal("A"), new NonTerminal("C"), new NonTerminal("B")), chain);
    }

    @Test
    public void cyclesTerminate() {
        Grammar grammar = Grammar.parse("S -> A\nA -> S\nS -> a");
        assertEquals("1. S -> a\n2. A -> a", eliminator.apply(grammar).toString());
    }

    @Test
    public void keepsEpsilonAndStart() {
        Grammar grammar = new Grammar(new NonTerminal("S1"));
        grammar.addRule("S1 -> S");
        grammar.addRule("S1 -> ε");
        grammar.addRule("S -> A S");
        grammar.addRule("S -> A");
        grammar.addRule("A -> a");

        Grammar result = eliminator.apply(grammar);
        assertEquals("1. S1 -> ε\n2. S1 -> A S\n3. S1 -> a\n4. S -> A S\n5. S -> a\n6. A -> a", result.toString());
        assertEquals(new NonTerminal("S1"), result.start());
    }
}
