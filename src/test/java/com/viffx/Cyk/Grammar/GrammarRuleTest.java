package com.viffx.Cyk.Grammar;

import com.viffx.Cyk.Symbols.NonTerminal;
import com.viffx.Cyk.Symbols.Terminal;
import org.testng.annotations.Test;

import java.util.List;

import static org.testng.AssertJUnit.assertEquals;
import static org.testng.AssertJUnit.assertFalse;
import static org.testng.AssertJUnit.assertNull;
import static org.testng.AssertJUnit.assertTrue;

public class GrammarRuleTest {

    @Test
    public void numberDoesNotTakePartInEquality() {
        GrammarRule rule = RuleDecoder.decode("S -> a");
        GrammarRule numbered = rule.withNumber(7);
        assertEquals(rule, numbered);
        assertEquals(rule.hashCode(), numbered.hashCode());
        assertEquals(Integer.valueOf(7), numbered.number());
        assertNull(rule.number());
    }

    @Test
    public void classifiesRuleShapes() {
        assertTrue(RuleDecoder.decode("S -> A").isUnit());
        assertTrue(RuleDecoder.decode("S -> a").isTerminal());
        assertTrue(RuleDecoder.decode("S -> A B").isBinary());
        assertTrue(RuleDecoder.decode("S -> ε").isEpsilon());
        assertFalse(RuleDecoder.decode("S -> A b").isBinary());
        assertFalse(RuleDecoder.decode("S -> a").isUnit());
    }

    @Test(expectedExceptions = UnsupportedOperationException.class)
    public void rightHandSideIsImmutable() {
        GrammarRule rule = new GrammarRule(new NonTerminal("S"), new java.util.ArrayList<>(List.of(new Terminal('a'))));
        rule.rhs().add(new Terminal('b'));
    }
}
