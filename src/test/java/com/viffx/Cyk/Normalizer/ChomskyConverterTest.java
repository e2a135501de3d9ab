package com.viffx.Cyk.Normalizer;

import com.viffx.Cyk.Grammar.Grammar;
import org.testng.annotations.Test;

import static org.testng.AssertJUnit.assertEquals;

public class ChomskyConverterTest {
    private final ChomskyConverter converter = new ChomskyConverter();

    @Test
    public void isolatesTerminalsAndBinarizes() {
        Grammar result = converter.apply(Grammar.parse("S -> a S a\nS -> b"));
        assertEquals("1. S -> X1 X2\n2. X2 -> S X1\n3. X1 -> a\n4. S -> b", result.toString());
    }

    @Test
    public void foldsFromTheRight() {
        Grammar result = converter.apply(Grammar.parse("A -> B c D E"));
        assertEquals("1. A -> B X3\n2. X3 -> X1 X2\n3. X2 -> D E\n4. X1 -> c", result.toString());
    }

    @Test
    public void helpersAreShared() {
        Grammar result = converter.apply(Grammar.parse("S -> a a\nT -> a a"));
        assertEquals("1. S -> X1 X1\n2. X1 -> a\n3. T -> X1 X1", result.toString());

        result = converter.apply(Grammar.parse("S -> A B C\nT -> D B C"));
        assertEquals("1. S -> A X1\n2. X1 -> B C\n3. T -> D X1", result.toString());
    }

    @Test
    public void helperNamesAvoidExistingNonTerminals() {
        Grammar result = converter.apply(Grammar.parse("S -> X1 b\nX1 -> a"));
        assertEquals("1. S -> X1 X2\n2. X2 -> b\n3. X1 -> a", result.toString());
    }

    @Test
    public void shortRulesAreKept() {
        Grammar result = converter.apply(Grammar.parse("S -> ε\nS -> a b\nS -> c"));
        assertEquals("1. S -> ε\n2. S -> X1 X2\n3. X1 -> a\n4. X2 -> b\n5. S -> c", result.toString());
        Normalizer.verifyChomskyForm(result);
    }
}
