package com.viffx.Cyk.Parser;

import com.viffx.Cyk.Grammar.Grammar;
import com.viffx.Cyk.Symbols.NonTerminal;
import org.testng.annotations.Test;

import java.util.List;

import static org.testng.AssertJUnit.assertEquals;
import static org.testng.AssertJUnit.assertFalse;
import static org.testng.AssertJUnit.assertTrue;

public class RecognitionTableTest {
    private static final NonTerminal A = new NonTerminal("A");
    private static final NonTerminal S = new NonTerminal("S");

    @Test
    public void cellsKeepEntriesByRuleNumber() {
        RecognitionTable table = new RecognitionTable("ab");
        assertTrue(table.add(0, 1, S, 5));
        assertTrue(table.add(0, 1, A, 3));
        assertFalse(table.add(0, 1, A, 3));
        assertTrue(table.add(0, 1, A, 4));

        assertEquals(List.of(new RecognitionTable.Entry(A, 3), new RecognitionTable.Entry(A, 4), new RecognitionTable.Entry(S, 5)),
                table.entries(0, 1));
        assertEquals(List.of(S, A), List.copyOf(table.symbols(0, 1)));
        assertTrue(table.contains(0, 1, A));
        assertFalse(table.contains(1, 1, A));
        assertEquals(2, table.length());
    }

    @Test(expectedExceptions = IndexOutOfBoundsException.class)
    public void spanPastTheEnd() {
        new RecognitionTable("ab").symbols(1, 2);
    }

    @Test(expectedExceptions = IndexOutOfBoundsException.class)
    public void emptySpan() {
        new RecognitionTable("ab").symbols(0, 0);
    }

    @Test
    public void formatsAsAlignedGrid() {
        CYKParser parser = new CYKParser(Grammar.parse("S -> A S\nS -> a\nA -> b"));
        parser.parse("ba");
        String expected = """
                |        | j=1  | j=2  |
                | ------ | ---- | ---- |
                | i=1, b | A, 3 | S, 1 |
                | i=2, a | S, 2 |      |""";
        assertEquals(expected, parser.table().format());
    }

    @Test
    public void cellsListEveryEntry() {
        CYKParser parser = new CYKParser(Grammar.parse("S -> A S\nS -> ε\nA -> a"));
        parser.parse("aa");
        assertEquals("S1, 3 ; S, 5 ; A, 6", String.join(" ; ",
                parser.table().entries(0, 1).stream().map(RecognitionTable.Entry::toString).toList()));
        assertTrue(parser.table().format().contains("| S1, 3 ; S, 5 ; A, 6 |"));
    }

    @Test
    public void emptyWordFormatsAsEmptyString() {
        assertEquals("", new RecognitionTable("").format());
    }
}
