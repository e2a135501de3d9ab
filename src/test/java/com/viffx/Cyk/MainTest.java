package com.viffx.Cyk;

import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.testng.AssertJUnit.assertEquals;
import static org.testng.AssertJUnit.assertFalse;
import static org.testng.AssertJUnit.assertTrue;

public class MainTest {
    private Path grammarFile;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeMethod
    public void setUp() throws IOException {
        grammarFile = Files.createTempFile("grammar", ".txt");
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    @AfterMethod
    public void tearDown() throws IOException {
        Files.deleteIfExists(grammarFile);
    }

    private int run(String stdin, String... args) throws IOException {
        return Main.run(args,
                new BufferedReader(new StringReader(stdin)),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private void writeGrammar(String text) throws IOException {
        Files.writeString(grammarFile, text, StandardCharsets.UTF_8);
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void recognizesWordsFromArguments() throws IOException {
        writeGrammar("S -> A S\nS -> a\nA -> b\n");
        assertEquals(0, run("", "-g", grammarFile.toString(), "ba", "ab"));

        String output = out();
        assertTrue(output, output.contains("Input grammar:\n1. S -> A S\n2. S -> a\n3. A -> b"));
        assertTrue(output, output.contains("Grammar in Chomsky Normal Form (start S):"));
        assertTrue(output, output.contains("Word: 'ba'\nTRUE: 1,3,2"));
        assertTrue(output, output.contains("Word: 'ab'\nFALSE"));
        assertFalse(output, output.contains("| i=1"));
        assertEquals("", err());
    }

    @Test
    public void printsTablesOnRequest() throws IOException {
        writeGrammar("S -> A S\nS -> a\nA -> b\n");
        assertEquals(0, run("", "-t", "-g", grammarFile.toString(), "ba"));
        assertTrue(out(), out().contains("| i=1, b | A, 3 | S, 1 |"));
    }

    @Test
    public void verboseShowsEveryStage() throws IOException {
        writeGrammar("S -> A S\nS -> ε\nA -> a\n");
        assertEquals(0, run("", "--verbose", "--grammar", grammarFile.toString(), "aa"));
        String output = out();
        assertTrue(output, output.contains("After stage 'epsilon-free' (start S1):"));
        assertTrue(output, output.contains("After stage 'cleaned' (start S1):"));
        assertTrue(output, output.contains("TRUE: 2,6,5"));
    }

    @Test
    public void readsWordsFromStandardInputUntilABlankLine() throws IOException {
        writeGrammar("S -> A S\nS -> a\nA -> b\n");
        assertEquals(0, run("ba\n  ab \n\nbba\n", "-g", grammarFile.toString()));
        String output = out();
        assertTrue(output, output.contains("Word: 'ba'"));
        assertTrue(output, output.contains("Word: 'ab'"));
        assertFalse(output, output.contains("Word: 'bba'"));
    }

    @Test
    public void reportsBadLinesAndKeepsGoing() throws IOException {
        writeGrammar("S -> a\ns -> b\nS -> b\n");
        assertEquals(0, run("", "-g", grammarFile.toString(), "b"));
        assertTrue(err(), err().startsWith("Error: line 2: "));
        assertTrue(out(), out().contains("Word: 'b'\nTRUE: 2"));
    }

    @Test
    public void emptyGrammarFails() throws IOException {
        writeGrammar("\nS -> a\n");
        assertEquals(1, run("", "-g", grammarFile.toString(), "a"));
        assertTrue(err(), err().contains("no rules"));
    }

    @Test
    public void missingGrammarFileFails() throws IOException {
        assertEquals(1, run("", "-g", grammarFile.resolveSibling("missing-grammar.txt").toString(), "a"));
        assertTrue(err(), err().contains("cannot read grammar file"));
    }

    @Test
    public void grammarOptionIsRequired() throws IOException {
        assertEquals(1, run("", "ab"));
        assertTrue(err(), err().contains("Usage: cyk"));
    }

    @Test
    public void helpExitsCleanly() throws IOException {
        assertEquals(0, run("", "-h"));
        assertTrue(out(), out().contains("Usage: cyk"));
        assertTrue(out(), out().contains("grammar"));
    }
}
