package com.viffx.Cyk.Parser;

import com.viffx.Cyk.Symbols.NonTerminal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * The CYK table for one word. Cell {@code (i, j)} holds the nonterminals that
 * derive the {@code j} characters starting at offset {@code i}, each with the
 * number of the rule that put it there.
 */
public class RecognitionTable {
    private static final String ENTRY_SEPARATOR = " ; ";

    /**
     * A nonterminal in a cell together with the rule that produced it.
     */
    public record Entry(NonTerminal nonTerminal, int rule) {
        @Override
        public String toString() {
            return nonTerminal + ", " + rule;
        }
    }

    private static final class Cell {
        private final Map<Integer, NonTerminal> byRule = new TreeMap<>();
        private final Set<NonTerminal> symbols = new LinkedHashSet<>();
    }

    private final String word;
    private final Cell[][] cells;

    public RecognitionTable(String word) {
        this.word = word;
        int n = word.length();
        cells = new Cell[n][];
        for (int i = 0; i < n; i++) {
            // index 0 is unused, spans run from 1 to n - i
            cells[i] = new Cell[n - i + 1];
            for (int j = 1; j <= n - i; j++) cells[i][j] = new Cell();
        }
    }

    public String word() {
        return word;
    }

    public int length() {
        return word.length();
    }

    /**
     * Records that {@code nonTerminal} derives the span {@code (i, j)} through rule {@code rule}.
     *
     * @return {@code false} if the entry was already present
     */
    public boolean add(int i, int j, NonTerminal nonTerminal, int rule) {
        Cell cell = cell(i, j);
        cell.symbols.add(nonTerminal);
        return cell.byRule.putIfAbsent(rule, nonTerminal) == null;
    }

    public boolean contains(int i, int j, NonTerminal nonTerminal) {
        return cell(i, j).symbols.contains(nonTerminal);
    }

    /**
     * Returns the distinct nonterminals of a cell in the order they were added.
     */
    public Set<NonTerminal> symbols(int i, int j) {
        return Collections.unmodifiableSet(cell(i, j).symbols);
    }

    /**
     * Returns the entries of a cell ordered by rule number.
     */
    public List<Entry> entries(int i, int j) {
        List<Entry> entries = new ArrayList<>();
        cell(i, j).byRule.forEach((rule, nonTerminal) -> entries.add(new Entry(nonTerminal, rule)));
        return entries;
    }

    private Cell cell(int i, int j) {
        if (i < 0 || i >= cells.length || j < 1 || j > cells.length - i) {
            throw new IndexOutOfBoundsException(String.format("Span (%d, %d) out of bounds for word length %d", i, j, cells.length));
        }
        return cells[i][j];
    }

    /**
     * Renders the table with fixed width columns. Rows are labelled with the
     * 1-based offset and its character, columns with the span length:
     * <pre>
     * |        | j=1  | j=2  |
     * | ------ | ---- | ---- |
     * | i=1, b | A, 3 | S, 1 |
     * | i=2, a | S, 2 |      |
     * </pre>
     * An empty word renders as an empty string.
     */
    public String format() {
        int n = word.length();
        if (n == 0) return "";

        String[] labels = new String[n];
        String[][] texts = new String[n][n + 1];
        int[] widths = new int[n + 1];
        for (int i = 0; i < n; i++) {
            labels[i] = "i=" + (i + 1) + ", " + word.charAt(i);
            widths[0] = Math.max(widths[0], labels[i].length());
        }
        for (int j = 1; j <= n; j++) widths[j] = ("j=" + j).length();
        for (int i = 0; i < n; i++) {
            for (int j = 1; j <= n; j++) {
                texts[i][j] = j <= n - i
                        ? entries(i, j).stream().map(Entry::toString).collect(Collectors.joining(ENTRY_SEPARATOR))
                        : "";
                widths[j] = Math.max(widths[j], texts[i][j].length());
            }
        }

        StringBuilder builder = new StringBuilder();
        builder.append("| ").append(leftAlign("", widths[0], ' ')).append(" |");
        for (int j = 1; j <= n; j++) builder.append(' ').append(center("j=" + j, widths[j])).append(" |");
        builder.append('\n');

        builder.append("| ").append(leftAlign("---", widths[0], '-')).append(" |");
        for (int j = 1; j <= n; j++) builder.append(' ').append(leftAlign("---", widths[j], '-')).append(" |");

        for (int i = 0; i < n; i++) {
            builder.append('\n');
            builder.append("| ").append(leftAlign(labels[i], widths[0], ' ')).append(" |");
            for (int j = 1; j <= n; j++) builder.append(' ').append(center(texts[i][j], widths[j])).append(" |");
        }
        return builder.toString();
    }

    private static String leftAlign(String text, int width, char fill) {
        return text + String.valueOf(fill).repeat(Math.max(0, width - text.length()));
    }

    private static String center(String text, int width) {
        int padding = Math.max(0, width - text.length());
        int left = padding / 2;
        return " ".repeat(left) + text + " ".repeat(padding - left);
    }

    @Override
    public String toString() {
        return format();
    }
}
