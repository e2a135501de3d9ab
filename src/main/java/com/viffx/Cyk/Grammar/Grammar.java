package com.viffx.Cyk.Grammar;

import com.viffx.Cyk.Symbols.NonTerminal;
import com.viffx.Cyk.Symbols.Symbol;
import com.viffx.Cyk.Symbols.Terminal;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Stream;

/**
 * An ordered, deduplicated set of {@link GrammarRule}s.
 * <p>
 * Rules are identified structurally by {@code (lhs, rhs)}; adding a rule that is
 * already present does nothing. Iteration, {@link #get(int)} and {@link #size()}
 * all work over the ordered view: rules sorted by their number.
 * <p>
 * Rule objects are never modified. Positional insertion replaces every shifted
 * rule with a renumbered copy.
 */
public class Grammar implements Iterable<GrammarRule> {
    // ====== INSTANCE FIELDS ====== //
    private final NonTerminal start;
    private List<GrammarRule> rules = new ArrayList<>();
    private final Set<GrammarRule> index = new HashSet<>();
    private int nextNumber = 1;

    // ====== CONSTRUCTORS ====== //
    public Grammar() {
        this(null);
    }

    /**
     * Creates an empty grammar with an explicit start symbol.
     *
     * @param start the start symbol, or {@code null} to use the left hand side of the first rule
     */
    public Grammar(@Nullable NonTerminal start) {
        this.start = start;
    }

    /**
     * Builds a grammar from text holding one rule per line. Reading stops at the
     * first blank line or at the end of the text.
     *
     * @param text the rules
     * @return the grammar
     * @throws GrammarException if a line cannot be decoded, the message names the line
     */
    @NotNull
    @Contract("_ -> new")
    public static Grammar parse(String text) {
        try {
            return read(new BufferedReader(new StringReader(text)));
        } catch (IOException e) {
            throw new IllegalStateException("Reading from a string failed", e);
        }
    }

    /**
     * Loads a grammar file holding one rule per line. Reading stops at the first
     * blank line or at the end of the file.
     *
     * @param filePath path of the grammar file
     * @return the grammar
     * @throws IOException      if the file cannot be read
     * @throws GrammarException if a line cannot be decoded, the message names the line
     */
    @NotNull
    @Contract("_ -> new")
    public static Grammar load(String filePath) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(Path.of(filePath), StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    private static Grammar read(BufferedReader reader) throws IOException {
        Grammar grammar = new Grammar();
        int lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) break;
            try {
                grammar.addRule(line);
            } catch (GrammarException e) {
                throw new GrammarException("Line " + lineNumber + ": " + e.getMessage(), e);
            }
        }
        return grammar;
    }

    // ====== PUBLIC API ====== //

    // Rule insertion

    /**
     * Decodes {@code text} and appends the rule with the next unused number.
     *
     * @param text the rule text, see {@link RuleDecoder}
     * @return {@code false} if the rule was already present
     * @throws InvalidRuleFormatException  if the text is not of the form {@code LHS -> RHS}
     * @throws InvalidNonTerminalException if a nonterminal breaks the naming rules
     */
    public boolean addRule(String text) {
        return add(RuleDecoder.decode(text));
    }

    /**
     * Decodes {@code text} and inserts the rule with number {@code position}.
     * <p>
     * Every rule numbered {@code position} or higher is shifted up by one first.
     * The shift runs over the ordered view, so the relative order of all
     * existing rules is kept.
     *
     * @param text     the rule text
     * @param position the number the new rule receives, at least 1
     * @return {@code false} if the rule was already present
     * @throws InvalidPositionException if {@code position < 1}
     */
    public boolean addRule(String text, int position) {
        if (position < 1) throw new InvalidPositionException(position);
        GrammarRule rule = RuleDecoder.decode(text);
        if (index.contains(rule)) return false;

        List<GrammarRule> shifted = new ArrayList<>(rules.size() + 1);
        boolean inserted = false;
        for (GrammarRule existing : rules) {
            if (existing.number() >= position) {
                if (!inserted) {
                    shifted.add(rule.withNumber(position));
                    inserted = true;
                }
                shifted.add(existing.withNumber(existing.number() + 1));
            } else {
                shifted.add(existing);
            }
        }
        if (!inserted) shifted.add(rule.withNumber(position));

        rules = shifted;
        index.add(rule);
        nextNumber = Math.max(nextNumber, rules.get(rules.size() - 1).number() + 1);
        return true;
    }

    /**
     * Appends a rule with the next unused number. Any number the rule already
     * carries is ignored.
     *
     * @return {@code false} if the rule was already present
     */
    public boolean add(GrammarRule rule) {
        Objects.requireNonNull(rule, "rule cannot be null");
        if (!index.add(rule)) return false;
        rules.add(rule.withNumber(nextNumber++));
        return true;
    }

    public boolean add(NonTerminal lhs, List<Symbol> rhs) {
        return add(new GrammarRule(lhs, rhs));
    }

    // Rule access

    public GrammarRule get(int index) {
        return rules.get(index);
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public boolean contains(GrammarRule rule) {
        return index.contains(rule);
    }

    /**
     * Returns if the grammar holds {@code lhs -> rhs}.
     */
    public boolean contains(NonTerminal lhs, List<Symbol> rhs) {
        return index.contains(new GrammarRule(lhs, rhs));
    }

    @Override
    public @NotNull Iterator<GrammarRule> iterator() {
        return Collections.unmodifiableList(rules).iterator();
    }

    public Stream<GrammarRule> stream() {
        return rules.stream();
    }

    /**
     * Returns the rules of {@code lhs} in rule number order.
     */
    public List<GrammarRule> rules(NonTerminal lhs) {
        return rules.stream().filter(rule -> rule.lhs().equals(lhs)).toList();
    }

    /**
     * Returns the rule with the given number, or {@code null}.
     */
    public @Nullable GrammarRule byNumber(int number) {
        for (GrammarRule rule : rules) {
            if (rule.number() == number) return rule;
        }
        return null;
    }

    // Symbol access

    /**
     * Returns the start symbol: the explicit one if the grammar was created with
     * one, otherwise the left hand side of the first rule. {@code null} for an
     * empty grammar without an explicit start.
     */
    public @Nullable NonTerminal start() {
        if (start != null) return start;
        return rules.isEmpty() ? null : rules.get(0).lhs();
    }

    /**
     * Returns every nonterminal on either side of a rule, in order of first appearance.
     */
    public Set<NonTerminal> nonTerminals() {
        Set<NonTerminal> nonTerminals = new LinkedHashSet<>();
        if (start != null) nonTerminals.add(start);
        for (GrammarRule rule : rules) {
            nonTerminals.add(rule.lhs());
            for (Symbol symbol : rule.rhs()) {
                if (symbol instanceof NonTerminal nonTerminal) nonTerminals.add(nonTerminal);
            }
        }
        return nonTerminals;
    }

    /**
     * Returns every nonterminal that has at least one rule, in order of first appearance.
     */
    public Set<NonTerminal> leftHandSides() {
        Set<NonTerminal> lhs = new LinkedHashSet<>();
        for (GrammarRule rule : rules) lhs.add(rule.lhs());
        return lhs;
    }

    public Set<Terminal> terminals() {
        Set<Terminal> terminals = new LinkedHashSet<>();
        for (GrammarRule rule : rules) {
            for (Symbol symbol : rule.rhs()) {
                if (symbol instanceof Terminal terminal) terminals.add(terminal);
            }
        }
        return terminals;
    }

    /**
     * Returns a copy of this grammar with the same start symbol and the rules
     * numbered {@code 1..N} in their current order.
     */
    @NotNull
    @Contract("-> new")
    public Grammar renumbered() {
        Grammar grammar = new Grammar(start());
        rules.forEach(grammar::add);
        return grammar;
    }

    /**
     * Returns one numbered line per rule: {@code 1. S -> A S}.
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (GrammarRule rule : rules) {
            if (!builder.isEmpty()) builder.append('\n');
            builder.append(rule.number()).append(". ").append(rule);
        }
        return builder.toString();
    }
}
