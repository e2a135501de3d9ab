package com.viffx.Cyk.Parser;

import com.viffx.Cyk.Grammar.Grammar;
import com.viffx.Cyk.Grammar.GrammarRule;
import com.viffx.Cyk.Normalizer.Normalizer;
import com.viffx.Cyk.Symbols.NonTerminal;
import com.viffx.Cyk.Symbols.Symbol;
import com.viffx.Cyk.Symbols.Terminal;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Cocke-Younger-Kasami recognizer over the Chomsky Normal Form of a grammar.
 * <p>
 * The grammar is normalized once, in the constructor. Each {@link #parse(String)}
 * call builds its own {@link RecognitionTable}; the table of the most recent call
 * stays available through {@link #table()} for diagnostics.
 * <p>
 * When several splits or rules justify a cell, the derivation uses the smallest
 * split first and then the smallest rule number, so the same word always yields
 * the same derivation.
 */
public class CYKParser {
    //[INSTANCE_FIELDS]
    private final Grammar grammar;
    private final NonTerminal start;
    private final Integer epsilonRule;
    // terminal -> rules A -> terminal, ascending rule number
    private final Map<Character, List<GrammarRule>> unaryRules = new HashMap<>();
    // (B, C) -> rules A -> B C, ascending rule number
    private final Map<Pair, List<GrammarRule>> binaryRules = new HashMap<>();
    private RecognitionTable table = new RecognitionTable("");

    //[CONSTRUCTORS]
    public CYKParser(Grammar grammar) {
        this(grammar, new Normalizer());
    }

    /**
     * @param grammar    the grammar to recognize, in any form
     * @param normalizer the pipeline used to bring it into Chomsky Normal Form
     */
    public CYKParser(Grammar grammar, Normalizer normalizer) {
        Objects.requireNonNull(grammar, "grammar cannot be null");
        this.grammar = normalizer.normalize(grammar);
        this.start = this.grammar.start();

        Integer epsilon = null;
        for (GrammarRule rule : this.grammar) {
            if (rule.isTerminal()) {
                char terminal = ((Terminal) rule.rhs().get(0)).character();
                unaryRules.computeIfAbsent(terminal, t -> new ArrayList<>()).add(rule);
            } else if (rule.isBinary()) {
                Pair pair = new Pair((NonTerminal) rule.rhs().get(0), (NonTerminal) rule.rhs().get(1));
                binaryRules.computeIfAbsent(pair, p -> new ArrayList<>()).add(rule);
            } else if (rule.isEpsilon() && rule.lhs().equals(start)) {
                epsilon = rule.number();
            }
        }
        this.epsilonRule = epsilon;
    }

    //[INTERNAL_DATATYPES]
    private record Pair(NonTerminal left, NonTerminal right) {}

    private record Span(int offset, int length, NonTerminal nonTerminal) {}

    private record Split(int k, GrammarRule rule, NonTerminal left, NonTerminal right) {}

    //[PUBLIC_METHODS]
    /**
     * Decides whether {@code word} belongs to the language and, if so, returns
     * the rule numbers of a derivation in pre-order.
     *
     * @param word the characters to recognize, each one a terminal
     * @return the verdict, with an empty derivation when rejected
     */
    public ParseResult parse(String word) {
        Objects.requireNonNull(word, "word cannot be null");
        table = new RecognitionTable(word);
        int n = word.length();
        if (start == null) return ParseResult.REJECTED;

        if (n == 0) {
            return epsilonRule == null ? ParseResult.REJECTED : ParseResult.accepted(List.of(epsilonRule));
        }

        // spans of length 1
        for (int i = 0; i < n; i++) {
            for (GrammarRule rule : unaryRules.getOrDefault(word.charAt(i), List.of())) {
                table.add(i, 1, rule.lhs(), rule.number());
            }
        }

        // longer spans from shorter ones
        for (int j = 2; j <= n; j++) {
            for (int i = 0; i + j <= n; i++) {
                for (int k = 1; k < j; k++) {
                    for (NonTerminal b : table.symbols(i, k)) {
                        for (NonTerminal c : table.symbols(i + k, j - k)) {
                            for (GrammarRule rule : binaryRules.getOrDefault(new Pair(b, c), List.of())) {
                                table.add(i, j, rule.lhs(), rule.number());
                            }
                        }
                    }
                }
            }
        }

        if (!table.contains(0, n, start)) return ParseResult.REJECTED;
        return ParseResult.accepted(derive(word));
    }

    /**
     * Returns the table built by the last {@link #parse(String)} call.
     */
    public RecognitionTable table() {
        return table;
    }

    /**
     * Returns the Chomsky Normal Form grammar the parser works on. Derivations
     * cite its rule numbers.
     */
    public Grammar grammar() {
        return grammar;
    }

    public @Nullable NonTerminal start() {
        return start;
    }

    //[PRIVATE_METHODS]
    // Rebuilds a derivation from the filled table, root first, left subtree before right subtree.
    private List<Integer> derive(String word) {
        List<Integer> derivation = new ArrayList<>();
        Deque<Span> stack = new ArrayDeque<>();
        stack.push(new Span(0, word.length(), start));
        while (!stack.isEmpty()) {
            Span span = stack.pop();
            if (span.length() == 1) {
                derivation.add(unaryRule(span, word.charAt(span.offset())).number());
                continue;
            }

            Split split = split(span);
            derivation.add(split.rule().number());
            // right is pushed first so that left is expanded first
            stack.push(new Span(span.offset() + split.k(), span.length() - split.k(), split.right()));
            stack.push(new Span(span.offset(), split.k(), split.left()));
        }
        return derivation;
    }

    private GrammarRule unaryRule(Span span, char terminal) {
        for (GrammarRule rule : unaryRules.getOrDefault(terminal, List.of())) {
            if (rule.lhs().equals(span.nonTerminal())) return rule;
        }
        throw new IllegalStateException("No rule " + span.nonTerminal() + " -> " + terminal + " behind table entry at offset " + span.offset());
    }

    private Split split(Span span) {
        int i = span.offset();
        int j = span.length();
        for (int k = 1; k < j; k++) {
            GrammarRule best = null;
            for (NonTerminal b : table.symbols(i, k)) {
                for (NonTerminal c : table.symbols(i + k, j - k)) {
                    for (GrammarRule rule : binaryRules.getOrDefault(new Pair(b, c), List.of())) {
                        if (!rule.lhs().equals(span.nonTerminal())) continue;
                        if (best == null || rule.number() < best.number()) best = rule;
                        // rules are sorted, later ones for this pair only have larger numbers
                        break;
                    }
                }
            }
            if (best != null) {
                List<Symbol> rhs = best.rhs();
                return new Split(k, best, (NonTerminal) rhs.get(0), (NonTerminal) rhs.get(1));
            }
        }
        throw new IllegalStateException("No split justifies " + span.nonTerminal() + " over span (" + i + ", " + j + ")");
    }
}
