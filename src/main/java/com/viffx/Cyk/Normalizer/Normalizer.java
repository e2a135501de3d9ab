package com.viffx.Cyk.Normalizer;

import com.viffx.Cyk.Grammar.Grammar;
import com.viffx.Cyk.Grammar.GrammarRule;
import com.viffx.Cyk.Symbols.NonTerminal;

import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * Runs the normalization passes in order and checks the invariants each later
 * pass relies on.
 * <ol>
 *   <li>remove non-productive symbols</li>
 *   <li>remove unreachable symbols</li>
 *   <li>eliminate epsilon rules</li>
 *   <li>eliminate chain rules</li>
 *   <li>remove non-productive and unreachable symbols again</li>
 *   <li>convert to Chomsky Normal Form</li>
 * </ol>
 * Epsilon and chain elimination can leave nonterminals without rules or without
 * a path from the start, hence the second clean up.
 */
public class Normalizer {
    //[STAGE_NAMES]
    public static final String INPUT = "input";
    public static final String PRODUCTIVE = "productive";
    public static final String REACHABLE = "reachable";
    public static final String EPSILON_FREE = "epsilon-free";
    public static final String CHAIN_FREE = "chain-free";
    public static final String CLEANED = "cleaned";
    public static final String CHOMSKY = "chomsky";

    //[INSTANCE_FIELDS]
    private final GrammarPass productive = new NonProductiveRemover();
    private final GrammarPass reachable = new UnreachableRemover();
    private final GrammarPass epsilon = new EpsilonEliminator();
    private final GrammarPass chain = new ChainRuleEliminator();
    private final GrammarPass chomsky = new ChomskyConverter();
    private final BiConsumer<String, Grammar> listener;

    //[CONSTRUCTORS]
    public Normalizer() {
        this((stage, grammar) -> {});
    }

    /**
     * @param listener receives the name and result of every stage, the input grammar included
     */
    public Normalizer(BiConsumer<String, Grammar> listener) {
        this.listener = Objects.requireNonNull(listener, "listener cannot be null");
    }

    //[PUBLIC_METHODS]
    /**
     * Returns a grammar in Chomsky Normal Form deriving the same words as
     * {@code grammar}. The input is left untouched.
     *
     * @param grammar the grammar to normalize, its start symbol is {@link Grammar#start()}
     * @return the normalized grammar with rules numbered {@code 1..N} and an explicit start symbol
     */
    public Grammar normalize(Grammar grammar) {
        Objects.requireNonNull(grammar, "grammar cannot be null");
        listener.accept(INPUT, grammar);

        Grammar current = stage(PRODUCTIVE, productive, grammar);
        current = stage(REACHABLE, reachable, current);
        current = stage(EPSILON_FREE, epsilon, current);
        current = stage(CHAIN_FREE, chain, current);
        current = stage(CLEANED, reachable, productive.apply(current));

        verifyReadyForConversion(current);
        current = stage(CHOMSKY, chomsky, current);
        verifyChomskyForm(current);
        return current;
    }

    /**
     * Checks that {@code grammar} is in Chomsky Normal Form: every rule is
     * {@code A -> a} or {@code A -> B C}, except for one {@code S -> ε} for a start
     * symbol that occurs on no right hand side.
     *
     * @throws IllegalStateException naming the first offending rule
     */
    public static void verifyChomskyForm(Grammar grammar) {
        for (GrammarRule rule : grammar) {
            if (rule.isTerminal() || rule.isBinary()) continue;
            if (rule.isEpsilon() && isDedicatedStart(grammar, rule.lhs())) continue;
            throw new IllegalStateException("Rule is not in Chomsky Normal Form: " + rule);
        }
    }

    //[PRIVATE_METHODS]
    private Grammar stage(String name, GrammarPass pass, Grammar grammar) {
        Grammar result = pass.apply(grammar);
        listener.accept(name, result);
        return result;
    }

    private static void verifyReadyForConversion(Grammar grammar) {
        for (GrammarRule rule : grammar) {
            if (rule.isUnit()) throw new IllegalStateException("Chain rule left after chain elimination: " + rule);
            if (rule.isEpsilon() && !isDedicatedStart(grammar, rule.lhs())) {
                throw new IllegalStateException("Epsilon rule left after epsilon elimination: " + rule);
            }
        }
    }

    private static boolean isDedicatedStart(Grammar grammar, NonTerminal nonTerminal) {
        if (!nonTerminal.equals(grammar.start())) return false;
        return grammar.stream().map(GrammarRule::rhs).noneMatch(rhs -> rhs.contains(nonTerminal));
    }
}
