package com.viffx.Cyk.Grammar;

import com.viffx.Cyk.Symbols.NonTerminal;
import com.viffx.Cyk.Symbols.Symbol;
import com.viffx.Cyk.Symbols.Terminal;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A single production {@code lhs -> rhs}.
 * <p>
 * The {@code number} is the ordinal a {@link Grammar} assigns to the rule and is
 * what derivations cite. It does not take part in equality: two rules with the
 * same left and right hand sides are the same rule.
 *
 * @param lhs    the left hand side
 * @param rhs    the right hand side, empty for an epsilon rule
 * @param number the rule number, {@code null} while the rule is not part of a grammar
 */
public record GrammarRule(NonTerminal lhs, List<Symbol> rhs, @Nullable Integer number) {
    public static final String ARROW = "->";
    public static final String EPSILON = "ε";

    public GrammarRule {
        Objects.requireNonNull(lhs, "lhs cannot be null");
        rhs = List.copyOf(Objects.requireNonNull(rhs, "rhs cannot be null"));
    }

    public GrammarRule(NonTerminal lhs, List<Symbol> rhs) {
        this(lhs, rhs, null);
    }

    @NotNull
    @Contract("_ -> new")
    public GrammarRule withNumber(int number) {
        return new GrammarRule(lhs, rhs, number);
    }

    public boolean isEpsilon() {
        return rhs.isEmpty();
    }

    /**
     * Returns if this is a chain rule {@code A -> B}.
     */
    public boolean isUnit() {
        return rhs.size() == 1 && rhs.get(0) instanceof NonTerminal;
    }

    /**
     * Returns if this is a rule {@code A -> a}.
     */
    public boolean isTerminal() {
        return rhs.size() == 1 && rhs.get(0) instanceof Terminal;
    }

    /**
     * Returns if this is a rule {@code A -> B C}.
     */
    public boolean isBinary() {
        return rhs.size() == 2 && rhs.get(0) instanceof NonTerminal && rhs.get(1) instanceof NonTerminal;
    }

    /**
     * Renders the rule as {@code LHS -> s1 s2 ...} or {@code LHS -> ε}, the same
     * form {@link RuleDecoder} reads.
     */
    @Override
    public String toString() {
        if (rhs.isEmpty()) return lhs + " " + ARROW + " " + EPSILON;
        return lhs + " " + ARROW + " " + rhs.stream().map(Symbol::value).collect(Collectors.joining(" "));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GrammarRule that = (GrammarRule) o;
        return lhs.equals(that.lhs) && rhs.equals(that.rhs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lhs, rhs);
    }
}
