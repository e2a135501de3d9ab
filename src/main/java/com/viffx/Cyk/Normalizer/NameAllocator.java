package com.viffx.Cyk.Normalizer;

import com.viffx.Cyk.Symbols.NonTerminal;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Hands out nonterminal names that collide neither with the names it was seeded
 * with nor with names it already handed out.
 * <p>
 * Candidates are tried in a fixed order: {@code X1..X9}, {@code Y1..Y9},
 * {@code Z1..Z9}, then {@code A1..W9}, then the same letters with two digit
 * suffixes. Single digit names come first because they are the ones the rule
 * encoding can read back.
 */
public class NameAllocator {
    private static final String LETTERS = "XYZABCDEFGHIJKLMNOPQRSTUVW";

    private static final int SHORT_NAMES = LETTERS.length() * 9;
    private static final int ALL_NAMES = SHORT_NAMES + LETTERS.length() * 90;

    private final Set<String> used = new HashSet<>();
    private int next = 0;

    public NameAllocator(Collection<NonTerminal> taken) {
        for (NonTerminal nonTerminal : taken) used.add(nonTerminal.value());
    }

    /**
     * Reserves {@code name} if it is free.
     *
     * @return the reserved nonterminal, or {@code null} if the name is taken or too long
     */
    public NonTerminal claim(String name) {
        if (name.length() > NonTerminal.MAX_LENGTH || used.contains(name)) return null;
        NonTerminal nonTerminal = new NonTerminal(name);
        used.add(name);
        return nonTerminal;
    }

    /**
     * Returns a fresh nonterminal.
     *
     * @throws IllegalStateException if every candidate name is taken
     */
    public NonTerminal fresh() {
        while (next < ALL_NAMES) {
            String name = candidate(next++);
            if (used.add(name)) return new NonTerminal(name);
        }
        throw new IllegalStateException("No free nonterminal names left, " + used.size() + " names are in use");
    }

    private static String candidate(int n) {
        if (n < SHORT_NAMES) return LETTERS.charAt(n / 9) + String.valueOf(n % 9 + 1);
        int m = n - SHORT_NAMES;
        return LETTERS.charAt(m / 90) + String.valueOf(10 + m % 90);
    }
}
