package com.viffx.Cyk.Parser;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of {@link CYKParser#parse(String)}.
 *
 * @param accepted   whether the word belongs to the language
 * @param derivation the rule numbers of a leftmost derivation in pre-order, empty when rejected
 */
public record ParseResult(boolean accepted, List<Integer> derivation) {
    public static final ParseResult REJECTED = new ParseResult(false, List.of());

    public ParseResult {
        derivation = List.copyOf(derivation);
    }

    public static ParseResult accepted(List<Integer> derivation) {
        return new ParseResult(true, derivation);
    }

    /**
     * Renders the result the way the command line prints it: {@code TRUE: 1,3,2} or {@code FALSE}.
     */
    @Override
    public String toString() {
        if (!accepted) return "FALSE";
        return "TRUE: " + derivation.stream().map(String::valueOf).collect(Collectors.joining(","));
    }
}
