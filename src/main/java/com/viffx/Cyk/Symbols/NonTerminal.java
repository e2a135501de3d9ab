package com.viffx.Cyk.Symbols;

import com.viffx.Cyk.Grammar.InvalidNonTerminalException;

import java.util.Objects;

/**
 * A grammar variable. Names start with an uppercase letter and are at most
 * {@link #MAX_LENGTH} characters long.
 */
public record NonTerminal(String value) implements Symbol {
    public static final int MAX_LENGTH = 3;

    public NonTerminal {
        if (value == null || value.isEmpty()) {
            throw new InvalidNonTerminalException("NonTerminal name cannot be empty");
        }
        if (!Character.isUpperCase(value.charAt(0))) {
            throw new InvalidNonTerminalException("NonTerminal must start with an uppercase letter: '" + value + "'");
        }
        if (value.length() > MAX_LENGTH) {
            throw new InvalidNonTerminalException("NonTerminal can't be longer than " + MAX_LENGTH + " characters: '" + value + "'");
        }
    }

    @Override
    public String toString() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NonTerminal that = (NonTerminal) o;
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }
}
