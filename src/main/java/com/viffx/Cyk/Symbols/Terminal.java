package com.viffx.Cyk.Symbols;

public record Terminal(char character) implements Symbol {

    @Override
    public String value() {
        return String.valueOf(character);
    }

    @Override
    public String toString() {
        return value();
    }
}
