package com.viffx.Cyk.Grammar;

import com.viffx.Cyk.Symbols.NonTerminal;
import com.viffx.Cyk.Symbols.Symbol;
import com.viffx.Cyk.Symbols.Terminal;
import com.viffx.Cyk.Utils.LexicalCharacterBuffer;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static java.lang.Character.isDigit;
import static java.lang.Character.isUpperCase;

/**
 * Decodes the one-line rule encoding {@code LHS -> RHS}.
 * <p>
 * The right hand side is read with all spaces removed:
 * <ul>
 *   <li>an uppercase letter starts a nonterminal which may absorb one following digit or apostrophe,</li>
 *   <li>a stray apostrophe extends the preceding nonterminal, or is a terminal when there is none,</li>
 *   <li>any other character is a terminal.</li>
 * </ul>
 * An empty or blank right hand side, {@code eps} and {@code ε} all denote an epsilon rule.
 */
public final class RuleDecoder {
    private static final String EPS = "eps";
    private static final char PRIME = '\'';

    private final String text;

    private RuleDecoder(String text) {
        this.text = text;
    }

    /**
     * Decodes a single rule. The returned rule carries no number.
     *
     * @param text the rule text
     * @return the decoded rule
     * @throws InvalidRuleFormatException  if the text has no or more than one {@code ->}
     * @throws InvalidNonTerminalException if a nonterminal token breaks the naming rules
     */
    @NotNull
    public static GrammarRule decode(String text) {
        Objects.requireNonNull(text, "rule text cannot be null");
        return new RuleDecoder(text).decode();
    }

    private GrammarRule decode() {
        String[] parts = text.split(GrammarRule.ARROW, -1);
        if (parts.length != 2) {
            throw new InvalidRuleFormatException("Invalid rule format, expected 'LHS -> RHS' got: '" + text + "'");
        }

        NonTerminal lhs = new NonTerminal(parts[0].strip());
        String rhsText = parts[1].strip();
        if (rhsText.isEmpty() || rhsText.equals(EPS) || rhsText.equals(GrammarRule.EPSILON)) {
            return new GrammarRule(lhs, List.of());
        }

        try {
            return new GrammarRule(lhs, decodeRhs(rhsText.replace(" ", "")));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private List<Symbol> decodeRhs(String rhsText) throws IOException {
        List<Symbol> rhs = new ArrayList<>();
        LexicalCharacterBuffer lexer = LexicalCharacterBuffer.of(rhsText);
        while (!lexer.eof()) {
            char c = lexer.crntChar();
            if (isUpperCase(c)) {
                // nonterminal, optionally followed by a digit or a prime
                StringBuilder name = new StringBuilder().append(c);
                if (lexer.hasPeek() && (isDigit(lexer.peekChar()) || lexer.peekChar() == PRIME)) {
                    name.append(lexer.nextChar());
                }
                rhs.add(nonTerminal(name.toString(), lexer));
            } else if (c == PRIME && !rhs.isEmpty() && rhs.get(rhs.size() - 1) instanceof NonTerminal previous) {
                rhs.set(rhs.size() - 1, nonTerminal(previous.value() + PRIME, lexer));
            } else {
                rhs.add(new Terminal(c));
            }
            lexer.nextChar();
        }
        return rhs;
    }

    private NonTerminal nonTerminal(String name, LexicalCharacterBuffer lexer) {
        try {
            return new NonTerminal(name);
        } catch (InvalidNonTerminalException e) {
            throw new InvalidNonTerminalException(e.getMessage() + errorContext(lexer));
        }
    }

    private String errorContext(LexicalCharacterBuffer lexer) {
        return " (rule: '" + text + "', index: " + lexer.position() + ", buffer: " + lexer.buffer() + ")";
    }
}
