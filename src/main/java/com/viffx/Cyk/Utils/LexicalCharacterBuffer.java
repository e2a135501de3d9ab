package com.viffx.Cyk.Utils;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;

/**
 * Provides a two-character buffered reader for lexers, allowing single-character
 * lookahead and controlled advancement through a text stream.
 *
 * <p>The buffer keeps the current and next characters and counts how many
 * characters have been consumed.
 *
 * <p>EOF is reached when the current character slot holds {@code -1}.
 */
public class LexicalCharacterBuffer {
    // ====== INSTANCE FIELDS ====== //

    /**
     * Reader supplying characters.
     */
    private final Reader reader;

    /**
     * Holds the current and next character codes from the input stream.
     * <ul>
     *     <li>{@code buffer[0]} - current character</li>
     *     <li>{@code buffer[1]} - next lookahead character</li>
     * </ul>
     */
    private final int[] buffer = new int[2];

    private boolean eof;

    /**
     * Number of characters consumed so far.
     */
    private int position = 0;

    // ====== CONSTRUCTORS ====== //
    /**
     * Wraps the given reader and fills the two-character buffer.
     *
     * @param reader source of characters
     * @throws IOException if the first two characters cannot be read
     */
    public LexicalCharacterBuffer(Reader reader) throws IOException {
        this.reader = reader;

        // initialize the buffer
        buffer[0] = reader.read();
        buffer[1] = reader.read();

        eof = buffer[0] == -1;
    }

    public static LexicalCharacterBuffer of(String text) throws IOException {
        return new LexicalCharacterBuffer(new StringReader(text));
    }

    // ====== PUBLIC API METHODS ====== //
    public final boolean eof() {
        return eof;
    }

    /**
     * Returns the current character in the buffer.
     *
     * @return the current character
     */
    public final char crntChar() {
        return (char) buffer[0];
    }

    /**
     * Returns {@code true} if a lookahead character is available.
     */
    public final boolean hasPeek() {
        return buffer[1] != -1;
    }

    /**
     * Returns the next character in the buffer without advancing it.
     *
     * @return the next character
     */
    public final char peekChar() {
        return (char) buffer[1];
    }

    /**
     * Returns the number of characters consumed so far, which is also the
     * zero based index of the current character.
     */
    public final int position() {
        return position;
    }

    /**
     * Advances the buffer by one character, shifting the lookahead character into
     * the current slot and reading a new lookahead from the underlying reader.
     *
     *
     * @return the newly current character after advancing
     * @throws IOException if the end of the input has already been reached
     */
    public final char nextChar() throws IOException {
        if (eof) throw new IOException("Reached the end of the input.");

        // shift characters
        buffer[0] = buffer[1];
        buffer[1] = reader.read();
        position++;

        eof = buffer[0] == -1;

        return crntChar();
    }

    // ====== DEBUG INFO ====== //
    /**
     * Returns a readable representation of the current buffer contents.
     *
     * @return a string showing the current and next characters in the buffer
     */
    public String buffer() {
        String[] chars = new String[2];
        for (int i = 0; i < 2; i++) {
            if (buffer[i] == -1) {
                chars[i] = "EOF";
                continue;
            }
            char c = (char) buffer[i];
            chars[i] = switch (c) {
                case '\t' -> "\\t";
                case '\n' -> "\\n";
                case '\r' -> "\\r";
                default -> String.valueOf(c);
            };
        }
        return String.format("['%s','%s']", chars[0], chars[1]);
    }
}
