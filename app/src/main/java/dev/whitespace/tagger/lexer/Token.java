package dev.whitespace.tagger.lexer;

import java.util.Objects;

/**
 * A lexical token: its kind and the code point columns it spans within the current line.
 */
public record Token(TokenKind kind, int start, int length) {

    public Token {
        Objects.requireNonNull(kind, "kind");
        if (start < 0 || length < 0) {
            throw new IllegalArgumentException("Invalid token span");
        }
    }

    public int end() {
        return start + length;
    }
}
