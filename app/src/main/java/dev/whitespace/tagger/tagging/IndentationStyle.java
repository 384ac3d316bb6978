package dev.whitespace.tagger.tagging;

import dev.whitespace.tagger.lexer.TokenKind;

/**
 * Indentation convention of a file: one tab per level, or {@code width} spaces per level.
 */
public record IndentationStyle(boolean usesTabs, int width) {

    public IndentationStyle {
        if (width < 1) {
            throw new IllegalArgumentException("Indentation width must be positive");
        }
        if (usesTabs && width != 1) {
            throw new IllegalArgumentException("Tab indentation uses one tab per level");
        }
    }

    public static IndentationStyle tabs() {
        return new IndentationStyle(true, 1);
    }

    public static IndentationStyle spaces(int width) {
        return new IndentationStyle(false, width);
    }

    /**
     * The whitespace token a well-formed indent is made of.
     */
    public TokenKind indentToken() {
        return usesTabs ? TokenKind.TAB : TokenKind.SPACE;
    }

    public char indentCharacter() {
        return usesTabs ? '\t' : ' ';
    }

    public int columnsFor(int levels) {
        return levels * width;
    }

    @Override
    public String toString() {
        return usesTabs ? "tabs" : "spaces(" + width + ")";
    }
}
