package dev.whitespace.tagger.lexer;

/**
 * Lexical category of a single code point.
 */
public enum ScalarCategory {
    SPACE(true),
    TAB(true),
    OTHER_WHITESPACE(true),
    QUOTE(false),
    OPEN_PAREN(false),
    CLOSE_PAREN(false),
    OPEN_BRACE(false),
    CLOSE_BRACE(false),
    OPEN_BRACKET(false),
    CLOSE_BRACKET(false),
    OPEN_ANGLE(false),
    CLOSE_ANGLE(false),
    BACKSLASH(false),
    COLON(false),
    COMMA(false),
    HASH(false),
    DOLLAR(false),
    PERIOD(false),
    SEMICOLON(false),
    AT_SIGN(false),
    BACKTICK(false),
    QUESTION_MARK(false),
    DIGIT(true),
    IDENTIFIER_CHAR(true),
    COMBINING_MARK(false),
    OPERATOR_CHAR(false),
    END_OF_LINE(false),
    INVALID(true);

    private final boolean aggregates;

    ScalarCategory(boolean aggregates) {
        this.aggregates = aggregates;
    }

    /**
     * Whether consecutive code points of this category form a single token.
     */
    public boolean aggregates() {
        return aggregates;
    }

    public boolean isWhitespace() {
        return this == SPACE || this == TAB || this == OTHER_WHITESPACE;
    }
}
