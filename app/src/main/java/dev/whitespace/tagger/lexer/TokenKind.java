package dev.whitespace.tagger.lexer;

/**
 * Kinds of tokens produced by the {@link Tokenizer}.
 */
public enum TokenKind {
    SPACE,
    TAB,
    WHITESPACE,
    QUOTE,
    OPEN_PAREN,
    CLOSE_PAREN,
    OPEN_BRACE,
    CLOSE_BRACE,
    OPEN_BRACKET,
    CLOSE_BRACKET,
    OPEN_ANGLE,
    CLOSE_ANGLE,
    BACKSLASH,
    COLON,
    COMMA,
    HASH,
    DOLLAR,
    PERIOD,
    SEMICOLON,
    AT_SIGN,
    BACKTICK,
    QUESTION_MARK,
    DIGITS,
    IDENTIFIER,
    COMBINING_MARK,
    OPERATOR,
    EQUALS,
    COMMENT_OPEN,
    COMMENT_CLOSE,
    LINE_COMMENT,
    CASE_KEYWORD,
    DEFAULT_KEYWORD,
    SWITCH_KEYWORD,
    IF_DIRECTIVE,
    ELSE_DIRECTIVE,
    ELSEIF_DIRECTIVE,
    ENDIF_DIRECTIVE,
    INVALID,
    END_OF_LINE;

    public boolean isWhitespace() {
        return this == SPACE || this == TAB || this == WHITESPACE;
    }

    public boolean isCloser() {
        return this == CLOSE_PAREN || this == CLOSE_BRACE || this == CLOSE_BRACKET;
    }

    /**
     * Tokens that may continue an operator run. Angle brackets only count when they are not
     * delimiting a generic parameter list, which is decided by the automaton.
     */
    public boolean isOperatorLike() {
        return this == OPERATOR || this == EQUALS || this == OPEN_ANGLE || this == CLOSE_ANGLE;
    }

    public boolean isKeyword() {
        return this == CASE_KEYWORD || this == DEFAULT_KEYWORD || this == SWITCH_KEYWORD;
    }

    public boolean isDirective() {
        return this == IF_DIRECTIVE || this == ELSE_DIRECTIVE || this == ELSEIF_DIRECTIVE || this == ENDIF_DIRECTIVE;
    }

    /**
     * Tokens that begin an operand: anything a binary operator could be applied to.
     */
    public boolean startsOperand() {
        switch (this) {
            case IDENTIFIER:
            case DIGITS:
            case QUOTE:
            case OPEN_PAREN:
            case OPEN_BRACKET:
            case DOLLAR:
            case AT_SIGN:
            case BACKTICK:
            case HASH:
            case PERIOD:
            case BACKSLASH:
            case COMBINING_MARK:
            case CASE_KEYWORD:
            case DEFAULT_KEYWORD:
            case SWITCH_KEYWORD:
                return true;
            default:
                return false;
        }
    }
}
