package dev.whitespace.tagger.tagging;

/**
 * Nodes of the pushdown automaton driven by {@link TransitionTable}.
 */
public enum AutomatonState {
    INDENT,
    INVALID_INDENT,
    INDENT_ENDED,
    BODY,
    SPACE_BODY,
    IDENTIFIER_BODY,
    PAREN_BODY,
    BRACE_BODY,
    ANGLE_BODY,
    POSTFIX,
    PREFIX,
    INFIX,
    LITERAL,
    ESCAPE,
    LINE_COMMENT,
    MULTI_COMMENT;

    public boolean isIndentation() {
        return this == INDENT || this == INVALID_INDENT || this == INDENT_ENDED;
    }

    /**
     * States that are in the middle of an operator run.
     */
    public boolean isOperatorRun() {
        return this == POSTFIX || this == PREFIX || this == INFIX;
    }
}
