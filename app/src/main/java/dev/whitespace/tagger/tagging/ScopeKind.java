package dev.whitespace.tagger.tagging;

/**
 * Entries of the scope stack: the nested lexical contexts that change which whitespace rules apply.
 */
public enum ScopeKind {
    STRING,
    COMMENT,
    INTERPOLATION,
    PAREN,
    BRACE,
    BRACKET,
    ANGLE,
    CONDITIONAL,
    SWITCH_BODY,
    PENDING_SWITCH,
    TERNARY,
    SHADOWED_PAREN,
    SHADOWED_BRACE,
    SHADOWED_BRACKET;

    /**
     * Whether an open scope of this kind adds one level of expected indentation.
     */
    public boolean countsForIndent() {
        return this == PAREN || this == BRACE || this == BRACKET || this == CONDITIONAL || this == SWITCH_BODY;
    }

    /**
     * The variant this scope turns into when a later opening on the same line supersedes it,
     * or {@code null} for kinds that are never shadowed.
     */
    public ScopeKind shadowed() {
        return switch (this) {
            case PAREN -> SHADOWED_PAREN;
            case BRACE, SWITCH_BODY -> SHADOWED_BRACE;
            case BRACKET -> SHADOWED_BRACKET;
            default -> null;
        };
    }
}
