package dev.whitespace.tagger.tagging;

/**
 * Kinds of whitespace violation.
 */
public enum Tag {
    INCORRECT_INDENT,
    MULTIPLE_SPACES,
    UNEXPECTED_WHITESPACE,
    MISSING_SPACE,
    INVALID_CHARACTER
}
