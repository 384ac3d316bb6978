package dev.whitespace.tagger.tagging;

import dev.whitespace.tagger.lexer.Token;
import dev.whitespace.tagger.lexer.TokenKind;
import java.util.Objects;
import java.util.Optional;

/**
 * Compares the leading whitespace of a line against the depth implied by the open scopes.
 */
public class IndentValidator {

    private final IndentationStyle style;

    public IndentValidator(IndentationStyle style) {
        this.style = Objects.requireNonNull(style, "style");
    }

    /**
     * Expected indentation levels for a line whose first body token is {@code upcoming}.
     */
    public int expectedLevels(TokenKind upcoming, ScopeView scopes) {
        int levels = scopes.indentDepth();
        if (dedents(upcoming, scopes)) {
            levels--;
        }
        return Math.max(0, levels);
    }

    /**
     * Validates a well-formed run of the style's indent character, or an absent indent when {@code run} is
     * {@code null}.
     */
    public Optional<TaggedRegion> validate(Token run, TokenKind upcoming, ScopeView scopes) {
        int levels = expectedLevels(upcoming, scopes);
        int observed = run == null ? 0 : run.length();
        if (observed == style.columnsFor(levels)) {
            return Optional.empty();
        }
        int end = run == null ? 0 : run.end();
        return Optional.of(new TaggedRegion(0, end, Tag.INCORRECT_INDENT, style.columnsFor(levels)));
    }

    /**
     * Flags leading whitespace of the wrong or mixed characters ending at column {@code end}.
     */
    public TaggedRegion reject(int end, TokenKind upcoming, ScopeView scopes) {
        int levels = expectedLevels(upcoming, scopes);
        return new TaggedRegion(0, end, Tag.INCORRECT_INDENT, style.columnsFor(levels));
    }

    private static boolean dedents(TokenKind upcoming, ScopeView scopes) {
        if (upcoming.isCloser()) {
            return true;
        }
        if (upcoming == TokenKind.CASE_KEYWORD || upcoming == TokenKind.DEFAULT_KEYWORD) {
            return scopes.innermostBlock() == ScopeKind.SWITCH_BODY;
        }
        if (upcoming == TokenKind.ELSE_DIRECTIVE || upcoming == TokenKind.ELSEIF_DIRECTIVE
                || upcoming == TokenKind.ENDIF_DIRECTIVE) {
            return scopes.count(ScopeKind.CONDITIONAL) > 0;
        }
        return false;
    }
}
