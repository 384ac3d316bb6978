package dev.whitespace.tagger.tagging;

import dev.whitespace.tagger.lexer.Token;
import dev.whitespace.tagger.lexer.TokenKind;
import java.util.Objects;

/**
 * Input of one transition: the current token with its neighbours and the operator run it belongs to.
 *
 * @param token         current token
 * @param previous      kind of the last token consumed in the body of the line, {@code null} at the start
 * @param next          kind of the following token
 * @param afterNext     kind of the token after {@code next}
 * @param following     kind of the first token after the current one that is not whitespace
 * @param runStart      column where the current operator run started
 * @param assignmentEnd column after the last {@code =} of the current run, or {@code -1} when it has none
 */
public record Step(
        Token token,
        TokenKind previous,
        TokenKind next,
        TokenKind afterNext,
        TokenKind following,
        int runStart,
        int assignmentEnd
) {

    public Step {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(next, "next");
        Objects.requireNonNull(afterNext, "afterNext");
        Objects.requireNonNull(following, "following");
    }

    public TokenKind kind() {
        return token.kind();
    }

    /**
     * Whether the current operator run contains {@code =} and therefore is binary.
     */
    public boolean binaryRun() {
        return assignmentEnd >= 0;
    }

    public boolean atLineStart() {
        return previous == null;
    }

    public boolean afterWhitespace() {
        return previous != null && previous.isWhitespace();
    }
}
