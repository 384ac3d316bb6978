package dev.whitespace.tagger.tagging;

import static dev.whitespace.tagger.tagging.Action.RETRY;
import static dev.whitespace.tagger.tagging.Action.discard;
import static dev.whitespace.tagger.tagging.Action.flag;
import static dev.whitespace.tagger.tagging.Action.flagAt;
import static dev.whitespace.tagger.tagging.Action.goTo;
import static dev.whitespace.tagger.tagging.Action.pop;
import static dev.whitespace.tagger.tagging.Action.promote;
import static dev.whitespace.tagger.tagging.Action.push;

import dev.whitespace.tagger.lexer.TokenKind;
import dev.whitespace.tagger.tagging.Action.Anchor;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Transition function of the whitespace automaton. Given the current state, the token step and a read-only view
 * of the scope stack it returns the actions to apply; it never mutates anything itself.
 */
public class TransitionTable {

    private static final List<Action> STAY = List.of();

    private final IndentationStyle style;
    private final IndentValidator indentValidator;

    public TransitionTable(IndentationStyle style) {
        this.style = Objects.requireNonNull(style, "style");
        this.indentValidator = new IndentValidator(style);
    }

    public List<Action> select(AutomatonState state, Step step, ScopeView scopes) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(step, "step");
        Objects.requireNonNull(scopes, "scopes");
        return switch (state) {
            case INDENT -> indent(step, scopes);
            case INVALID_INDENT -> invalidIndent(step, scopes);
            case INDENT_ENDED -> step.kind() == TokenKind.END_OF_LINE ? STAY : retryIn(AutomatonState.BODY);
            case BODY -> body(step, scopes);
            case SPACE_BODY -> spaceBody(step, scopes);
            case IDENTIFIER_BODY -> identifierBody(step, scopes);
            case PAREN_BODY -> parenBody(step);
            case BRACE_BODY -> braceBody(step);
            case ANGLE_BODY -> angleBody(step, scopes);
            case POSTFIX -> postfix(step);
            case PREFIX -> prefix(step);
            case INFIX -> infix(step);
            case LITERAL -> literal(step);
            case ESCAPE -> escape(step);
            case LINE_COMMENT -> step.kind() == TokenKind.INVALID ? invalid() : STAY;
            case MULTI_COMMENT -> multiComment(step, scopes);
        };
    }

    private List<Action> indent(Step step, ScopeView scopes) {
        TokenKind kind = step.kind();
        if (kind == style.indentToken()) {
            if (step.next().isWhitespace()) {
                return List.of(goTo(AutomatonState.INVALID_INDENT));
            }
            List<Action> actions = new ArrayList<>();
            indentValidator.validate(step.token(), step.next(), scopes).ifPresent(region -> actions.add(flagAt(region)));
            actions.add(goTo(AutomatonState.INDENT_ENDED));
            return actions;
        }
        if (kind.isWhitespace()) {
            return List.of(goTo(AutomatonState.INVALID_INDENT));
        }
        if (kind == TokenKind.END_OF_LINE) {
            return STAY;
        }
        List<Action> actions = new ArrayList<>();
        indentValidator.validate(null, kind, scopes).ifPresent(region -> actions.add(flagAt(region)));
        actions.add(goTo(AutomatonState.BODY));
        actions.add(RETRY);
        return actions;
    }

    private List<Action> invalidIndent(Step step, ScopeView scopes) {
        if (step.kind().isWhitespace()) {
            return STAY;
        }
        TaggedRegion region = indentValidator.reject(step.token().start(), step.kind(), scopes);
        return List.of(flagAt(region), goTo(AutomatonState.BODY), RETRY);
    }

    private List<Action> body(Step step, ScopeView scopes) {
        TokenKind previous = step.previous();
        switch (step.kind()) {
            case SPACE:
                return spaceRun(step, scopes);
            case TAB:
            case WHITESPACE:
                return otherWhitespaceRun(step, scopes);
            case QUOTE:
                return List.of(push(ScopeKind.STRING), goTo(AutomatonState.LITERAL));
            case OPEN_PAREN:
                return List.of(push(ScopeKind.PAREN), goTo(AutomatonState.PAREN_BODY));
            case OPEN_BRACKET:
                return List.of(push(ScopeKind.BRACKET), goTo(AutomatonState.PAREN_BODY));
            case OPEN_BRACE:
                return openBrace(step, scopes);
            case CLOSE_BRACE:
                return closeBrace(step);
            case CLOSE_PAREN:
                if (scopes.top() == ScopeKind.INTERPOLATION) {
                    return List.of(pop(ScopeKind.INTERPOLATION), goTo(AutomatonState.LITERAL));
                }
                return List.of(pop(ScopeKind.PAREN), goTo(AutomatonState.IDENTIFIER_BODY));
            case CLOSE_BRACKET:
                return List.of(pop(ScopeKind.BRACKET), goTo(AutomatonState.IDENTIFIER_BODY));
            case COLON:
                if (scopes.top() == ScopeKind.TERNARY) {
                    return ternaryColon(step, !step.atLineStart() && !step.afterWhitespace());
                }
                if (previous != TokenKind.COLON && !spaceOptionalAfterColon(step.next())
                        && !beforeArgumentLabel(step)) {
                    return List.of(flag(Tag.MISSING_SPACE, Anchor.AFTER, 1));
                }
                return STAY;
            case COMMA:
                if (!spaceOptionalAfterComma(step.next())) {
                    return List.of(flag(Tag.MISSING_SPACE, Anchor.AFTER, 1));
                }
                return STAY;
            case SWITCH_KEYWORD:
                if (previous == TokenKind.PERIOD || previous == TokenKind.BACKTICK) {
                    return List.of(goTo(AutomatonState.IDENTIFIER_BODY));
                }
                return List.of(push(ScopeKind.PENDING_SWITCH), goTo(AutomatonState.IDENTIFIER_BODY));
            case IF_DIRECTIVE:
                return List.of(push(ScopeKind.CONDITIONAL), goTo(AutomatonState.IDENTIFIER_BODY));
            case ENDIF_DIRECTIVE:
                return List.of(pop(ScopeKind.CONDITIONAL), goTo(AutomatonState.IDENTIFIER_BODY));
            case COMMENT_OPEN:
                return List.of(push(ScopeKind.COMMENT), goTo(AutomatonState.MULTI_COMMENT));
            case LINE_COMMENT:
                return List.of(goTo(AutomatonState.LINE_COMMENT));
            case OPERATOR:
            case EQUALS:
            case OPEN_ANGLE:
            case CLOSE_ANGLE:
            case QUESTION_MARK:
            case COMMENT_CLOSE:
            case BACKSLASH:
                return List.of(goTo(AutomatonState.PREFIX));
            case CASE_KEYWORD:
            case DEFAULT_KEYWORD:
            case ELSE_DIRECTIVE:
            case ELSEIF_DIRECTIVE:
            case IDENTIFIER:
            case DIGITS:
            case DOLLAR:
            case AT_SIGN:
            case BACKTICK:
            case HASH:
            case PERIOD:
            case COMBINING_MARK:
                return List.of(goTo(AutomatonState.IDENTIFIER_BODY));
            case INVALID:
                return invalid();
            case SEMICOLON:
            case END_OF_LINE:
            default:
                return STAY;
        }
    }

    /**
     * A whitespace group is judged by the first token after the whole group. Only its first run may survive.
     */
    private List<Action> spaceRun(Step step, ScopeView scopes) {
        TokenKind following = step.following();
        Action toSpaceBody = goTo(AutomatonState.SPACE_BODY);
        if (following == TokenKind.END_OF_LINE) {
            return List.of(flag(Tag.UNEXPECTED_WHITESPACE, Anchor.TOKEN, 0), toSpaceBody);
        }
        if (rejectsSpaceBefore(following, scopes)) {
            if (step.token().length() > 1) {
                return List.of(
                        flag(Tag.MULTIPLE_SPACES, Anchor.SURPLUS, 0),
                        flag(Tag.UNEXPECTED_WHITESPACE, Anchor.LAST_COLUMN, 0),
                        toSpaceBody);
            }
            return List.of(flag(Tag.UNEXPECTED_WHITESPACE, Anchor.TOKEN, 0), toSpaceBody);
        }
        if (step.afterWhitespace()) {
            return List.of(flag(Tag.UNEXPECTED_WHITESPACE, Anchor.TOKEN, 0), toSpaceBody);
        }
        if (step.token().length() > 1) {
            return List.of(flag(Tag.MULTIPLE_SPACES, Anchor.TOKEN, 1), toSpaceBody);
        }
        return List.of(toSpaceBody);
    }

    private List<Action> otherWhitespaceRun(Step step, ScopeView scopes) {
        TokenKind following = step.following();
        boolean removable = step.afterWhitespace()
                || following == TokenKind.END_OF_LINE
                || rejectsSpaceBefore(following, scopes);
        return List.of(flag(Tag.UNEXPECTED_WHITESPACE, Anchor.TOKEN, removable ? 0 : 1),
                goTo(AutomatonState.SPACE_BODY));
    }

    private List<Action> openBrace(Step step, ScopeView scopes) {
        List<Action> actions = new ArrayList<>();
        TokenKind previous = step.previous();
        boolean spaced = step.atLineStart() || step.afterWhitespace()
                || previous == TokenKind.OPEN_PAREN || previous == TokenKind.OPEN_BRACKET;
        if (!spaced) {
            actions.add(flag(Tag.MISSING_SPACE, Anchor.BEFORE, 1));
        }
        if (scopes.top() == ScopeKind.PENDING_SWITCH) {
            actions.add(promote(ScopeKind.PENDING_SWITCH, ScopeKind.SWITCH_BODY));
        } else {
            actions.add(push(ScopeKind.BRACE));
        }
        actions.add(goTo(AutomatonState.BRACE_BODY));
        return actions;
    }

    private List<Action> closeBrace(Step step) {
        List<Action> actions = new ArrayList<>();
        boolean spacedBefore = step.atLineStart() || step.afterWhitespace() || step.previous() == TokenKind.OPEN_BRACE;
        if (!spacedBefore) {
            actions.add(flag(Tag.MISSING_SPACE, Anchor.BEFORE, 1));
        }
        if (!spaceOptionalAfterCloseBrace(step.next())) {
            actions.add(flag(Tag.MISSING_SPACE, Anchor.AFTER, 1));
        }
        actions.add(pop(ScopeKind.BRACE));
        actions.add(goTo(AutomatonState.IDENTIFIER_BODY));
        return actions;
    }

    private List<Action> ternaryColon(Step step, boolean missingBefore) {
        List<Action> actions = new ArrayList<>();
        if (missingBefore) {
            actions.add(flag(Tag.MISSING_SPACE, Anchor.BEFORE, 1));
        }
        TokenKind next = step.next();
        if (!next.isWhitespace() && next != TokenKind.END_OF_LINE) {
            actions.add(flag(Tag.MISSING_SPACE, Anchor.AFTER, 1));
        }
        actions.add(pop(ScopeKind.TERNARY));
        actions.add(goTo(AutomatonState.INFIX));
        return actions;
    }

    private List<Action> spaceBody(Step step, ScopeView scopes) {
        TokenKind kind = step.kind();
        if (kind.isOperatorLike()) {
            return List.of(goTo(AutomatonState.INFIX));
        }
        if (kind == TokenKind.QUESTION_MARK) {
            if (step.next().isWhitespace()) {
                return List.of(push(ScopeKind.TERNARY), goTo(AutomatonState.INFIX));
            }
            return List.of(goTo(AutomatonState.PREFIX));
        }
        if (kind == TokenKind.COLON && scopes.top() == ScopeKind.TERNARY) {
            return ternaryColon(step, false);
        }
        return retryIn(AutomatonState.BODY);
    }

    private List<Action> identifierBody(Step step, ScopeView scopes) {
        TokenKind kind = step.kind();
        if (kind == TokenKind.OPEN_ANGLE && step.previous() == TokenKind.IDENTIFIER && opensGenericList(step.next())) {
            return List.of(push(ScopeKind.ANGLE), goTo(AutomatonState.ANGLE_BODY));
        }
        if (kind.isOperatorLike()) {
            return List.of(goTo(AutomatonState.POSTFIX));
        }
        if (kind == TokenKind.QUESTION_MARK) {
            return STAY;
        }
        if (kind == TokenKind.COLON && scopes.top() == ScopeKind.TERNARY) {
            return ternaryColon(step, true);
        }
        return retryIn(AutomatonState.BODY);
    }

    private List<Action> parenBody(Step step) {
        TokenKind kind = step.kind();
        if (kind.isWhitespace()) {
            return List.of(flag(Tag.UNEXPECTED_WHITESPACE, Anchor.TOKEN, 0), goTo(AutomatonState.BODY));
        }
        if (kind.isOperatorLike() || kind == TokenKind.QUESTION_MARK) {
            return List.of(goTo(AutomatonState.PREFIX));
        }
        return retryIn(AutomatonState.BODY);
    }

    private List<Action> braceBody(Step step) {
        TokenKind kind = step.kind();
        if (kind.isWhitespace() || kind == TokenKind.END_OF_LINE || kind == TokenKind.CLOSE_BRACE
                || kind == TokenKind.INVALID) {
            return retryIn(AutomatonState.BODY);
        }
        return List.of(flag(Tag.MISSING_SPACE, Anchor.BEFORE, 1), goTo(AutomatonState.BODY), RETRY);
    }

    private List<Action> angleBody(Step step, ScopeView scopes) {
        switch (step.kind()) {
            case OPEN_ANGLE:
                return List.of(push(ScopeKind.ANGLE));
            case CLOSE_ANGLE:
                if (step.previous() == TokenKind.OPERATOR) {
                    return STAY;
                }
                if (scopes.top() != ScopeKind.ANGLE) {
                    return abortGenericList();
                }
                if (scopes.count(ScopeKind.ANGLE) == 1) {
                    return List.of(pop(ScopeKind.ANGLE), goTo(AutomatonState.IDENTIFIER_BODY));
                }
                return List.of(pop(ScopeKind.ANGLE));
            case OPEN_PAREN:
                return List.of(push(ScopeKind.PAREN));
            case OPEN_BRACKET:
                return List.of(push(ScopeKind.BRACKET));
            case CLOSE_PAREN:
                return scopes.top() == ScopeKind.PAREN ? List.of(pop(ScopeKind.PAREN)) : abortGenericList();
            case CLOSE_BRACKET:
                return scopes.top() == ScopeKind.BRACKET ? List.of(pop(ScopeKind.BRACKET)) : abortGenericList();
            case OPEN_BRACE:
            case CLOSE_BRACE:
            case SEMICOLON:
            case QUOTE:
            case COMMENT_OPEN:
            case LINE_COMMENT:
            case END_OF_LINE:
                return abortGenericList();
            case INVALID:
                return invalid();
            default:
                return STAY;
        }
    }

    private List<Action> postfix(Step step) {
        TokenKind kind = step.kind();
        if (kind.isOperatorLike()) {
            return STAY;
        }
        List<Action> actions = new ArrayList<>();
        if (step.binaryRun()) {
            actions.add(flag(Tag.MISSING_SPACE, Anchor.RUN_START, 1));
            if (kind.startsOperand()) {
                actions.add(flag(Tag.MISSING_SPACE, Anchor.ASSIGNMENT_END, 1));
            }
        }
        actions.add(goTo(AutomatonState.BODY));
        actions.add(RETRY);
        return actions;
    }

    private List<Action> infix(Step step) {
        TokenKind kind = step.kind();
        if (kind.isOperatorLike()) {
            return STAY;
        }
        if (step.binaryRun() && kind.startsOperand()) {
            return List.of(flag(Tag.MISSING_SPACE, Anchor.ASSIGNMENT_END, 1), goTo(AutomatonState.BODY), RETRY);
        }
        return retryIn(AutomatonState.BODY);
    }

    private List<Action> prefix(Step step) {
        TokenKind kind = step.kind();
        if (kind.isOperatorLike() || kind == TokenKind.QUESTION_MARK) {
            return STAY;
        }
        return retryIn(AutomatonState.BODY);
    }

    private List<Action> literal(Step step) {
        switch (step.kind()) {
            case QUOTE:
                return List.of(pop(ScopeKind.STRING), goTo(AutomatonState.IDENTIFIER_BODY));
            case BACKSLASH:
                return List.of(goTo(AutomatonState.ESCAPE));
            case INVALID:
                return invalid();
            default:
                return STAY;
        }
    }

    private List<Action> escape(Step step) {
        switch (step.kind()) {
            case OPEN_PAREN:
                return List.of(push(ScopeKind.INTERPOLATION), goTo(AutomatonState.PAREN_BODY));
            case END_OF_LINE:
                return retryIn(AutomatonState.LITERAL);
            case INVALID:
                return List.of(flag(Tag.INVALID_CHARACTER, Anchor.TOKEN, 0), goTo(AutomatonState.LITERAL));
            default:
                return List.of(goTo(AutomatonState.LITERAL));
        }
    }

    private List<Action> multiComment(Step step, ScopeView scopes) {
        switch (step.kind()) {
            case COMMENT_OPEN:
                return List.of(push(ScopeKind.COMMENT));
            case COMMENT_CLOSE:
                if (scopes.count(ScopeKind.COMMENT) <= 1) {
                    return List.of(pop(ScopeKind.COMMENT), goTo(AutomatonState.BODY));
                }
                return List.of(pop(ScopeKind.COMMENT));
            case INVALID:
                return invalid();
            default:
                return STAY;
        }
    }

    private static List<Action> invalid() {
        return List.of(flag(Tag.INVALID_CHARACTER, Anchor.TOKEN, 0));
    }

    private static List<Action> retryIn(AutomatonState state) {
        return List.of(goTo(state), RETRY);
    }

    private static List<Action> abortGenericList() {
        return List.of(discard(ScopeKind.ANGLE), goTo(AutomatonState.BODY), RETRY);
    }

    private static boolean rejectsSpaceBefore(TokenKind next, ScopeView scopes) {
        return next == TokenKind.COMMA
                || next == TokenKind.CLOSE_PAREN
                || next == TokenKind.CLOSE_BRACKET
                || (next == TokenKind.COLON && scopes.top() != ScopeKind.TERNARY);
    }

    private static boolean spaceOptionalAfterColon(TokenKind next) {
        return next.isWhitespace()
                || next == TokenKind.END_OF_LINE
                || next == TokenKind.CLOSE_PAREN
                || next == TokenKind.CLOSE_BRACKET
                || next == TokenKind.COLON;
    }

    /**
     * Colon inside a compound name such as {@code foo(_:bar:)}, where the next label ends in a colon too.
     */
    private static boolean beforeArgumentLabel(Step step) {
        return step.next() == TokenKind.IDENTIFIER && step.afterNext() == TokenKind.COLON;
    }

    private static boolean spaceOptionalAfterComma(TokenKind next) {
        return next.isWhitespace()
                || next == TokenKind.END_OF_LINE
                || next == TokenKind.CLOSE_PAREN
                || next == TokenKind.CLOSE_BRACKET;
    }

    private static boolean spaceOptionalAfterCloseBrace(TokenKind next) {
        return next.isWhitespace()
                || next == TokenKind.END_OF_LINE
                || next.isCloser()
                || next == TokenKind.OPEN_PAREN
                || next == TokenKind.COMMA
                || next == TokenKind.PERIOD
                || next == TokenKind.SEMICOLON
                || next == TokenKind.QUESTION_MARK;
    }

    private static boolean opensGenericList(TokenKind next) {
        return next == TokenKind.IDENTIFIER
                || next == TokenKind.OPEN_PAREN
                || next == TokenKind.OPEN_BRACKET
                || next == TokenKind.AT_SIGN;
    }
}
