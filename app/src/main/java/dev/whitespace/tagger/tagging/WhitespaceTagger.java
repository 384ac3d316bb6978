package dev.whitespace.tagger.tagging;

import dev.whitespace.tagger.lexer.Token;
import dev.whitespace.tagger.lexer.TokenKind;
import dev.whitespace.tagger.lexer.Tokenizer;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tags whitespace violations line by line. A tagger carries its automaton state and scope stack from one
 * {@link #parseLine(String)} call to the next, so one instance must be fed the lines of a single file in order.
 */
public class WhitespaceTagger {

    private static final Logger LOGGER = LoggerFactory.getLogger(WhitespaceTagger.class);

    private final IndentationStyle style;
    private final TransitionTable table;
    private final ScopeStack scopes = new ScopeStack();
    private final RegionTagger regions = new RegionTagger();
    private AutomatonState state = AutomatonState.INDENT;

    public WhitespaceTagger(IndentationStyle style) {
        this.style = Objects.requireNonNull(style, "style");
        this.table = new TransitionTable(style);
    }

    public static WhitespaceTagger newTagger(IndentationStyle style) {
        return new WhitespaceTagger(style);
    }

    /**
     * Processes the next line of the file.
     *
     * @param text line content, optionally ending with its terminator
     * @return violations found on this line, sorted by start column
     */
    public List<TaggedRegion> parseLine(String text) {
        Objects.requireNonNull(text, "text");
        Tokenizer tokenizer = new Tokenizer(text);
        scopes.markLine();
        state = entryState();

        TokenKind previous = null;
        int runStart = 0;
        int assignmentEnd = -1;
        AutomatonState retriedState = null;
        Token retriedToken = null;

        Token token = tokenizer.next();
        while (true) {
            if (!state.isOperatorRun()) {
                runStart = token.start();
                assignmentEnd = -1;
            }
            if (token.kind() == TokenKind.EQUALS) {
                assignmentEnd = token.end();
            }
            Step step = new Step(token, previous, tokenizer.peek().kind(), tokenizer.peekSecond(),
                    tokenizer.peekPastWhitespace(), runStart, assignmentEnd);
            AutomatonState from = state;
            if (apply(table.select(from, step, scopes), step)) {
                if (from == retriedState && token.equals(retriedToken)) {
                    throw new IllegalStateException("Transition loop in state " + from + " at " + token);
                }
                retriedState = from;
                retriedToken = token;
                continue;
            }
            retriedState = null;
            retriedToken = null;
            if (token.kind() == TokenKind.END_OF_LINE) {
                break;
            }
            if (!from.isIndentation()) {
                previous = token.kind();
            }
            token = tokenizer.next();
        }

        scopes.truncateAbove(ScopeKind.STRING);
        scopes.shadowSinceMark();
        return regions.drain();
    }

    public IndentationStyle style() {
        return style;
    }

    /**
     * State the automaton ended the last line in.
     */
    public AutomatonState state() {
        return state;
    }

    /**
     * Scopes left open after the last line, innermost last.
     */
    public List<ScopeKind> scopes() {
        return scopes.snapshot();
    }

    private AutomatonState entryState() {
        if (scopes.contains(ScopeKind.COMMENT)) {
            return AutomatonState.MULTI_COMMENT;
        }
        if (scopes.top() == ScopeKind.STRING) {
            return AutomatonState.LITERAL;
        }
        return AutomatonState.INDENT;
    }

    private boolean apply(List<Action> actions, Step step) {
        boolean retry = false;
        for (Action action : actions) {
            if (action instanceof Action.Flag flag) {
                regions.record(flag.regionFor(step));
            } else if (action instanceof Action.FlagAt flagAt) {
                regions.record(flagAt.region());
            } else if (action instanceof Action.Push push) {
                scopes.push(push.kind());
            } else if (action instanceof Action.Pop pop) {
                if (!scopes.pop(pop.kind())) {
                    LOGGER.trace("Unbalanced {} at column {}, open scopes {}", step.kind(), step.token().start(), scopes);
                }
            } else if (action instanceof Action.Promote promote) {
                scopes.promote(promote.from(), promote.to());
            } else if (action instanceof Action.Discard discard) {
                scopes.discardFrom(discard.kind());
            } else if (action instanceof Action.Goto target) {
                state = target.state();
            } else if (action instanceof Action.Retry) {
                retry = true;
            }
        }
        return retry;
    }
}
