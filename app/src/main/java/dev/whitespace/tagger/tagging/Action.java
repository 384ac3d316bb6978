package dev.whitespace.tagger.tagging;

import java.util.Objects;

/**
 * Effects requested by the {@link TransitionTable} for one token. The {@link WhitespaceTagger} applies them in
 * order.
 */
public interface Action {

    Action RETRY = new Retry();

    static Action flag(Tag tag, Anchor anchor, int expectedWidth) {
        return new Flag(tag, anchor, expectedWidth);
    }

    static Action flagAt(TaggedRegion region) {
        return new FlagAt(region);
    }

    static Action push(ScopeKind kind) {
        return new Push(kind);
    }

    static Action pop(ScopeKind kind) {
        return new Pop(kind);
    }

    static Action promote(ScopeKind from, ScopeKind to) {
        return new Promote(from, to);
    }

    static Action discard(ScopeKind kind) {
        return new Discard(kind);
    }

    static Action goTo(AutomatonState state) {
        return new Goto(state);
    }

    /**
     * Where a flagged region sits relative to the current step.
     */
    enum Anchor {
        /** The whole current token. */
        TOKEN,
        /** Insertion point at the start of the current token. */
        BEFORE,
        /** Insertion point at the end of the current token. */
        AFTER,
        /** All columns of the current token except the last one. */
        SURPLUS,
        /** The last column of the current token. */
        LAST_COLUMN,
        /** Insertion point at the start of the current operator run. */
        RUN_START,
        /** Insertion point after the last {@code =} of the current operator run. */
        ASSIGNMENT_END;

        TaggedRegion resolve(Step step, Tag tag, int expectedWidth) {
            int start = step.token().start();
            int end = step.token().end();
            return switch (this) {
                case TOKEN -> new TaggedRegion(start, end, tag, expectedWidth);
                case BEFORE -> new TaggedRegion(start, start, tag, expectedWidth);
                case AFTER -> new TaggedRegion(end, end, tag, expectedWidth);
                case SURPLUS -> new TaggedRegion(start, end - 1, tag, expectedWidth);
                case LAST_COLUMN -> new TaggedRegion(end - 1, end, tag, expectedWidth);
                case RUN_START -> new TaggedRegion(step.runStart(), step.runStart(), tag, expectedWidth);
                case ASSIGNMENT_END -> new TaggedRegion(step.assignmentEnd(), step.assignmentEnd(), tag, expectedWidth);
            };
        }
    }

    /**
     * Records a region positioned relative to the current step.
     */
    record Flag(Tag tag, Anchor anchor, int expectedWidth) implements Action {

        public Flag {
            Objects.requireNonNull(tag, "tag");
            Objects.requireNonNull(anchor, "anchor");
        }

        public TaggedRegion regionFor(Step step) {
            return anchor.resolve(step, tag, expectedWidth);
        }
    }

    /**
     * Records a region computed up front, such as an indentation mismatch.
     */
    record FlagAt(TaggedRegion region) implements Action {

        public FlagAt {
            Objects.requireNonNull(region, "region");
        }
    }

    record Push(ScopeKind kind) implements Action {

        public Push {
            Objects.requireNonNull(kind, "kind");
        }
    }

    record Pop(ScopeKind kind) implements Action {

        public Pop {
            Objects.requireNonNull(kind, "kind");
        }
    }

    record Promote(ScopeKind from, ScopeKind to) implements Action {

        public Promote {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
        }
    }

    /**
     * Drops the outermost scope of the kind and everything above it.
     */
    record Discard(ScopeKind kind) implements Action {

        public Discard {
            Objects.requireNonNull(kind, "kind");
        }
    }

    record Goto(AutomatonState state) implements Action {

        public Goto {
            Objects.requireNonNull(state, "state");
        }
    }

    /**
     * Presents the current token again under the state selected by a preceding {@link Goto}.
     */
    record Retry() implements Action {
    }
}
