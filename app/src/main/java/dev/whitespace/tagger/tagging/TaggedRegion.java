package dev.whitespace.tagger.tagging;

import java.util.Objects;

/**
 * A half-open column range of a line that violates a whitespace rule. A region with {@code start == end}
 * marks an insertion point. {@code expectedWidth} is the number of whitespace characters that should
 * replace the range.
 */
public record TaggedRegion(int start, int end, Tag tag, int expectedWidth) {

    public TaggedRegion {
        Objects.requireNonNull(tag, "tag");
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid region boundaries: [" + start + ", " + end + ")");
        }
        if (expectedWidth < 0) {
            throw new IllegalArgumentException("expectedWidth must be zero or greater");
        }
    }

    public boolean isInsertion() {
        return start == end;
    }

    public int width() {
        return end - start;
    }
}
