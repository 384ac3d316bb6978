package dev.whitespace.tagger.correct;

/**
 * Column range of a corrected line that differs from the source line.
 */
public record ChangedRange(int start, int end) {

    public ChangedRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid range: [" + start + ", " + end + ")");
        }
    }
}
