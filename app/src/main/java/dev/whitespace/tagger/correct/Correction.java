package dev.whitespace.tagger.correct;

import java.util.List;
import java.util.Objects;

/**
 * Result of correcting one line.
 *
 * @param correctedText the rewritten line, including its original terminator
 * @param changedRanges columns of {@code correctedText} that were rewritten
 */
public record Correction(String correctedText, List<ChangedRange> changedRanges) {

    public Correction {
        Objects.requireNonNull(correctedText, "correctedText");
        changedRanges = List.copyOf(changedRanges);
    }

    public boolean changes(String original) {
        return !correctedText.equals(original);
    }
}
