package dev.whitespace.tagger.document;

import dev.whitespace.tagger.tagging.Tag;
import java.util.List;

/**
 * Columns of one line to highlight: a violation in detect mode, a rewritten range in correct mode.
 *
 * @param line  zero-based line index
 * @param start first selected column
 * @param end   column after the selection
 * @param tags  violations the selection stands for
 */
public record LineSelection(int line, int start, int end, List<Tag> tags) {

    public LineSelection {
        if (line < 0 || start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid selection: line " + line + " [" + start + ", " + end + ")");
        }
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
