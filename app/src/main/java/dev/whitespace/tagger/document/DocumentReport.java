package dev.whitespace.tagger.document;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of processing one file.
 *
 * @param path       file path as it should be shown to the user
 * @param selections violations found, or ranges rewritten in correct mode
 * @param rewritten  whether the file was written back
 */
public record DocumentReport(String path, List<LineSelection> selections, boolean rewritten) {

    public DocumentReport {
        Objects.requireNonNull(path, "path");
        selections = List.copyOf(selections);
    }

    public boolean clean() {
        return selections.isEmpty();
    }

    public long affectedLineCount() {
        return selections.stream().mapToInt(LineSelection::line).distinct().count();
    }
}
