package dev.whitespace.tagger.document;

import java.util.List;

/**
 * Lines of a document after processing, together with the selections produced for them.
 */
public record ProcessingResult(List<String> lines, List<LineSelection> selections) {

    public ProcessingResult {
        lines = List.copyOf(lines);
        selections = List.copyOf(selections);
    }

    public boolean hasSelections() {
        return !selections.isEmpty();
    }
}
