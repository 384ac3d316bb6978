package dev.whitespace.tagger.cli;

import dev.whitespace.tagger.config.Mode;
import dev.whitespace.tagger.document.DocumentReport;
import dev.whitespace.tagger.document.LineSelection;
import dev.whitespace.tagger.tagging.Tag;
import java.io.PrintWriter;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Prints per-file results and the run summary to standard output. Lines and columns are one-based; a selection
 * prints as {@code path:line:start-end: TAGS} with {@code end} exclusive.
 */
class ReportPrinter {

    private final PrintWriter out;

    ReportPrinter(PrintWriter out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    void print(Mode mode, DocumentReport report) {
        if (mode.isCorrect()) {
            if (report.rewritten()) {
                out.printf("%s: corrected %d lines%n", report.path(), report.affectedLineCount());
            }
            return;
        }
        for (LineSelection selection : report.selections()) {
            out.printf("%s:%d:%d-%d: %s%n", report.path(), selection.line() + 1,
                    selection.start() + 1, selection.end() + 1, describe(selection.tags()));
        }
    }

    void printSummary(Mode mode, List<DocumentReport> reports, int failures) {
        long affectedFiles = reports.stream().filter(report -> !report.clean()).count();
        long affectedLines = reports.stream().mapToLong(DocumentReport::affectedLineCount).sum();
        String verb = mode.isCorrect() ? "Corrected" : "Found violations on";
        out.printf("%s %d lines in %d of %d files%n", verb, affectedLines, affectedFiles, reports.size() + failures);
        if (failures > 0) {
            out.printf("%d files could not be processed%n", failures);
        }
        out.flush();
    }

    private static String describe(List<Tag> tags) {
        return tags.stream().map(Tag::name).collect(Collectors.joining(","));
    }
}
