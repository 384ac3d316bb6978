package dev.whitespace.tagger.document;

import dev.whitespace.tagger.config.Mode;
import dev.whitespace.tagger.correct.ChangedRange;
import dev.whitespace.tagger.correct.Correction;
import dev.whitespace.tagger.correct.Corrector;
import dev.whitespace.tagger.tagging.IndentationStyle;
import dev.whitespace.tagger.tagging.Tag;
import dev.whitespace.tagger.tagging.TaggedRegion;
import dev.whitespace.tagger.tagging.WhitespaceTagger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Runs a fresh tagger over every line of a document and either reports or corrects what it finds.
 */
public class LineProcessor {

    /**
     * Processes {@code lines} in order. The whole document is always tagged so that scope state is right for
     * every line; {@code limit} only restricts which lines correct mode rewrites.
     */
    public ProcessingResult process(List<String> lines, IndentationStyle style, Mode mode, LineRange limit) {
        Objects.requireNonNull(lines, "lines");
        Objects.requireNonNull(style, "style");
        Objects.requireNonNull(mode, "mode");
        LineRange range = limit == null ? LineRange.all() : limit;

        WhitespaceTagger tagger = WhitespaceTagger.newTagger(style);
        List<String> output = new ArrayList<>(lines);
        List<LineSelection> selections = new ArrayList<>();
        for (int index = 0; index < lines.size(); index++) {
            String line = lines.get(index);
            List<TaggedRegion> regions = tagger.parseLine(line);
            if (regions.isEmpty()) {
                continue;
            }
            if (mode.isCorrect()) {
                if (!range.contains(index)) {
                    continue;
                }
                Correction correction = Corrector.apply(line, regions, style);
                output.set(index, correction.correctedText());
                List<Tag> tags = distinctTags(regions);
                for (ChangedRange changed : correction.changedRanges()) {
                    selections.add(new LineSelection(index, changed.start(), changed.end(), tags));
                }
            } else if (regions.stream().anyMatch(TaggedRegion::isInsertion)) {
                selections.add(new LineSelection(index, 0, contentLength(line), distinctTags(regions)));
            } else {
                for (TaggedRegion region : regions) {
                    selections.add(new LineSelection(index, region.start(), region.end(), List.of(region.tag())));
                }
            }
        }
        return new ProcessingResult(output, selections);
    }

    private static List<Tag> distinctTags(List<TaggedRegion> regions) {
        return regions.stream().map(TaggedRegion::tag).distinct().collect(Collectors.toList());
    }

    private static int contentLength(String line) {
        int length = 0;
        for (int index = 0; index < line.length(); ) {
            int codePoint = line.codePointAt(index);
            if (codePoint == '\n' || codePoint == '\r') {
                break;
            }
            length++;
            index += Character.charCount(codePoint);
        }
        return length;
    }
}
