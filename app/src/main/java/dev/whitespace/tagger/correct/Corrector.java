package dev.whitespace.tagger.correct;

import dev.whitespace.tagger.tagging.IndentationStyle;
import dev.whitespace.tagger.tagging.Tag;
import dev.whitespace.tagger.tagging.TaggedRegion;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Rewrites a line so that every tagged region holds exactly its expected whitespace.
 */
public final class Corrector {

    private Corrector() {
    }

    /**
     * Applies {@code regions} to {@code text}. Each region is replaced by {@code expectedWidth} tabs for an
     * indentation region under tab style, or spaces otherwise. When no region inserts anything the whole
     * corrected line is reported as changed.
     */
    public static Correction apply(String text, List<TaggedRegion> regions, IndentationStyle style) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(regions, "regions");
        Objects.requireNonNull(style, "style");

        int[] codePoints = text.codePoints().toArray();
        int contentEnd = contentEnd(codePoints);
        List<TaggedRegion> ordered = new ArrayList<>(regions);
        ordered.sort(Comparator.comparingInt(TaggedRegion::start).thenComparingInt(TaggedRegion::end));

        StringBuilder corrected = new StringBuilder(text.length());
        List<ChangedRange> changed = new ArrayList<>();
        int cursor = 0;
        int offset = 0;
        for (TaggedRegion region : ordered) {
            int start = Math.min(Math.max(region.start(), cursor), contentEnd);
            int end = Math.max(start, Math.min(region.end(), contentEnd));
            corrected.append(new String(codePoints, cursor, start - cursor));
            char filler = region.tag() == Tag.INCORRECT_INDENT ? style.indentCharacter() : ' ';
            corrected.append(String.valueOf(filler).repeat(region.expectedWidth()));
            if (region.expectedWidth() > 0) {
                changed.add(new ChangedRange(start + offset, start + offset + region.expectedWidth()));
            }
            offset += region.expectedWidth() - (end - start);
            cursor = end;
        }
        corrected.append(new String(codePoints, cursor, codePoints.length - cursor));

        if (changed.isEmpty()) {
            changed.add(new ChangedRange(0, contentEnd + offset));
        }
        return new Correction(corrected.toString(), changed);
    }

    private static int contentEnd(int[] codePoints) {
        for (int index = 0; index < codePoints.length; index++) {
            if (codePoints[index] == '\n' || codePoints[index] == '\r') {
                return index;
            }
        }
        return codePoints.length;
    }
}
