package dev.whitespace.tagger.tagging;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Collects the regions flagged while one line is processed.
 */
public class RegionTagger {

    private static final Comparator<TaggedRegion> BY_POSITION =
            Comparator.comparingInt(TaggedRegion::start).thenComparingInt(TaggedRegion::end);

    private final List<TaggedRegion> regions = new ArrayList<>();
    private boolean indentTagged;

    /**
     * Adds a region. A second indentation region on the same line and exact duplicates are ignored.
     */
    public void record(TaggedRegion region) {
        if (region.tag() == Tag.INCORRECT_INDENT) {
            if (indentTagged) {
                return;
            }
            indentTagged = true;
        }
        if (!regions.contains(region)) {
            regions.add(region);
        }
    }

    /**
     * Returns the recorded regions sorted by position and starts a new line.
     */
    public List<TaggedRegion> drain() {
        List<TaggedRegion> sorted = new ArrayList<>(regions);
        sorted.sort(BY_POSITION);
        regions.clear();
        indentTagged = false;
        return List.copyOf(sorted);
    }
}
