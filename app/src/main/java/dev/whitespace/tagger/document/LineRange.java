package dev.whitespace.tagger.document;

/**
 * Zero-based half-open range of line indices. An empty range places no limit, matching an editor selection
 * that covers nothing.
 */
public record LineRange(int start, int endExclusive) {

    private static final LineRange ALL = new LineRange(0, 0);

    public LineRange {
        if (start < 0 || endExclusive < start) {
            throw new IllegalArgumentException("Invalid line range: " + start + ".." + endExclusive);
        }
    }

    public static LineRange all() {
        return ALL;
    }

    /**
     * Parses {@code START:END}, one-based and inclusive on both ends. Either bound may be omitted.
     */
    public static LineRange parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return ALL;
        }
        String value = raw.trim();
        int separator = value.indexOf(':');
        if (separator < 0) {
            int line = parseLine(value);
            return new LineRange(line - 1, line);
        }
        String first = value.substring(0, separator).trim();
        String last = value.substring(separator + 1).trim();
        int start = first.isEmpty() ? 1 : parseLine(first);
        int end = last.isEmpty() ? Integer.MAX_VALUE : parseLine(last);
        if (end < start) {
            throw new IllegalArgumentException("Line range end precedes its start: " + raw);
        }
        return new LineRange(start - 1, end);
    }

    public boolean isUnbounded() {
        return start == endExclusive;
    }

    public boolean contains(int line) {
        return isUnbounded() || (line >= start && line < endExclusive);
    }

    private static int parseLine(String raw) {
        try {
            int line = Integer.parseInt(raw);
            if (line < 1) {
                throw new IllegalArgumentException("Line numbers start at 1: " + raw);
            }
            return line;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid line number: " + raw, ex);
        }
    }
}
