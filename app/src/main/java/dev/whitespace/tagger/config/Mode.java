package dev.whitespace.tagger.config;

/**
 * What the CLI does with the violations it finds.
 */
public enum Mode {
    DETECT,
    CORRECT;

    public static Mode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return DETECT;
        }
        for (Mode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported mode: " + raw);
    }

    public boolean isCorrect() {
        return this == CORRECT;
    }
}
