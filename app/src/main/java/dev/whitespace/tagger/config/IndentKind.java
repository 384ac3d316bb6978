package dev.whitespace.tagger.config;

/**
 * Character used for indentation, as named on the command line and in the environment.
 */
public enum IndentKind {
    TABS,
    SPACES;

    public static IndentKind from(String raw) {
        if (raw == null || raw.isBlank()) {
            return TABS;
        }
        for (IndentKind kind : values()) {
            if (kind.name().equalsIgnoreCase(raw.trim())) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported indentation style: " + raw);
    }
}
