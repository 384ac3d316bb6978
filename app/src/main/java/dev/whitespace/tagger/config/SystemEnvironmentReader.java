package dev.whitespace.tagger.config;

import java.util.Optional;

/**
 * Reads {@code WHITESPACE_*} settings from the process environment.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(System.getenv(key)).filter(value -> !value.isBlank());
    }
}
