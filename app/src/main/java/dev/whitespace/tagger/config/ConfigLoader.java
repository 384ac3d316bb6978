package dev.whitespace.tagger.config;

import dev.whitespace.tagger.cli.CliArguments;
import dev.whitespace.tagger.tagging.IndentationStyle;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_MODE = "WHITESPACE_MODE";
    static final String ENV_INDENT_STYLE = "WHITESPACE_INDENT_STYLE";
    static final String ENV_INDENT_WIDTH = "WHITESPACE_INDENT_WIDTH";
    static final String ENV_EXTENSIONS = "WHITESPACE_EXTENSIONS";
    static final String ENV_LOG_FORMAT = "WHITESPACE_LOG_FORMAT";

    private static final int DEFAULT_INDENT_WIDTH = 4;
    private static final List<String> DEFAULT_EXTENSIONS = List.of("swift");

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Mode mode = resolveMode(arguments);
        IndentationStyle style = resolveIndentationStyle(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);

        List<String> extensions = arguments.extensions();
        if (extensions == null || extensions.isEmpty()) {
            extensions = environmentReader.get(ENV_EXTENSIONS)
                    .filter(ConfigLoader::isNotBlank)
                    .map(ConfigLoader::parseExtensions)
                    .orElse(DEFAULT_EXTENSIONS);
        }

        List<Path> paths = arguments.paths();
        if (!arguments.changedOnly() && paths.isEmpty()) {
            paths = List.of(Path.of("."));
        }

        return new Config(mode, style, arguments.lineRange(), arguments.changedOnly(),
                new LinkedHashSet<>(extensions), logFormat, paths);
    }

    private Mode resolveMode(CliArguments arguments) {
        Mode cliMode = arguments.mode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.get(ENV_MODE)
                .map(Mode::from)
                .orElse(Mode.DETECT);
    }

    private IndentationStyle resolveIndentationStyle(CliArguments arguments) {
        IndentKind kind = arguments.indentKind();
        if (kind == null) {
            kind = environmentReader.get(ENV_INDENT_STYLE)
                    .map(IndentKind::from)
                    .orElse(IndentKind.TABS);
        }
        if (kind == IndentKind.TABS) {
            return IndentationStyle.tabs();
        }
        Integer width = arguments.indentWidth();
        if (width == null) {
            width = environmentReader.get(ENV_INDENT_WIDTH)
                    .filter(ConfigLoader::isNotBlank)
                    .map(String::trim)
                    .map(ConfigLoader::parseWidth)
                    .orElse(DEFAULT_INDENT_WIDTH);
        }
        if (width < 1) {
            throw new IllegalArgumentException("--indent-width must be greater than zero");
        }
        return IndentationStyle.spaces(width);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private static int parseWidth(String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_INDENT_WIDTH + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static List<String> parseExtensions(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .collect(Collectors.toList());
    }
}
