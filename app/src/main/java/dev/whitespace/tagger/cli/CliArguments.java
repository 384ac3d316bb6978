package dev.whitespace.tagger.cli;

import dev.whitespace.tagger.config.IndentKind;
import dev.whitespace.tagger.config.LogFormat;
import dev.whitespace.tagger.config.Mode;
import dev.whitespace.tagger.document.LineRange;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "whitespace-tagger", mixinStandardHelpOptions = true, version = "whitespace-tagger 0.1.0",
        description = "Detects and corrects whitespace style violations in source files")
public class CliArguments {

    @CommandLine.Option(names = "--mode", converter = ModeConverter.class, description = "Execution mode: detect or correct")
    private Mode mode;

    @CommandLine.Option(names = "--indent", converter = IndentKindConverter.class, description = "Indentation style: tabs or spaces", paramLabel = "STYLE")
    private IndentKind indentKind;

    @CommandLine.Option(names = "--indent-width", description = "Spaces per indentation level when indenting with spaces", paramLabel = "N")
    private Integer indentWidth;

    @CommandLine.Option(names = "--lines", converter = LineRangeConverter.class, description = "Lines correct mode may rewrite, one-based and inclusive", paramLabel = "START:END")
    private LineRange lineRange;

    @CommandLine.Option(names = "--changed", description = "Check the added, modified and untracked files of a Git work tree")
    private boolean changedOnly;

    @CommandLine.Option(names = "--extensions", split = ",", description = "File extensions to check when scanning directories", paramLabel = "EXT")
    private List<String> extensions;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Parameters(paramLabel = "PATH", arity = "0..*", description = "Files or directories to check")
    private List<Path> paths = new ArrayList<>();

    public Mode mode() {
        return mode;
    }

    public IndentKind indentKind() {
        return indentKind;
    }

    public Integer indentWidth() {
        return indentWidth;
    }

    public LineRange lineRange() {
        return lineRange;
    }

    public boolean changedOnly() {
        return changedOnly;
    }

    public List<String> extensions() {
        return extensions;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public List<Path> paths() {
        return paths == null ? List.of() : paths;
    }
}
