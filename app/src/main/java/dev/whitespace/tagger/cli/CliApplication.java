package dev.whitespace.tagger.cli;

import dev.whitespace.tagger.config.Config;
import dev.whitespace.tagger.config.ConfigLoader;
import dev.whitespace.tagger.config.SystemEnvironmentReader;
import dev.whitespace.tagger.document.DocumentProcessor;
import dev.whitespace.tagger.document.DocumentReport;
import dev.whitespace.tagger.document.SourceFile;
import dev.whitespace.tagger.document.SourceFileFinder;
import dev.whitespace.tagger.git.WorkTreeException;
import dev.whitespace.tagger.git.WorkingTreeScanner;
import dev.whitespace.tagger.logging.LoggingConfigurator;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and document processing.
 */
public final class CliApplication {

    static final int EXIT_OK = 0;
    static final int EXIT_VIOLATIONS = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO_FAILURE = 3;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final SourceFileFinder sourceFileFinder;
    private final WorkingTreeScanner workingTreeScanner;
    private final DocumentProcessor documentProcessor;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new SourceFileFinder(), new WorkingTreeScanner(),
                new DocumentProcessor(), new PrintWriter(System.out, true), new PrintWriter(System.err, true));
    }

    CliApplication(ConfigLoader configLoader,
                   SourceFileFinder sourceFileFinder,
                   WorkingTreeScanner workingTreeScanner,
                   DocumentProcessor documentProcessor,
                   PrintWriter out,
                   PrintWriter err) {
        this.configLoader = configLoader;
        this.sourceFileFinder = sourceFileFinder;
        this.workingTreeScanner = workingTreeScanner;
        this.documentProcessor = documentProcessor;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            err.println(ex.getMessage());
            commandLine.usage(err);
            err.flush();
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            out.flush();
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            out.flush();
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            err.flush();
            return EXIT_USAGE;
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Running in {} mode with {} indentation", config.mode(), config.indentationStyle());

        List<SourceFile> files;
        try {
            files = resolveFiles(config);
        } catch (UncheckedIOException | WorkTreeException ex) {
            LOGGER.error("Unable to determine files to check: {}", ex.getMessage());
            err.println(ex.getMessage());
            err.flush();
            return EXIT_IO_FAILURE;
        }
        LOGGER.info("Checking {} files", files.size());

        ReportPrinter printer = new ReportPrinter(out);
        List<DocumentReport> reports = new ArrayList<>();
        int failures = 0;
        for (SourceFile file : files) {
            try (MDC.MDCCloseable ignored = MDC.putCloseable("file", file.relativePath())) {
                DocumentReport report = documentProcessor.process(file.root(), file.relativePath(),
                        config.indentationStyle(), config.mode(), config.lineRange());
                reports.add(report);
                printer.print(config.mode(), report);
            } catch (UncheckedIOException ex) {
                failures++;
                LOGGER.error("Failed to process {}", file.path(), ex);
            }
        }
        printer.printSummary(config.mode(), reports, failures);

        if (failures > 0) {
            LOGGER.warn("{} files could not be processed", failures);
            return EXIT_IO_FAILURE;
        }
        boolean violations = reports.stream().anyMatch(report -> !report.clean());
        if (!config.mode().isCorrect() && violations) {
            return EXIT_VIOLATIONS;
        }
        return EXIT_OK;
    }

    private List<SourceFile> resolveFiles(Config config) {
        if (!config.changedOnly()) {
            return sourceFileFinder.find(config.paths(), config.extensions());
        }
        Path root = config.paths().isEmpty() ? Path.of(".") : config.paths().get(0);
        return workingTreeScanner.changedFiles(root, config.extensions()).stream()
                .map(relativePath -> new SourceFile(root, relativePath))
                .collect(Collectors.toList());
    }
}
