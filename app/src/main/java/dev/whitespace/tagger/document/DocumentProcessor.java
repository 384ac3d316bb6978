package dev.whitespace.tagger.document;

import dev.whitespace.tagger.config.Mode;
import dev.whitespace.tagger.tagging.IndentationStyle;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads one file, runs the {@link LineProcessor} over it and writes it back when correct mode changed it.
 */
public class DocumentProcessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentProcessor.class);

    private final DocumentReader reader;
    private final DocumentWriter writer;
    private final LineProcessor lineProcessor;

    public DocumentProcessor() {
        this(new DocumentReader(), new DocumentWriter(), new LineProcessor());
    }

    public DocumentProcessor(DocumentReader reader, DocumentWriter writer, LineProcessor lineProcessor) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.lineProcessor = Objects.requireNonNull(lineProcessor, "lineProcessor");
    }

    public DocumentReport process(Path root, String relativePath, IndentationStyle style, Mode mode, LineRange limit) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(relativePath, "relativePath");
        Path file = root.resolve(relativePath);
        List<String> lines = reader.read(file);
        ProcessingResult result = lineProcessor.process(lines, style, mode, limit);
        LOGGER.debug("Processed {} lines, {} selections", lines.size(), result.selections().size());

        boolean rewritten = false;
        if (mode.isCorrect() && !result.lines().equals(lines)) {
            writer.write(root, relativePath, result.lines());
            rewritten = true;
        }
        return new DocumentReport(file.normalize().toString(), result.selections(), rewritten);
    }
}
