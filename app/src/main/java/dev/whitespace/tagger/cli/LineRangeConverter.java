package dev.whitespace.tagger.cli;

import dev.whitespace.tagger.document.LineRange;
import picocli.CommandLine;

/**
 * Parses {@code --lines START:END}.
 */
public class LineRangeConverter implements CommandLine.ITypeConverter<LineRange> {

    @Override
    public LineRange convert(String value) {
        try {
            return LineRange.parse(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage());
        }
    }
}
