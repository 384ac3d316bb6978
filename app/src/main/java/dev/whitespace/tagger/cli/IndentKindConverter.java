package dev.whitespace.tagger.cli;

import dev.whitespace.tagger.config.IndentKind;
import picocli.CommandLine;

public class IndentKindConverter implements CommandLine.ITypeConverter<IndentKind> {

    @Override
    public IndentKind convert(String value) {
        return IndentKind.from(value);
    }
}
