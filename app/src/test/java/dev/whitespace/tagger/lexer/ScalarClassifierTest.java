package dev.whitespace.tagger.lexer;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ScalarClassifierTest {

    @Test
    void classifiesAsciiPunctuationIndividually() {
        assertThat(ScalarClassifier.classify(' ')).isEqualTo(ScalarCategory.SPACE);
        assertThat(ScalarClassifier.classify('\t')).isEqualTo(ScalarCategory.TAB);
        assertThat(ScalarClassifier.classify('"')).isEqualTo(ScalarCategory.QUOTE);
        assertThat(ScalarClassifier.classify('<')).isEqualTo(ScalarCategory.OPEN_ANGLE);
        assertThat(ScalarClassifier.classify('>')).isEqualTo(ScalarCategory.CLOSE_ANGLE);
        assertThat(ScalarClassifier.classify('`')).isEqualTo(ScalarCategory.BACKTICK);
        assertThat(ScalarClassifier.classify('?')).isEqualTo(ScalarCategory.QUESTION_MARK);
        assertThat(ScalarClassifier.classify('#')).isEqualTo(ScalarCategory.HASH);
    }

    @Test
    void treatsCarriageReturnAndLineFeedAsEndOfLine() {
        assertThat(ScalarClassifier.classify('\n')).isEqualTo(ScalarCategory.END_OF_LINE);
        assertThat(ScalarClassifier.classify('\r')).isEqualTo(ScalarCategory.END_OF_LINE);
    }

    @Test
    void recognisesUnicodeSpacesOtherThanSpaceAndTab() {
        assertThat(ScalarClassifier.classify(0x00A0)).isEqualTo(ScalarCategory.OTHER_WHITESPACE);
        assertThat(ScalarClassifier.classify(0x2003)).isEqualTo(ScalarCategory.OTHER_WHITESPACE);
        assertThat(ScalarClassifier.classify(0x3000)).isEqualTo(ScalarCategory.OTHER_WHITESPACE);
        assertThat(ScalarClassifier.classify(0x000B)).isEqualTo(ScalarCategory.OTHER_WHITESPACE);
        assertThat(ScalarClassifier.classify(0x0085)).isEqualTo(ScalarCategory.OTHER_WHITESPACE);
    }

    @Test
    void flagsControlCharactersAndLoneSurrogatesAsInvalid() {
        assertThat(ScalarClassifier.classify(0x0000)).isEqualTo(ScalarCategory.INVALID);
        assertThat(ScalarClassifier.classify(0x0007)).isEqualTo(ScalarCategory.INVALID);
        assertThat(ScalarClassifier.classify(0xD800)).isEqualTo(ScalarCategory.INVALID);
    }

    @Test
    void groupsOperatorCharactersIncludingMathSymbols() {
        for (char ch : "/=-+!*%&|^~".toCharArray()) {
            assertThat(ScalarClassifier.classify(ch)).as("operator %s", ch).isEqualTo(ScalarCategory.OPERATOR_CHAR);
        }
        assertThat(ScalarClassifier.classify(0x2211)).isEqualTo(ScalarCategory.OPERATOR_CHAR);
    }

    @Test
    void fallsBackToIdentifierCharacters() {
        assertThat(ScalarClassifier.classify('a')).isEqualTo(ScalarCategory.IDENTIFIER_CHAR);
        assertThat(ScalarClassifier.classify('_')).isEqualTo(ScalarCategory.IDENTIFIER_CHAR);
        assertThat(ScalarClassifier.classify(0x00E9)).isEqualTo(ScalarCategory.IDENTIFIER_CHAR);
        assertThat(ScalarClassifier.classify(0x1F600)).isEqualTo(ScalarCategory.IDENTIFIER_CHAR);
        assertThat(ScalarClassifier.classify('7')).isEqualTo(ScalarCategory.DIGIT);
        assertThat(ScalarClassifier.classify(0x0301)).isEqualTo(ScalarCategory.COMBINING_MARK);
    }
}
