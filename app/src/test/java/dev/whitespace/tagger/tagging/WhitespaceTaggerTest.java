package dev.whitespace.tagger.tagging;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import org.junit.jupiter.api.Test;

class WhitespaceTaggerTest {

    private final WhitespaceTagger tagger = WhitespaceTagger.newTagger(IndentationStyle.tabs());

    @Test
    void emptyLineIsClean() {
        assertThat(tagger.parseLine("")).isEmpty();
        assertThat(tagger.parseLine("\n")).isEmpty();
        assertThat(tagger.scopes()).isEmpty();
    }

    @Test
    void singleSpaceIsAnIncorrectIndent() {
        assertThat(tagger.parseLine(" "))
                .containsExactly(region(0, 1, Tag.INCORRECT_INDENT, 0));
        assertThat(tagger.scopes()).isEmpty();
    }

    @Test
    void lineCommentsIgnoreTheirContent() {
        assertThat(tagger.parseLine("//  This is a comment")).isEmpty();
        assertThat(tagger.parseLine("// This is a comment\n")).isEmpty();
    }

    @Test
    void spacesBeforeACommentAreAnIncorrectIndent() {
        assertThat(tagger.parseLine("  // This is a comment\n"))
                .containsExactly(region(0, 2, Tag.INCORRECT_INDENT, 0));
    }

    @Test
    void plainTextIsClean() {
        assertThat(tagger.parseLine("The quick brown fox.")).isEmpty();
    }

    @Test
    void tabAtTopLevelIsAnIncorrectIndent() {
        assertThat(tagger.parseLine("\tThe quick brown fox.\n"))
                .containsExactly(region(0, 1, Tag.INCORRECT_INDENT, 0));
    }

    @Test
    void doubleSpaceBetweenWordsIsFlagged() {
        assertThat(tagger.parseLine("The quick  brown fox."))
                .containsExactly(region(9, 11, Tag.MULTIPLE_SPACES, 1));
    }

    @Test
    void trailingSpaceIsUnexpected() {
        assertThat(tagger.parseLine("A \n"))
                .containsExactly(region(1, 2, Tag.UNEXPECTED_WHITESPACE, 0));
    }

    @Test
    void blockCommentContentIsIgnored() {
        assertThat(tagger.parseLine("Comment /* something  **/")).isEmpty();
        assertThat(tagger.scopes()).isEmpty();
    }

    @Test
    void unclosedBlockCommentContinuesOnTheNextLine() {
        assertThat(tagger.parseLine("Comment /* something ")).isEmpty();
        assertThat(tagger.scopes()).containsExactly(ScopeKind.COMMENT);
        assertThat(tagger.state()).isEqualTo(AutomatonState.MULTI_COMMENT);

        assertThat(tagger.parseLine("   */ end comment")).isEmpty();
        assertThat(tagger.scopes()).isEmpty();
    }

    @Test
    void nestedBlockCommentsNeedMatchingCloses() {
        assertThat(tagger.parseLine("/* outer /* inner */ still comment  ")).isEmpty();
        assertThat(tagger.scopes()).containsExactly(ScopeKind.COMMENT);

        assertThat(tagger.parseLine("*/")).isEmpty();
        assertThat(tagger.scopes()).isEmpty();
    }

    @Test
    void parenthesisAndBraceScopesSpanLines() {
        assertThat(tagger.parseLine("(")).isEmpty();
        assertThat(tagger.scopes()).containsExactly(ScopeKind.PAREN);
        assertThat(tagger.parseLine(")")).isEmpty();
        assertThat(tagger.scopes()).isEmpty();

        assertThat(tagger.parseLine("{")).isEmpty();
        assertThat(tagger.scopes()).containsExactly(ScopeKind.BRACE);
        assertThat(tagger.parseLine("}")).isEmpty();
        assertThat(tagger.scopes()).isEmpty();
    }

    @Test
    void balancedLineLeavesTheStackUnchanged() {
        assertThat(tagger.parseLine("foo(bar[1], { x in x })")).isEmpty();
        assertThat(tagger.scopes()).isEmpty();
    }

    @Test
    void stringLiteralContentIsIgnored() {
        assertThat(tagger.parseLine("Some \"literal  with  double  spaces\"")).isEmpty();
        assertThat(tagger.scopes()).isEmpty();
    }

    @Test
    void unterminatedStringContinuesAsLiteral() {
        assertThat(tagger.parseLine("let s = \"abc")).isEmpty();
        assertThat(tagger.scopes()).containsExactly(ScopeKind.STRING);
        assertThat(tagger.state()).isEqualTo(AutomatonState.LITERAL);

        assertThat(tagger.parseLine("  def  \"")).isEmpty();
        assertThat(tagger.scopes()).isEmpty();
    }

    @Test
    void interpolationsFollowBodyRulesInsideLiterals() {
        String line = "body \"literal ignore dbl space  \\(interpolation nested paren(\"nestedLiteral ignore dbl space"
                + "  dummy paren)\" back to interpolation  flag dbl space) outside paren) literal  ignore dbl space\""
                + " all scopes closed";

        assertThat(tagger.parseLine(line))
                .containsExactly(region(129, 131, Tag.MULTIPLE_SPACES, 1));
        assertThat(tagger.scopes()).isEmpty();
    }

    @Test
    void bracesNeedSurroundingSpaces() {
        assertThat(tagger.parseLine("let o = OnDelete {x = true}"))
                .containsExactly(
                        region(18, 18, Tag.MISSING_SPACE, 1),
                        region(26, 26, Tag.MISSING_SPACE, 1));
        assertThat(tagger.scopes()).isEmpty();
    }

    @Test
    void trailingClosureWithoutAnySpaces() {
        assertThat(tagger.parseLine("a.map{$0}"))
                .containsExactly(
                        region(5, 5, Tag.MISSING_SPACE, 1),
                        region(6, 6, Tag.MISSING_SPACE, 1),
                        region(8, 8, Tag.MISSING_SPACE, 1));
        assertThat(tagger.scopes()).isEmpty();
    }

    @Test
    void ternaryWithSpacesIsClean() {
        assertThat(tagger.parseLine("let x = y > 0 ? y : 0")).isEmpty();
        assertThat(tagger.scopes()).isEmpty();
    }

    @Test
    void ternaryColonNeedsSpacesOnBothSides() {
        assertThat(tagger.parseLine("a ? b:c"))
                .containsExactly(
                        region(5, 5, Tag.MISSING_SPACE, 1),
                        region(6, 6, Tag.MISSING_SPACE, 1));
        assertThat(tagger.scopes()).isEmpty();
    }

    @Test
    void optionalChainingIsNotATernary() {
        assertThat(tagger.parseLine("let x = a?.b ?? c")).isEmpty();
        assertThat(tagger.scopes()).isEmpty();
    }

    @Test
    void spaceBeforeCommaSplitsIntoSurplusAndLastColumn() {
        assertThat(tagger.parseLine("let x = (0  ,0)"))
                .containsExactly(
                        region(10, 11, Tag.MULTIPLE_SPACES, 0),
                        region(11, 12, Tag.UNEXPECTED_WHITESPACE, 0),
                        region(13, 13, Tag.MISSING_SPACE, 1));
    }

    @Test
    void commaAndColonNeedASpaceAfter() {
        assertThat(tagger.parseLine("f(a,b)")).containsExactly(region(4, 4, Tag.MISSING_SPACE, 1));
        assertThat(tagger.parseLine("let x:Int")).containsExactly(region(6, 6, Tag.MISSING_SPACE, 1));
        assertThat(tagger.parseLine("let y: [String: Int] = [:]")).isEmpty();
    }

    @Test
    void whitespaceInsideDelimitersIsUnexpected() {
        assertThat(tagger.parseLine("f( a )"))
                .containsExactly(
                        region(2, 3, Tag.UNEXPECTED_WHITESPACE, 0),
                        region(4, 5, Tag.UNEXPECTED_WHITESPACE, 0));
        assertThat(tagger.parseLine("[a : b]"))
                .containsExactly(region(2, 3, Tag.UNEXPECTED_WHITESPACE, 0));
    }

    @Test
    void tabsInTheBodyAreReplacedBySpaces() {
        assertThat(tagger.parseLine("a\tb")).containsExactly(region(1, 2, Tag.UNEXPECTED_WHITESPACE, 1));
        assertThat(tagger.parseLine("a\t")).containsExactly(region(1, 2, Tag.UNEXPECTED_WHITESPACE, 0));
        assertThat(tagger.parseLine("x  \t y"))
                .containsExactly(
                        region(1, 3, Tag.MULTIPLE_SPACES, 1),
                        region(3, 4, Tag.UNEXPECTED_WHITESPACE, 0),
                        region(4, 5, Tag.UNEXPECTED_WHITESPACE, 0));
    }

    @Test
    void mixedWhitespaceIsJudgedByTheTokenAfterTheWholeGroup() {
        assertThat(tagger.parseLine("a \t"))
                .containsExactly(
                        region(1, 2, Tag.UNEXPECTED_WHITESPACE, 0),
                        region(2, 3, Tag.UNEXPECTED_WHITESPACE, 0));
        assertThat(tagger.parseLine("x \t,y"))
                .containsExactly(
                        region(1, 2, Tag.UNEXPECTED_WHITESPACE, 0),
                        region(2, 3, Tag.UNEXPECTED_WHITESPACE, 0),
                        region(4, 4, Tag.MISSING_SPACE, 1));
        assertThat(tagger.parseLine("f(a \t)"))
                .containsExactly(
                        region(3, 4, Tag.UNEXPECTED_WHITESPACE, 0),
                        region(4, 5, Tag.UNEXPECTED_WHITESPACE, 0));
        assertThat(tagger.parseLine("a \tb")).containsExactly(region(2, 3, Tag.UNEXPECTED_WHITESPACE, 0));
    }

    @Test
    void tabAroundATernaryBecomesASpace() {
        assertThat(tagger.parseLine("a ? b\t: c")).containsExactly(region(5, 6, Tag.UNEXPECTED_WHITESPACE, 1));
        assertThat(tagger.scopes()).isEmpty();
        assertThat(tagger.parseLine("a ?\tb : c")).containsExactly(region(3, 4, Tag.UNEXPECTED_WHITESPACE, 1));
        assertThat(tagger.scopes()).isEmpty();
    }

    @Test
    void compoundNameLabelsNeedNoSpaceAfterTheColon() {
        assertThat(tagger.parseLine("let s = #selector(foo(_:bar:))")).isEmpty();
        assertThat(tagger.parseLine("f(a:b)")).containsExactly(region(4, 4, Tag.MISSING_SPACE, 1));
        assertThat(tagger.scopes()).isEmpty();
    }

    @Test
    void operatorRunsWithEqualsNeedSpacesOnBothSides() {
        assertThat(tagger.parseLine("let a=b"))
                .containsExactly(
                        region(5, 5, Tag.MISSING_SPACE, 1),
                        region(6, 6, Tag.MISSING_SPACE, 1));
        assertThat(tagger.parseLine("a ==b")).containsExactly(region(4, 4, Tag.MISSING_SPACE, 1));
        assertThat(tagger.parseLine("a+=1"))
                .containsExactly(
                        region(1, 1, Tag.MISSING_SPACE, 1),
                        region(3, 3, Tag.MISSING_SPACE, 1));
    }

    @Test
    void operatorRunsWithoutEqualsAreNeverFlagged() {
        assertThat(tagger.parseLine("let x = -1")).isEmpty();
        assertThat(tagger.parseLine("a+b")).isEmpty();
        assertThat(tagger.parseLine("let y = !flag && x<1")).isEmpty();
    }

    @Test
    void genericParameterListsAreExemptFromSpacingRules() {
        assertThat(tagger.parseLine("let a: Dictionary<String, Array<Int>> = [:]")).isEmpty();
        assertThat(tagger.parseLine("let f: Array<(Int) -> Void> = []")).isEmpty();
        assertThat(tagger.scopes()).isEmpty();
    }

    @Test
    void abortedGenericListRetriesTheTokenInTheBody() {
        assertThat(tagger.parseLine("if a<b {")).isEmpty();
        assertThat(tagger.scopes()).containsExactly(ScopeKind.BRACE);
    }

    @Test
    void invalidCharactersAreFlaggedEverywhere() {
        assertThat(tagger.parseLine("a\u0000b")).containsExactly(region(1, 2, Tag.INVALID_CHARACTER, 0));
        assertThat(tagger.parseLine("\"a\u0007\"")).containsExactly(region(2, 3, Tag.INVALID_CHARACTER, 0));
        assertThat(tagger.parseLine("/* \u0001 */")).containsExactly(region(3, 4, Tag.INVALID_CHARACTER, 0));
    }

    @Test
    void switchCasesAlignWithTheSwitch() {
        assertThat(tagger.parseLine("switch a {")).isEmpty();
        assertThat(tagger.scopes()).containsExactly(ScopeKind.SWITCH_BODY);
        assertThat(tagger.parseLine("case one:")).isEmpty();
        assertThat(tagger.parseLine("\tmultiline")).isEmpty();
        assertThat(tagger.parseLine("case two: single line")).isEmpty();
        assertThat(tagger.parseLine("default: break")).isEmpty();
        assertThat(tagger.scopes()).containsExactly(ScopeKind.SWITCH_BODY);
        assertThat(tagger.parseLine("}")).isEmpty();
        assertThat(tagger.scopes()).isEmpty();
    }

    @Test
    void casesOutsideASwitchAreIndented() {
        assertThat(tagger.parseLine("enum a {")).isEmpty();
        assertThat(tagger.parseLine("\tcase one")).isEmpty();
        assertThat(tagger.parseLine("\tcase two")).isEmpty();
        assertThat(tagger.scopes()).containsExactly(ScopeKind.BRACE);
        assertThat(tagger.parseLine("}")).isEmpty();
        assertThat(tagger.scopes()).isEmpty();
    }

    @Test
    void blocksInsideASwitchCaseIndentFurther() {
        assertThat(tagger.parseLine("switch x {")).isEmpty();
        assertThat(tagger.parseLine("case .a:")).isEmpty();
        assertThat(tagger.parseLine("\tif y {")).isEmpty();
        assertThat(tagger.parseLine("\t\tz()")).isEmpty();
        assertThat(tagger.parseLine("\t}")).isEmpty();
        assertThat(tagger.parseLine("}")).isEmpty();
        assertThat(tagger.scopes()).isEmpty();
    }

    @Test
    void memberNamedSwitchDoesNotOpenASwitch() {
        assertThat(tagger.parseLine("a.switch {")).isEmpty();
        assertThat(tagger.scopes()).containsExactly(ScopeKind.BRACE);
    }

    @Test
    void conditionalCompilationBlocksIndent() {
        assertThat(tagger.parseLine("class TestClass: TestSuperclass {\n")).isEmpty();
        assertThat(tagger.parseLine("\tfunc testMethod() {\n")).isEmpty();
        assertThat(tagger.parseLine("\t\tvar someVar = someValue\n")).isEmpty();
        assertThat(tagger.parseLine("\t\tsomeValue.doSomething()\n")).isEmpty();
        assertThat(tagger.parseLine("\t\t#if someTest()\n")).isEmpty();
        assertThat(tagger.scopes()).containsExactly(ScopeKind.BRACE, ScopeKind.BRACE, ScopeKind.CONDITIONAL);
        assertThat(tagger.parseLine("\t\t\tsomeValue.doSomethingElse()\n")).isEmpty();
        assertThat(tagger.parseLine("\t\t#else\n")).isEmpty();
        assertThat(tagger.parseLine("\t\t\tfallback()\n")).isEmpty();
        assertThat(tagger.parseLine("\t\t#endif\n")).isEmpty();
        assertThat(tagger.scopes()).containsExactly(ScopeKind.BRACE, ScopeKind.BRACE);
        assertThat(tagger.parseLine("\t}\n")).isEmpty();
        assertThat(tagger.parseLine("\tvar t = s\n")).isEmpty();
        assertThat(tagger.parseLine("}")).isEmpty();
        assertThat(tagger.scopes()).isEmpty();
    }

    @Test
    void earlierScopesOpenedOnALineAreShadowed() {
        assertThat(tagger.parseLine("a({")).isEmpty();
        assertThat(tagger.scopes()).containsExactly(ScopeKind.SHADOWED_PAREN, ScopeKind.BRACE);

        assertThat(tagger.parseLine("\tb")).isEmpty();
        assertThat(tagger.parseLine("}, c, {")).isEmpty();
        assertThat(tagger.scopes()).containsExactly(ScopeKind.SHADOWED_PAREN, ScopeKind.BRACE);

        assertThat(tagger.parseLine("\td")).isEmpty();
        assertThat(tagger.parseLine("}) {("))
                .containsExactly(region(4, 4, Tag.MISSING_SPACE, 1));
        assertThat(tagger.scopes()).containsExactly(ScopeKind.SHADOWED_BRACE, ScopeKind.PAREN);

        assertThat(tagger.parseLine("\te")).isEmpty();
        assertThat(tagger.parseLine(") }")).isEmpty();
        assertThat(tagger.scopes()).isEmpty();
    }

    @Test
    void missingIndentIsAnInsertionAtColumnZero() {
        tagger.parseLine("dummy {");

        assertThat(tagger.parseLine("not indented"))
                .containsExactly(region(0, 0, Tag.INCORRECT_INDENT, 1));
    }

    @Test
    void mixedIndentCharactersAreAlwaysIncorrect() {
        tagger.parseLine("dummy {");

        assertThat(tagger.parseLine("\t  x"))
                .containsExactly(region(0, 3, Tag.INCORRECT_INDENT, 1));
    }

    @Test
    void spaceIndentationCountsWidthPerLevel() {
        WhitespaceTagger spaces = WhitespaceTagger.newTagger(IndentationStyle.spaces(4));

        assertThat(spaces.parseLine("if x {")).isEmpty();
        assertThat(spaces.parseLine("    y")).isEmpty();
        assertThat(spaces.parseLine("  z")).containsExactly(region(0, 2, Tag.INCORRECT_INDENT, 4));
        assertThat(spaces.parseLine("\tw")).containsExactly(region(0, 1, Tag.INCORRECT_INDENT, 4));
        assertThat(spaces.parseLine("}")).isEmpty();
    }

    @Test
    void unbalancedClosersAreIgnored() {
        assertThat(tagger.parseLine(")")).isEmpty();
        assertThat(tagger.parseLine("]")).isEmpty();
        assertThat(tagger.parseLine("} // stray")).isEmpty();
        assertThat(tagger.scopes()).isEmpty();
    }

    @Test
    void rejectsNullInput() {
        Throwable thrown = catchThrowable(() -> tagger.parseLine(null));

        assertThat(thrown).isInstanceOf(NullPointerException.class);
    }

    private static TaggedRegion region(int start, int end, Tag tag, int expectedWidth) {
        return new TaggedRegion(start, end, tag, expectedWidth);
    }
}
