package dev.whitespace.tagger.lexer;

/**
 * Maps code points to their {@link ScalarCategory}. Total: every code point has exactly one category.
 */
public final class ScalarClassifier {

    private static final String OPERATOR_CHARS = "/=-+!*%&|^~";

    private ScalarClassifier() {
    }

    public static ScalarCategory classify(int codePoint) {
        switch (codePoint) {
            case ' ':
                return ScalarCategory.SPACE;
            case '\t':
                return ScalarCategory.TAB;
            case '\n':
            case '\r':
                return ScalarCategory.END_OF_LINE;
            case '"':
                return ScalarCategory.QUOTE;
            case '(':
                return ScalarCategory.OPEN_PAREN;
            case ')':
                return ScalarCategory.CLOSE_PAREN;
            case '{':
                return ScalarCategory.OPEN_BRACE;
            case '}':
                return ScalarCategory.CLOSE_BRACE;
            case '[':
                return ScalarCategory.OPEN_BRACKET;
            case ']':
                return ScalarCategory.CLOSE_BRACKET;
            case '<':
                return ScalarCategory.OPEN_ANGLE;
            case '>':
                return ScalarCategory.CLOSE_ANGLE;
            case '\\':
                return ScalarCategory.BACKSLASH;
            case ':':
                return ScalarCategory.COLON;
            case ',':
                return ScalarCategory.COMMA;
            case '#':
                return ScalarCategory.HASH;
            case '$':
                return ScalarCategory.DOLLAR;
            case '.':
                return ScalarCategory.PERIOD;
            case ';':
                return ScalarCategory.SEMICOLON;
            case '@':
                return ScalarCategory.AT_SIGN;
            case '`':
                return ScalarCategory.BACKTICK;
            case '?':
                return ScalarCategory.QUESTION_MARK;
            default:
                break;
        }
        if (isOtherWhitespace(codePoint)) {
            return ScalarCategory.OTHER_WHITESPACE;
        }
        if (codePoint >= '0' && codePoint <= '9') {
            return ScalarCategory.DIGIT;
        }
        if (codePoint < 0x80 && OPERATOR_CHARS.indexOf(codePoint) >= 0) {
            return ScalarCategory.OPERATOR_CHAR;
        }
        int type = Character.getType(codePoint);
        switch (type) {
            case Character.CONTROL:
            case Character.SURROGATE:
                return ScalarCategory.INVALID;
            case Character.NON_SPACING_MARK:
            case Character.ENCLOSING_MARK:
            case Character.COMBINING_SPACING_MARK:
                return ScalarCategory.COMBINING_MARK;
            case Character.MATH_SYMBOL:
                return ScalarCategory.OPERATOR_CHAR;
            default:
                return ScalarCategory.IDENTIFIER_CHAR;
        }
    }

    private static boolean isOtherWhitespace(int codePoint) {
        return codePoint == 0x000B
                || codePoint == 0x000C
                || codePoint == 0x0085
                || codePoint == 0x00A0
                || codePoint == 0x1680
                || (codePoint >= 0x2000 && codePoint <= 0x200A)
                || codePoint == 0x2028
                || codePoint == 0x2029
                || codePoint == 0x202F
                || codePoint == 0x205F
                || codePoint == 0x3000;
    }
}
