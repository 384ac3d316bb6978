package dev.whitespace.tagger.lexer;

import java.util.Map;
import java.util.Objects;

/**
 * Splits a single line into tokens. A tokenizer is created per line, reads forward only and keeps at most
 * one token of lookahead. The last token is always {@link TokenKind#END_OF_LINE}; once it is reached every
 * further call returns it again.
 */
public class Tokenizer {

    private static final Map<String, TokenKind> KEYWORDS = Map.of(
            "case", TokenKind.CASE_KEYWORD,
            "default", TokenKind.DEFAULT_KEYWORD,
            "switch", TokenKind.SWITCH_KEYWORD);

    private static final Map<String, TokenKind> DIRECTIVES = Map.of(
            "if", TokenKind.IF_DIRECTIVE,
            "else", TokenKind.ELSE_DIRECTIVE,
            "elseif", TokenKind.ELSEIF_DIRECTIVE,
            "endif", TokenKind.ENDIF_DIRECTIVE);

    private final int[] codePoints;
    private final int limit;
    private int position;
    private Token lookahead;

    public Tokenizer(String line) {
        Objects.requireNonNull(line, "line");
        this.codePoints = line.codePoints().toArray();
        this.limit = endOfLine(codePoints);
    }

    /**
     * Returns the next token without consuming it.
     */
    public Token peek() {
        if (lookahead == null) {
            lookahead = read();
        }
        return lookahead;
    }

    /**
     * Kind of the token after the one {@link #peek()} returns, without consuming anything.
     */
    public TokenKind peekSecond() {
        peek();
        int saved = position;
        TokenKind kind = read().kind();
        position = saved;
        return kind;
    }

    /**
     * Kind of the first token from {@link #peek()} on that is not whitespace, without consuming anything.
     */
    public TokenKind peekPastWhitespace() {
        Token token = peek();
        int saved = position;
        while (token.kind().isWhitespace()) {
            token = read();
        }
        position = saved;
        return token.kind();
    }

    public Token next() {
        Token token = peek();
        if (token.kind() != TokenKind.END_OF_LINE) {
            lookahead = null;
        }
        return token;
    }

    private Token read() {
        if (position >= limit) {
            return new Token(TokenKind.END_OF_LINE, limit, 0);
        }
        int start = position;
        ScalarCategory category = ScalarClassifier.classify(codePoints[position++]);
        switch (category) {
            case HASH:
                return readHash(start);
            case OPERATOR_CHAR:
                return readOperator(start);
            case IDENTIFIER_CHAR:
                return readIdentifier(start);
            default:
                break;
        }
        if (category.aggregates()) {
            while (position < limit && ScalarClassifier.classify(codePoints[position]) == category) {
                position++;
            }
        }
        return new Token(kindOf(category), start, position - start);
    }

    private Token readIdentifier(int start) {
        position = scanIdentifier(position);
        String text = new String(codePoints, start, position - start);
        TokenKind kind = KEYWORDS.getOrDefault(text, TokenKind.IDENTIFIER);
        return new Token(kind, start, position - start);
    }

    private Token readHash(int start) {
        if (position < limit && ScalarClassifier.classify(codePoints[position]) == ScalarCategory.IDENTIFIER_CHAR) {
            int end = scanIdentifier(position + 1);
            TokenKind directive = DIRECTIVES.get(new String(codePoints, position, end - position));
            if (directive != null) {
                position = end;
                return new Token(directive, start, end - start);
            }
        }
        // The identifier after a plain '#' is read again as its own token.
        return new Token(TokenKind.HASH, start, 1);
    }

    private Token readOperator(int start) {
        int current = codePoints[start];
        int following = position < limit ? codePoints[position] : -1;
        if (current == '/' && following == '*') {
            position++;
            return new Token(TokenKind.COMMENT_OPEN, start, 2);
        }
        if (current == '/' && following == '/') {
            position++;
            return new Token(TokenKind.LINE_COMMENT, start, 2);
        }
        if (current == '*' && following == '/') {
            position++;
            return new Token(TokenKind.COMMENT_CLOSE, start, 2);
        }
        return new Token(current == '=' ? TokenKind.EQUALS : TokenKind.OPERATOR, start, 1);
    }

    private int scanIdentifier(int from) {
        int index = from;
        while (index < limit) {
            ScalarCategory category = ScalarClassifier.classify(codePoints[index]);
            if (category != ScalarCategory.IDENTIFIER_CHAR
                    && category != ScalarCategory.DIGIT
                    && category != ScalarCategory.COMBINING_MARK) {
                break;
            }
            index++;
        }
        return index;
    }

    private static int endOfLine(int[] codePoints) {
        for (int i = 0; i < codePoints.length; i++) {
            if (ScalarClassifier.classify(codePoints[i]) == ScalarCategory.END_OF_LINE) {
                return i;
            }
        }
        return codePoints.length;
    }

    private static TokenKind kindOf(ScalarCategory category) {
        return switch (category) {
            case SPACE -> TokenKind.SPACE;
            case TAB -> TokenKind.TAB;
            case OTHER_WHITESPACE -> TokenKind.WHITESPACE;
            case QUOTE -> TokenKind.QUOTE;
            case OPEN_PAREN -> TokenKind.OPEN_PAREN;
            case CLOSE_PAREN -> TokenKind.CLOSE_PAREN;
            case OPEN_BRACE -> TokenKind.OPEN_BRACE;
            case CLOSE_BRACE -> TokenKind.CLOSE_BRACE;
            case OPEN_BRACKET -> TokenKind.OPEN_BRACKET;
            case CLOSE_BRACKET -> TokenKind.CLOSE_BRACKET;
            case OPEN_ANGLE -> TokenKind.OPEN_ANGLE;
            case CLOSE_ANGLE -> TokenKind.CLOSE_ANGLE;
            case BACKSLASH -> TokenKind.BACKSLASH;
            case COLON -> TokenKind.COLON;
            case COMMA -> TokenKind.COMMA;
            case HASH -> TokenKind.HASH;
            case DOLLAR -> TokenKind.DOLLAR;
            case PERIOD -> TokenKind.PERIOD;
            case SEMICOLON -> TokenKind.SEMICOLON;
            case AT_SIGN -> TokenKind.AT_SIGN;
            case BACKTICK -> TokenKind.BACKTICK;
            case QUESTION_MARK -> TokenKind.QUESTION_MARK;
            case DIGIT -> TokenKind.DIGITS;
            case IDENTIFIER_CHAR -> TokenKind.IDENTIFIER;
            case COMBINING_MARK -> TokenKind.COMBINING_MARK;
            case OPERATOR_CHAR -> TokenKind.OPERATOR;
            case END_OF_LINE -> TokenKind.END_OF_LINE;
            case INVALID -> TokenKind.INVALID;
        };
    }
}
