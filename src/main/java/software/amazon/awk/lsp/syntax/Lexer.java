/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.syntax;

import software.amazon.smithy.utils.SimpleParser;

/**
 * Splits AWK source text into {@link Token}s.
 *
 * <p>A {@code /} is always read as division here. The parser knows when an
 * operand is expected, and calls {@link #rescanAsRegex} there.
 */
final class Lexer extends SimpleParser {
    private static final String[] DIRECTIVES = {"@include", "@load", "@namespace"};

    private final String text;
    private final StringBuilder docComment = new StringBuilder();
    private boolean docCommentOnLine;
    private TokenType last = TokenType.NEWLINE;

    Lexer(CharSequence text) {
        super(text);
        this.text = text.toString();
    }

    /**
     * @return The next token, {@link TokenType#EOF} once the text is consumed
     */
    Token next() {
        int gapStart = position();
        skipIgnored();
        int gap = position() - gapStart;

        int start = position();
        int line = line() - 1;
        int character = column() - 1;
        if (eof()) {
            return emit(TokenType.EOF, start, line, character, gap, null);
        }

        char c = peek();
        if (c == '\n') {
            skip();
            if (!docCommentOnLine && last == TokenType.NEWLINE) {
                // A blank line separates doc comments from what follows.
                docComment.setLength(0);
            }
            docCommentOnLine = false;
            return emit(TokenType.NEWLINE, start, line, character, gap, null);
        } else if (isIdentStart(c)) {
            return name(start, line, character, gap);
        } else if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
            number();
            return emit(TokenType.NUMBER, start, line, character, gap, null);
        } else if (c == '"') {
            String error = string();
            return emit(TokenType.STRING, start, line, character, gap, error);
        }

        TokenType type = operator();
        if (type == null) {
            skip();
            return emit(TokenType.ERROR, start, line, character, gap, "unexpected character '" + c + "'");
        }
        return emit(type, start, line, character, gap, null);
    }

    /**
     * Reads a regular expression literal starting at {@code slash}, which must
     * be the last token returned.
     *
     * @param slash A {@link TokenType#SLASH} or {@link TokenType#DIV_ASSIGN} token
     * @return The regular expression token
     */
    Token rescanAsRegex(Token slash) {
        rewind(slash.start(), slash.line() + 1, slash.character() + 1);
        skip(); // '/'
        String error = null;
        boolean inBracket = false;
        while (true) {
            if (eof() || peek() == '\n') {
                error = "unterminated regular expression";
                break;
            }
            char c = peek();
            if (c == '\\') {
                skip();
                if (!eof() && peek() != '\n') {
                    skip();
                }
            } else if (inBracket) {
                if (c == '[' && peek(1) == ':') {
                    skipCharacterClass();
                } else {
                    skip();
                    inBracket = c != ']';
                }
            } else if (c == '[') {
                skip();
                inBracket = true;
                if (peek() == '^') {
                    skip();
                }
                if (peek() == ']') {
                    skip();
                }
            } else {
                skip();
                if (c == '/') {
                    break;
                }
            }
        }
        String regex = sliceFrom(slash.start());
        last = TokenType.ERE;
        return new Token(TokenType.ERE, regex, slash.start(), slash.line(), slash.character(),
                slash.gap(), slash.docComment(), error);
    }

    private void skipCharacterClass() {
        int close = indexOf(":]", position() + 2);
        if (close < 0) {
            skip();
            return;
        }
        while (position() < close + 2) {
            skip();
        }
    }

    private int indexOf(String s, int from) {
        int newline = text.indexOf('\n', from);
        int found = text.indexOf(s, from);
        return newline >= 0 && found > newline ? -1 : found;
    }

    private void skipIgnored() {
        while (!eof()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
                skip();
            } else if (c == '\\' && (peek(1) == '\n' || (peek(1) == '\r' && peek(2) == '\n'))) {
                skip();
                if (peek() == '\r') {
                    skip();
                }
                skip();
            } else if (c == '#') {
                comment();
            } else {
                return;
            }
        }
    }

    private void comment() {
        int start = position();
        while (!eof() && peek() != '\n') {
            skip();
        }
        String text = sliceFrom(start).stripTrailing();
        if (text.startsWith("##") && last == TokenType.NEWLINE) {
            if (docComment.length() > 0) {
                docComment.append('\n');
            }
            docComment.append(text);
            docCommentOnLine = true;
        } else {
            docComment.setLength(0);
        }
    }

    private Token name(int start, int line, int character, int gap) {
        while (isIdentChar(peek())) {
            skip();
        }
        // gawk namespaces: ns::name
        if (peek() == ':' && peek(1) == ':' && isIdentStart(peek(2))) {
            skip();
            skip();
            while (isIdentChar(peek())) {
                skip();
            }
        }
        TokenType keyword = TokenType.keyword(sliceFrom(start));
        if (keyword != null) {
            return emit(keyword, start, line, character, gap, null);
        }
        TokenType type = peek() == '(' ? TokenType.FUNC_NAME : TokenType.NAME;
        return emit(type, start, line, character, gap, null);
    }

    private void number() {
        if (peek() == '0' && (peek(1) == 'x' || peek(1) == 'X') && isHexDigit(peek(2))) {
            skip();
            skip();
            while (isHexDigit(peek())) {
                skip();
            }
            return;
        }
        while (isDigit(peek())) {
            skip();
        }
        if (peek() == '.') {
            skip();
            while (isDigit(peek())) {
                skip();
            }
        }
        if ((peek() == 'e' || peek() == 'E')
                && (isDigit(peek(1)) || ((peek(1) == '+' || peek(1) == '-') && isDigit(peek(2))))) {
            skip();
            skip();
            while (isDigit(peek())) {
                skip();
            }
        }
    }

    private String string() {
        skip(); // '"'
        while (!eof()) {
            char c = peek();
            if (c == '"') {
                skip();
                return null;
            } else if (c == '\n') {
                return "unterminated string";
            } else if (c == '\\') {
                skip();
                if (!eof()) {
                    skip();
                }
            } else {
                skip();
            }
        }
        return "unterminated string";
    }

    private TokenType operator() {
        char c = peek();
        char next = peek(1);
        TokenType type;
        int length = 1;
        switch (c) {
            case '{' -> type = TokenType.LBRACE;
            case '}' -> type = TokenType.RBRACE;
            case '(' -> type = TokenType.LPAREN;
            case ')' -> type = TokenType.RPAREN;
            case '[' -> type = TokenType.LBRACKET;
            case ']' -> type = TokenType.RBRACKET;
            case ';' -> type = TokenType.SEMICOLON;
            case ',' -> type = TokenType.COMMA;
            case '@' -> {
                length = directiveLength();
                type = length > 1 ? TokenType.DIRECTIVE : TokenType.AT;
            }
            case '?' -> type = TokenType.QUESTION;
            case ':' -> type = TokenType.COLON;
            case '~' -> type = TokenType.MATCH;
            case '$' -> type = TokenType.DOLLAR;
            case '=' -> {
                type = next == '=' ? TokenType.EQ : TokenType.ASSIGN;
                length = next == '=' ? 2 : 1;
            }
            case '!' -> {
                type = next == '=' ? TokenType.NE : next == '~' ? TokenType.NO_MATCH : TokenType.NOT;
                length = type == TokenType.NOT ? 1 : 2;
            }
            case '<' -> {
                type = next == '=' ? TokenType.LE : TokenType.LT;
                length = next == '=' ? 2 : 1;
            }
            case '>' -> {
                type = next == '=' ? TokenType.GE : next == '>' ? TokenType.APPEND : TokenType.GT;
                length = type == TokenType.GT ? 1 : 2;
            }
            case '|' -> {
                type = next == '|' ? TokenType.OR : next == '&' ? TokenType.PIPE_BOTH : TokenType.PIPE;
                length = type == TokenType.PIPE ? 1 : 2;
            }
            case '&' -> {
                if (next != '&') {
                    return null;
                }
                type = TokenType.AND;
                length = 2;
            }
            case '+' -> {
                type = next == '+' ? TokenType.INCR : next == '=' ? TokenType.ADD_ASSIGN : TokenType.PLUS;
                length = type == TokenType.PLUS ? 1 : 2;
            }
            case '-' -> {
                type = next == '-' ? TokenType.DECR : next == '=' ? TokenType.SUB_ASSIGN : TokenType.MINUS;
                length = type == TokenType.MINUS ? 1 : 2;
            }
            case '*' -> {
                if (next == '*') {
                    boolean assign = peek(2) == '=';
                    type = assign ? TokenType.POW_ASSIGN : TokenType.CARET;
                    length = assign ? 3 : 2;
                } else {
                    type = next == '=' ? TokenType.MUL_ASSIGN : TokenType.STAR;
                    length = next == '=' ? 2 : 1;
                }
            }
            case '/' -> {
                type = next == '=' ? TokenType.DIV_ASSIGN : TokenType.SLASH;
                length = next == '=' ? 2 : 1;
            }
            case '%' -> {
                type = next == '=' ? TokenType.MOD_ASSIGN : TokenType.PERCENT;
                length = next == '=' ? 2 : 1;
            }
            case '^' -> {
                type = next == '=' ? TokenType.POW_ASSIGN : TokenType.CARET;
                length = next == '=' ? 2 : 1;
            }
            default -> {
                return null;
            }
        }
        for (int i = 0; i < length; i++) {
            skip();
        }
        return type;
    }

    private int directiveLength() {
        for (String directive : DIRECTIVES) {
            int length = directive.length();
            if (text.startsWith(directive, position()) && !isIdentChar(peek(length))) {
                return length;
            }
        }
        return 1;
    }

    private Token emit(TokenType type, int start, int line, int character, int gap, String error) {
        String doc = "";
        if (type != TokenType.NEWLINE && type != TokenType.EOF) {
            doc = docComment.toString();
            docComment.setLength(0);
        }
        last = type;
        return new Token(type, sliceFrom(start), start, line, character, gap, doc, error);
    }

    private static boolean isIdentStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentChar(char c) {
        return isIdentStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
