/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.syntax;

import org.eclipse.lsp4j.Position;

/**
 * A token read by the {@link Lexer}.
 *
 * @param type The kind of token
 * @param text The token's source text, including quotes and slashes
 * @param start Index of the token's first character
 * @param line 0-based line of the token's first character
 * @param character 0-based character of the token's first character
 * @param gap Number of whitespace, continuation and comment characters
 *            skipped right before the token
 * @param docComment The {@code ##} comment lines right before the token, or
 *                   an empty string
 * @param error Why the token is malformed, or {@code null}
 */
record Token(
        TokenType type,
        String text,
        int start,
        int line,
        int character,
        int gap,
        String docComment,
        String error
) {
    boolean is(TokenType other) {
        return type == other;
    }

    int length() {
        return text.length();
    }

    Position position() {
        return new Position(line, character);
    }

    /**
     * @return The position right after the token, assuming it is on one line
     */
    Position endPosition() {
        return new Position(line, character + text.length());
    }

    /**
     * @return The contents of a string literal, without quotes or escapes
     */
    String stringValue() {
        int end = text.endsWith("\"") && text.length() > 1 ? text.length() - 1 : text.length();
        StringBuilder value = new StringBuilder(end);
        for (int i = 1; i < end; i++) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < end) {
                c = text.charAt(++i);
                switch (c) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    default -> value.append(c);
                }
            } else {
                value.append(c);
            }
        }
        return value.toString();
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + line + ":" + character;
    }
}
