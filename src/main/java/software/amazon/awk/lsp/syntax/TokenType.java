/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.syntax;

import java.util.HashMap;
import java.util.Map;

/**
 * The kinds of tokens the {@link Lexer} produces.
 */
enum TokenType {
    EOF,
    ERROR,
    NEWLINE,

    NAME,
    FUNC_NAME,
    NUMBER,
    STRING,
    ERE,

    LBRACE,
    RBRACE,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    SEMICOLON,
    COMMA,
    AT,
    DIRECTIVE,

    ASSIGN,
    ADD_ASSIGN,
    SUB_ASSIGN,
    MUL_ASSIGN,
    DIV_ASSIGN,
    MOD_ASSIGN,
    POW_ASSIGN,
    QUESTION,
    COLON,
    OR,
    AND,
    MATCH,
    NO_MATCH,
    LT,
    LE,
    NE,
    EQ,
    GT,
    GE,
    APPEND,
    PIPE,
    PIPE_BOTH,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    PERCENT,
    CARET,
    NOT,
    INCR,
    DECR,
    DOLLAR,

    BEGIN,
    END,
    BEGINFILE,
    ENDFILE,
    FUNCTION,
    IF,
    ELSE,
    WHILE,
    FOR,
    DO,
    BREAK,
    CONTINUE,
    NEXT,
    NEXTFILE,
    EXIT,
    RETURN,
    DELETE,
    GETLINE,
    PRINT,
    PRINTF,
    IN,
    SWITCH,
    CASE,
    DEFAULT;

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        KEYWORDS.put("BEGIN", BEGIN);
        KEYWORDS.put("END", END);
        KEYWORDS.put("BEGINFILE", BEGINFILE);
        KEYWORDS.put("ENDFILE", ENDFILE);
        KEYWORDS.put("function", FUNCTION);
        KEYWORDS.put("func", FUNCTION);
        KEYWORDS.put("if", IF);
        KEYWORDS.put("else", ELSE);
        KEYWORDS.put("while", WHILE);
        KEYWORDS.put("for", FOR);
        KEYWORDS.put("do", DO);
        KEYWORDS.put("break", BREAK);
        KEYWORDS.put("continue", CONTINUE);
        KEYWORDS.put("next", NEXT);
        KEYWORDS.put("nextfile", NEXTFILE);
        KEYWORDS.put("exit", EXIT);
        KEYWORDS.put("return", RETURN);
        KEYWORDS.put("delete", DELETE);
        KEYWORDS.put("getline", GETLINE);
        KEYWORDS.put("print", PRINT);
        KEYWORDS.put("printf", PRINTF);
        KEYWORDS.put("in", IN);
        KEYWORDS.put("switch", SWITCH);
        KEYWORDS.put("case", CASE);
        KEYWORDS.put("default", DEFAULT);
    }

    /**
     * @param word An identifier
     * @return The keyword {@code word} spells, or {@code null}
     */
    static TokenType keyword(String word) {
        return KEYWORDS.get(word);
    }

    boolean isAssignment() {
        return this == ASSIGN || this == ADD_ASSIGN || this == SUB_ASSIGN || this == MUL_ASSIGN
               || this == DIV_ASSIGN || this == MOD_ASSIGN || this == POW_ASSIGN;
    }
}
