/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.eclipse.lsp4j.Position;
import software.amazon.awk.lsp.document.SymbolType;

/**
 * Recursive descent parser for AWK, producing {@link Syntax.Event}s.
 *
 * <p>One instance parses one text. All state that depends on where the
 * parser is, like the enclosing function or the structure path, lives in the
 * instance.
 *
 * <p>Syntax errors are reported and then unwound with {@link ParseError} to
 * the closest statement, where the parser skips to the next statement
 * boundary and continues.
 */
final class Parser {
    // '>' is output redirection, not a comparison.
    private static final int NO_GT = 1;
    // '|' not followed by getline is output redirection.
    private static final int NO_PIPE = 2;
    private static final int PRINT_ARGUMENTS = NO_GT | NO_PIPE;

    private static final Pattern POSITIONAL_FORMAT = Pattern.compile("%[0-9]+\\$");
    private static final String FUNCTION_SEGMENT = "function ";
    private static final String RULE_SEGMENT = "rule";
    private static final int MAX_NESTING = 500;

    private final Lexer lexer;
    private final boolean extendedMode;
    private final List<Syntax.Event> events = new ArrayList<>();
    private final Set<String> globals = new HashSet<>();
    private final Deque<String> path = new ArrayDeque<>();

    private Token token;
    private Token previous;
    private Token peeked;
    private Scope scope;
    private String rule;
    private int loopDepth;
    private int switchDepth;
    private int nesting;
    private boolean formatExpected;

    /**
     * The function being parsed.
     */
    private static final class Scope {
        final Syntax.Define function;
        // Parameter or local name -> whether it is a parameter
        final Map<String, Boolean> names = new HashMap<>();

        Scope(Syntax.Define function) {
            this.function = function;
        }
    }

    private static final class ParseError extends RuntimeException {
        ParseError() {
            super(null, null, false, false);
        }
    }

    Parser(CharSequence text, boolean extendedMode) {
        this.lexer = new Lexer(text);
        this.extendedMode = extendedMode;
    }

    List<Syntax.Event> events() {
        return Collections.unmodifiableList(events);
    }

    Position lastTokenPosition() {
        return token == null ? new Position(0, 0) : token.position();
    }

    /**
     * Reports a failure of the parser itself at the current token.
     */
    void crashed() {
        Position position = lastTokenPosition();
        int length = token == null ? 1 : Math.max(1, token.length());
        events.add(new Syntax.Message(Syntax.Severity.ERROR, Syntax.Category.INTERNAL,
                "parser crash", position, length));
    }

    void parse() {
        advance();
        while (!token.is(TokenType.EOF)) {
            try {
                item();
            } catch (ParseError e) {
                recoverItem();
            }
        }
    }

    private void item() {
        switch (token.type()) {
            case NEWLINE, SEMICOLON -> advance();
            case FUNCTION -> function();
            case DIRECTIVE -> directive();
            case BEGIN, END -> specialRule();
            case BEGINFILE, ENDFILE -> {
                compatibility(token, token.text());
                specialRule();
            }
            default -> rule();
        }
    }

    private void recoverItem() {
        scope = null;
        rule = null;
        if (!token.is(TokenType.EOF)) {
            advance();
        }
        while (!token.is(TokenType.NEWLINE) && !token.is(TokenType.EOF)) {
            advance();
        }
    }

    // @include "file", @load "extension", @namespace "name"
    private void directive() {
        Token directive = advance();
        compatibility(directive, directive.text());
        if (!token.is(TokenType.STRING)) {
            throw error("syntax error: " + directive.text() + " expects a quoted name");
        }
        Token name = advance();
        if (directive.text().equals("@include")) {
            String file = name.stringValue();
            events.add(new Syntax.Include(file, !file.startsWith("/"), name.position(), name.length()));
        }
        if (!token.is(TokenType.NEWLINE) && !token.is(TokenType.SEMICOLON) && !token.is(TokenType.EOF)) {
            throw error("syntax error: unexpected " + describe(token));
        }
    }

    private void specialRule() {
        Token keyword = advance();
        if (!token.is(TokenType.LBRACE)) {
            throw error("syntax error: " + keyword.text() + " blocks must have an action part");
        }
        rule = keyword.text();
        try {
            body(keyword.text());
        } finally {
            rule = null;
        }
    }

    private void rule() {
        if (!token.is(TokenType.LBRACE)) {
            expression(0);
            if (token.is(TokenType.COMMA)) {
                advance();
                optionalNewlines();
                expression(0);
            }
        }
        if (token.is(TokenType.LBRACE)) {
            rule = RULE_SEGMENT;
            try {
                body(RULE_SEGMENT);
            } finally {
                rule = null;
            }
        } else if (!token.is(TokenType.NEWLINE) && !token.is(TokenType.SEMICOLON) && !token.is(TokenType.EOF)) {
            throw error("syntax error: unexpected " + describe(token));
        }
    }

    private void function() {
        Token keyword = advance();
        if (keyword.text().equals("func")) {
            compatibility(keyword, "func");
        }
        if (!token.is(TokenType.NAME) && !token.is(TokenType.FUNC_NAME)) {
            throw error("syntax error: expected function name");
        }
        Token name = advance();
        checkBuiltinRedefinition(name);

        Syntax.Define function = define(SymbolType.FUNCTION, null, name, keyword.docComment());
        scope = new Scope(function);
        try {
            expect(TokenType.LPAREN);
            parameters(name.text());
            expect(TokenType.RPAREN);
            optionalNewlines();
            if (!token.is(TokenType.LBRACE)) {
                throw error("syntax error: expected '{' to start the body of " + name.text());
            }
            body(FUNCTION_SEGMENT + name.text());
        } finally {
            scope = null;
        }
    }

    // Extra space before a name, or a line break, separates the parameters
    // from the local variables.
    private void parameters(String functionName) {
        if (token.is(TokenType.RPAREN)) {
            return;
        }
        boolean locals = false;
        boolean lineBreak = optionalNewlines();
        int index = 0;
        while (true) {
            if (!token.is(TokenType.NAME)) {
                throw error("syntax error: expected parameter name");
            }
            Token parameter = token;
            if (index > 0 && (parameter.gap() > 1 || lineBreak)) {
                locals = true;
            }
            String name = parameter.text();
            if (name.equals(functionName)) {
                message(Syntax.Severity.ERROR, Syntax.Category.SYNTAX,
                        "function " + functionName + ": cannot use function name as parameter name", parameter);
            } else if (scope.names.containsKey(name)) {
                message(Syntax.Severity.ERROR, Syntax.Category.SYNTAX,
                        "function " + functionName + ": duplicate parameter " + name, parameter);
            } else if (Builtins.isVariable(name)) {
                message(Syntax.Severity.ERROR, Syntax.Category.SYNTAX,
                        "function " + functionName + ": cannot use special variable " + name
                        + " as a parameter", parameter);
            }
            define(locals ? SymbolType.LOCAL_VARIABLE : SymbolType.PARAMETER, scope.function, parameter, "");
            scope.names.putIfAbsent(name, !locals);
            advance();
            index++;
            if (!token.is(TokenType.COMMA)) {
                return;
            }
            advance();
            lineBreak = optionalNewlines();
        }
    }

    private void checkBuiltinRedefinition(Token name) {
        Builtins.Builtin builtin = Builtins.get(name.text());
        if (builtin == null) {
            return;
        }
        if (builtin.awk()) {
            message(Syntax.Severity.WARNING, Syntax.Category.STRUCTURE,
                    "function " + name.text() + " redefines a built-in", name);
        } else {
            message(Syntax.Severity.WARNING, Syntax.Category.COMPATIBILITY,
                    "function " + name.text() + " redefines a gawk built-in", name);
        }
    }

    // A braced block that is recorded in the path position tree.
    private void body(String segment) {
        Token open = expect(TokenType.LBRACE);
        path.addLast(segment);
        try {
            pathBoundary(Syntax.PathBoundary.Kind.BEGIN, open.endPosition());
            statements();
            Token close = token;
            expectClosingBrace();
            pathBoundary(Syntax.PathBoundary.Kind.END, close.position());
        } finally {
            path.removeLast();
        }
    }

    private void statements() {
        while (!token.is(TokenType.RBRACE) && !token.is(TokenType.EOF)) {
            try {
                statement();
            } catch (ParseError e) {
                recoverStatement();
            }
        }
    }

    private void recoverStatement() {
        int depth = 0;
        while (!token.is(TokenType.EOF)) {
            switch (token.type()) {
                case LBRACE -> depth++;
                case RBRACE -> {
                    if (depth == 0) {
                        return;
                    }
                    depth--;
                }
                case NEWLINE, SEMICOLON -> {
                    if (depth == 0) {
                        advance();
                        return;
                    }
                }
                default -> {
                }
            }
            advance();
        }
    }

    private void expectClosingBrace() {
        if (!token.is(TokenType.RBRACE)) {
            throw error("syntax error: missing '}'");
        }
        advance();
    }

    private void statement() {
        enter();
        try {
            switch (token.type()) {
                case NEWLINE, SEMICOLON -> advance();
                case LBRACE -> {
                    advance();
                    statements();
                    expectClosingBrace();
                }
                case IF -> ifStatement();
                case WHILE -> whileStatement();
                case DO -> doStatement();
                case FOR -> forStatement();
                case SWITCH -> switchStatement();
                default -> {
                    simpleStatement();
                    terminator();
                }
            }
        } finally {
            nesting--;
        }
    }

    private void terminator() {
        switch (token.type()) {
            case SEMICOLON -> advance();
            case NEWLINE -> {
                missingSemicolon(token);
                advance();
            }
            case RBRACE, EOF -> {
            }
            default -> throw error("syntax error: unexpected " + describe(token));
        }
    }

    private void missingSemicolon(Token newline) {
        Syntax.Severity severity = extendedMode ? Syntax.Severity.WARNING : Syntax.Severity.ERROR;
        events.add(new Syntax.Message(severity, Syntax.Category.MISSING_SEMICOLON,
                "missing semicolon", newline.position(), 1));
    }

    private void simpleStatement() {
        switch (token.type()) {
            case PRINT, PRINTF -> printStatement();
            case NEXT -> {
                Token next = advance();
                if ("BEGIN".equals(rule) || "END".equals(rule)) {
                    message(Syntax.Severity.ERROR, Syntax.Category.SYNTAX,
                            "next used in " + rule + " action", next);
                }
            }
            case NEXTFILE -> compatibility(advance(), "nextfile");
            case EXIT -> {
                advance();
                if (startsExpression(token)) {
                    expression(0);
                }
            }
            case RETURN -> {
                Token keyword = advance();
                if (scope == null) {
                    message(Syntax.Severity.ERROR, Syntax.Category.SYNTAX, "return used outside function", keyword);
                }
                if (startsExpression(token)) {
                    expression(0);
                }
            }
            case BREAK -> {
                Token keyword = advance();
                if (loopDepth == 0 && switchDepth == 0) {
                    message(Syntax.Severity.ERROR, Syntax.Category.SYNTAX,
                            "break is not allowed outside a loop or switch", keyword);
                }
            }
            case CONTINUE -> {
                Token keyword = advance();
                if (loopDepth == 0) {
                    message(Syntax.Severity.ERROR, Syntax.Category.SYNTAX,
                            "continue is not allowed outside a loop", keyword);
                }
            }
            case DELETE -> deleteStatement();
            default -> expression(0);
        }
    }

    private void printStatement() {
        Token keyword = advance();
        boolean printf = keyword.is(TokenType.PRINTF);
        if (startsExpression(token)) {
            formatExpected = printf;
            expressionList(PRINT_ARGUMENTS);
            formatExpected = false;
        } else if (printf) {
            throw error("syntax error: printf needs a format");
        }
        switch (token.type()) {
            case GT, APPEND, PIPE, PIPE_BOTH -> {
                Token redirection = advance();
                if (redirection.is(TokenType.PIPE_BOTH)) {
                    compatibility(redirection, "|&");
                }
                concatenation(PRINT_ARGUMENTS);
            }
            default -> {
            }
        }
    }

    private void deleteStatement() {
        advance();
        if (!token.is(TokenType.NAME)) {
            throw error("syntax error: expected array name after delete");
        }
        variable(advance());
        if (token.is(TokenType.LBRACKET)) {
            advance();
            expressionList(0);
            expect(TokenType.RBRACKET);
        }
    }

    private void ifStatement() {
        advance();
        expect(TokenType.LPAREN);
        expression(0);
        expect(TokenType.RPAREN);
        optionalNewlines();
        statement();
        optionalNewlines();
        if (token.is(TokenType.ELSE)) {
            advance();
            optionalNewlines();
            statement();
        }
    }

    private void whileStatement() {
        advance();
        expect(TokenType.LPAREN);
        expression(0);
        expect(TokenType.RPAREN);
        loopBody();
    }

    private void doStatement() {
        advance();
        optionalNewlines();
        loopDepth++;
        try {
            statement();
        } finally {
            loopDepth--;
        }
        optionalNewlines();
        expect(TokenType.WHILE);
        expect(TokenType.LPAREN);
        expression(0);
        expect(TokenType.RPAREN);
        terminator();
    }

    // for (init; condition; step) and for (name in array)
    private void forStatement() {
        advance();
        expect(TokenType.LPAREN);
        if (!token.is(TokenType.SEMICOLON)) {
            Token first = token;
            Expr init = expression(0);
            boolean loopHeader = init instanceof Expr.Membership && ((Expr.Membership) init).isLoopHeader();
            if (token.is(TokenType.RPAREN)) {
                if (!loopHeader) {
                    message(Syntax.Severity.ERROR, Syntax.Category.SYNTAX,
                            "syntax error: expected 'name in array' in for loop", first);
                }
                advance();
                loopBody();
                return;
            } else if (loopHeader) {
                message(Syntax.Severity.WARNING, Syntax.Category.STRUCTURE,
                        "membership test used as for loop initializer", first);
            }
        }
        expect(TokenType.SEMICOLON);
        optionalNewlines();
        if (!token.is(TokenType.SEMICOLON)) {
            expression(0);
        }
        expect(TokenType.SEMICOLON);
        optionalNewlines();
        if (!token.is(TokenType.RPAREN)) {
            expression(0);
        }
        expect(TokenType.RPAREN);
        loopBody();
    }

    private void loopBody() {
        if (token.is(TokenType.SEMICOLON)) {
            advance();
            return;
        }
        optionalNewlines();
        loopDepth++;
        try {
            statement();
        } finally {
            loopDepth--;
        }
    }

    private void switchStatement() {
        compatibility(advance(), "switch");
        expect(TokenType.LPAREN);
        expression(0);
        expect(TokenType.RPAREN);
        optionalNewlines();
        expect(TokenType.LBRACE);
        switchDepth++;
        try {
            while (!token.is(TokenType.RBRACE) && !token.is(TokenType.EOF)) {
                try {
                    switchItem();
                } catch (ParseError e) {
                    recoverStatement();
                }
            }
            expectClosingBrace();
        } finally {
            switchDepth--;
        }
    }

    private void switchItem() {
        switch (token.type()) {
            case CASE -> {
                advance();
                caseLabel();
                expect(TokenType.COLON);
            }
            case DEFAULT -> {
                advance();
                expect(TokenType.COLON);
            }
            default -> statement();
        }
    }

    private void caseLabel() {
        if (token.is(TokenType.MINUS) || token.is(TokenType.PLUS)) {
            advance();
            expect(TokenType.NUMBER);
            return;
        }
        if (token.is(TokenType.SLASH) || token.is(TokenType.DIV_ASSIGN)) {
            regex();
            return;
        }
        if (!token.is(TokenType.NUMBER) && !token.is(TokenType.STRING)) {
            throw error("syntax error: case label must be a constant");
        }
        advance();
    }

    private List<Expr> expressionList(int flags) {
        List<Expr> list = new ArrayList<>();
        list.add(expression(flags));
        while (token.is(TokenType.COMMA)) {
            advance();
            optionalNewlines();
            list.add(expression(flags));
        }
        return list;
    }

    private Expr expression(int flags) {
        enter();
        try {
            Expr left = ternary(flags);
            if (token.type().isAssignment()) {
                Token operator = token;
                if (!left.isLvalue()) {
                    throw error("syntax error: cannot assign to this expression");
                }
                if (operator.text().equals("**=")) {
                    compatibility(operator, "**=");
                }
                advance();
                optionalNewlines();
                return new Expr.Assign(operator.type(), left, expression(flags));
            }
            return left;
        } finally {
            nesting--;
        }
    }

    private Expr ternary(int flags) {
        Expr condition = or(flags);
        if (!token.is(TokenType.QUESTION)) {
            return condition;
        }
        advance();
        optionalNewlines();
        Expr then = expression(flags);
        optionalNewlines();
        expect(TokenType.COLON);
        optionalNewlines();
        return new Expr.Ternary(condition, then, expression(flags));
    }

    private Expr or(int flags) {
        Expr left = and(flags);
        while (token.is(TokenType.OR)) {
            advance();
            optionalNewlines();
            left = new Expr.Binary(TokenType.OR, left, and(flags));
        }
        return left;
    }

    private Expr and(int flags) {
        Expr left = membership(flags);
        while (token.is(TokenType.AND)) {
            advance();
            optionalNewlines();
            left = new Expr.Binary(TokenType.AND, left, membership(flags));
        }
        return left;
    }

    private Expr membership(int flags) {
        Expr left = matching(flags);
        while (token.is(TokenType.IN)) {
            advance();
            if (!token.is(TokenType.NAME)) {
                throw error("syntax error: expected array name after 'in'");
            }
            Token array = advance();
            variable(array);
            left = new Expr.Membership(left, array.text());
        }
        return left;
    }

    private Expr matching(int flags) {
        Expr left = relational(flags);
        while (token.is(TokenType.MATCH) || token.is(TokenType.NO_MATCH)) {
            TokenType operator = advance().type();
            left = new Expr.Binary(operator, left, relational(flags));
        }
        return left;
    }

    private Expr relational(int flags) {
        Expr left = concatenation(flags);
        while (true) {
            switch (token.type()) {
                case LT, LE, NE, EQ, GE -> {
                    TokenType operator = advance().type();
                    left = new Expr.Binary(operator, left, concatenation(flags));
                }
                case GT -> {
                    if ((flags & NO_GT) != 0) {
                        return left;
                    }
                    advance();
                    left = new Expr.Binary(TokenType.GT, left, concatenation(flags));
                }
                case PIPE, PIPE_BOTH -> {
                    if (!peekToken().is(TokenType.GETLINE)) {
                        return left;
                    }
                    Token pipe = advance();
                    if (pipe.is(TokenType.PIPE_BOTH)) {
                        compatibility(pipe, "|&");
                    }
                    advance(); // getline
                    left = new Expr.Getline(left, getlineTarget(), null);
                }
                default -> {
                    return left;
                }
            }
        }
    }

    // Juxtaposed operands are concatenated.
    private Expr concatenation(int flags) {
        Expr left = additive(flags);
        while (startsConcatenationOperand(token)) {
            left = new Expr.Concat(left, additive(flags));
        }
        return left;
    }

    private Expr additive(int flags) {
        Expr left = multiplicative(flags);
        while (token.is(TokenType.PLUS) || token.is(TokenType.MINUS)) {
            TokenType operator = advance().type();
            left = new Expr.Binary(operator, left, multiplicative(flags));
        }
        return left;
    }

    private Expr multiplicative(int flags) {
        Expr left = unary(flags);
        while (token.is(TokenType.STAR) || token.is(TokenType.SLASH) || token.is(TokenType.PERCENT)) {
            TokenType operator = advance().type();
            left = new Expr.Binary(operator, left, unary(flags));
        }
        return left;
    }

    private Expr unary(int flags) {
        enter();
        try {
            if (token.is(TokenType.NOT) || token.is(TokenType.MINUS) || token.is(TokenType.PLUS)) {
                TokenType operator = advance().type();
                return new Expr.Unary(operator, unary(flags));
            }
            return power(flags);
        } finally {
            nesting--;
        }
    }

    private Expr power(int flags) {
        enter();
        try {
            Expr base = increment(flags);
            if (!token.is(TokenType.CARET)) {
                return base;
            }
            Token operator = advance();
            if (operator.text().equals("**")) {
                compatibility(operator, "**");
            }
            Expr exponent;
            if (token.is(TokenType.NOT) || token.is(TokenType.MINUS) || token.is(TokenType.PLUS)) {
                TokenType sign = advance().type();
                exponent = new Expr.Unary(sign, power(flags));
            } else {
                exponent = power(flags);
            }
            return new Expr.Binary(TokenType.CARET, base, exponent);
        } finally {
            nesting--;
        }
    }

    private Expr increment(int flags) {
        if (token.is(TokenType.INCR) || token.is(TokenType.DECR)) {
            TokenType operator = advance().type();
            Expr target = field(flags);
            if (!target.isLvalue()) {
                throw error("syntax error: " + (operator == TokenType.INCR ? "++" : "--")
                            + " needs a variable, field or array element");
            }
            return new Expr.IncDec(operator, true, target);
        }
        Expr operand = field(flags);
        if ((token.is(TokenType.INCR) || token.is(TokenType.DECR)) && operand.isLvalue()) {
            return new Expr.IncDec(advance().type(), false, operand);
        }
        return operand;
    }

    private Expr field(int flags) {
        enter();
        try {
            if (!token.is(TokenType.DOLLAR)) {
                return primary(flags);
            }
            advance();
            if (token.is(TokenType.INCR) || token.is(TokenType.DECR)) {
                return new Expr.Field(increment(flags));
            } else if (token.is(TokenType.NOT) || token.is(TokenType.MINUS) || token.is(TokenType.PLUS)) {
                TokenType operator = advance().type();
                return new Expr.Field(new Expr.Unary(operator, field(flags)));
            }
            return new Expr.Field(field(flags));
        } finally {
            nesting--;
        }
    }

    private Expr primary(int flags) {
        boolean format = formatExpected;
        formatExpected = false;
        switch (token.type()) {
            case NUMBER -> {
                Token number = advance();
                return new Expr.Literal(number.type(), number.text());
            }
            case STRING -> {
                Token string = advance();
                if (format) {
                    checkFormat(string);
                }
                return new Expr.Literal(string.type(), string.text());
            }
            case SLASH, DIV_ASSIGN -> {
                return regex();
            }
            case LPAREN -> {
                advance();
                formatExpected = format;
                List<Expr> elements = expressionList(0);
                expect(TokenType.RPAREN);
                return new Expr.Group(elements);
            }
            case GETLINE -> {
                advance();
                Expr target = getlineTarget();
                Expr file = null;
                if (token.is(TokenType.LT)) {
                    advance();
                    file = increment(flags);
                }
                return new Expr.Getline(null, target, file);
            }
            case AT -> {
                return indirectCall();
            }
            case FUNC_NAME -> {
                return call(advance());
            }
            case NAME -> {
                return name();
            }
            default -> throw error("syntax error: unexpected " + describe(token));
        }
    }

    private Expr regex() {
        token = lexer.rescanAsRegex(token);
        peeked = null;
        if (token.error() != null) {
            message(Syntax.Severity.ERROR, Syntax.Category.SYNTAX, token.error(), token);
        }
        Token regex = advance();
        return new Expr.Literal(regex.type(), regex.text());
    }

    private Expr getlineTarget() {
        if (token.is(TokenType.NAME) || token.is(TokenType.DOLLAR)) {
            Expr target = field(0);
            if (!target.isLvalue()) {
                throw error("syntax error: getline needs a variable");
            }
            return target;
        }
        return null;
    }

    private Expr name() {
        Token name = token;
        Builtins.Builtin builtin = Builtins.get(name.text());
        if (builtin != null && builtin.function() && (builtin.awk() || extendedMode)) {
            if (peekToken().is(TokenType.LPAREN)) {
                return call(advance());
            } else if (name.text().equals("length")) {
                // length without parentheses is length($0)
                advance();
                use(SymbolType.FUNCTION, name);
                return new Expr.Call(name.text(), List.of());
            }
            throw error("syntax error: expected '(' after " + name.text());
        }
        advance();
        variable(name);
        if (!token.is(TokenType.LBRACKET)) {
            return new Expr.Name(name.text());
        }
        advance();
        List<Expr> subscripts = expressionList(0);
        expect(TokenType.RBRACKET);
        return new Expr.Index(name.text(), subscripts);
    }

    private Expr call(Token name) {
        String function = name.text();
        Builtins.Builtin builtin = Builtins.get(function);
        if (builtin != null && builtin.function() && !builtin.awk()) {
            compatibility(name, function);
        }
        use(SymbolType.FUNCTION, name);
        events.add(new Syntax.CallBoundary(true, function, name.position()));
        path.addLast(function + "()");
        List<Expr> arguments = new ArrayList<>();
        Position closedAt = null;
        try {
            Token open = expect(TokenType.LPAREN);
            pathBoundary(Syntax.PathBoundary.Kind.BEGIN_EMBEDDING, open.endPosition());
            formatExpected = function.equals("sprintf");
            arguments(arguments, true);
            formatExpected = false;
            Token close = expect(TokenType.RPAREN);
            closedAt = close.position();
            pathBoundary(Syntax.PathBoundary.Kind.END_EMBEDDING, close.position());
            pathBoundary(Syntax.PathBoundary.Kind.END, close.endPosition());
        } finally {
            path.removeLast();
            // Keep call boundaries balanced when the argument list is broken.
            Position end = closedAt == null ? token.position() : closedAt;
            events.add(new Syntax.CallBoundary(false, function, end));
        }
        return new Expr.Call(function, arguments);
    }

    // @name(arguments) calls the function whose name is in the variable
    private Expr indirectCall() {
        Token at = advance();
        compatibility(at, "indirect function call");
        if (!token.is(TokenType.FUNC_NAME)) {
            throw error("syntax error: expected function call after '@'");
        }
        Token name = advance();
        variable(name);
        expect(TokenType.LPAREN);
        List<Expr> arguments = new ArrayList<>();
        arguments(arguments, false);
        expect(TokenType.RPAREN);
        return new Expr.Call(name.text(), arguments);
    }

    private void arguments(List<Expr> arguments, boolean boundaries) {
        optionalNewlines();
        if (token.is(TokenType.RPAREN)) {
            return;
        }
        int index = 0;
        while (true) {
            if (boundaries) {
                events.add(new Syntax.ParameterBoundary(index, true, token.position()));
            }
            arguments.add(expression(0));
            if (boundaries) {
                events.add(new Syntax.ParameterBoundary(index, false, previous.endPosition()));
            }
            index++;
            optionalNewlines();
            if (!token.is(TokenType.COMMA)) {
                return;
            }
            advance();
            optionalNewlines();
        }
    }

    private void checkFormat(Token string) {
        if (POSITIONAL_FORMAT.matcher(string.text()).find()) {
            compatibility(string, "positional format specifier");
        }
    }

    private void variable(Token name) {
        String text = name.text();
        if (scope != null && scope.names.containsKey(text)) {
            SymbolType type = scope.names.get(text) ? SymbolType.PARAMETER : SymbolType.LOCAL_VARIABLE;
            use(type, name);
            return;
        }
        Builtins.Builtin builtin = Builtins.get(text);
        if (builtin != null && !builtin.function()) {
            if (!builtin.awk()) {
                compatibility(name, text);
            }
        } else if (globals.add(text)) {
            events.add(new Syntax.Define(SymbolType.GLOBAL_VARIABLE, null, text, name.position(),
                    name.docComment(), true));
        }
        use(SymbolType.GLOBAL_VARIABLE, name);
    }

    private Syntax.Define define(SymbolType type, Syntax.Define enclosing, Token name, String docComment) {
        Syntax.Define define = new Syntax.Define(type, enclosing, name.text(), name.position(), docComment, false);
        events.add(define);
        events.add(new Syntax.Use(type.toDefineType(), enclosing, name.text(), name.position()));
        return define;
    }

    private void use(SymbolType type, Token name) {
        Syntax.Define enclosing = scope == null ? null : scope.function;
        events.add(new Syntax.Use(type, enclosing, name.text(), name.position()));
    }

    private void pathBoundary(Syntax.PathBoundary.Kind kind, Position position) {
        events.add(new Syntax.PathBoundary(List.copyOf(path), kind, position));
    }

    private void compatibility(Token at, String construct) {
        if (!extendedMode) {
            message(Syntax.Severity.WARNING, Syntax.Category.COMPATIBILITY,
                    construct + " is a gawk extension", at);
        }
    }

    private void message(Syntax.Severity severity, Syntax.Category category, String text, Token at) {
        events.add(new Syntax.Message(severity, category, text, at.position(), Math.max(1, at.length())));
    }

    private void enter() {
        if (nesting == MAX_NESTING) {
            throw error("syntax error: nested too deeply");
        }
        nesting++;
    }

    private ParseError error(String text) {
        message(Syntax.Severity.ERROR, Syntax.Category.SYNTAX, text, token);
        return new ParseError();
    }

    private Token expect(TokenType type) {
        if (!token.is(type)) {
            throw error("syntax error: expected " + describe(type) + " but found " + describe(token));
        }
        return advance();
    }

    private boolean optionalNewlines() {
        boolean any = false;
        while (token.is(TokenType.NEWLINE)) {
            advance();
            any = true;
        }
        return any;
    }

    private Token advance() {
        previous = token;
        if (peeked != null) {
            token = peeked;
            peeked = null;
        } else {
            token = lexer.next();
        }
        while (token.is(TokenType.ERROR)) {
            message(Syntax.Severity.ERROR, Syntax.Category.SYNTAX, token.error(), token);
            token = lexer.next();
        }
        if (token.is(TokenType.STRING) && token.error() != null) {
            message(Syntax.Severity.ERROR, Syntax.Category.SYNTAX, token.error(), token);
        }
        return previous;
    }

    private Token peekToken() {
        if (peeked == null) {
            peeked = lexer.next();
        }
        return peeked;
    }

    private static boolean startsExpression(Token token) {
        return switch (token.type()) {
            case NAME, FUNC_NAME, NUMBER, STRING, ERE, SLASH, DIV_ASSIGN, LPAREN, DOLLAR, NOT, MINUS, PLUS,
                    INCR, DECR, GETLINE, AT -> true;
            default -> false;
        };
    }

    private static boolean startsConcatenationOperand(Token token) {
        return switch (token.type()) {
            case NAME, FUNC_NAME, NUMBER, STRING, LPAREN, DOLLAR, INCR, DECR, AT -> true;
            default -> false;
        };
    }

    private static String describe(Token token) {
        return switch (token.type()) {
            case EOF -> "end of file";
            case NEWLINE -> "newline";
            default -> "'" + token.text() + "'";
        };
    }

    private static String describe(TokenType type) {
        return switch (type) {
            case LPAREN -> "'('";
            case RPAREN -> "')'";
            case LBRACE -> "'{'";
            case RBRACE -> "'}'";
            case RBRACKET -> "']'";
            case SEMICOLON -> "';'";
            case COLON -> "':'";
            case WHILE -> "'while'";
            case NUMBER -> "number";
            default -> type.name().toLowerCase(Locale.ROOT);
        };
    }
}
