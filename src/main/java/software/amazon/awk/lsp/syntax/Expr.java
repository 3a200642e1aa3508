/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.syntax;

import java.util.List;

/**
 * The shape of a parsed expression.
 *
 * <p>Expressions are built for structural checks only, like whether the
 * first clause of a {@code for} is {@code name in array}, or whether the
 * target of an assignment can be assigned to.
 */
sealed interface Expr {
    /**
     * @return Whether the expression can be assigned to
     */
    default boolean isLvalue() {
        return false;
    }

    record Name(String name) implements Expr {
        @Override
        public boolean isLvalue() {
            return true;
        }
    }

    record Index(String array, List<Expr> subscripts) implements Expr {
        @Override
        public boolean isLvalue() {
            return true;
        }
    }

    record Field(Expr index) implements Expr {
        @Override
        public boolean isLvalue() {
            return true;
        }
    }

    record Literal(TokenType type, String text) implements Expr {
    }

    /**
     * A parenthesized expression, or list of expressions.
     */
    record Group(List<Expr> elements) implements Expr {
    }

    record Unary(TokenType operator, Expr operand) implements Expr {
    }

    record Binary(TokenType operator, Expr left, Expr right) implements Expr {
    }

    record Concat(Expr left, Expr right) implements Expr {
    }

    record Ternary(Expr condition, Expr then, Expr otherwise) implements Expr {
    }

    record Assign(TokenType operator, Expr target, Expr value) implements Expr {
    }

    record IncDec(TokenType operator, boolean prefix, Expr target) implements Expr {
    }

    /**
     * {@code key in array}, where key may be a parenthesized list.
     */
    record Membership(Expr key, String array) implements Expr {
        /**
         * @return Whether this has the form a {@code for (name in array)}
         *  loop needs
         */
        boolean isLoopHeader() {
            return key instanceof Name;
        }
    }

    record Call(String function, List<Expr> arguments) implements Expr {
    }

    record Getline(Expr command, Expr target, Expr file) implements Expr {
    }
}
