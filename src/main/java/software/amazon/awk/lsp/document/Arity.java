/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.document;

/**
 * The number of arguments a function accepts.
 *
 * @param min The least number of arguments
 * @param max The most arguments, {@link #UNBOUNDED} for variadic functions
 */
public record Arity(int min, int max) {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    /**
     * @param count The exact number of arguments
     * @return An arity accepting only {@code count} arguments
     */
    public static Arity exactly(int count) {
        return new Arity(count, count);
    }

    /**
     * @param min The least number of arguments
     * @return An arity accepting {@code min} or more arguments
     */
    public static Arity atLeast(int min) {
        return new Arity(min, UNBOUNDED);
    }

    /**
     * @param count Number of arguments passed
     * @return Whether fewer than the minimum were passed
     */
    public boolean tooFew(int count) {
        return count < min;
    }

    /**
     * @param count Number of arguments passed
     * @return Whether more than the maximum were passed
     */
    public boolean tooMany(int count) {
        return count > max;
    }

    @Override
    public String toString() {
        if (min == max) {
            return String.valueOf(min);
        } else if (max == UNBOUNDED) {
            return "at least " + min;
        }
        return min + " to " + max;
    }
}
