/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.document;

import org.eclipse.lsp4j.Range;

/**
 * The directive that made one document include another.
 *
 * <p>Both sides of an include edge hold the same instance, so identity is
 * meaningful here.
 */
public final class IncludeDeclaration {
    private final Range range;

    public IncludeDeclaration(Range range) {
        this.range = range;
    }

    /**
     * @return The range of the include directive's file name
     */
    public Range range() {
        return range;
    }

    @Override
    public String toString() {
        return "IncludeDeclaration{range=" + range + '}';
    }
}
