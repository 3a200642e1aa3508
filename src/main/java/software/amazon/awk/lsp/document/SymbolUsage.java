/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.document;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import software.amazon.awk.lsp.protocol.LspAdapter;

/**
 * An occurrence of a symbol in a document.
 *
 * @param name The name of the symbol
 * @param type How the symbol is used
 * @param position Where the usage starts
 */
public record SymbolUsage(String name, SymbolType type, Position position) {
    /**
     * @return The number of characters the usage covers
     */
    public int length() {
        return name.length();
    }

    /**
     * @return The range of the name
     */
    public Range range() {
        return LspAdapter.span(position, length());
    }

    /**
     * @return This usage with any definition flavor removed from its type
     */
    public SymbolUsage asUse() {
        return type.isDefineType() ? new SymbolUsage(name, type.fromDefineType(), position) : this;
    }
}
