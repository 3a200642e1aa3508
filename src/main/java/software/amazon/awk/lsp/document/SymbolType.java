/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.document;

/**
 * The kinds of symbols an AWK document defines and uses.
 *
 * <p>The first half of the constants are use types. Each has a definition
 * flavored counterpart at the same offset in the second half, which marks the
 * usage that sits on a symbol's declaration.
 */
public enum SymbolType {
    FUNCTION,
    GLOBAL_VARIABLE,
    LOCAL_VARIABLE,
    PARAMETER,

    DEFINE_FUNCTION,
    DEFINE_GLOBAL_VARIABLE,
    DEFINE_LOCAL_VARIABLE,
    DEFINE_PARAMETER;

    private static final int NR_USE_TYPES = 4;
    private static final SymbolType[] VALUES = values();

    /**
     * @return Whether this is a definition flavored type
     */
    public boolean isDefineType() {
        return ordinal() >= NR_USE_TYPES;
    }

    /**
     * @return The definition flavored counterpart of this type, or this type
     *  if it already is one
     */
    public SymbolType toDefineType() {
        return isDefineType() ? this : VALUES[ordinal() + NR_USE_TYPES];
    }

    /**
     * @return The use type of this type, or this type if it already is one
     */
    public SymbolType fromDefineType() {
        return isDefineType() ? VALUES[ordinal() - NR_USE_TYPES] : this;
    }

    /**
     * @return Whether symbols of this type live in a function's scope
     */
    public boolean isFunctionScoped() {
        SymbolType base = fromDefineType();
        return base == LOCAL_VARIABLE || base == PARAMETER;
    }
}
