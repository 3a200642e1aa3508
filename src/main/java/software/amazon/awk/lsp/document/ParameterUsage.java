/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.document;

import org.eclipse.lsp4j.Position;

/**
 * A boundary in a function call's argument list.
 *
 * <p>An index of {@link #CALL} marks the boundary of the whole call: the
 * opening one at the callee's name when {@code start} is true, the closing one
 * at the closing parenthesis otherwise. Other indices mark the start or end
 * of the argument with that 0-based index.
 *
 * @param call The usage of the called function
 * @param index The argument index, or {@link #CALL}
 * @param start Whether this is a start boundary
 * @param position Where the boundary is
 */
public record ParameterUsage(SymbolUsage call, int index, boolean start, Position position) {
    public static final int CALL = -1;

    /**
     * @return Whether this opens a call
     */
    public boolean isCallStart() {
        return index == CALL && start;
    }

    /**
     * @return Whether this closes a call
     */
    public boolean isCallEnd() {
        return index == CALL && !start;
    }
}
