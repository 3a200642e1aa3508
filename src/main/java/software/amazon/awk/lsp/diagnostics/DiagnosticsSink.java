/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.diagnostics;

import java.util.List;
import org.eclipse.lsp4j.Diagnostic;

/**
 * Receives the diagnostics of a document whenever they change.
 */
@FunctionalInterface
public interface DiagnosticsSink {
    /**
     * @param uri URI of the document
     * @param diagnostics All current diagnostics of the document, possibly empty
     */
    void publish(String uri, List<Diagnostic> diagnostics);
}
