/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.language;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.eclipse.lsp4j.SymbolKind;
import org.eclipse.lsp4j.WorkspaceSymbol;
import org.eclipse.lsp4j.WorkspaceSymbolParams;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import software.amazon.awk.lsp.document.SymbolDefinition;
import software.amazon.awk.lsp.document.SymbolType;
import software.amazon.awk.lsp.project.AwkFile;
import software.amazon.awk.lsp.project.IncludeGraph;

/**
 * Finds functions in every known file whose name starts with the query.
 *
 * @param graph All known files
 */
public record WorkspaceSymbolHandler(IncludeGraph graph) {
    /**
     * @param params The request params
     * @return The matching functions
     */
    public List<WorkspaceSymbol> handle(WorkspaceSymbolParams params) {
        String query = params.getQuery() == null ? "" : params.getQuery();
        List<WorkspaceSymbol> symbols = new ArrayList<>();
        for (AwkFile file : graph.files()) {
            for (Map.Entry<String, List<SymbolDefinition>> entry : file.symbolTable(SymbolType.FUNCTION).entrySet()) {
                if (!entry.getKey().startsWith(query)) {
                    continue;
                }
                for (SymbolDefinition definition : entry.getValue()) {
                    symbols.add(new WorkspaceSymbol(
                            definition.name(), SymbolKind.Function, Either.forLeft(definition.location())));
                }
            }
        }
        return symbols;
    }
}
