/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.language;

import java.util.ArrayList;
import java.util.List;
import org.eclipse.lsp4j.DefinitionParams;
import org.eclipse.lsp4j.Location;
import software.amazon.awk.lsp.document.SymbolDefinition;
import software.amazon.awk.lsp.document.SymbolUsage;
import software.amazon.awk.lsp.project.AwkFile;
import software.amazon.awk.lsp.project.IncludeGraph;

/**
 * Handles go-to-definition requests for AWK files.
 *
 * @param graph All known files
 * @param file The file the request is in
 */
public record DefinitionHandler(IncludeGraph graph, AwkFile file) {
    /**
     * @param params The request params
     * @return A list of possible definition locations
     */
    public List<Location> handle(DefinitionParams params) {
        SymbolUsage usage = SymbolSearch.usageAt(file, params.getPosition()).orElse(null);
        if (usage == null) {
            return List.of();
        }
        List<Location> locations = new ArrayList<>();
        for (SymbolDefinition definition : SymbolSearch.definitions(graph, file, usage)) {
            locations.add(definition.location());
        }
        return locations;
    }
}
