/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.language;

import java.util.ArrayList;
import java.util.List;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.ReferenceParams;
import software.amazon.awk.lsp.document.SymbolUsage;
import software.amazon.awk.lsp.project.AwkFile;
import software.amazon.awk.lsp.project.IncludeGraph;

/**
 * Handles find-references requests for AWK files. Parameters and local
 * variables are only found within their function.
 *
 * @param graph All known files
 * @param file The file the request is in
 */
public record ReferencesHandler(IncludeGraph graph, AwkFile file) {
    /**
     * @param params The request params
     * @return A list of locations of the found refs
     */
    public List<Location> handle(ReferenceParams params) {
        SymbolUsage usage = SymbolSearch.usageAt(file, params.getPosition()).orElse(null);
        if (usage == null) {
            return List.of();
        }
        boolean includeDeclarations = params.getContext() == null || params.getContext().isIncludeDeclaration();
        List<Location> locations = new ArrayList<>();
        for (SymbolSearch.FoundUsage found : SymbolSearch.references(graph, file, usage, includeDeclarations)) {
            locations.add(new Location(found.uri(), found.usage().range()));
        }
        return locations;
    }
}
