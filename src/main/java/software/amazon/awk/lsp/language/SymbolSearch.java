/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.language;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import software.amazon.awk.lsp.document.SymbolDefinition;
import software.amazon.awk.lsp.document.SymbolType;
import software.amazon.awk.lsp.document.SymbolUsage;
import software.amazon.awk.lsp.project.AwkFile;
import software.amazon.awk.lsp.project.IncludeGraph;
import software.amazon.awk.lsp.protocol.LspAdapter;

/**
 * Finds symbols and their definitions across the known files.
 */
final class SymbolSearch {
    private static final String FUNCTION_SEGMENT = "function ";

    private SymbolSearch() {
    }

    /**
     * @param file The file to search
     * @param position The cursor
     * @return The usage under the cursor, as a use even if it is a declaration
     */
    static Optional<SymbolUsage> usageAt(AwkFile file, Position position) {
        return file.findUsageAt(position).map(SymbolUsage::asUse);
    }

    /**
     * @param file The file to search
     * @param position A position in the file
     * @return The function whose body contains {@code position}
     */
    static Optional<SymbolDefinition> enclosingFunction(AwkFile file, Position position) {
        List<String> path = file.positionTree().pathAt(position);
        if (!path.isEmpty() && path.get(0).startsWith(FUNCTION_SEGMENT)) {
            String name = path.get(0).substring(FUNCTION_SEGMENT.length());
            // With the same function defined twice, take the last one before the position.
            SymbolDefinition enclosing = null;
            for (SymbolDefinition definition : file.definitions(name, SymbolType.FUNCTION)) {
                if (LspAdapter.compare(definition.position(), position) <= 0) {
                    enclosing = definition;
                }
            }
            return Optional.ofNullable(enclosing);
        }

        // Parameter lists come before the body.
        SymbolDefinition enclosing = null;
        for (List<SymbolDefinition> definitions : file.symbolTable(SymbolType.FUNCTION).values()) {
            for (SymbolDefinition definition : definitions) {
                boolean contains = file.functionRange(definition)
                        .map(range -> LspAdapter.contains(range, position))
                        .orElse(false);
                if (contains && (enclosing == null
                                 || LspAdapter.compare(enclosing.position(), definition.position()) < 0)) {
                    enclosing = definition;
                }
            }
        }
        return Optional.ofNullable(enclosing);
    }

    /**
     * Parameters and locals resolve within the function they are used in.
     * Functions and globals resolve to their definitions in every known file,
     * preferring declarations over first uses.
     *
     * @param graph All known files
     * @param file The file the usage is in
     * @param usage The usage
     * @return Definitions of the used symbol
     */
    static List<SymbolDefinition> definitions(IncludeGraph graph, AwkFile file, SymbolUsage usage) {
        SymbolType type = usage.type().fromDefineType();
        if (type.isFunctionScoped()) {
            List<SymbolDefinition> scoped = new ArrayList<>();
            enclosingFunction(file, usage.position()).ifPresent(function -> {
                List<SymbolDefinition> candidates = type == SymbolType.PARAMETER
                        ? function.parameters()
                        : function.locals();
                for (SymbolDefinition candidate : candidates) {
                    if (candidate.name().equals(usage.name())) {
                        scoped.add(candidate);
                    }
                }
            });
            return scoped;
        }

        List<SymbolDefinition> declared = new ArrayList<>();
        List<SymbolDefinition> implicit = new ArrayList<>();
        for (AwkFile known : graph.files()) {
            for (SymbolDefinition definition : known.definitions(usage.name(), type)) {
                (definition.isImplicit() ? implicit : declared).add(definition);
            }
        }
        return declared.isEmpty() ? implicit : declared;
    }

    /**
     * @param graph All known files
     * @param file The file the usage is in
     * @param usage The usage
     * @param includeDeclarations Whether to include the usages on declarations
     * @return Every usage of the same symbol
     */
    static List<FoundUsage> references(IncludeGraph graph, AwkFile file, SymbolUsage usage,
                                       boolean includeDeclarations) {
        SymbolType type = usage.type().fromDefineType();
        List<FoundUsage> found = new ArrayList<>();
        if (type.isFunctionScoped()) {
            Optional<Range> scope = enclosingFunction(file, usage.position()).flatMap(file::functionRange);
            if (scope.isEmpty()) {
                return found;
            }
            collect(file, usage.name(), type, includeDeclarations, scope.get(), found);
            return found;
        }
        for (AwkFile known : graph.files()) {
            collect(known, usage.name(), type, includeDeclarations, null, found);
        }
        return found;
    }

    private static void collect(AwkFile file, String name, SymbolType type, boolean includeDeclarations,
                                Range within, List<FoundUsage> found) {
        for (SymbolUsage candidate : file.usages()) {
            if (!candidate.name().equals(name) || candidate.type().fromDefineType() != type) {
                continue;
            }
            if (candidate.type().isDefineType() && !includeDeclarations) {
                continue;
            }
            if (within != null && !LspAdapter.contains(within, candidate.position())) {
                continue;
            }
            found.add(new FoundUsage(file.uri(), candidate));
        }
    }

    /**
     * @param uri The file the usage is in
     * @param usage The usage
     */
    record FoundUsage(String uri, SymbolUsage usage) {
    }
}
