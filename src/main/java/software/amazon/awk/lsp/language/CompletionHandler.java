/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.language;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionItemKind;
import org.eclipse.lsp4j.CompletionParams;
import org.eclipse.lsp4j.MarkupContent;
import org.eclipse.lsp4j.MarkupKind;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import software.amazon.awk.lsp.document.SymbolDefinition;
import software.amazon.awk.lsp.document.SymbolType;
import software.amazon.awk.lsp.project.AwkFile;
import software.amazon.awk.lsp.project.IncludeGraph;
import software.amazon.awk.lsp.syntax.Builtins;

/**
 * Handles completion requests for AWK files.
 *
 * <p>Completes every function and global variable defined in any known file,
 * the parameters and local variables of the function around the cursor, and
 * the built-ins available in the file's dialect.
 *
 * @param graph All known files
 * @param file The file completion is requested in
 */
public record CompletionHandler(IncludeGraph graph, AwkFile file) {
    /**
     * @param params The request params
     * @return A list of possible completions
     */
    public List<CompletionItem> handle(CompletionParams params) {
        Position position = params.getPosition();
        List<CompletionItem> items = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();

        SymbolSearch.enclosingFunction(file, position).ifPresent(function -> {
            for (SymbolDefinition parameter : function.parameters()) {
                addDefined(items, seen, parameter.name(), CompletionItemKind.Variable, "parameter", "");
            }
            for (SymbolDefinition local : function.locals()) {
                addDefined(items, seen, local.name(), CompletionItemKind.Variable, "local variable", "");
            }
        });

        addGlobal(items, seen, SymbolType.FUNCTION, CompletionItemKind.Function);
        addGlobal(items, seen, SymbolType.GLOBAL_VARIABLE, CompletionItemKind.Variable);

        for (Builtins.Builtin builtin : Builtins.all()) {
            if (!builtin.availableIn(file.extendedMode()) || !seen.add(builtin.name())) {
                continue;
            }
            CompletionItem item = new CompletionItem(builtin.name());
            item.setKind(builtin.function() ? CompletionItemKind.Function : CompletionItemKind.Variable);
            item.setDetail(builtin.function() ? builtin.signature() : "built-in variable");
            item.setDocumentation(markup(builtin.description()));
            items.add(item);
        }
        return items;
    }

    private void addGlobal(List<CompletionItem> items, Set<String> seen, SymbolType type, CompletionItemKind kind) {
        Map<String, List<String>> docs = new LinkedHashMap<>();
        Map<String, String> details = new LinkedHashMap<>();
        for (AwkFile known : graph.files()) {
            for (Map.Entry<String, List<SymbolDefinition>> entry : known.symbolTable(type).entrySet()) {
                List<String> nameDocs = docs.computeIfAbsent(entry.getKey(), k -> new ArrayList<>());
                for (SymbolDefinition definition : entry.getValue()) {
                    String doc = DocComments.leftAlign(definition.docComment());
                    if (!doc.isEmpty() && !nameDocs.contains(doc)) {
                        nameDocs.add(doc);
                    }
                    if (type == SymbolType.FUNCTION) {
                        details.putIfAbsent(entry.getKey(), "function " + definition.name()
                                + "(" + String.join(", ", definition.parameterNames()) + ")");
                    }
                }
            }
        }
        for (Map.Entry<String, List<String>> entry : docs.entrySet()) {
            String detail = details.getOrDefault(entry.getKey(), "global variable");
            addDefined(items, seen, entry.getKey(), kind, detail, String.join("\n\n", entry.getValue()));
        }
    }

    private static void addDefined(List<CompletionItem> items, Set<String> seen, String name,
                                   CompletionItemKind kind, String detail, String documentation) {
        if (!seen.add(name)) {
            return;
        }
        CompletionItem item = new CompletionItem(name);
        item.setKind(kind);
        item.setDetail(detail);
        if (!documentation.isEmpty()) {
            item.setDocumentation(markup(documentation));
        }
        items.add(item);
    }

    private static Either<String, MarkupContent> markup(String text) {
        return Either.forRight(new MarkupContent(MarkupKind.PLAINTEXT, text));
    }
}
