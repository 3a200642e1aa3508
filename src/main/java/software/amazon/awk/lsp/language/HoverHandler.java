/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.language;

import java.util.ArrayList;
import java.util.List;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.HoverParams;
import org.eclipse.lsp4j.MarkupContent;
import org.eclipse.lsp4j.MarkupKind;
import software.amazon.awk.lsp.document.SymbolDefinition;
import software.amazon.awk.lsp.document.SymbolType;
import software.amazon.awk.lsp.document.SymbolUsage;
import software.amazon.awk.lsp.project.AwkFile;
import software.amazon.awk.lsp.project.IncludeGraph;
import software.amazon.awk.lsp.syntax.Builtins;

/**
 * Handles hover requests for AWK files.
 *
 * @param graph All known files
 * @param file The file the hover is in
 * @param compatibilityWarnings Whether GAWK built-ins are described in AWK files
 */
public record HoverHandler(IncludeGraph graph, AwkFile file, boolean compatibilityWarnings) {
    /**
     * Empty hover content.
     */
    public static final Hover EMPTY = new Hover(new MarkupContent(MarkupKind.PLAINTEXT, ""));

    private static final String SEPARATOR = "\n\n";

    /**
     * @param params The request params
     * @return The hover content
     */
    public Hover handle(HoverParams params) {
        SymbolUsage usage = SymbolSearch.usageAt(file, params.getPosition()).orElse(null);
        if (usage == null) {
            return EMPTY;
        }

        Builtins.Builtin builtin = Builtins.get(usage.name());
        if (builtin != null && isBuiltinUse(builtin, usage.type()) && isDescribed(builtin)) {
            return withText(describe(builtin));
        }

        List<String> texts = new ArrayList<>();
        for (SymbolDefinition definition : SymbolSearch.definitions(graph, file, usage)) {
            String text = describe(definition);
            if (text != null) {
                texts.add(text);
            }
        }
        if (texts.isEmpty()) {
            return switch (usage.type()) {
                case FUNCTION -> withText("undeclared function");
                case GLOBAL_VARIABLE -> withText("global variable");
                default -> EMPTY;
            };
        }
        return withText(String.join(SEPARATOR, texts));
    }

    /**
     * @param builtin A built-in function or variable
     * @return The hover text of the built-in
     */
    static String describe(Builtins.Builtin builtin) {
        if (builtin.function()) {
            return "built-in function: " + builtin.signature() + ": " + builtin.description();
        }
        return "built-in variable: " + builtin.description();
    }

    private static boolean isBuiltinUse(Builtins.Builtin builtin, SymbolType type) {
        return builtin.function() ? type == SymbolType.FUNCTION : type == SymbolType.GLOBAL_VARIABLE;
    }

    private boolean isDescribed(Builtins.Builtin builtin) {
        return builtin.awk() || compatibilityWarnings || file.extendedMode();
    }

    private static String describe(SymbolDefinition definition) {
        String text = switch (definition.type()) {
            case FUNCTION -> "function " + definition.name() + "(" + String.join(", ", definition.parameterNames())
                             + ")";
            case PARAMETER -> "parameter";
            case LOCAL_VARIABLE -> "local variable";
            default -> null;
        };
        String docComment = DocComments.leftAlign(definition.docComment());
        if (docComment.isEmpty()) {
            return text;
        }
        return text == null ? docComment : text + "\n" + docComment;
    }

    private static Hover withText(String text) {
        return new Hover(new MarkupContent(MarkupKind.PLAINTEXT, text));
    }
}
