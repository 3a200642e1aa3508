/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.language;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.eclipse.lsp4j.DocumentSymbol;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.SymbolInformation;
import org.eclipse.lsp4j.SymbolKind;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import software.amazon.awk.lsp.document.SymbolDefinition;
import software.amazon.awk.lsp.document.SymbolType;
import software.amazon.awk.lsp.project.AwkFile;
import software.amazon.awk.lsp.protocol.LspAdapter;

/**
 * Lists the functions defined in a file, with their parameters and local
 * variables as children.
 *
 * @param file The file to list symbols of
 */
public record DocumentSymbolHandler(AwkFile file) {
    /**
     * @return A list of DocumentSymbol
     */
    public List<Either<SymbolInformation, DocumentSymbol>> handle() {
        List<SymbolDefinition> functions = new ArrayList<>();
        for (List<SymbolDefinition> definitions : file.symbolTable(SymbolType.FUNCTION).values()) {
            functions.addAll(definitions);
        }
        functions.sort(Comparator.comparing(SymbolDefinition::position, LspAdapter::compare));

        List<Either<SymbolInformation, DocumentSymbol>> result = new ArrayList<>();
        for (SymbolDefinition function : functions) {
            result.add(Either.forRight(functionSymbol(function)));
        }
        return result;
    }

    private DocumentSymbol functionSymbol(SymbolDefinition function) {
        Range selectionRange = function.location().getRange();
        Range range = file.functionRange(function).orElse(selectionRange);
        DocumentSymbol symbol = new DocumentSymbol(function.name(), SymbolKind.Function, range, selectionRange);
        symbol.setDetail("function " + function.name() + "(" + String.join(", ", function.parameterNames()) + ")");

        List<DocumentSymbol> children = new ArrayList<>();
        for (SymbolDefinition parameter : function.parameters()) {
            children.add(variableSymbol(parameter, "parameter"));
        }
        for (SymbolDefinition local : function.locals()) {
            children.add(variableSymbol(local, "local variable"));
        }
        if (!children.isEmpty()) {
            symbol.setChildren(children);
        }
        return symbol;
    }

    private static DocumentSymbol variableSymbol(SymbolDefinition definition, String detail) {
        Range range = definition.location().getRange();
        return new DocumentSymbol(definition.name(), SymbolKind.Variable, range, range, detail);
    }
}
