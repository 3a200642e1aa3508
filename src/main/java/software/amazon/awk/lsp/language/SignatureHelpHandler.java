/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.language;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.eclipse.lsp4j.MarkupContent;
import org.eclipse.lsp4j.MarkupKind;
import org.eclipse.lsp4j.ParameterInformation;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.SignatureHelp;
import org.eclipse.lsp4j.SignatureHelpParams;
import org.eclipse.lsp4j.SignatureInformation;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import software.amazon.awk.lsp.document.Document;
import software.amazon.awk.lsp.document.ParameterUsage;
import software.amazon.awk.lsp.document.SymbolDefinition;
import software.amazon.awk.lsp.document.SymbolUsage;
import software.amazon.awk.lsp.project.AwkFile;
import software.amazon.awk.lsp.project.IncludeGraph;
import software.amazon.awk.lsp.protocol.LspAdapter;
import software.amazon.awk.lsp.syntax.Builtins;

/**
 * Shows the signature of the innermost call around the cursor, using the
 * call and argument boundaries recorded when the file was analyzed.
 *
 * @param graph All known files
 * @param file The file the request is in
 */
public record SignatureHelpHandler(IncludeGraph graph, AwkFile file) {
    /**
     * @param params The request params
     * @return The signature of the call, or {@code null} outside of calls
     */
    public SignatureHelp handle(SignatureHelpParams params) {
        Position cursor = params.getPosition();
        ParameterUsage last = file.findParameterUsageAt(cursor).orElse(null);
        if (last == null) {
            return null;
        }

        Deque<ActiveCall> calls = new ArrayDeque<>();
        ParameterUsage lastReplayed = null;
        for (ParameterUsage usage : file.parameterUsages()) {
            int order = LspAdapter.compare(usage.position(), cursor);
            if (order > 0 || (order == 0 && !(usage.start() && usage.index() != ParameterUsage.CALL))) {
                break;
            }
            if (usage.isCallStart()) {
                calls.push(new ActiveCall(usage.call()));
            } else if (usage.isCallEnd()) {
                calls.poll();
            } else if (!calls.isEmpty()) {
                calls.peek().argument = usage.index();
            }
            lastReplayed = usage;
        }
        if (calls.isEmpty()) {
            return null;
        }

        ActiveCall call = calls.peek();
        if (lastReplayed != null && !lastReplayed.start() && lastReplayed.index() != ParameterUsage.CALL
            && commaBetween(lastReplayed.position(), cursor)) {
            call.argument++;
        }

        List<SignatureInformation> signatures = signatures(call.usage);
        if (signatures.isEmpty()) {
            return null;
        }
        return new SignatureHelp(signatures, 0, call.argument);
    }

    private List<SignatureInformation> signatures(SymbolUsage call) {
        List<SignatureInformation> signatures = new ArrayList<>();
        for (SymbolDefinition definition : SymbolSearch.definitions(graph, file, call)) {
            List<ParameterInformation> parameters = new ArrayList<>();
            for (String name : definition.parameterNames()) {
                parameters.add(new ParameterInformation(name));
            }
            String label = definition.name() + "(" + String.join(", ", definition.parameterNames()) + ")";
            SignatureInformation signature = new SignatureInformation(label);
            signature.setParameters(parameters);
            String doc = DocComments.leftAlign(definition.docComment());
            if (!doc.isEmpty()) {
                signature.setDocumentation(Either.forRight(new MarkupContent(MarkupKind.PLAINTEXT, doc)));
            }
            signatures.add(signature);
        }
        if (signatures.isEmpty()) {
            Builtins.Builtin builtin = Builtins.get(call.name());
            if (builtin != null && builtin.function()) {
                List<ParameterInformation> parameters = new ArrayList<>();
                for (String name : builtin.parameters()) {
                    parameters.add(new ParameterInformation(name));
                }
                SignatureInformation signature = new SignatureInformation(builtin.signature());
                signature.setParameters(parameters);
                signature.setDocumentation(
                        Either.forRight(new MarkupContent(MarkupKind.PLAINTEXT, builtin.description())));
                signatures.add(signature);
            }
        }
        return signatures;
    }

    private boolean commaBetween(Position from, Position to) {
        Document document = Document.of(file.text());
        int start = document.indexOfPosition(from);
        int end = LspAdapter.compare(to, document.end()) >= 0 ? document.length() : document.indexOfPosition(to);
        if (start < 0 || end < 0) {
            return false;
        }
        CharSequence text = document.borrowText();
        for (int i = start; i < end; i++) {
            if (text.charAt(i) == ',') {
                return true;
            }
        }
        return false;
    }

    private static final class ActiveCall {
        private final SymbolUsage usage;
        private int argument;

        private ActiveCall(SymbolUsage usage) {
            this.usage = usage;
        }
    }
}
