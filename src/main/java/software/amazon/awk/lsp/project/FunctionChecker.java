/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.project;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.eclipse.lsp4j.DiagnosticSeverity;
import software.amazon.awk.lsp.diagnostics.AwkDiagnostics;
import software.amazon.awk.lsp.document.Arity;
import software.amazon.awk.lsp.document.ParameterUsage;
import software.amazon.awk.lsp.document.SymbolDefinition;
import software.amazon.awk.lsp.document.SymbolType;
import software.amazon.awk.lsp.document.SymbolUsage;
import software.amazon.awk.lsp.syntax.Builtins;

/**
 * Checks the function calls in a file against the functions it defines, the
 * functions defined by the files it includes, directly or not, and the
 * built-in functions.
 */
public final class FunctionChecker {
    private FunctionChecker() {
    }

    /**
     * Replaces the analysis diagnostics of {@code file} with the problems
     * found in its calls. Files without calls are only cleared.
     *
     * @param file The file to check
     */
    public static void check(AwkFile file) {
        file.clearAnalysisDiagnostics();
        if (file.parameterUsages().isEmpty()) {
            return;
        }

        Map<String, Arity> declared = new HashMap<>(file.functionArities());
        for (AwkFile included : file.includeClosure()) {
            for (Map.Entry<String, Arity> entry : included.functionArities().entrySet()) {
                String name = entry.getKey();
                if (file.functionArities().containsKey(name)) {
                    reportDuplicate(file, included, name);
                }
                declared.putIfAbsent(name, entry.getValue());
            }
        }

        Deque<Call> calls = new ArrayDeque<>();
        for (ParameterUsage usage : file.parameterUsages()) {
            if (usage.isCallStart()) {
                calls.push(new Call(usage.call(), resolve(file, usage.call(), declared)));
            } else if (usage.isCallEnd()) {
                if (!calls.isEmpty()) {
                    calls.pop().check(file);
                }
            } else if (usage.start() && !calls.isEmpty()) {
                calls.peek().arguments = usage.index() + 1;
            }
        }
    }

    private static Arity resolve(AwkFile file, SymbolUsage call, Map<String, Arity> declared) {
        Arity arity = declared.get(call.name());
        if (arity != null) {
            return arity;
        }
        Builtins.Builtin builtin = Builtins.get(call.name());
        if (builtin != null && builtin.function()) {
            return builtin.arity();
        }
        file.addAnalysisDiagnostic(AwkDiagnostics.create(
                call.range(), "undeclared function", DiagnosticSeverity.Error, AwkDiagnostics.UNDECLARED_FUNCTION));
        return null;
    }

    private static void reportDuplicate(AwkFile file, AwkFile included, String name) {
        List<SymbolDefinition> definitions = file.definitions(name, SymbolType.FUNCTION);
        if (definitions.isEmpty()) {
            return;
        }
        SymbolDefinition definition = definitions.get(0);
        file.addAnalysisDiagnostic(AwkDiagnostics.create(
                definition.location().getRange(),
                "function " + name + " is also defined in " + included.uri(),
                DiagnosticSeverity.Error,
                AwkDiagnostics.DUPLICATE_FUNCTION));
    }

    private static final class Call {
        private final SymbolUsage usage;
        private final Arity arity;
        private int arguments;

        private Call(SymbolUsage usage, Arity arity) {
            this.usage = usage;
            this.arity = arity;
        }

        private void check(AwkFile file) {
            if (arity == null) {
                return;
            }
            if (arity.tooFew(arguments)) {
                file.addAnalysisDiagnostic(AwkDiagnostics.create(
                        usage.range(), "not enough arguments", DiagnosticSeverity.Error,
                        AwkDiagnostics.NOT_ENOUGH_ARGUMENTS));
            } else if (arity.tooMany(arguments)) {
                file.addAnalysisDiagnostic(AwkDiagnostics.create(
                        usage.range(), "too many arguments", DiagnosticSeverity.Error,
                        AwkDiagnostics.TOO_MANY_ARGUMENTS));
            }
        }
    }
}
