/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.diagnostics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.Range;
import software.amazon.awk.lsp.protocol.LspAdapter;
import software.amazon.awk.lsp.syntax.Syntax;

/**
 * Creates diagnostics for AWK files.
 */
public final class AwkDiagnostics {
    public static final String SOURCE = "awk-language-server";

    public static final String SYNTAX = "syntax";
    public static final String MISSING_SEMICOLON = "missing-semicolon";
    public static final String COMPATIBILITY = "compatibility";
    public static final String STRUCTURE = "structure";
    public static final String PARSER_CRASH = "parser-crash";
    public static final String REPEATED_INCLUDE = "repeated-include";
    public static final String NO_SUCH_FILE = "no-such-file";
    public static final String UNDECLARED_FUNCTION = "undeclared-function";
    public static final String NOT_ENOUGH_ARGUMENTS = "not-enough-arguments";
    public static final String TOO_MANY_ARGUMENTS = "too-many-arguments";
    public static final String DUPLICATE_FUNCTION = "duplicate-function";

    private static final Comparator<Diagnostic> BY_SEVERITY = Comparator.comparingInt(AwkDiagnostics::severityRank);
    private static final Comparator<Diagnostic> BY_POSITION =
            (a, b) -> LspAdapter.compare(a.getRange().getStart(), b.getRange().getStart());

    private AwkDiagnostics() {
    }

    /**
     * @param range Range the diagnostic covers
     * @param message The message
     * @param severity How bad it is
     * @param code One of the codes defined by this class
     * @return The diagnostic
     */
    public static Diagnostic create(Range range, String message, DiagnosticSeverity severity, String code) {
        return new Diagnostic(range, message, severity, SOURCE, code);
    }

    /**
     * @param message A message produced by the parser
     * @return The diagnostic for the message
     */
    public static Diagnostic fromMessage(Syntax.Message message) {
        DiagnosticSeverity severity = message.severity() == Syntax.Severity.ERROR
                ? DiagnosticSeverity.Error
                : DiagnosticSeverity.Warning;
        String code = switch (message.category()) {
            case SYNTAX -> SYNTAX;
            case MISSING_SEMICOLON -> MISSING_SEMICOLON;
            case COMPATIBILITY -> COMPATIBILITY;
            case STRUCTURE -> STRUCTURE;
            case INTERNAL -> PARSER_CRASH;
        };
        return create(LspAdapter.span(message.position(), message.length()), message.text(), severity, code);
    }

    /**
     * Caps the number of diagnostics, dropping the least severe ones first.
     *
     * @param diagnostics Diagnostics of one document
     * @param max Most diagnostics to keep
     * @return At most {@code max} diagnostics, ordered by position if any were
     *  dropped, or {@code diagnostics} itself otherwise
     */
    public static List<Diagnostic> limit(List<Diagnostic> diagnostics, int max) {
        if (diagnostics.size() <= max) {
            return diagnostics;
        }
        List<Diagnostic> kept = new ArrayList<>(diagnostics);
        // List.sort is stable, so equally severe diagnostics keep their order.
        kept.sort(BY_SEVERITY);
        kept = new ArrayList<>(kept.subList(0, Math.max(0, max)));
        kept.sort(BY_POSITION);
        return kept;
    }

    private static int severityRank(Diagnostic diagnostic) {
        DiagnosticSeverity severity = diagnostic.getSeverity();
        return severity == null ? DiagnosticSeverity.Hint.getValue() : severity.getValue();
    }
}
