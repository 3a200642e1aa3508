/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.diagnostics;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.sameInstance;

import java.util.List;
import java.util.stream.Collectors;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.Position;
import org.junit.jupiter.api.Test;
import software.amazon.awk.lsp.protocol.LspAdapter;
import software.amazon.awk.lsp.syntax.Syntax;

public class AwkDiagnosticsTest {
    @Test
    public void convertsParserMessages() {
        Syntax.Message message = new Syntax.Message(
                Syntax.Severity.WARNING,
                Syntax.Category.MISSING_SEMICOLON,
                "missing semicolon",
                new Position(1, 9),
                1);

        Diagnostic diagnostic = AwkDiagnostics.fromMessage(message);

        assertThat(diagnostic.getMessage(), equalTo("missing semicolon"));
        assertThat(diagnostic.getSeverity(), equalTo(DiagnosticSeverity.Warning));
        assertThat(diagnostic.getSource(), equalTo(AwkDiagnostics.SOURCE));
        assertThat(diagnostic.getCode().getLeft(), equalTo(AwkDiagnostics.MISSING_SEMICOLON));
        assertThat(diagnostic.getRange(), equalTo(LspAdapter.lineSpan(1, 9, 10)));
    }

    @Test
    public void parserCrashesHaveTheirOwnCode() {
        Syntax.Message message = new Syntax.Message(
                Syntax.Severity.ERROR, Syntax.Category.INTERNAL, "parser crash", new Position(0, 0), 0);

        Diagnostic diagnostic = AwkDiagnostics.fromMessage(message);

        assertThat(diagnostic.getSeverity(), equalTo(DiagnosticSeverity.Error));
        assertThat(diagnostic.getCode().getLeft(), equalTo(AwkDiagnostics.PARSER_CRASH));
    }

    @Test
    public void limitKeepsListUnderMax() {
        List<Diagnostic> diagnostics = List.of(diagnostic(0, DiagnosticSeverity.Error));

        assertThat(AwkDiagnostics.limit(diagnostics, 5), sameInstance(diagnostics));
    }

    @Test
    public void limitDropsWarningsBeforeErrors() {
        List<Diagnostic> diagnostics = List.of(
                diagnostic(0, DiagnosticSeverity.Warning),
                diagnostic(1, DiagnosticSeverity.Error),
                diagnostic(2, DiagnosticSeverity.Warning),
                diagnostic(3, DiagnosticSeverity.Error));

        List<Diagnostic> limited = AwkDiagnostics.limit(diagnostics, 3);

        assertThat(lines(limited), contains(0, 1, 3));
    }

    @Test
    public void limitOfZeroDropsEverything() {
        List<Diagnostic> diagnostics = List.of(diagnostic(0, DiagnosticSeverity.Error));

        assertThat(AwkDiagnostics.limit(diagnostics, 0).size(), equalTo(0));
    }

    private static Diagnostic diagnostic(int line, DiagnosticSeverity severity) {
        return AwkDiagnostics.create(LspAdapter.lineSpan(line, 0, 1), "line " + line, severity, AwkDiagnostics.SYNTAX);
    }

    private static List<Integer> lines(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(d -> d.getRange().getStart().getLine()).collect(Collectors.toList());
    }
}
