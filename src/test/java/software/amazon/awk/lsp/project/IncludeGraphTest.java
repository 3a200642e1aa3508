/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.project;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;

import java.util.ArrayList;
import java.util.List;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.Range;
import org.junit.jupiter.api.Test;
import software.amazon.awk.lsp.diagnostics.AwkDiagnostics;
import software.amazon.awk.lsp.diagnostics.DiagnosticsSink;
import software.amazon.awk.lsp.protocol.LspAdapter;

public class IncludeGraphTest {
    private static final Range RANGE = LspAdapter.lineSpan(0, 9, 16);
    private static final DiagnosticsSink NO_SINK = (uri, diagnostics) -> { };

    @Test
    public void registersFilesOnce() {
        IncludeGraph graph = new IncludeGraph();

        AwkFile a = graph.getOrCreate("file:///a.awk");

        assertThat(graph.getOrCreate("file:///a.awk"), sameInstance(a));
        assertThat(graph.get("file:///a.awk"), sameInstance(a));
        assertThat(graph.contains("file:///b.awk"), is(false));
        assertThat(graph.get("file:///b.awk"), nullValue());
        assertThat(graph.contains(IncludeGraph.EDITOR_ROOT_URI), is(false));
    }

    @Test
    public void opensAndClosesThroughEditorRoot() {
        IncludeGraph graph = new IncludeGraph();
        AwkFile a = graph.getOrCreate("file:///a.awk");

        graph.open(a);
        graph.open(a);

        assertThat(graph.isOpen(a), is(true));
        assertThat(a.includedBy().keySet(), containsInAnyOrder(graph.editorRoot()));
        assertThat(graph.editorRoot().parseDiagnostics(), empty());
        assertThat(graph.close(a), is(true));
        assertThat(graph.close(a), is(false));
        assertThat(graph.isOpen(a), is(false));
    }

    @Test
    public void sweepKeepsFilesReachableFromEditor() {
        IncludeGraph graph = new IncludeGraph();
        AwkFile a = graph.getOrCreate("file:///a.awk");
        AwkFile b = graph.getOrCreate("file:///b.awk");
        AwkFile c = graph.getOrCreate("file:///c.awk");
        graph.open(a);
        a.addInclude(b, RANGE);

        List<AwkFile> dropped = graph.sweep(NO_SINK);

        assertThat(dropped, containsInAnyOrder(c));
        assertThat(graph.files(), containsInAnyOrder(a, b));
    }

    @Test
    public void sweepDropsUnreachableCycles() {
        IncludeGraph graph = new IncludeGraph();
        AwkFile a = graph.getOrCreate("file:///a.awk");
        AwkFile b = graph.getOrCreate("file:///b.awk");
        AwkFile c = graph.getOrCreate("file:///c.awk");
        graph.open(a);
        a.addInclude(b, RANGE);
        b.addInclude(c, RANGE);
        c.addInclude(b, RANGE);
        graph.close(a);

        List<AwkFile> dropped = graph.sweep(NO_SINK);

        assertThat(dropped, containsInAnyOrder(a, b, c));
        assertThat(graph.files(), empty());
        assertThat(b.isIncluded(), is(false));
        assertThat(c.isIncluded(), is(false));
    }

    @Test
    public void sweepWithdrawsDiagnosticsOfDroppedFiles() {
        List<String> withdrawn = new ArrayList<>();
        DiagnosticsSink sink = (uri, diagnostics) -> {
            if (diagnostics.isEmpty()) {
                withdrawn.add(uri);
            }
        };
        IncludeGraph graph = new IncludeGraph();
        AwkFile a = graph.getOrCreate("file:///a.awk");
        AwkFile b = graph.getOrCreate("file:///b.awk");
        graph.open(a);
        a.addInclude(b, RANGE);
        b.addParseDiagnostic(AwkDiagnostics.create(RANGE, "oops", DiagnosticSeverity.Error, AwkDiagnostics.SYNTAX));
        b.sendDiagnostics(sink, 100);

        graph.close(a);
        graph.sweep(sink);

        assertThat(withdrawn, equalTo(List.of("file:///b.awk")));
    }
}
