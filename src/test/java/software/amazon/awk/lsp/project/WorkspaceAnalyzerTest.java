/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.project;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.Position;
import org.junit.jupiter.api.Test;
import software.amazon.awk.lsp.InMemoryIncludeFiles;
import software.amazon.awk.lsp.ServerOptions;
import software.amazon.awk.lsp.document.SymbolDefinition;
import software.amazon.awk.lsp.document.SymbolType;
import software.amazon.awk.lsp.protocol.LspAdapter;

public class WorkspaceAnalyzerTest {
    private static final String MAIN = "file:///work/main.awk";
    private static final String LIB = "file:///work/lib.awk";
    private static final ServerOptions OPTIONS = ServerOptions.builder().setIncludePath(List.of()).build();

    private final InMemoryIncludeFiles files = new InMemoryIncludeFiles();
    private final Map<String, List<Diagnostic>> published = new HashMap<>();
    private final WorkspaceAnalyzer analyzer = new WorkspaceAnalyzer(files, published::put, Runnable::run, OPTIONS);

    private List<String> publishedMessages(String uri) {
        return published.get(uri).stream().map(Diagnostic::getMessage).collect(Collectors.toList());
    }

    @Test
    public void analyzesOpenedFile() {
        analyzer.open(MAIN, "function f(a,  b) { }\n");

        AwkFile file = analyzer.getFile(MAIN);
        assertThat(file.text(), equalTo("function f(a,  b) { }\n"));
        assertThat(file.isDefined("f", SymbolType.FUNCTION), is(true));
        assertThat(file.definitions("a", SymbolType.PARAMETER).size(), equalTo(1));
        assertThat(file.definitions("b", SymbolType.LOCAL_VARIABLE).size(), equalTo(1));
        assertThat(file.functionArities().get("f").toString(), equalTo("1"));
        assertThat(analyzer.graph().isOpen(file), is(true));
        assertThat(analyzer.isIdle(), is(true));
    }

    @Test
    public void recordsFunctionStructure() {
        analyzer.open(MAIN, "function f(x) {\n    return g(x)\n}\n");

        AwkFile file = analyzer.getFile(MAIN);
        SymbolDefinition x = file.definitions("x", SymbolType.PARAMETER).get(0);
        assertThat(file.functionRange(x).map(r -> r.getEnd().getLine()).orElse(-1), equalTo(2));
        assertThat(file.positionTree().pathAt(new Position(1, 13)), contains("function f", "g()"));
        assertThat(file.parameterUsages().size(), equalTo(4));
    }

    @Test
    public void followsIncludes() {
        files.put("/work/lib.awk", "function helper() { }\n");

        analyzer.open(MAIN, "@include \"lib.awk\"\nBEGIN { helper(); }\n");

        AwkFile main = analyzer.getFile(MAIN);
        AwkFile lib = analyzer.getFile(LIB);
        assertThat(lib, notNullValue());
        assertThat(main.includes(), hasKey(lib));
        assertThat(lib.isDefined("helper", SymbolType.FUNCTION), is(true));
        assertThat(analyzer.graph().isOpen(lib), is(false));
        assertThat(files.reads(), contains("/work/lib.awk"));
        assertThat(published, not(hasKey(MAIN)));
    }

    @Test
    public void knownFilesAreNotReadAgain() {
        files.put("/work/lib.awk", "function helper() { }\n");
        analyzer.open(LIB, "function helper() { }\n");

        analyzer.open(MAIN, "@include \"lib.awk\"\n");
        analyzer.change(MAIN, "@include \"lib.awk\"\nBEGIN { }\n");

        assertThat(files.reads(), empty());
        assertThat(analyzer.getFile(MAIN).includes(), hasKey(analyzer.getFile(LIB)));
    }

    @Test
    public void includeNamesThatAreNotFileNamesAreMissing() {
        analyzer.open(MAIN, "@include \"a\0b\"\nBEGIN { }\n");

        assertThat(publishedMessages(MAIN), contains("no such file: a\0b (file:///work/main.awk)"));
        assertThat(analyzer.isIdle(), is(true));
    }

    @Test
    public void reportsMissingIncludes() {
        analyzer.open(MAIN, "@include \"missing.awk\"\n");

        assertThat(publishedMessages(MAIN), contains("no such file: missing.awk (file:///work/main.awk)"));
        assertThat(published.get(MAIN).get(0).getSeverity(), equalTo(DiagnosticSeverity.Error));
        assertThat(published.get(MAIN).get(0).getRange(), equalTo(LspAdapter.lineSpan(0, 9, 22)));
    }

    @Test
    public void outstandingReadsHoldBackAnalysis() {
        files.put("/work/lib.awk", "function helper() { }\n").deferReads();

        analyzer.open(MAIN, "@include \"lib.awk\"\nBEGIN { helper(1); }\n");
        analyzer.open("file:///work/other.awk", "BEGIN { }\n");

        assertThat(analyzer.isIdle(), is(false));
        assertThat(analyzer.getFile(LIB).text(), equalTo(""));
        assertThat(analyzer.getFile("file:///work/other.awk").text(), equalTo(""));
        assertThat(published, not(hasKey(MAIN)));

        files.completeReads();

        assertThat(analyzer.isIdle(), is(true));
        assertThat(analyzer.getFile(LIB).text(), equalTo("function helper() { }\n"));
        assertThat(analyzer.getFile("file:///work/other.awk").text(), equalTo("BEGIN { }\n"));
        assertThat(publishedMessages(MAIN), contains("too many arguments"));
    }

    @Test
    public void unreadableIncludeIsReportedMissing() {
        files.unreadable("/work/lib.awk");

        analyzer.open(MAIN, "@include \"lib.awk\"\n");

        assertThat(publishedMessages(MAIN), contains("no such file: lib.awk (file:///work/main.awk)"));
        assertThat(analyzer.getFile(LIB), nullValue());
        assertThat(analyzer.getFile(MAIN).includes().isEmpty(), is(true));
        assertThat(analyzer.isIdle(), is(true));
    }

    @Test
    public void closingDropsFileAndItsIncludes() {
        files.put("/work/lib.awk", "BEGIN { oops(); }\n");
        analyzer.open(MAIN, "@include \"lib.awk\"\nBEGIN { f(); }\n");
        assertThat(publishedMessages(MAIN), contains("undeclared function"));
        assertThat(publishedMessages(LIB), contains("undeclared function"));

        analyzer.close(MAIN);

        assertThat(analyzer.getFile(MAIN), nullValue());
        assertThat(analyzer.getFile(LIB), nullValue());
        assertThat(published.get(MAIN), empty());
        assertThat(published.get(LIB), empty());
    }

    @Test
    public void closedFileStaysWhileIncluded() {
        analyzer.open(LIB, "function helper() { }\n");
        analyzer.open(MAIN, "@include \"lib.awk\"\n");
        AwkFile lib = analyzer.getFile(LIB);

        analyzer.close(LIB);

        assertThat(analyzer.getFile(LIB), sameInstance(lib));
        assertThat(analyzer.graph().isOpen(lib), is(false));
        assertThat(lib.text(), equalTo("function helper() { }\n"));
    }

    @Test
    public void closingUnknownFileIsIgnored() {
        analyzer.close(MAIN);

        assertThat(analyzer.graph().files(), empty());
    }

    @Test
    public void changesReplaceResults() {
        analyzer.open(MAIN, "BEGIN { f(); }\n");
        assertThat(publishedMessages(MAIN), contains("undeclared function"));

        analyzer.change(MAIN, "function f() { }\nBEGIN { f(); }\n");

        assertThat(published.get(MAIN), empty());
        assertThat(analyzer.getFile(MAIN).isDefined("f", SymbolType.FUNCTION), is(true));
    }

    @Test
    public void changingFunctionsRechecksIncluders() {
        analyzer.open(LIB, "function helper(a) { }\n");
        analyzer.open(MAIN, "@include \"lib.awk\"\nBEGIN { helper(1); }\n");
        assertThat(published, not(hasKey(MAIN)));

        analyzer.change(LIB, "function helper(a, b) { }\n");

        assertThat(publishedMessages(MAIN), contains("not enough arguments"));
    }

    @Test
    public void changingUnknownFileOpensIt() {
        analyzer.change(MAIN, "BEGIN { }\n");

        assertThat(analyzer.graph().isOpen(analyzer.getFile(MAIN)), is(true));
    }

    @Test
    public void optionsThatAffectAnalysisReanalyze() {
        analyzer.open(MAIN, "BEGIN {\n    x = 1\n}\n");
        assertThat(published, not(hasKey(MAIN)));

        boolean reanalyzed = analyzer.updateOptions(ServerOptions.builder()
                .setIncludePath(List.of())
                .setMissingSemicolonWarnings(true)
                .build());

        assertThat(reanalyzed, is(true));
        assertThat(publishedMessages(MAIN), contains("missing semicolon"));
        assertThat(published.get(MAIN).get(0).getSeverity(), equalTo(DiagnosticSeverity.Warning));
        assertThat(analyzer.updateOptions(analyzer.options()), is(false));
    }

    @Test
    public void strictModeReportsGawkExtensions() {
        analyzer.updateOptions(ServerOptions.builder().setIncludePath(List.of()).setExtendedMode(false).build());

        analyzer.open(MAIN, "BEGIN { print systime(); }\n");

        assertThat(analyzer.getFile(MAIN).extendedMode(), is(false));
        assertThat(publishedMessages(MAIN), contains("systime is a gawk extension"));
    }

    @Test
    public void compatibilityWarningsCanBeTurnedOff() {
        analyzer.updateOptions(ServerOptions.builder()
                .setIncludePath(List.of())
                .setExtendedMode(false)
                .setCompatibilityWarnings(false)
                .build());

        analyzer.open(MAIN, "BEGIN { print systime(); }\n");

        assertThat(published, not(hasKey(MAIN)));
    }

    @Test
    public void limitsPublishedDiagnostics() {
        analyzer.updateOptions(ServerOptions.builder().setIncludePath(List.of()).setMaxNumberOfProblems(1).build());

        analyzer.open(MAIN, "BEGIN { f(); g(); }\n");

        assertThat(published.get(MAIN).size(), equalTo(1));
        assertThat(analyzer.getFile(MAIN).analysisDiagnostics().size(), equalTo(2));
    }
}
