/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.project;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.eclipse.lsp4j.Diagnostic;
import org.junit.jupiter.api.Test;
import software.amazon.awk.lsp.InMemoryIncludeFiles;
import software.amazon.awk.lsp.ServerOptions;
import software.amazon.awk.lsp.protocol.LspAdapter;

public class FunctionCheckerTest {
    private static final String MAIN = "file:///work/main.awk";

    private final InMemoryIncludeFiles files = new InMemoryIncludeFiles();
    private final Map<String, List<Diagnostic>> published = new HashMap<>();

    private WorkspaceAnalyzer analyzer(ServerOptions options) {
        return new WorkspaceAnalyzer(files, published::put, Runnable::run, options);
    }

    private AwkFile analyze(String text) {
        WorkspaceAnalyzer analyzer = analyzer(ServerOptions.builder().setIncludePath(List.of()).build());
        analyzer.open(MAIN, text);
        return analyzer.getFile(MAIN);
    }

    private static List<String> messages(AwkFile file) {
        return file.analysisDiagnostics().stream().map(Diagnostic::getMessage).collect(Collectors.toList());
    }

    @Test
    public void reportsUndeclaredFunctions() {
        AwkFile file = analyze("BEGIN { f(1); }");

        assertThat(messages(file), contains("undeclared function"));
        assertThat(file.analysisDiagnostics().get(0).getRange(), equalTo(LspAdapter.lineSpan(0, 8, 9)));
        assertThat(published.get(MAIN).size(), equalTo(1));
    }

    @Test
    public void checksArgumentCounts() {
        AwkFile file = analyze("""
                function f(a, b) { }
                BEGIN { f(1); f(1, 2, 3); f(1, 2); f(g(), 2); }
                function g() { }
                """);

        assertThat(messages(file), contains("not enough arguments", "too many arguments"));
    }

    @Test
    public void docCommentMarksOptionalParameters() {
        AwkFile file = analyze("""
                ## @param a required
                ## @param [b] optional
                function f(a, b) { }
                BEGIN { f(1); f(1, 2); }
                """);

        assertThat(messages(file), empty());
    }

    @Test
    public void checksBuiltinCalls() {
        AwkFile file = analyze("BEGIN { x = substr(\"a\"); y = length(); z = substr(\"abc\", 1, 2, 3); }");

        assertThat(messages(file), contains("not enough arguments", "too many arguments"));
    }

    @Test
    public void nestedCallsAreCheckedSeparately() {
        AwkFile file = analyze("""
                function f(a) { }
                BEGIN { f(f()); }
                """);

        assertThat(messages(file), contains("not enough arguments"));
        assertThat(file.analysisDiagnostics().get(0).getRange(), equalTo(LspAdapter.lineSpan(1, 10, 11)));
    }

    @Test
    public void seesFunctionsOfIndirectIncludes() {
        files.put("/work/b.awk", "@include \"c.awk\"\n");
        files.put("/work/c.awk", "function g(x) { }\n");

        AwkFile file = analyze("@include \"b.awk\"\nBEGIN { g(1, 2); h(); }");

        assertThat(messages(file), contains("too many arguments", "undeclared function"));
    }

    @Test
    public void reportsFunctionsAlsoDefinedInIncludes() {
        files.put("/work/lib.awk", "function f() { }\n");

        AwkFile file = analyze("@include \"lib.awk\"\nfunction f() { }\nBEGIN { f(); }");

        assertThat(messages(file), contains("function f is also defined in file:///work/lib.awk"));
        assertThat(file.analysisDiagnostics().get(0).getRange(), equalTo(LspAdapter.lineSpan(1, 9, 10)));
    }

    @Test
    public void checksCanBeTurnedOff() {
        WorkspaceAnalyzer analyzer = analyzer(ServerOptions.builder()
                .setIncludePath(List.of())
                .setFunctionCallArityChecks(false)
                .build());

        analyzer.open(MAIN, "BEGIN { f(1); }");

        assertThat(messages(analyzer.getFile(MAIN)), empty());
        assertThat(published.containsKey(MAIN), equalTo(false));
    }
}
