/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.language;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;

import java.util.List;
import java.util.stream.Collectors;
import org.eclipse.lsp4j.DocumentSymbol;
import org.eclipse.lsp4j.SymbolKind;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.junit.jupiter.api.Test;
import software.amazon.awk.lsp.protocol.LspAdapter;

public class DocumentSymbolHandlerTest {
    private static List<DocumentSymbol> symbols(String text) {
        TestWorkspace workspace = new TestWorkspace();
        return new DocumentSymbolHandler(workspace.open(text)).handle().stream()
                .map(Either::getRight)
                .collect(Collectors.toList());
    }

    @Test
    public void listsFunctionsInOrder() {
        List<DocumentSymbol> symbols = symbols("""
                function g() { }
                BEGIN { }
                function f(a,  t) {
                }
                """);

        assertThat(symbols.stream().map(DocumentSymbol::getName).collect(Collectors.toList()), contains("g", "f"));
        assertThat(symbols.get(0).getKind(), equalTo(SymbolKind.Function));
        assertThat(symbols.get(0).getChildren(), nullValue());
        assertThat(symbols.get(1).getDetail(), equalTo("function f(a)"));
    }

    @Test
    public void functionRangeCoversBody() {
        List<DocumentSymbol> symbols = symbols("function f(a,  t) {\n}\n");

        DocumentSymbol f = symbols.get(0);
        assertThat(f.getSelectionRange(), equalTo(LspAdapter.lineSpan(0, 9, 10)));
        assertThat(f.getRange(), equalTo(LspAdapter.of(0, 9, 1, 0)));
    }

    @Test
    public void parametersAndLocalsAreChildren() {
        List<DocumentSymbol> symbols = symbols("function f(a,  t) {\n}\n");

        List<DocumentSymbol> children = symbols.get(0).getChildren();
        assertThat(children.stream().map(DocumentSymbol::getName).collect(Collectors.toList()), contains("a", "t"));
        assertThat(children.get(0).getDetail(), equalTo("parameter"));
        assertThat(children.get(1).getDetail(), equalTo("local variable"));
        assertThat(children.get(1).getRange(), equalTo(LspAdapter.lineSpan(0, 15, 16)));
    }
}
