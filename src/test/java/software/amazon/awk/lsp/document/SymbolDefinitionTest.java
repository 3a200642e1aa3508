/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.document;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

import org.eclipse.lsp4j.Position;
import org.junit.jupiter.api.Test;
import software.amazon.awk.lsp.protocol.LspAdapter;

public class SymbolDefinitionTest {
    private static final String URI = "file:///work/main.awk";

    private static SymbolDefinition function(String doc, String... parameters) {
        SymbolDefinition function = new SymbolDefinition(
                URI, "f", SymbolType.DEFINE_FUNCTION, new Position(0, 9), doc, null, false);
        for (int i = 0; i < parameters.length; i++) {
            new SymbolDefinition(URI, parameters[i], SymbolType.DEFINE_PARAMETER,
                    new Position(0, 11 + i * 3), "", function, false);
        }
        return function;
    }

    @Test
    public void normalizesDefineTypes() {
        SymbolDefinition function = function("");

        assertThat(function.type(), equalTo(SymbolType.FUNCTION));
    }

    @Test
    public void registersWithScope() {
        SymbolDefinition function = function("", "a", "b");
        new SymbolDefinition(
                URI, "tmp", SymbolType.DEFINE_LOCAL_VARIABLE, new Position(0, 20), "", function, false);

        assertThat(function.parameterNames(), contains("a", "b"));
        assertThat(function.locals().size(), equalTo(1));
        assertThat(function.arity(), equalTo(Arity.exactly(2)));
    }

    @Test
    public void optionalParametersComeFromDocComment() {
        SymbolDefinition function = function("## @param a first\n## @param [b] second\n", "a", "b", "c");

        assertThat(function.arity(), equalTo(new Arity(1, 3)));
    }

    @Test
    public void unknownOptionalParameterIsIgnored() {
        SymbolDefinition function = function("## @param [z]\n", "a");

        assertThat(function.arity(), equalTo(Arity.exactly(1)));
    }

    @Test
    public void locationSpansName() {
        SymbolDefinition function = function("");

        assertThat(function.location().getUri(), equalTo(URI));
        assertThat(function.location().getRange(), equalTo(LspAdapter.lineSpan(0, 9, 10)));
    }

    @Test
    public void equalityIgnoresScopeAndImplicitness() {
        SymbolDefinition a = new SymbolDefinition(
                URI, "x", SymbolType.GLOBAL_VARIABLE, new Position(1, 0), "", null, true);
        SymbolDefinition b = new SymbolDefinition(
                URI, "x", SymbolType.DEFINE_GLOBAL_VARIABLE, new Position(1, 0), null, null, false);
        SymbolDefinition c = new SymbolDefinition(
                URI, "x", SymbolType.GLOBAL_VARIABLE, new Position(2, 0), "", null, true);

        assertThat(a, equalTo(b));
        assertThat(a.hashCode(), equalTo(b.hashCode()));
        assertThat(a, not(equalTo(c)));
        assertThat(a.isImplicit(), is(true));
    }
}
