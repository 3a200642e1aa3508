/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.document;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

public class SymbolTypeTest {
    @ParameterizedTest
    @EnumSource(value = SymbolType.class, names = {"FUNCTION", "GLOBAL_VARIABLE", "LOCAL_VARIABLE", "PARAMETER"})
    public void defineTypesRoundTrip(SymbolType type) {
        assertThat(type.isDefineType(), is(false));
        assertThat(type.toDefineType().isDefineType(), is(true));
        assertThat(type.toDefineType().fromDefineType(), equalTo(type));
        assertThat(type.fromDefineType(), equalTo(type));
    }

    @Test
    public void mapsToMatchingDefineType() {
        assertThat(SymbolType.FUNCTION.toDefineType(), equalTo(SymbolType.DEFINE_FUNCTION));
        assertThat(SymbolType.PARAMETER.toDefineType(), equalTo(SymbolType.DEFINE_PARAMETER));
        assertThat(SymbolType.DEFINE_LOCAL_VARIABLE.toDefineType(), equalTo(SymbolType.DEFINE_LOCAL_VARIABLE));
    }

    @Test
    public void onlyParametersAndLocalsAreFunctionScoped() {
        assertThat(SymbolType.PARAMETER.isFunctionScoped(), is(true));
        assertThat(SymbolType.DEFINE_LOCAL_VARIABLE.isFunctionScoped(), is(true));
        assertThat(SymbolType.GLOBAL_VARIABLE.isFunctionScoped(), is(false));
        assertThat(SymbolType.DEFINE_FUNCTION.isFunctionScoped(), is(false));
    }
}
