/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.language;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;

import org.junit.jupiter.api.Test;

public class DocCommentsTest {
    @Test
    public void stripsMarkersAndCommonIndentation() {
        String doc = "##   Sums values.\n##   @param a first\n##     indented";

        assertThat(DocComments.leftAlign(doc), equalTo("Sums values.\n@param a first\n  indented"));
    }

    @Test
    public void alignsToLeastIndentedLine() {
        String doc = "##  first\n##second";

        assertThat(DocComments.leftAlign(doc), equalTo("first\nsecond"));
    }

    @Test
    public void emptyLinesStayEmpty() {
        String doc = "## a\n##\n## b";

        assertThat(DocComments.leftAlign(doc), equalTo("a\n\nb"));
    }

    @Test
    public void handlesMissingDocComments() {
        assertThat(DocComments.leftAlign(null), equalTo(""));
        assertThat(DocComments.leftAlign("##\n##"), equalTo(""));
        assertThat(DocComments.leftAlign(""), equalTo(""));
    }
}
