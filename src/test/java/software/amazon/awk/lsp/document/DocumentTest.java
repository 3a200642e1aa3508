/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.document;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;

import org.eclipse.lsp4j.Position;
import org.junit.jupiter.api.Test;
import software.amazon.awk.lsp.protocol.LspAdapter;

public class DocumentTest {
    @Test
    public void appliesTrailingReplacementEdit() {
        String s = "abc\n" +
                   "def";
        Document document = Document.of(s);

        document.applyEdit(LspAdapter.of(1, 2, 1, 3), "g");

        assertThat(document.copyText(), equalTo("abc\ndeg"));
    }

    @Test
    public void appliesAppendingEdit() {
        Document document = Document.of("abc\ndef");

        document.applyEdit(LspAdapter.of(1, 3, 1, 3), "g");

        assertThat(document.copyText(), equalTo("abc\ndefg"));
    }

    @Test
    public void appliesMultiLineEdit() {
        Document document = Document.of("abc\ndef\nghi");

        document.applyEdit(LspAdapter.of(0, 1, 2, 1), "X");

        assertThat(document.copyText(), equalTo("aXhi"));
        assertThat(document.lastLine(), equalTo(0));
    }

    @Test
    public void appliesInsertingNewLines() {
        Document document = Document.of("BEGIN { }");

        document.applyEdit(LspAdapter.of(0, 8, 0, 8), "\n  x = 1\n");

        assertThat(document.copyText(), equalTo("BEGIN { \n  x = 1\n}"));
        assertThat(document.lastLine(), equalTo(2));
        assertThat(document.indexOfLine(2), equalTo(document.copyText().lastIndexOf('\n') + 1));
    }

    @Test
    public void replacesAllTextWithoutRange() {
        Document document = Document.of("abc");

        document.applyEdit(null, "x\ny");

        assertThat(document.copyText(), equalTo("x\ny"));
        assertThat(document.end(), equalTo(new Position(1, 1)));
    }

    @Test
    public void clampsEditsPastTheEnd() {
        Document document = Document.of("abc");

        document.applyEdit(LspAdapter.of(5, 0, 6, 0), "d");

        assertThat(document.copyText(), equalTo("abcd"));
    }

    @Test
    public void convertsBetweenIndicesAndPositions() {
        Document document = Document.of("ab\n\ncd");

        assertThat(document.indexOfLine(0), equalTo(0));
        assertThat(document.indexOfLine(1), equalTo(3));
        assertThat(document.indexOfLine(2), equalTo(4));
        assertThat(document.indexOfLine(3), equalTo(-1));
        assertThat(document.lineOfIndex(1), equalTo(0));
        assertThat(document.lineOfIndex(3), equalTo(1));
        assertThat(document.lineOfIndex(5), equalTo(2));
        assertThat(document.lineOfIndex(6), equalTo(-1));
        assertThat(document.indexOfPosition(new Position(2, 1)), equalTo(5));
        assertThat(document.indexOfPosition(new Position(0, 5)), equalTo(-1));
        assertThat(document.positionAtIndex(4), equalTo(new Position(2, 0)));
        assertThat(document.positionAtIndex(10), nullValue());
    }

    @Test
    public void computesEndAndFullRange() {
        Document document = Document.of("ab\ncde\n");

        assertThat(document.end(), equalTo(new Position(2, 0)));
        assertThat(document.fullRange(), equalTo(LspAdapter.of(0, 0, 2, 0)));
    }

    @Test
    public void findsNextIndex() {
        Document document = Document.of("a,b,c");

        assertThat(document.nextIndexOf(",", 0), equalTo(1));
        assertThat(document.nextIndexOf(",", 2), equalTo(3));
        assertThat(document.nextIndexOf(",", 4), equalTo(-1));
    }
}
