/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.document;

import java.util.Arrays;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import software.amazon.awk.lsp.protocol.LspAdapter;

/**
 * In-memory representation of a text document, indexed by line, which can
 * be patched in-place.
 *
 * <p>Methods on this class return {@code -1} or {@code null} for out of
 * bounds arguments.
 */
public final class Document {
    private final StringBuilder buffer;
    private int[] lineIndices;

    private Document(StringBuilder buffer) {
        this.buffer = buffer;
        this.lineIndices = computeLineIndices(buffer);
    }

    /**
     * @param string String to create a document for
     * @return The created document
     */
    public static Document of(String string) {
        return new Document(new StringBuilder(string));
    }

    /**
     * @param range The range to apply the edit to. Providing {@code null} will
     *              replace the text in the document
     * @param text The text of the edit to apply
     */
    public void applyEdit(Range range, String text) {
        if (range == null) {
            buffer.replace(0, buffer.length(), text);
        } else {
            int startIndex = clampedIndex(range.getStart());
            int endIndex = clampedIndex(range.getEnd());
            buffer.replace(startIndex, Math.max(startIndex, endIndex), text);
        }
        lineIndices = computeLineIndices(buffer);
    }

    /**
     * @return The range of the document, from (0, 0) to {@link #end()}
     */
    public Range fullRange() {
        Position end = end();
        return LspAdapter.of(0, 0, end.getLine(), end.getCharacter());
    }

    /**
     * @param line The line to find the index of
     * @return The index of the start of the given {@code line}, or {@code -1}
     *  if the line doesn't exist
     */
    public int indexOfLine(int line) {
        if (line >= lineIndices.length || line < 0) {
            return -1;
        }
        return lineIndices[line];
    }

    /**
     * @param idx Index to find the line of
     * @return The line that {@code idx} is within or {@code -1} if the index
     *  is out of bounds
     */
    public int lineOfIndex(int idx) {
        if (idx >= length() || idx < 0) {
            return -1;
        }
        int found = Arrays.binarySearch(lineIndices, idx);
        // Not a line start: the insertion point is one past the containing line.
        return found >= 0 ? found : -found - 2;
    }

    /**
     * @param position The position to find the index of
     * @return The index of the position in this document, or {@code -1} if the
     *  position is out of bounds
     */
    public int indexOfPosition(Position position) {
        int lineStart = indexOfLine(position.getLine());
        if (lineStart < 0) {
            return -1;
        }
        int idx = lineStart + position.getCharacter();
        int limit = position.getLine() == lastLine() ? length() : indexOfLine(position.getLine() + 1);
        return idx < limit ? idx : -1;
    }

    /**
     * @param index The index to find the position of
     * @return The position of the index in this document, or {@code null} if
     *  the index is out of bounds
     */
    public Position positionAtIndex(int index) {
        int line = lineOfIndex(index);
        if (line < 0) {
            return null;
        }
        return new Position(line, index - indexOfLine(line));
    }

    /**
     * @return The line number of the last line in this document
     */
    public int lastLine() {
        return lineIndices.length - 1;
    }

    /**
     * @return The end position of this document
     */
    public Position end() {
        return new Position(lastLine(), buffer.length() - lineIndices[lastLine()]);
    }

    /**
     * @param s The string to find the next index of
     * @param after The index to start the search at
     * @return The index of the next occurrence of {@code s} after {@code after}
     *  or {@code -1} if one doesn't exist
     */
    public int nextIndexOf(String s, int after) {
        return buffer.indexOf(s, after);
    }

    /**
     * @return A reference to the text in this document
     */
    public CharSequence borrowText() {
        return buffer;
    }

    /**
     * @return A copy of the text of this document
     */
    public String copyText() {
        return buffer.toString();
    }

    /**
     * @return The length of the document's text
     */
    public int length() {
        return buffer.length();
    }

    private int clampedIndex(Position position) {
        if (position.getLine() >= lineIndices.length) {
            return buffer.length();
        }
        return Math.min(buffer.length(), lineIndices[position.getLine()] + position.getCharacter());
    }

    private static int[] computeLineIndices(StringBuilder buffer) {
        int count = 1;
        for (int i = 0; i < buffer.length(); i++) {
            if (buffer.charAt(i) == '\n') {
                count++;
            }
        }
        int[] indices = new int[count];
        int line = 1;
        for (int i = 0; i < buffer.length(); i++) {
            if (buffer.charAt(i) == '\n') {
                indices[line++] = i + 1;
            }
        }
        return indices;
    }
}
