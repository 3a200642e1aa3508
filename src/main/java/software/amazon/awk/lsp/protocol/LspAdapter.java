/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.protocol;

import java.net.URI;
import java.nio.file.Paths;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;

/**
 * Utility methods for converting to and from LSP types {@link Range}, {@link Position},
 * {@link Location} and URI (which is just a string).
 */
public final class LspAdapter {
    private LspAdapter() {
    }

    /**
     * @param point Position to create a point range of
     * @return Range of (point) - (point)
     */
    public static Range point(Position point) {
        return new Range(point, point);
    }

    /**
     * @param line Line the span is on
     * @param startCharacter Start character of the span
     * @param endCharacter End character of the span
     * @return Range of (line, startCharacter) - (line, endCharacter)
     */
    public static Range lineSpan(int line, int startCharacter, int endCharacter) {
        return of(line, startCharacter, line, endCharacter);
    }

    /**
     * @param start Start of the span
     * @param length Number of characters the span covers on the start line
     * @return Range of (start) - (start.line, start.character + length)
     */
    public static Range span(Position start, int length) {
        return lineSpan(start.getLine(), start.getCharacter(), start.getCharacter() + length);
    }

    /**
     * @param startLine Range start line
     * @param startCharacter Range start character
     * @param endLine Range end line
     * @param endCharacter Range end character
     * @return Range of (startLine, startCharacter) - (endLine, endCharacter)
     */
    public static Range of(int startLine, int startCharacter, int endLine, int endCharacter) {
        return new Range(new Position(startLine, startCharacter), new Position(endLine, endCharacter));
    }

    /**
     * @param range The range to check
     * @return Whether the range's start is equal to it's end
     */
    public static boolean isEmpty(Range range) {
        return range.getStart().equals(range.getEnd());
    }

    /**
     * Orders positions by line, then by character.
     *
     * @param a First position
     * @param b Second position
     * @return A negative number, zero, or a positive number as {@code a} is
     *  before, at, or after {@code b}
     */
    public static int compare(Position a, Position b) {
        int byLine = Integer.compare(a.getLine(), b.getLine());
        return byLine != 0 ? byLine : Integer.compare(a.getCharacter(), b.getCharacter());
    }

    /**
     * @param range Range to check
     * @param position Position to look for
     * @return Whether {@code position} is within {@code range}, both ends inclusive
     */
    public static boolean contains(Range range, Position position) {
        return compare(range.getStart(), position) <= 0 && compare(position, range.getEnd()) <= 0;
    }

    /**
     * @param uri LSP URI to convert to a path
     * @return A path representation of the {@code uri}, with the scheme removed
     */
    public static String toPath(String uri) {
        if (uri.startsWith("file:")) {
            return Paths.get(URI.create(uri)).toString();
        }
        return uri;
    }

    /**
     * @param path Path to convert to LSP URI
     * @return A URI representation of the given {@code path}
     */
    public static String toUri(String path) {
        if (path.startsWith("file:")) {
            return path;
        }
        return Paths.get(path).toUri().toString();
    }

    /**
     * @param uri Document the location is in
     * @param start Start of the symbol
     * @param length Length of the symbol on its line
     * @return Location spanning the symbol
     */
    public static Location toLocation(String uri, Position start, int length) {
        return new Location(uri, span(start, length));
    }
}
