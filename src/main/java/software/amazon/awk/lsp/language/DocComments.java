/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.language;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Formatting of {@code ##} doc comments for display.
 */
final class DocComments {
    private static final Pattern MARKER = Pattern.compile("^##[ \\t]*");
    private static final int MARKER_LENGTH = 2;

    private DocComments() {
    }

    /**
     * Removes the comment markers, and as much of the whitespace following
     * them as all non-blank lines have in common.
     *
     * @param docComment Doc comment lines as written
     * @return The text of the doc comment
     */
    static String leftAlign(String docComment) {
        if (docComment == null || docComment.isEmpty()) {
            return "";
        }
        String[] lines = docComment.split("\n", -1);
        int strip = Integer.MAX_VALUE;
        for (String line : lines) {
            Matcher matcher = MARKER.matcher(line);
            int prefix = matcher.find() ? matcher.end() : MARKER_LENGTH;
            if (prefix < line.length()) {
                strip = Math.min(strip, prefix);
            }
        }
        if (strip == Integer.MAX_VALUE) {
            return "";
        }
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                builder.append('\n');
            }
            String line = lines[i];
            builder.append(line.length() > strip ? line.substring(strip) : "");
        }
        return builder.toString().strip();
    }
}
