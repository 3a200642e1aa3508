/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.project;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import org.eclipse.lsp4j.Range;
import software.amazon.awk.lsp.diagnostics.DiagnosticsSink;
import software.amazon.awk.lsp.protocol.LspAdapter;

/**
 * All known files, by URI, and the include edges between them.
 *
 * <p>Files open in the editor are included by an editor root, which is not
 * registered itself. Files that can't be reached from the editor root are
 * dropped by {@link #sweep}.
 */
public final class IncludeGraph {
    public static final String EDITOR_ROOT_URI = "editor://";

    private static final Logger LOGGER = Logger.getLogger(IncludeGraph.class.getName());
    private static final Range EDITOR_INCLUDE_RANGE = LspAdapter.of(0, 0, 1, 0);

    private final Map<String, AwkFile> files = new LinkedHashMap<>();
    private final AwkFile editorRoot = new AwkFile(EDITOR_ROOT_URI);

    /**
     * @param uri URI of the file
     * @return The file, or {@code null} if it isn't known
     */
    public AwkFile get(String uri) {
        return files.get(uri);
    }

    /**
     * @param uri URI of the file
     * @return Whether the file is known
     */
    public boolean contains(String uri) {
        return files.containsKey(uri);
    }

    /**
     * @param uri URI of the file
     * @return The known file, or a new empty file registered under {@code uri}
     */
    public AwkFile getOrCreate(String uri) {
        return files.computeIfAbsent(uri, AwkFile::new);
    }

    /**
     * @return All known files, in the order they became known
     */
    public Collection<AwkFile> files() {
        return Collections.unmodifiableCollection(files.values());
    }

    public AwkFile editorRoot() {
        return editorRoot;
    }

    /**
     * Makes the editor root include {@code file}.
     *
     * @param file A file opened in the editor
     */
    public void open(AwkFile file) {
        if (!editorRoot.includes().containsKey(file)) {
            editorRoot.addInclude(file, EDITOR_INCLUDE_RANGE);
        }
    }

    /**
     * Removes the edge from the editor root to {@code file}.
     *
     * @param file A file closed in the editor
     * @return Whether the file was open
     */
    public boolean close(AwkFile file) {
        return editorRoot.removeInclude(file);
    }

    /**
     * @param file A known file
     * @return Whether the file is open in the editor
     */
    public boolean isOpen(AwkFile file) {
        return editorRoot.includes().containsKey(file);
    }

    /**
     * Drops every file that can't be reached from the editor root, withdrawing
     * their diagnostics. Groups of files including each other are dropped too
     * when nothing reachable includes any of them.
     *
     * @param sink Where diagnostics are published
     * @return The dropped files
     */
    public List<AwkFile> sweep(DiagnosticsSink sink) {
        Set<AwkFile> reachable = editorRoot.includeClosure();
        List<AwkFile> dropped = new ArrayList<>();
        for (AwkFile file : files.values()) {
            if (!reachable.contains(file)) {
                dropped.add(file);
            }
        }
        for (AwkFile file : dropped) {
            LOGGER.finest(() -> "Dropping unreachable file " + file.uri());
            files.remove(file.uri());
            file.close(sink);
        }
        return dropped;
    }
}
