/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import software.amazon.awk.lsp.document.Document;

/**
 * Keeps track of the documents open in the editor, whose text is owned by
 * the client rather than read from disk.
 */
public final class ServerState {
    private static final Logger LOGGER = Logger.getLogger(ServerState.class.getName());

    private final Map<String, Document> managedDocuments = new HashMap<>();

    /**
     * @param uri URI of the document
     * @return The open document, or {@code null} if it isn't open
     */
    public Document getManagedDocument(String uri) {
        return managedDocuments.get(uri);
    }

    /**
     * @return URIs of all open documents
     */
    public Set<String> managedUris() {
        return Collections.unmodifiableSet(managedDocuments.keySet());
    }

    /**
     * @param uri URI of the opened document
     * @param text Its text
     * @return The managed document
     */
    public Document open(String uri, String text) {
        Document document = Document.of(text);
        if (managedDocuments.put(uri, document) != null) {
            LOGGER.info(() -> "Reopened document that was already open: " + uri);
        }
        return document;
    }

    /**
     * @param uri URI of the closed document
     * @return The document that was open, or {@code null}
     */
    public Document close(String uri) {
        return managedDocuments.remove(uri);
    }
}
