/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.eclipse.lsp4j.ConfigurationParams;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.MessageActionItem;
import org.eclipse.lsp4j.MessageParams;
import org.eclipse.lsp4j.MessageType;
import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.RegistrationParams;
import org.eclipse.lsp4j.ShowMessageRequestParams;
import org.eclipse.lsp4j.services.LanguageClient;
import software.amazon.awk.lsp.diagnostics.DiagnosticsSink;

/**
 * Wrapper around a delegate {@link LanguageClient} that provides convenience
 * methods, and receives the diagnostics the analysis produces.
 */
public final class AwkLanguageClient implements LanguageClient, DiagnosticsSink {
    private final LanguageClient delegate;

    AwkLanguageClient(LanguageClient delegate) {
        this.delegate = delegate;
    }

    /**
     * Log a {@link MessageType#Info} message on the client.
     *
     * @param message Message to log
     */
    public void info(String message) {
        delegate.logMessage(new MessageParams(MessageType.Info, message));
    }

    /**
     * Log a {@link MessageType#Error} message on the client.
     *
     * @param message Message to log
     */
    public void error(String message) {
        delegate.logMessage(new MessageParams(MessageType.Error, message));
    }

    /**
     * Log a {@link MessageType#Error} message on the client, specifically for
     * situations where a file is requested but isn't known to the server.
     *
     * @param uri LSP URI of the file that was requested.
     * @param source Reason for requesting the file.
     */
    public void unknownFileError(String uri, String source) {
        delegate.logMessage(new MessageParams(
                MessageType.Error, "attempted to get file for " + source + " that isn't tracked: " + uri));
    }

    @Override
    public void publish(String uri, List<Diagnostic> diagnostics) {
        delegate.publishDiagnostics(new PublishDiagnosticsParams(uri, diagnostics));
    }

    @Override
    public CompletableFuture<Void> registerCapability(RegistrationParams params) {
        return delegate.registerCapability(params);
    }

    @Override
    public void telemetryEvent(Object object) {
        delegate.telemetryEvent(object);
    }

    @Override
    public void publishDiagnostics(PublishDiagnosticsParams diagnostics) {
        delegate.publishDiagnostics(diagnostics);
    }

    @Override
    public void showMessage(MessageParams messageParams) {
        delegate.showMessage(messageParams);
    }

    @Override
    public CompletableFuture<MessageActionItem> showMessageRequest(ShowMessageRequestParams requestParams) {
        return delegate.showMessageRequest(requestParams);
    }

    @Override
    public void logMessage(MessageParams message) {
        delegate.logMessage(message);
    }

    @Override
    public CompletableFuture<List<Object>> configuration(ConfigurationParams configurationParams) {
        return delegate.configuration(configurationParams);
    }
}
