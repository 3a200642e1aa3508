/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp;

import static java.util.concurrent.CompletableFuture.completedFuture;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;
import java.util.logging.Logger;
import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionList;
import org.eclipse.lsp4j.CompletionOptions;
import org.eclipse.lsp4j.CompletionParams;
import org.eclipse.lsp4j.DefinitionParams;
import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.DocumentSymbol;
import org.eclipse.lsp4j.DocumentSymbolParams;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.HoverParams;
import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializeResult;
import org.eclipse.lsp4j.InitializedParams;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.LocationLink;
import org.eclipse.lsp4j.ReferenceParams;
import org.eclipse.lsp4j.SaveOptions;
import org.eclipse.lsp4j.ServerCapabilities;
import org.eclipse.lsp4j.SetTraceParams;
import org.eclipse.lsp4j.SignatureHelp;
import org.eclipse.lsp4j.SignatureHelpOptions;
import org.eclipse.lsp4j.SignatureHelpParams;
import org.eclipse.lsp4j.SymbolInformation;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.eclipse.lsp4j.TextDocumentSyncKind;
import org.eclipse.lsp4j.TextDocumentSyncOptions;
import org.eclipse.lsp4j.WorkDoneProgressCancelParams;
import org.eclipse.lsp4j.WorkspaceSymbol;
import org.eclipse.lsp4j.WorkspaceSymbolParams;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.LanguageServer;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import software.amazon.awk.lsp.document.Document;
import software.amazon.awk.lsp.language.CompletionHandler;
import software.amazon.awk.lsp.language.DefinitionHandler;
import software.amazon.awk.lsp.language.DocumentSymbolHandler;
import software.amazon.awk.lsp.language.HoverHandler;
import software.amazon.awk.lsp.language.ReferencesHandler;
import software.amazon.awk.lsp.language.SignatureHelpHandler;
import software.amazon.awk.lsp.language.WorkspaceSymbolHandler;
import software.amazon.awk.lsp.project.AwkFile;
import software.amazon.awk.lsp.project.IncludeFiles;
import software.amazon.awk.lsp.project.LocalIncludeFiles;
import software.amazon.awk.lsp.project.WorkspaceAnalyzer;

public class AwkLanguageServer implements
        LanguageServer, LanguageClientAware, WorkspaceService, TextDocumentService {
    private static final Logger LOGGER = Logger.getLogger(AwkLanguageServer.class.getName());
    private static final ServerCapabilities CAPABILITIES;

    static {
        ServerCapabilities capabilities = new ServerCapabilities();
        TextDocumentSyncOptions sync = new TextDocumentSyncOptions();
        sync.setOpenClose(true);
        sync.setChange(TextDocumentSyncKind.Incremental);
        sync.setSave(new SaveOptions(true));
        capabilities.setTextDocumentSync(sync);
        capabilities.setCompletionProvider(new CompletionOptions(false, null));
        capabilities.setHoverProvider(true);
        capabilities.setDefinitionProvider(true);
        capabilities.setReferencesProvider(true);
        capabilities.setDocumentSymbolProvider(true);
        capabilities.setWorkspaceSymbolProvider(true);
        capabilities.setSignatureHelpProvider(new SignatureHelpOptions(List.of("(", ",")));
        CAPABILITIES = capabilities;
    }

    private final ServerState state = new ServerState();
    private final Executor executor;
    private final IncludeFiles includeFiles;
    private AwkLanguageClient client;
    private WorkspaceAnalyzer analyzer;

    AwkLanguageServer() {
        this(Executors.newSingleThreadExecutor(), new LocalIncludeFiles());
    }

    /**
     * @param executor Runs all analysis, and all requests that read its results
     * @param includeFiles Access to included files
     */
    AwkLanguageServer(Executor executor, IncludeFiles includeFiles) {
        this.executor = executor;
        this.includeFiles = includeFiles;
    }

    ServerState getState() {
        return state;
    }

    WorkspaceAnalyzer getAnalyzer() {
        return analyzer;
    }

    @Override
    public void connect(LanguageClient client) {
        LOGGER.finest("Connect");
        this.client = new AwkLanguageClient(client);
        this.analyzer = new WorkspaceAnalyzer(includeFiles, this.client, executor, ServerOptions.defaults());
        String message = "awk-language-server";
        try {
            Properties props = new Properties();
            props.load(Objects.requireNonNull(getClass().getClassLoader().getResourceAsStream("version.properties")));
            message += " version " + props.getProperty("version");
        } catch (IOException e) {
            this.client.error("Failed to load awk-language-server version: " + e);
        }
        this.client.info(message + " started.");
    }

    @Override
    public CompletableFuture<InitializeResult> initialize(InitializeParams params) {
        LOGGER.finest("Initialize");

        Optional.ofNullable(params.getProcessId())
                .flatMap(ProcessHandle::of)
                .ifPresent(processHandle -> processHandle.onExit().thenRun(this::exit));

        ServerOptions options = ServerOptions.fromInitializeParams(params, client);
        executor.execute(() -> analyzer.updateOptions(options));

        LOGGER.finest("Done initialize");
        return completedFuture(new InitializeResult(CAPABILITIES));
    }

    @Override
    public void initialized(InitializedParams params) {
        LOGGER.finest("Initialized");
    }

    @Override
    public WorkspaceService getWorkspaceService() {
        return this;
    }

    @Override
    public TextDocumentService getTextDocumentService() {
        return this;
    }

    @Override
    public CompletableFuture<Object> shutdown() {
        LOGGER.finest("Shutdown");
        if (executor instanceof ExecutorService executorService) {
            executorService.shutdown();
        }
        return completedFuture(new Object());
    }

    @Override
    public void exit() {
        System.exit(0);
    }

    @Override
    public void cancelProgress(WorkDoneProgressCancelParams params) {
        LOGGER.warning("window/workDoneProgress/cancel not implemented");
    }

    @Override
    public void setTrace(SetTraceParams params) {
        LOGGER.warning("$/setTrace not implemented");
    }

    @Override
    public void didChangeConfiguration(DidChangeConfigurationParams params) {
        LOGGER.finest("DidChangeConfiguration");
        ServerOptions options = ServerOptions.fromSettings(params.getSettings(), client);
        executor.execute(() -> analyzer.updateOptions(options));
    }

    @Override
    public void didChangeWatchedFiles(DidChangeWatchedFilesParams params) {
        // Included files are read again the next time their includer is analyzed.
        LOGGER.finest("DidChangeWatchedFiles");
    }

    @Override
    public void didOpen(DidOpenTextDocumentParams params) {
        LOGGER.finest("DidOpen");

        String uri = params.getTextDocument().getUri();
        Document document = state.open(uri, params.getTextDocument().getText());
        String text = document.copyText();
        executor.execute(() -> analyzer.open(uri, text));
    }

    @Override
    public void didChange(DidChangeTextDocumentParams params) {
        LOGGER.finest("DidChange");

        if (params.getContentChanges().isEmpty()) {
            LOGGER.info("Received empty DidChange");
            return;
        }

        String uri = params.getTextDocument().getUri();
        Document document = state.getManagedDocument(uri);
        if (document == null) {
            client.unknownFileError(uri, "change");
            return;
        }

        for (TextDocumentContentChangeEvent contentChangeEvent : params.getContentChanges()) {
            if (contentChangeEvent.getRange() != null) {
                document.applyEdit(contentChangeEvent.getRange(), contentChangeEvent.getText());
            } else {
                document.applyEdit(document.fullRange(), contentChangeEvent.getText());
            }
        }

        String text = document.copyText();
        executor.execute(() -> analyzer.change(uri, text));
    }

    @Override
    public void didClose(DidCloseTextDocumentParams params) {
        LOGGER.finest("DidClose");

        String uri = params.getTextDocument().getUri();
        if (state.close(uri) == null) {
            client.unknownFileError(uri, "close");
            return;
        }
        executor.execute(() -> analyzer.close(uri));
    }

    @Override
    public void didSave(DidSaveTextDocumentParams params) {
        LOGGER.finest("DidSave");

        String uri = params.getTextDocument().getUri();
        Document document = state.getManagedDocument(uri);
        if (document == null) {
            client.unknownFileError(uri, "save");
            return;
        }

        if (params.getText() != null && !params.getText().contentEquals(document.borrowText())) {
            document.applyEdit(document.fullRange(), params.getText());
            String text = document.copyText();
            executor.execute(() -> analyzer.change(uri, text));
        }
    }

    @Override
    public CompletableFuture<Either<List<CompletionItem>, CompletionList>> completion(CompletionParams params) {
        LOGGER.finest("Completion");

        String uri = params.getTextDocument().getUri();
        return withFile(uri, "completion", Either.forLeft(Collections.emptyList()),
                file -> Either.forLeft(new CompletionHandler(analyzer.graph(), file).handle(params)));
    }

    @Override
    public CompletableFuture<CompletionItem> resolveCompletionItem(CompletionItem unresolved) {
        LOGGER.finest("ResolveCompletion");
        return completedFuture(unresolved);
    }

    @Override
    public CompletableFuture<Hover> hover(HoverParams params) {
        LOGGER.finest("Hover");

        String uri = params.getTextDocument().getUri();
        return withFile(uri, "hover", null, file -> {
            boolean compatibilityWarnings = analyzer.options().getCompatibilityWarnings();
            return new HoverHandler(analyzer.graph(), file, compatibilityWarnings).handle(params);
        });
    }

    @Override
    public CompletableFuture<Either<List<? extends Location>, List<? extends LocationLink>>>
    definition(DefinitionParams params) {
        LOGGER.finest("Definition");

        String uri = params.getTextDocument().getUri();
        return withFile(uri, "definition", null,
                file -> Either.forLeft(new DefinitionHandler(analyzer.graph(), file).handle(params)));
    }

    @Override
    public CompletableFuture<List<? extends Location>> references(ReferenceParams params) {
        LOGGER.finest("References");

        String uri = params.getTextDocument().getUri();
        return withFile(uri, "references", Collections.emptyList(),
                file -> new ReferencesHandler(analyzer.graph(), file).handle(params));
    }

    @Override
    public CompletableFuture<List<Either<SymbolInformation, DocumentSymbol>>>
    documentSymbol(DocumentSymbolParams params) {
        LOGGER.finest("DocumentSymbol");

        String uri = params.getTextDocument().getUri();
        return withFile(uri, "document symbol", Collections.emptyList(),
                file -> new DocumentSymbolHandler(file).handle());
    }

    @Override
    public CompletableFuture<Either<List<? extends SymbolInformation>, List<? extends WorkspaceSymbol>>>
    symbol(WorkspaceSymbolParams params) {
        LOGGER.finest("WorkspaceSymbol");

        return CompletableFuture.supplyAsync(
                () -> Either.forRight(new WorkspaceSymbolHandler(analyzer.graph()).handle(params)), executor);
    }

    @Override
    public CompletableFuture<SignatureHelp> signatureHelp(SignatureHelpParams params) {
        LOGGER.finest("SignatureHelp");

        String uri = params.getTextDocument().getUri();
        return withFile(uri, "signature help", null,
                file -> new SignatureHelpHandler(analyzer.graph(), file).handle(params));
    }

    /**
     * Runs {@code handler} on the analysis thread, so it sees the results of
     * every change received before the request.
     */
    private <T> CompletableFuture<T> withFile(String uri, String source, T unknown, Function<AwkFile, T> handler) {
        return CompletableFuture.supplyAsync(() -> {
            AwkFile file = analyzer.getFile(uri);
            if (file == null) {
                client.unknownFileError(uri, source);
                return unknown;
            }
            return handler.apply(file);
        }, executor);
    }
}
