/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.project;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.Range;
import software.amazon.awk.lsp.ServerOptions;
import software.amazon.awk.lsp.diagnostics.AwkDiagnostics;
import software.amazon.awk.lsp.diagnostics.DiagnosticsSink;
import software.amazon.awk.lsp.document.Document;
import software.amazon.awk.lsp.document.PathPositionTree;
import software.amazon.awk.lsp.document.SymbolDefinition;
import software.amazon.awk.lsp.document.SymbolType;
import software.amazon.awk.lsp.document.SymbolUsage;
import software.amazon.awk.lsp.protocol.LspAdapter;
import software.amazon.awk.lsp.syntax.Syntax;

/**
 * Analyzes open files and the files they include, keeping the include graph
 * and every file's diagnostics up to date.
 *
 * <p>All methods must be called from {@code executor}, the thread that also
 * receives the results of include file reads.
 */
public final class WorkspaceAnalyzer {
    private static final Logger LOGGER = Logger.getLogger(WorkspaceAnalyzer.class.getName());

    private final IncludeGraph graph = new IncludeGraph();
    private final IncludeFiles includeFiles;
    private final DiagnosticsSink sink;
    private final Executor executor;
    private final AnalysisQueue queue;
    private ServerOptions options;
    private final Set<String> unreadable = new HashSet<>();
    private int parseLevel;

    /**
     * @param includeFiles Access to included files
     * @param sink Where diagnostics are published
     * @param executor The analysis thread
     * @param options Initial options
     */
    public WorkspaceAnalyzer(IncludeFiles includeFiles, DiagnosticsSink sink, Executor executor, ServerOptions options) {
        this.includeFiles = includeFiles;
        this.sink = sink;
        this.executor = executor;
        this.options = options;
        this.queue = new AnalysisQueue(this::analyze, this::finishUp);
    }

    public IncludeGraph graph() {
        return graph;
    }

    public ServerOptions options() {
        return options;
    }

    /**
     * @param uri URI of the file
     * @return The known file, or {@code null}
     */
    public AwkFile getFile(String uri) {
        return graph.get(uri);
    }

    /**
     * @return Whether nothing is queued and no include file is being read
     */
    public boolean isIdle() {
        return queue.size() == 0 && queue.outstandingReads() == 0;
    }

    /**
     * Starts tracking a file opened in the editor and queues it for analysis.
     * A file already known from an include directive becomes open too.
     *
     * @param uri URI of the opened file
     * @param text Text of the opened file
     */
    public void open(String uri, String text) {
        AwkFile file = graph.getOrCreate(uri);
        graph.open(file);
        queue.addLast(file, text);
    }

    /**
     * Queues a changed file for analysis.
     *
     * @param uri URI of the changed file
     * @param text Its new text
     */
    public void change(String uri, String text) {
        AwkFile file = graph.get(uri);
        if (file == null || !graph.isOpen(file)) {
            open(uri, text);
            return;
        }
        queue.addLast(file, text);
    }

    /**
     * Stops tracking a file closed in the editor. The file stays known while
     * other known files include it.
     *
     * @param uri URI of the closed file
     */
    public void close(String uri) {
        AwkFile file = graph.get(uri);
        if (file == null || !graph.close(file)) {
            LOGGER.warning(() -> "Closed file wasn't open: " + uri);
            return;
        }
        queue.markDirty();
        queue.drain();
    }

    /**
     * Switches to {@code newOptions}, queueing every known file for analysis if
     * they may change results.
     *
     * @param newOptions The options to use from now on
     * @return Whether files were queued
     */
    public boolean updateOptions(ServerOptions newOptions) {
        boolean reanalyze = options.affectsAnalysis(newOptions);
        options = newOptions;
        if (!reanalyze) {
            return false;
        }
        for (AwkFile file : new ArrayList<>(graph.files())) {
            queue.addLast(file, file.text());
        }
        queue.markDirty();
        queue.drain();
        return true;
    }

    private void analyze(AnalysisQueue.Item item) {
        AwkFile file = item.file();
        if (graph.get(file.uri()) != file) {
            // Dropped while waiting in the queue.
            return;
        }
        if (parseLevel != 0) {
            LOGGER.severe(() -> "Started analyzing " + file.uri() + " while another analysis was running");
        }
        parseLevel++;
        try {
            LOGGER.finest(() -> "Analyzing " + file.uri());
            file.clear();
            file.setText(item.text());
            Syntax.ParseResult result = Syntax.parse(item.text(), new Syntax.Options(options.getExtendedMode()));
            file.setExtendedMode(result.extendedMode());

            Map<Syntax.Define, SymbolDefinition> definitions = new IdentityHashMap<>();
            for (Syntax.Event event : result.events()) {
                consume(file, event, definitions);
            }
            for (Map.Entry<String, List<SymbolDefinition>> entry
                    : file.symbolTable(SymbolType.FUNCTION).entrySet()) {
                file.addFunctionArity(entry.getKey(), entry.getValue().get(0).arity());
            }
            file.positionTree().finish(Document.of(item.text()).end());
        } finally {
            parseLevel--;
        }
    }

    private void consume(AwkFile file, Syntax.Event event, Map<Syntax.Define, SymbolDefinition> definitions) {
        if (event instanceof Syntax.Define define) {
            SymbolDefinition scope = define.scope() == null ? null : definitions.get(define.scope());
            SymbolDefinition definition = new SymbolDefinition(file.uri(), define.name(), define.type(),
                    define.position(), define.docComment(), scope, define.isImplicit());
            definitions.put(define, definition);
            file.addDefinition(define.name(), definition);
        } else if (event instanceof Syntax.Use use) {
            file.addUsage(new SymbolUsage(use.name(), use.type(), use.position()));
        } else if (event instanceof Syntax.Message message) {
            if (!isIgnored(message)) {
                file.addParseDiagnostic(AwkDiagnostics.fromMessage(message));
            }
        } else if (event instanceof Syntax.Include include) {
            resolveInclude(file, include);
        } else if (event instanceof Syntax.CallBoundary boundary) {
            file.registerFunctionCall(boundary.start(), boundary.function(), boundary.position());
        } else if (event instanceof Syntax.ParameterBoundary boundary) {
            file.registerFunctionCallParameter(boundary.index(), boundary.start(), boundary.position());
        } else if (event instanceof Syntax.PathBoundary boundary) {
            PathPositionTree tree = file.positionTree();
            switch (boundary.kind()) {
                case BEGIN -> tree.begin(boundary.path(), boundary.position());
                case BEGIN_EMBEDDING -> tree.beginEmbedding(boundary.path(), boundary.position());
                case END_EMBEDDING -> tree.endEmbedding(boundary.path(), boundary.position());
                case END -> tree.end(boundary.path(), boundary.position());
            }
        }
    }

    private boolean isIgnored(Syntax.Message message) {
        if (message.severity() != Syntax.Severity.WARNING) {
            return false;
        }
        return switch (message.category()) {
            case MISSING_SEMICOLON -> !options.getMissingSemicolonWarnings();
            case COMPATIBILITY -> !options.getCompatibilityWarnings();
            default -> false;
        };
    }

    private void resolveInclude(AwkFile file, Syntax.Include include) {
        Range range = LspAdapter.span(include.position(), include.length());
        String path = null;
        for (String candidate : includeFiles.candidates(
                file.uri(), include.path(), include.relative(), options.getIncludePath())) {
            if (!unreadable.contains(candidate) && includeFiles.exists(candidate)) {
                path = candidate;
                break;
            }
        }
        if (path == null) {
            file.addParseDiagnostic(noSuchFile(file, include, range));
            return;
        }

        String uri = LspAdapter.toUri(path);
        AwkFile known = graph.get(uri);
        if (known != null) {
            file.addInclude(known, range);
            return;
        }

        AwkFile target = graph.getOrCreate(uri);
        file.addInclude(target, range);
        String includePath = path;
        queue.readStarted();
        includeFiles.read(path).whenCompleteAsync((text, error) -> {
            try {
                if (error != null) {
                    LOGGER.log(Level.WARNING, "Failed to read included file " + includePath, error);
                    unreadable.add(includePath);
                    for (AwkFile includer : new ArrayList<>(target.includedBy().keySet())) {
                        queue.addFirst(includer, includer.text());
                    }
                } else if (graph.get(uri) == target && !graph.isOpen(target)) {
                    queue.addLast(target, text);
                }
            } finally {
                queue.readFinished();
            }
        }, executor);
    }

    private static Diagnostic noSuchFile(AwkFile file, Syntax.Include include, Range range) {
        return AwkDiagnostics.create(
                range,
                "no such file: " + include.path() + " (" + file.uri() + ")",
                DiagnosticSeverity.Error,
                AwkDiagnostics.NO_SUCH_FILE);
    }

    private void finishUp() {
        graph.sweep(sink);
        for (AwkFile file : graph.files()) {
            if (options.getFunctionCallArityChecks()) {
                FunctionChecker.check(file);
            } else {
                file.clearAnalysisDiagnostics();
            }
        }
        for (AwkFile file : graph.files()) {
            file.sendDiagnostics(sink, options.getMaxNumberOfProblems());
        }
        unreadable.clear();
    }
}
