/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.project;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Logger;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import software.amazon.awk.lsp.diagnostics.AwkDiagnostics;
import software.amazon.awk.lsp.diagnostics.DiagnosticsSink;
import software.amazon.awk.lsp.document.Arity;
import software.amazon.awk.lsp.document.IncludeDeclaration;
import software.amazon.awk.lsp.document.ParameterUsage;
import software.amazon.awk.lsp.document.PathPositionTree;
import software.amazon.awk.lsp.document.SymbolDefinition;
import software.amazon.awk.lsp.document.SymbolType;
import software.amazon.awk.lsp.document.SymbolUsage;
import software.amazon.awk.lsp.protocol.LspAdapter;

/**
 * The language server's representation of an AWK file: everything the last
 * analysis of its text found, and its place in the include graph.
 *
 * <p>Files are compared by identity. Include edges are stored on both ends,
 * sharing one {@link IncludeDeclaration} per edge.
 */
public final class AwkFile {
    private static final Logger LOGGER = Logger.getLogger(AwkFile.class.getName());

    private final String uri;
    private final Map<SymbolType, Map<String, List<SymbolDefinition>>> symbols = new EnumMap<>(SymbolType.class);
    private final List<SymbolUsage> usages = new ArrayList<>();
    private final PathPositionTree positionTree = new PathPositionTree();
    private final Map<AwkFile, IncludeDeclaration> includes = new LinkedHashMap<>();
    private final Map<AwkFile, IncludeDeclaration> includedBy = new LinkedHashMap<>();
    private final List<Diagnostic> parseDiagnostics = new ArrayList<>();
    private final List<Diagnostic> analysisDiagnostics = new ArrayList<>();
    private final Deque<SymbolUsage> callStack = new ArrayDeque<>();
    private final List<ParameterUsage> parameterUsages = new ArrayList<>();
    private Map<String, Arity> functionArities = new LinkedHashMap<>();
    private Map<String, Arity> previousFunctionArities = new LinkedHashMap<>();
    private List<Diagnostic> published = List.of();
    private boolean diagnosticsChanged;
    private boolean extendedMode = true;
    private String text = "";

    AwkFile(String uri) {
        this.uri = uri;
    }

    public String uri() {
        return uri;
    }

    /**
     * @return Whether the last analysis parsed this file as GAWK
     */
    public boolean extendedMode() {
        return extendedMode;
    }

    void setExtendedMode(boolean extendedMode) {
        this.extendedMode = extendedMode;
    }

    /**
     * @return The text of the last analysis
     */
    public String text() {
        return text;
    }

    void setText(String text) {
        this.text = text;
    }

    /**
     * Adds a definition to the symbol table of its type. A name may be
     * defined any number of times.
     *
     * @param name The defined name
     * @param definition The definition
     */
    public void addDefinition(String name, SymbolDefinition definition) {
        symbols.computeIfAbsent(definition.type(), t -> new LinkedHashMap<>())
                .computeIfAbsent(name, n -> new ArrayList<>())
                .add(definition);
    }

    /**
     * Adds a usage after all usages added so far, which must not start after it.
     *
     * @param usage The usage
     */
    public void addUsage(SymbolUsage usage) {
        usages.add(usage);
    }

    /**
     * @param name Name of the symbol
     * @param type Type of the symbol
     * @return Whether this file defines the symbol
     */
    public boolean isDefined(String name, SymbolType type) {
        Map<String, List<SymbolDefinition>> table = symbols.get(type.fromDefineType());
        return table != null && table.containsKey(name);
    }

    /**
     * @param name Name of the symbol
     * @param type Type of the symbol
     * @return The definitions of the symbol in declaration order, possibly empty
     */
    public List<SymbolDefinition> definitions(String name, SymbolType type) {
        Map<String, List<SymbolDefinition>> table = symbols.get(type.fromDefineType());
        if (table == null) {
            return List.of();
        }
        return Collections.unmodifiableList(table.getOrDefault(name, List.of()));
    }

    /**
     * @param type Type of the symbols
     * @return The symbol table of {@code type}, by name
     */
    public Map<String, List<SymbolDefinition>> symbolTable(SymbolType type) {
        return Collections.unmodifiableMap(symbols.getOrDefault(type.fromDefineType(), Map.of()));
    }

    /**
     * @return Every definition in this file
     */
    public List<SymbolDefinition> allDefinitions() {
        List<SymbolDefinition> all = new ArrayList<>();
        for (Map<String, List<SymbolDefinition>> table : symbols.values()) {
            for (List<SymbolDefinition> definitions : table.values()) {
                all.addAll(definitions);
            }
        }
        return all;
    }

    /**
     * @return The usages in this file, in text order
     */
    public List<SymbolUsage> usages() {
        return Collections.unmodifiableList(usages);
    }

    public PathPositionTree positionTree() {
        return positionTree;
    }

    /**
     * @return The call and argument boundaries in this file, in text order
     */
    public List<ParameterUsage> parameterUsages() {
        return Collections.unmodifiableList(parameterUsages);
    }

    /**
     * Records that this file includes {@code target}. Including the same
     * file again reports a warning at {@code range} and moves the edge there.
     *
     * @param target The included file
     * @param range Range of the include directive's file name
     */
    public void addInclude(AwkFile target, Range range) {
        if (includes.containsKey(target)) {
            addParseDiagnostic(AwkDiagnostics.create(
                    range, "repeated include", DiagnosticSeverity.Warning, AwkDiagnostics.REPEATED_INCLUDE));
        }
        IncludeDeclaration declaration = new IncludeDeclaration(range);
        includes.put(target, declaration);
        target.includedBy.put(this, declaration);
    }

    /**
     * Removes the edge from this file to {@code target}, if there is one.
     *
     * @param target The included file
     * @return Whether there was an edge
     */
    public boolean removeInclude(AwkFile target) {
        if (includes.remove(target) == null) {
            return false;
        }
        target.includedBy.remove(this);
        return true;
    }

    /**
     * @return The files this file includes, with their include declarations
     */
    public Map<AwkFile, IncludeDeclaration> includes() {
        return Collections.unmodifiableMap(includes);
    }

    /**
     * @return The files including this file, with their include declarations
     */
    public Map<AwkFile, IncludeDeclaration> includedBy() {
        return Collections.unmodifiableMap(includedBy);
    }

    /**
     * @return Whether any file includes this file
     */
    public boolean isIncluded() {
        return !includedBy.isEmpty();
    }

    /**
     * @return Every file reachable through includes from this file, not
     *  including this file itself, nearest first
     */
    public Set<AwkFile> includeClosure() {
        Set<AwkFile> visited = new LinkedHashSet<>();
        Deque<AwkFile> pending = new ArrayDeque<>(includes.keySet());
        while (!pending.isEmpty()) {
            AwkFile next = pending.removeFirst();
            if (next == this || !visited.add(next)) {
                continue;
            }
            pending.addAll(next.includes.keySet());
        }
        return visited;
    }

    /**
     * Resets everything the last analysis produced, cutting the edges to the
     * files this file includes. The function arities found by the last
     * analysis are kept for {@link #functionSignaturesChanged()}.
     *
     * @return Whether any include edge was removed
     */
    public boolean clear() {
        boolean severed = !includes.isEmpty();
        for (AwkFile target : includes.keySet()) {
            target.includedBy.remove(this);
        }
        includes.clear();
        symbols.clear();
        usages.clear();
        positionTree.clear();
        if (!parseDiagnostics.isEmpty() || !analysisDiagnostics.isEmpty()) {
            diagnosticsChanged = true;
        }
        parseDiagnostics.clear();
        analysisDiagnostics.clear();
        callStack.clear();
        parameterUsages.clear();
        previousFunctionArities = functionArities;
        functionArities = new LinkedHashMap<>();
        return severed;
    }

    /**
     * Like {@link #clear()}, also withdrawing this file's diagnostics.
     *
     * @param sink Where diagnostics are published
     * @return Whether any include edge was removed
     */
    public boolean close(DiagnosticsSink sink) {
        boolean severed = clear();
        diagnosticsChanged = false;
        if (!published.isEmpty()) {
            published = List.of();
            sink.publish(uri, List.of());
        }
        return severed;
    }

    /**
     * Adds a diagnostic found while parsing, unless the previous one starts
     * at the same position.
     *
     * @param diagnostic The diagnostic
     */
    public void addParseDiagnostic(Diagnostic diagnostic) {
        if (!parseDiagnostics.isEmpty()) {
            Diagnostic last = parseDiagnostics.get(parseDiagnostics.size() - 1);
            if (last.getRange().getStart().equals(diagnostic.getRange().getStart())) {
                return;
            }
        }
        parseDiagnostics.add(diagnostic);
        diagnosticsChanged = true;
    }

    /**
     * @param diagnostic A diagnostic found by checking this file against the
     *                   files it includes
     */
    public void addAnalysisDiagnostic(Diagnostic diagnostic) {
        analysisDiagnostics.add(diagnostic);
        diagnosticsChanged = true;
    }

    /**
     * Removes the diagnostics added by {@link #addAnalysisDiagnostic}.
     */
    public void clearAnalysisDiagnostics() {
        if (!analysisDiagnostics.isEmpty()) {
            analysisDiagnostics.clear();
            diagnosticsChanged = true;
        }
    }

    public List<Diagnostic> parseDiagnostics() {
        return Collections.unmodifiableList(parseDiagnostics);
    }

    public List<Diagnostic> analysisDiagnostics() {
        return Collections.unmodifiableList(analysisDiagnostics);
    }

    /**
     * @return Whether diagnostics changed since they were last sent
     */
    public boolean diagnosticsChanged() {
        return diagnosticsChanged;
    }

    /**
     * @param max Most diagnostics to return
     * @return Parse and analysis diagnostics, capped at {@code max}
     */
    public List<Diagnostic> diagnosticsToPublish(int max) {
        List<Diagnostic> all = new ArrayList<>(parseDiagnostics.size() + analysisDiagnostics.size());
        all.addAll(parseDiagnostics);
        all.addAll(analysisDiagnostics);
        return AwkDiagnostics.limit(all, max);
    }

    /**
     * Publishes this file's diagnostics if they changed since they were last
     * published.
     *
     * @param sink Where to publish
     * @param max Most diagnostics to publish
     * @return Whether anything was published
     */
    public boolean sendDiagnostics(DiagnosticsSink sink, int max) {
        if (!diagnosticsChanged) {
            return false;
        }
        diagnosticsChanged = false;
        List<Diagnostic> diagnostics = diagnosticsToPublish(max);
        if (diagnostics.equals(published)) {
            return false;
        }
        published = List.copyOf(diagnostics);
        sink.publish(uri, published);
        return true;
    }

    /**
     * Opens or closes a call. Closing boundaries match the most recently
     * opened call.
     *
     * @param start Whether the call opens here
     * @param name The called function
     * @param position Position of the function name when opening, of the
     *                 closing parenthesis otherwise
     */
    public void registerFunctionCall(boolean start, String name, Position position) {
        if (start) {
            SymbolUsage call = new SymbolUsage(name, SymbolType.FUNCTION, position);
            callStack.push(call);
            parameterUsages.add(new ParameterUsage(call, ParameterUsage.CALL, true, position));
        } else if (callStack.isEmpty()) {
            LOGGER.warning(() -> "Unbalanced call boundary for " + name + " in " + uri);
        } else {
            parameterUsages.add(new ParameterUsage(callStack.pop(), ParameterUsage.CALL, false, position));
        }
    }

    /**
     * @param index 0-based argument index
     * @param start Whether the argument starts or ends here
     * @param position Where the boundary is
     */
    public void registerFunctionCallParameter(int index, boolean start, Position position) {
        if (callStack.isEmpty()) {
            LOGGER.warning(() -> "Argument boundary outside of a call in " + uri);
            return;
        }
        parameterUsages.add(new ParameterUsage(callStack.peek(), index, start, position));
    }

    /**
     * @param name Function name
     * @param arity Arguments the function accepts
     */
    void addFunctionArity(String name, Arity arity) {
        functionArities.putIfAbsent(name, arity);
    }

    /**
     * @return Arguments accepted by each function this file defines
     */
    public Map<String, Arity> functionArities() {
        return Collections.unmodifiableMap(functionArities);
    }

    /**
     * @return Whether the functions this file defines, or the arguments they
     *  accept, differ from before the last {@link #clear()}
     */
    public boolean functionSignaturesChanged() {
        return !functionArities.equals(previousFunctionArities);
    }

    /**
     * @param position Position to look up
     * @return The usage whose name covers {@code position}. A usage covers
     *  the characters from its start up to, not including, its end.
     */
    public Optional<SymbolUsage> findUsageAt(Position position) {
        int index = lastStartingAtOrBefore(usages, position, SymbolUsage::position);
        while (index >= 0) {
            SymbolUsage usage = usages.get(index);
            Position start = usage.position();
            if (start.getLine() != position.getLine()) {
                return Optional.empty();
            }
            int offset = position.getCharacter() - start.getCharacter();
            if (offset < usage.length() || (usage.length() == 0 && offset == 0)) {
                return Optional.of(usage);
            }
            // Usages starting at the same position, look at the earlier ones.
            if (index > 0 && usages.get(index - 1).position().equals(start)) {
                index--;
            } else {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * @param position Position to look up
     * @return The last call or argument boundary at or before {@code position}
     */
    public Optional<ParameterUsage> findParameterUsageAt(Position position) {
        int index = lastStartingAtOrBefore(parameterUsages, position, ParameterUsage::position);
        return index < 0 ? Optional.empty() : Optional.of(parameterUsages.get(index));
    }

    /**
     * @param definition A function-scoped definition in this file
     * @return The range of the function {@code definition} belongs to, if its
     *  body was recorded
     */
    public Optional<Range> functionRange(SymbolDefinition definition) {
        SymbolDefinition function = definition.scope() == null ? definition : definition.scope();
        return positionTree.find(List.of("function " + function.name()))
                .filter(node -> node.end() != null)
                .map(node -> new Range(function.position(), node.end()));
    }

    private static <T> int lastStartingAtOrBefore(
            List<T> items,
            Position position,
            Function<T, Position> positionOf
    ) {
        int low = 0;
        int high = items.size() - 1;
        int found = -1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            if (LspAdapter.compare(positionOf.apply(items.get(mid)), position) <= 0) {
                found = mid;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return found;
    }

    @Override
    public String toString() {
        return "AwkFile{uri='" + uri + "'}";
    }
}
