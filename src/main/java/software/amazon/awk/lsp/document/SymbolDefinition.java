/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.Position;
import software.amazon.awk.lsp.protocol.LspAdapter;

/**
 * The declaration of a function, variable or parameter in a document.
 *
 * <p>A function definition owns the definitions of its parameters and local
 * variables, in declaration order. Definitions of parameters and locals point
 * back at the function through {@link #scope()}.
 */
public final class SymbolDefinition {
    private static final Pattern OPTIONAL_PARAM = Pattern.compile("@param\\s+\\[\\s*([A-Za-z_][A-Za-z0-9_]*)");

    private final String uri;
    private final String name;
    private final SymbolType type;
    private final Position position;
    private final String docComment;
    private final SymbolDefinition scope;
    private final boolean implicit;
    private final List<SymbolDefinition> parameters = new ArrayList<>();
    private final List<SymbolDefinition> locals = new ArrayList<>();

    /**
     * @param uri URI of the document the symbol is declared in
     * @param name Name of the symbol
     * @param type Use type of the symbol
     * @param position Where the name is declared
     * @param docComment Doc comment preceding the declaration, possibly empty
     * @param scope The function the symbol is declared in, or {@code null}
     * @param implicit Whether the definition was synthesized from a first use
     */
    public SymbolDefinition(
            String uri,
            String name,
            SymbolType type,
            Position position,
            String docComment,
            SymbolDefinition scope,
            boolean implicit
    ) {
        this.uri = uri;
        this.name = name;
        this.type = type.fromDefineType();
        this.position = position;
        this.docComment = docComment == null ? "" : docComment;
        this.scope = scope;
        this.implicit = implicit;
        if (scope != null) {
            if (this.type == SymbolType.PARAMETER) {
                scope.parameters.add(this);
            } else if (this.type == SymbolType.LOCAL_VARIABLE) {
                scope.locals.add(this);
            }
        }
    }

    public String uri() {
        return uri;
    }

    public String name() {
        return name;
    }

    public SymbolType type() {
        return type;
    }

    public Position position() {
        return position;
    }

    public String docComment() {
        return docComment;
    }

    /**
     * @return The function this symbol is declared in, or {@code null} for
     *  functions and globals
     */
    public SymbolDefinition scope() {
        return scope;
    }

    /**
     * @return Whether this definition stands in for a global's first use
     *  rather than a declaration
     */
    public boolean isImplicit() {
        return implicit;
    }

    /**
     * @return The parameters of this function, in order
     */
    public List<SymbolDefinition> parameters() {
        return Collections.unmodifiableList(parameters);
    }

    /**
     * @return The local variables of this function, in order
     */
    public List<SymbolDefinition> locals() {
        return Collections.unmodifiableList(locals);
    }

    /**
     * @return The names of this function's parameters
     */
    public List<String> parameterNames() {
        List<String> names = new ArrayList<>(parameters.size());
        for (SymbolDefinition parameter : parameters) {
            names.add(parameter.name);
        }
        return names;
    }

    /**
     * Parameters listed as {@code @param [name]} in the doc comment are
     * optional, and so are all parameters after the first optional one.
     *
     * @return The number of arguments this function accepts
     */
    public Arity arity() {
        int min = parameters.size();
        Matcher matcher = OPTIONAL_PARAM.matcher(docComment);
        while (matcher.find()) {
            String optional = matcher.group(1);
            for (int i = 0; i < parameters.size(); i++) {
                if (parameters.get(i).name.equals(optional) && i < min) {
                    min = i;
                }
            }
        }
        return new Arity(min, parameters.size());
    }

    /**
     * @return The location of the declared name
     */
    public Location location() {
        return LspAdapter.toLocation(uri, position, name.length());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SymbolDefinition that = (SymbolDefinition) o;
        return name.equals(that.name)
               && uri.equals(that.uri)
               && position.equals(that.position)
               && type == that.type
               && docComment.equals(that.docComment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, uri, position, type, docComment);
    }

    @Override
    public String toString() {
        return "SymbolDefinition{"
               + "name='" + name + '\''
               + ", type=" + type
               + ", uri='" + uri + '\''
               + ", position=" + position.getLine() + ':' + position.getCharacter()
               + (implicit ? ", implicit" : "")
               + '}';
    }
}
