/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.syntax;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.eclipse.lsp4j.Position;
import software.amazon.awk.lsp.document.SymbolType;

/**
 * Provides methods to parse AWK source text, and the events parsing produces.
 *
 * <p>Parsing never throws. Syntax errors are reported as {@link Message}
 * events, and a failure inside the parser itself becomes a single message at
 * the token being parsed when it happened.
 */
public final class Syntax {
    private static final Logger LOGGER = Logger.getLogger(Syntax.class.getName());

    private Syntax() {
    }

    public enum Severity {
        ERROR,
        WARNING
    }

    public enum Category {
        SYNTAX,
        MISSING_SEMICOLON,
        COMPATIBILITY,
        STRUCTURE,
        INTERNAL
    }

    /**
     * @param extendedMode Whether GAWK extensions are allowed, unless the
     *                     script's interpreter line says otherwise
     */
    public record Options(boolean extendedMode) {
        public static Options defaults() {
            return new Options(true);
        }
    }

    /**
     * Something the parser found, in text order.
     */
    public sealed interface Event
            permits Define, Use, Message, Include, CallBoundary, ParameterBoundary, PathBoundary {
    }

    /**
     * A declaration. Instances are handles: later events refer to the
     * function a symbol is declared in by its {@code Define} event.
     */
    public static final class Define implements Event {
        private final SymbolType type;
        private final Define scope;
        private final String name;
        private final Position position;
        private final String docComment;
        private final boolean implicit;

        Define(SymbolType type, Define scope, String name, Position position, String docComment, boolean implicit) {
            this.type = type;
            this.scope = scope;
            this.name = name;
            this.position = position;
            this.docComment = docComment;
            this.implicit = implicit;
        }

        public SymbolType type() {
            return type;
        }

        public Define scope() {
            return scope;
        }

        public String name() {
            return name;
        }

        public Position position() {
            return position;
        }

        public String docComment() {
            return docComment;
        }

        public boolean isImplicit() {
            return implicit;
        }

        @Override
        public String toString() {
            return "Define{" + type + " " + name + "@" + position.getLine() + ":" + position.getCharacter() + '}';
        }
    }

    /**
     * @param type How the symbol is used; definition flavored at declarations
     * @param scope The function the use is in, or {@code null}
     * @param name The symbol's name
     * @param position Where the name starts
     */
    public record Use(SymbolType type, Define scope, String name, Position position) implements Event {
    }

    /**
     * @param severity How bad it is
     * @param category What kind of problem it is
     * @param text The message
     * @param position Where the problem starts
     * @param length How many characters on that line it covers
     */
    public record Message(Severity severity, Category category, String text, Position position, int length)
            implements Event {
    }

    /**
     * @param path The file name as written, without quotes
     * @param relative Whether the name is resolved against the including file
     * @param position Where the quoted file name starts
     * @param length The length of the quoted file name
     */
    public record Include(String path, boolean relative, Position position, int length) implements Event {
    }

    /**
     * @param start Whether the call opens here, at the function's name, or
     *              closes here, at the closing parenthesis
     * @param function The called function
     * @param position Where the boundary is
     */
    public record CallBoundary(boolean start, String function, Position position) implements Event {
    }

    /**
     * @param index 0-based index of the argument
     * @param start Whether the argument starts or ends here
     * @param position Where the boundary is
     */
    public record ParameterBoundary(int index, boolean start, Position position) implements Event {
    }

    /**
     * @param path Segments identifying the structure
     * @param kind Which boundary this is
     * @param position Where the boundary is
     */
    public record PathBoundary(List<String> path, PathBoundary.Kind kind, Position position) implements Event {
        public enum Kind {
            BEGIN,
            BEGIN_EMBEDDING,
            END_EMBEDDING,
            END
        }
    }

    /**
     * @param events What the parser found, in text order
     * @param extendedMode Whether the text was parsed with GAWK extensions
     * @param lastToken The position of the last token read
     */
    public record ParseResult(List<Event> events, boolean extendedMode, Position lastToken) {
    }

    /**
     * @param text The text to parse
     * @param options How to parse it
     * @return The events parsing produced
     */
    public static ParseResult parse(CharSequence text, Options options) {
        boolean extendedMode = interpreterMode(text, options.extendedMode());
        Parser parser = new Parser(text, extendedMode);
        try {
            parser.parse();
        } catch (RuntimeException | StackOverflowError e) {
            LOGGER.log(Level.SEVERE, "Parser crashed at " + parser.lastTokenPosition(), e);
            parser.crashed();
        }
        return new ParseResult(parser.events(), extendedMode, parser.lastTokenPosition());
    }

    /**
     * A first line like {@code #!/usr/bin/gawk -f} selects extended mode, and
     * one naming any other awk selects strict mode.
     *
     * @param text The script
     * @param fallback Mode to use when there is no interpreter line
     * @return Whether the script uses GAWK extensions
     */
    static boolean interpreterMode(CharSequence text, boolean fallback) {
        if (text.length() < 2 || text.charAt(0) != '#' || text.charAt(1) != '!') {
            return fallback;
        }
        int end = 2;
        while (end < text.length() && text.charAt(end) != '\n') {
            end++;
        }
        String interpreter = text.subSequence(2, end).toString().trim().split("\\s+")[0];
        int slash = interpreter.lastIndexOf('/');
        String command = interpreter.substring(slash + 1);
        if (command.equals("env")) {
            String[] words = text.subSequence(2, end).toString().trim().split("\\s+");
            command = words.length > 1 ? words[1] : "";
        }
        if (command.equals("gawk")) {
            return true;
        } else if (command.endsWith("awk")) {
            return false;
        }
        return fallback;
    }
}
