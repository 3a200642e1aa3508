/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.syntax;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import software.amazon.awk.lsp.document.Arity;
import software.amazon.smithy.utils.IoUtils;

/**
 * The functions and variables AWK and GAWK provide, loaded from
 * {@code builtins.json}.
 */
public final class Builtins {
    private static final Map<String, Builtin> BUILTINS = load();

    private Builtins() {
    }

    /**
     * A built-in function or variable.
     *
     * @param name Name of the built-in
     * @param function Whether it is a function
     * @param parameters Parameter names of a function, empty for variables
     * @param firstOptional Index of the first optional parameter, or -1 if
     *                      all are required
     * @param variadic Whether a function takes any number of trailing arguments
     * @param awk Whether the built-in is available in strict mode
     * @param description What the built-in does
     */
    public record Builtin(
            String name,
            boolean function,
            List<String> parameters,
            int firstOptional,
            boolean variadic,
            boolean awk,
            String description
    ) {
        /**
         * @return The number of arguments the function accepts
         */
        public Arity arity() {
            int min = firstOptional < 0 ? parameters.size() : firstOptional;
            return new Arity(min, variadic ? Arity.UNBOUNDED : parameters.size());
        }

        /**
         * @return The function's signature with optional parameters in
         *  brackets, like {@code substr(string,start[,length])}
         */
        public String signature() {
            if (firstOptional < 0) {
                return name + "(" + String.join(",", parameters) + (variadic ? ",..." : "") + ")";
            }
            List<String> required = parameters.subList(0, firstOptional);
            List<String> optional = parameters.subList(firstOptional, parameters.size());
            return name + "(" + String.join(",", required)
                   + (required.isEmpty() ? "[" : "[,") + String.join(",", optional) + "])";
        }

        /**
         * @param extendedMode Whether GAWK extensions are enabled
         * @return Whether the built-in exists in the given mode
         */
        public boolean availableIn(boolean extendedMode) {
            return awk || extendedMode;
        }
    }

    /**
     * @param name Name to look up
     * @return The built-in with that name, or {@code null}
     */
    public static Builtin get(String name) {
        return BUILTINS.get(name);
    }

    /**
     * @param name Name to look up
     * @return Whether {@code name} is a built-in function
     */
    public static boolean isFunction(String name) {
        Builtin builtin = BUILTINS.get(name);
        return builtin != null && builtin.function();
    }

    /**
     * @param name Name to look up
     * @return Whether {@code name} is a built-in variable
     */
    public static boolean isVariable(String name) {
        Builtin builtin = BUILTINS.get(name);
        return builtin != null && !builtin.function();
    }

    /**
     * @return All built-ins, functions first
     */
    public static Collection<Builtin> all() {
        return BUILTINS.values();
    }

    private static Map<String, Builtin> load() {
        String json = IoUtils.readUtf8Resource(Builtins.class, "builtins.json");
        JsonArray entries = JsonParser.parseString(json).getAsJsonArray();
        Map<String, Builtin> builtins = new LinkedHashMap<>();
        for (JsonElement element : entries) {
            JsonObject entry = element.getAsJsonObject();
            List<String> parameters = new ArrayList<>();
            if (entry.has("parameters")) {
                for (JsonElement parameter : entry.getAsJsonArray("parameters")) {
                    parameters.add(parameter.getAsString());
                }
            }
            Builtin builtin = new Builtin(
                    entry.get("name").getAsString(),
                    "function".equals(entry.get("kind").getAsString()),
                    Collections.unmodifiableList(parameters),
                    entry.has("firstOptional") ? entry.get("firstOptional").getAsInt() : -1,
                    entry.has("variadic") && entry.get("variadic").getAsBoolean(),
                    entry.get("awk").getAsBoolean(),
                    entry.get("description").getAsString());
            builtins.put(builtin.name(), builtin);
        }
        return Collections.unmodifiableMap(builtins);
    }
}
