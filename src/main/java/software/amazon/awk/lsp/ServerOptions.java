/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.eclipse.lsp4j.InitializeParams;

public final class ServerOptions {
    static final String SETTINGS_SECTION = "awk";

    private final int maxNumberOfProblems;
    private final boolean extendedMode;
    private final boolean missingSemicolonWarnings;
    private final boolean compatibilityWarnings;
    private final boolean functionCallArityChecks;
    private final List<String> includePath;

    private ServerOptions(Builder builder) {
        this.maxNumberOfProblems = builder.maxNumberOfProblems;
        this.extendedMode = builder.extendedMode;
        this.missingSemicolonWarnings = builder.missingSemicolonWarnings;
        this.compatibilityWarnings = builder.compatibilityWarnings;
        this.functionCallArityChecks = builder.functionCallArityChecks;
        this.includePath = List.copyOf(builder.includePath);
    }

    /**
     * @return The most diagnostics published for a single document
     */
    public int getMaxNumberOfProblems() {
        return maxNumberOfProblems;
    }

    /**
     * @return Whether scripts are parsed as GAWK unless their interpreter
     *  line says otherwise
     */
    public boolean getExtendedMode() {
        return extendedMode;
    }

    public boolean getMissingSemicolonWarnings() {
        return missingSemicolonWarnings;
    }

    public boolean getCompatibilityWarnings() {
        return compatibilityWarnings;
    }

    public boolean getFunctionCallArityChecks() {
        return functionCallArityChecks;
    }

    /**
     * @return Directories searched for {@code @include} files, in order
     */
    public List<String> getIncludePath() {
        return includePath;
    }

    /**
     * @param other Options to compare with
     * @return Whether documents analyzed with {@code other} could get
     *  different results than with these options
     */
    public boolean affectsAnalysis(ServerOptions other) {
        return extendedMode != other.extendedMode
               || missingSemicolonWarnings != other.missingSemicolonWarnings
               || compatibilityWarnings != other.compatibilityWarnings
               || functionCallArityChecks != other.functionCallArityChecks
               || maxNumberOfProblems != other.maxNumberOfProblems
               || !includePath.equals(other.includePath);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return Options with every setting at its default
     */
    public static ServerOptions defaults() {
        return builder().build();
    }

    /**
     * Creates a ServerOptions instance from the initialization options provided by the client.
     *
     * @param params The params passed directly from the client
     * @param client The language client used for reporting invalid settings
     * @return A new {@code ServerOptions} instance with parsed configuration values
     */
    public static ServerOptions fromInitializeParams(InitializeParams params, AwkLanguageClient client) {
        Object initializationOptions = params.getInitializationOptions();
        if (initializationOptions instanceof JsonElement element) {
            return fromSettings(element, client);
        }
        return defaults();
    }

    /**
     * Reads settings as sent in {@code workspace/didChangeConfiguration}, either
     * as the {@code awk} section itself or as an object containing it.
     *
     * @param settings The settings sent by the client
     * @param client The language client used for reporting invalid settings
     * @return A new {@code ServerOptions} instance with parsed configuration values
     */
    public static ServerOptions fromSettings(Object settings, AwkLanguageClient client) {
        Builder builder = builder();
        if (!(settings instanceof JsonObject jsonObject)) {
            return builder.build();
        }
        if (jsonObject.has(SETTINGS_SECTION) && jsonObject.get(SETTINGS_SECTION).isJsonObject()) {
            jsonObject = jsonObject.getAsJsonObject(SETTINGS_SECTION);
        }

        if (jsonObject.has("maxNumberOfProblems")) {
            JsonElement value = jsonObject.get("maxNumberOfProblems");
            if (isNumber(value) && value.getAsInt() >= 0) {
                builder.setMaxNumberOfProblems(value.getAsInt());
            } else {
                client.error("Invalid value for 'maxNumberOfProblems': " + value
                             + ". Must be a non-negative number.");
            }
        }
        if (jsonObject.has("mode")) {
            String mode = jsonObject.get("mode").getAsString();
            switch (mode) {
                case "gawk" -> builder.setExtendedMode(true);
                case "awk" -> builder.setExtendedMode(false);
                default -> client.error(String.format("""
                        Invalid value for 'mode': %s.
                        Must be one of [gawk, awk].""", mode));
            }
        }
        if (jsonObject.has("stylisticWarnings") && jsonObject.get("stylisticWarnings").isJsonObject()) {
            JsonObject warnings = jsonObject.getAsJsonObject("stylisticWarnings");
            if (warnings.has("missingSemicolon")) {
                builder.setMissingSemicolonWarnings(warnings.get("missingSemicolon").getAsBoolean());
            }
            if (warnings.has("compatibility")) {
                builder.setCompatibilityWarnings(warnings.get("compatibility").getAsBoolean());
            }
            if (warnings.has("functionCallArity")) {
                builder.setFunctionCallArityChecks(warnings.get("functionCallArity").getAsBoolean());
            }
        }
        if (jsonObject.has("path")) {
            JsonElement path = jsonObject.get("path");
            if (path.isJsonArray()) {
                List<String> directories = new ArrayList<>();
                for (JsonElement directory : (JsonArray) path) {
                    directories.add(directory.getAsString());
                }
                builder.setIncludePath(directories);
            } else if (path.isJsonPrimitive()) {
                builder.setIncludePath(splitPath(path.getAsString()));
            } else {
                client.error("Invalid value for 'path': " + path + ". Must be a list of directories.");
            }
        }
        return builder.build();
    }

    /**
     * @param environment Environment variables
     * @return The directories in {@code AWKPATH}, or the current directory
     *  if it is not set
     */
    static List<String> defaultIncludePath(Map<String, String> environment) {
        String awkPath = environment.get("AWKPATH");
        if (awkPath == null || awkPath.isBlank()) {
            return List.of(".");
        }
        return splitPath(awkPath);
    }

    private static List<String> splitPath(String path) {
        List<String> directories = new ArrayList<>();
        for (String directory : path.split(File.pathSeparator)) {
            directories.add(directory.isEmpty() ? "." : directory);
        }
        return directories;
    }

    private static boolean isNumber(JsonElement element) {
        return element.isJsonPrimitive() && element.getAsJsonPrimitive().isNumber();
    }

    public static final class Builder {
        private int maxNumberOfProblems = 100;
        private boolean extendedMode = true;
        private boolean missingSemicolonWarnings = false;
        private boolean compatibilityWarnings = true;
        private boolean functionCallArityChecks = true;
        private List<String> includePath = defaultIncludePath(System.getenv());

        public Builder setMaxNumberOfProblems(int maxNumberOfProblems) {
            this.maxNumberOfProblems = maxNumberOfProblems;
            return this;
        }

        public Builder setExtendedMode(boolean extendedMode) {
            this.extendedMode = extendedMode;
            return this;
        }

        public Builder setMissingSemicolonWarnings(boolean missingSemicolonWarnings) {
            this.missingSemicolonWarnings = missingSemicolonWarnings;
            return this;
        }

        public Builder setCompatibilityWarnings(boolean compatibilityWarnings) {
            this.compatibilityWarnings = compatibilityWarnings;
            return this;
        }

        public Builder setFunctionCallArityChecks(boolean functionCallArityChecks) {
            this.functionCallArityChecks = functionCallArityChecks;
            return this;
        }

        public Builder setIncludePath(List<String> includePath) {
            this.includePath = Objects.requireNonNull(includePath);
            return this;
        }

        public ServerOptions build() {
            return new ServerOptions(this);
        }
    }
}
