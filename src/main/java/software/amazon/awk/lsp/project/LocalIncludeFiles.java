/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.project;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.logging.Logger;
import software.amazon.awk.lsp.protocol.LspAdapter;
import software.amazon.smithy.utils.IoUtils;

/**
 * Resolves include directives against the local file system, the way gawk
 * does: a name without the {@code .awk} suffix is tried with it too, and
 * relative names are looked up next to the including file, then in each
 * directory of the search path.
 */
public final class LocalIncludeFiles implements IncludeFiles {
    private static final Logger LOGGER = Logger.getLogger(LocalIncludeFiles.class.getName());
    private static final String SUFFIX = ".awk";

    private final Executor readExecutor;

    public LocalIncludeFiles() {
        this(ForkJoinPool.commonPool());
    }

    LocalIncludeFiles(Executor readExecutor) {
        this.readExecutor = readExecutor;
    }

    @Override
    public List<String> candidates(String sourceUri, String rawPath, boolean relative, List<String> searchPath) {
        List<String> candidates = new ArrayList<>();
        try {
            if (!relative) {
                addWithSuffix(candidates, Paths.get(rawPath));
                return candidates;
            }

            Path sourceDirectory = sourceDirectory(sourceUri);
            if (sourceDirectory != null) {
                addWithSuffix(candidates, sourceDirectory.resolve(rawPath));
            }
            for (String directory : searchPath) {
                Path base = Paths.get(directory);
                if (!base.isAbsolute() && sourceDirectory != null) {
                    base = sourceDirectory.resolve(base);
                }
                addWithSuffix(candidates, base.resolve(rawPath));
            }
        } catch (InvalidPathException e) {
            LOGGER.warning(() -> "Include path isn't a valid file name: " + e.getMessage());
        }
        return candidates;
    }

    @Override
    public boolean exists(String path) {
        try {
            return Files.isRegularFile(Paths.get(path));
        } catch (InvalidPathException e) {
            return false;
        }
    }

    @Override
    public CompletableFuture<String> read(String path) {
        return CompletableFuture.supplyAsync(() -> IoUtils.readUtf8File(path), readExecutor);
    }

    private static void addWithSuffix(List<String> candidates, Path path) {
        String normalized = path.normalize().toString();
        if (!candidates.contains(normalized)) {
            candidates.add(normalized);
        }
        if (!normalized.endsWith(SUFFIX) && !candidates.contains(normalized + SUFFIX)) {
            candidates.add(normalized + SUFFIX);
        }
    }

    private static Path sourceDirectory(String sourceUri) {
        if (!sourceUri.startsWith("file:")) {
            return null;
        }
        return Paths.get(LspAdapter.toPath(sourceUri)).getParent();
    }
}
