/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.project;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Access to the files {@code @include} directives refer to.
 */
public interface IncludeFiles {
    /**
     * @param sourceUri URI of the file containing the directive
     * @param rawPath The file name as written in the directive
     * @param relative Whether {@code rawPath} is relative
     * @param searchPath Directories to search relative names in
     * @return Paths the directive may refer to, most preferred first
     */
    List<String> candidates(String sourceUri, String rawPath, boolean relative, List<String> searchPath);

    /**
     * @param path A path returned by {@link #candidates}
     * @return Whether there is a file at {@code path}
     */
    boolean exists(String path);

    /**
     * @param path Path of an existing file
     * @return A future completing with the file's text, or exceptionally if
     *  it could not be read
     */
    CompletableFuture<String> read(String path);
}
