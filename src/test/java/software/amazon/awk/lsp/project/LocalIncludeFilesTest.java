/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.project;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class LocalIncludeFilesTest {
    private final LocalIncludeFiles files = new LocalIncludeFiles(Runnable::run);

    @Test
    public void relativeNamesTrySourceDirectoryThenSearchPath() {
        List<String> candidates = files.candidates(
                "file:///work/main.awk", "lib", true, List.of("/usr/share/awk", "inc"));

        assertThat(candidates, contains(
                "/work/lib",
                "/work/lib.awk",
                "/usr/share/awk/lib",
                "/usr/share/awk/lib.awk",
                "/work/inc/lib",
                "/work/inc/lib.awk"));
    }

    @Test
    public void candidatesAreNotRepeated() {
        List<String> candidates = files.candidates("file:///work/main.awk", "lib.awk", true, List.of("."));

        assertThat(candidates, contains("/work/lib.awk"));
    }

    @Test
    public void absoluteNamesIgnoreSearchPath() {
        List<String> candidates = files.candidates(
                "file:///work/main.awk", "/abs/x.awk", false, List.of("/usr/share/awk"));

        assertThat(candidates, contains("/abs/x.awk"));
    }

    @Test
    public void untitledDocumentsOnlyUseSearchPath() {
        List<String> candidates = files.candidates("untitled:Untitled-1", "lib.awk", true, List.of("/usr/share/awk"));

        assertThat(candidates, contains("/usr/share/awk/lib.awk"));
    }

    @Test
    public void invalidFileNamesHaveNoCandidates() {
        assertThat(files.candidates("file:///work/main.awk", "a\0b", true, List.of("/usr/share/awk")), empty());
        assertThat(files.candidates("file:///work/main.awk", "/a\0b", false, List.of()), empty());
        assertThat(files.exists("/work/a\0b.awk"), is(false));
    }

    @Test
    public void readsExistingFiles(@TempDir Path dir) throws Exception {
        Path lib = dir.resolve("lib.awk");
        Files.write(lib, "function f() { }\n".getBytes(StandardCharsets.UTF_8));

        assertThat(files.exists(lib.toString()), is(true));
        assertThat(files.exists(dir.toString()), is(false));
        assertThat(files.read(lib.toString()).get(), equalTo("function f() { }\n"));
    }

    @Test
    public void failedReadsCompleteExceptionally(@TempDir Path dir) {
        CompletableFuture<String> read = files.read(dir.resolve("missing.awk").toString());

        assertThat(read.isCompletedExceptionally(), is(true));
    }
}
