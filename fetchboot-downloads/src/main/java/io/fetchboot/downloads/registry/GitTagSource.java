package io.fetchboot.downloads.registry;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/// Reads the last tag of the git checkout in a working directory by running `git tag`.
public class GitTagSource implements TagSource {
    private static final Logger logger = LogManager.getLogger(GitTagSource.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final Path workingDirectory;
    private final List<String> command;
    private final Duration timeout;

    /// @param workingDirectory the directory to run git in
    public GitTagSource(Path workingDirectory) {
        this(workingDirectory, List.of("git", "tag"), DEFAULT_TIMEOUT);
    }

    GitTagSource(Path workingDirectory, List<String> command, Duration timeout) {
        this.workingDirectory = workingDirectory;
        this.command = List.copyOf(command);
        this.timeout = timeout;
    }

    /// Runs the tag listing and returns its last tag.
    ///
    /// Output goes to a temporary file that is read after the process exits, so a hanging
    /// process is bounded by the timeout rather than by a blocked read.
    ///
    /// @throws IOException if the process cannot start, fails, or does not finish in time
    @Override
    public Optional<String> lastTag() throws IOException {
        Path output = Files.createTempFile("fetchboot-git-tag", ".out");
        try {
            Process process = new ProcessBuilder(command)
                    .directory(workingDirectory.toAbsolutePath().toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile())
                    .start();
            try {
                if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    process.destroyForcibly();
                    throw new IOException(String.join(" ", command) + " did not finish within " + timeout);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
                throw new IOException("Interrupted while waiting for " + String.join(" ", command), e);
            }
            String text = Files.readString(output, StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                throw new IOException(String.join(" ", command) + " exited with " + process.exitValue() + ": " + text.trim());
            }
            return lastToken(text);
        } finally {
            Files.deleteIfExists(output);
        }
    }

    static Optional<String> lastToken(String output) {
        String[] tokens = output.trim().split("\\s+");
        String last = tokens[tokens.length - 1];
        if (last.isEmpty()) {
            logger.debug("git tag listed no tags");
            return Optional.empty();
        }
        return Optional.of(last);
    }
}
