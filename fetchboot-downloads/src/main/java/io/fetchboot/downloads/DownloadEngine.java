package io.fetchboot.downloads;

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

import io.fetchboot.api.artifacts.DownloadOutcome;
import io.fetchboot.api.artifacts.TransferAttempt;
import io.fetchboot.api.config.FetchbootSettings;
import io.fetchboot.api.transport.TransferRequest;
import io.fetchboot.api.transport.Transport;
import io.fetchboot.api.transport.TransportIO;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/// Fetches one remote file to a local path with a fallback transport and a minimum size
/// check.
///
/// The primary transport is tried first. If it throws, even after writing part of the
/// file, or leaves a file that is not larger than the minimum size, the partial file is deleted and the fallback transport is tried,
/// against the alternate URL when one is given. If the file is still not valid after that,
/// it is deleted and a failed {@link DownloadOutcome} is returned. Transfer failures are
/// never thrown, and no exit path leaves a partial file at the destination.
///
/// Progress is reported only when this class logs at debug level.
public class DownloadEngine implements Closeable {
    private static final Logger logger = LogManager.getLogger(DownloadEngine.class);

    private final Transport primary;
    private final Transport fallback;

    /// Creates an engine with the primary and fallback transports named in the settings.
    /// @param settings transport kinds and their configuration
    public DownloadEngine(FetchbootSettings settings) {
        this(TransportIO.create(settings.primaryTransport(), settings),
                TransportIO.create(settings.fallbackTransport(), settings));
    }

    /// @param primary transport tried first
    /// @param fallback transport tried when the primary fails validation
    public DownloadEngine(Transport primary, Transport fallback) {
        this.primary = primary;
        this.fallback = fallback;
    }

    /// Fetches without an alternate URL or error hint.
    /// @see #fetch(String, Path, long, String, String)
    public DownloadOutcome fetch(String url, Path destination, long minBytes) {
        return fetch(url, destination, minBytes, null, "");
    }

    /// Fetches a file, validating that it ends up strictly larger than `minBytes`.
    ///
    /// @param url where to fetch the file from
    /// @param destination the local file to write
    /// @param minBytes the file must be larger than this many bytes to be valid
    /// @param alternateUrl URL for the fallback attempt, or null to retry `url`
    /// @param errorHint appended to the error log when every attempt failed, may be null
    /// @return the outcome, never null
    /// @throws IllegalArgumentException if the url is blank or minBytes is negative
    public DownloadOutcome fetch(String url, Path destination, long minBytes, String alternateUrl, String errorHint) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        if (destination == null) {
            throw new IllegalArgumentException("destination must not be null");
        }
        if (minBytes < 0) {
            throw new IllegalArgumentException("minBytes must not be negative: " + minBytes);
        }

        String errorMessage = "Valid '" + destination + "' not found, missing or smaller than " + minBytes + " bytes";
        List<TransferAttempt> attempts = new ArrayList<>();
        boolean valid = false;
        try {
            logger.info("Downloading {} to {}...", url, destination);
            TransferAttempt first = attempt(primary, url, destination, minBytes);
            attempts.add(first);

            if (!first.valid()) {
                deletePartial(destination);
                String retryUrl = alternateUrl != null && !alternateUrl.isBlank() ? alternateUrl : url;
                logger.warn("ERROR: {}", first.error() != null ? first.error() : errorMessage);
                logger.info("Re-attempting {} to {}...", retryUrl, destination);
                attempts.add(attempt(fallback, retryUrl, destination, minBytes));
            }

            valid = attempts.get(attempts.size() - 1).valid() && isValid(destination, minBytes);
            if (valid) {
                return DownloadOutcome.succeeded(destination, sizeOf(destination), attempts);
            }
            String hint = errorHint == null ? "" : errorHint;
            logger.error("ERROR: {}{}{}", errorMessage, hint.isEmpty() ? "" : "\n", hint);
            return DownloadOutcome.failed(destination, lastError(attempts, errorMessage), attempts);
        } finally {
            if (!valid) {
                deletePartial(destination);
            }
        }
    }

    private TransferAttempt attempt(Transport transport, String url, Path destination, long minBytes) {
        if (Files.isDirectory(destination)) {
            return new TransferAttempt(transport.kind(), url, 0L, false,
                    "Destination " + destination + " is a directory");
        }
        String error = null;
        try {
            Path parent = destination.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            TransferRequest request = TransferRequest.of(URI.create(url), destination)
                    .withProgress(logger.isDebugEnabled())
                    .withQuiet(!logger.isInfoEnabled());
            transport.transfer(request);
        } catch (IOException | RuntimeException e) {
            error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            logger.debug("{} transfer of {} failed", transport.kind(), url, e);
        }
        long size = sizeOf(destination);
        // a transfer that failed part way is truncated, whatever its size
        boolean valid = error == null && isValid(destination, minBytes);
        if (error == null && !valid) {
            error = "Downloaded file " + destination + " is " + size + " bytes, expected more than " + minBytes;
        }
        return new TransferAttempt(transport.kind(), url, size, valid, error);
    }

    private static boolean isValid(Path destination, long minBytes) {
        return Files.isRegularFile(destination) && sizeOf(destination) > minBytes;
    }

    private static long sizeOf(Path destination) {
        try {
            return Files.exists(destination) ? Files.size(destination) : 0L;
        } catch (IOException e) {
            logger.warn("Unable to read size of {}: {}", destination, e.getMessage());
            return 0L;
        }
    }

    private static void deletePartial(Path destination) {
        try {
            if (Files.isRegularFile(destination, LinkOption.NOFOLLOW_LINKS)) {
                Files.delete(destination);
                logger.debug("Deleted partial file {}", destination);
            }
        } catch (IOException e) {
            logger.warn("Unable to delete partial file {}: {}", destination, e.getMessage());
        }
    }

    private static String lastError(List<TransferAttempt> attempts, String fallbackMessage) {
        for (int i = attempts.size() - 1; i >= 0; i--) {
            String error = attempts.get(i).error();
            if (error != null) {
                return error;
            }
        }
        return fallbackMessage;
    }

    @Override
    public void close() throws IOException {
        try {
            primary.close();
        } finally {
            fallback.close();
        }
    }
}
