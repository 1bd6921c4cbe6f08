package io.fetchboot.transport;

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

import io.fetchboot.api.config.FetchbootSettings;
import io.fetchboot.api.transport.TransferException;
import io.fetchboot.api.transport.TransferRequest;
import io.fetchboot.api.transport.TransferResult;
import io.fetchboot.api.transport.Transport;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;

/// Fallback transport: GET with resume and a fixed retry budget.
///
/// Each attempt asks for the bytes after whatever is already at the destination with a
/// `Range: bytes=<n>-` header. A 206 answer is appended, a 200 answer restarts the file,
/// and a 416 answer for a non-empty destination means the file is already complete.
/// Connection failures, timeouts, 408, 429 and 5xx answers are retried after a fixed
/// pause until the attempt budget is spent. Other client errors end the transfer at once.
public class ResumableHttpTransport implements Transport {
    private static final Logger logger = LogManager.getLogger(ResumableHttpTransport.class);

    /// Kind name this transport is registered under
    public static final String KIND = "resumable";

    private static final int BUFFER_SIZE = 8192 * 2;

    private final OkHttpClient client;
    private final int maxAttempts;
    private final Duration backoff;

    /// @param settings timeouts, attempt budget and pause between attempts
    public ResumableHttpTransport(FetchbootSettings settings) {
        this(HttpClients.create(settings), settings.retries(), settings.retryBackoff());
    }

    /// @param client the HTTP client to use
    /// @param maxAttempts how many attempts to make before giving up, at least 1
    /// @param backoff pause between attempts
    public ResumableHttpTransport(OkHttpClient client, int maxAttempts, Duration backoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        this.client = client;
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
    }

    @Override
    public TransferResult transfer(TransferRequest transfer) throws IOException {
        Level attemptLevel = transfer.quiet() ? Level.DEBUG : Level.WARN;
        IOException lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                long size = attemptTransfer(transfer);
                return new TransferResult(transfer.destination(), size, attempt);
            } catch (NonRetryableException e) {
                throw new TransferException(e.getMessage(), attempt, e);
            } catch (IOException e) {
                lastFailure = e;
                logger.log(attemptLevel, "Attempt {}/{} for {} failed: {}",
                        attempt, maxAttempts, transfer.source(), e.getMessage());
            }
            if (attempt < maxAttempts) {
                pause();
            }
        }
        throw new TransferException(
                "Giving up on " + transfer.source() + " after " + maxAttempts + " attempts", maxAttempts, lastFailure);
    }

    private long attemptTransfer(TransferRequest transfer) throws IOException {
        Path destination = transfer.destination();
        long existing = Files.exists(destination) ? Files.size(destination) : 0L;

        Request.Builder builder = new Request.Builder().url(transfer.source().toString()).get();
        if (existing > 0) {
            builder.header("Range", "bytes=" + existing + "-");
        }

        try (Response response = client.newCall(builder.build()).execute()) {
            int code = response.code();
            if (code == 416 && existing > 0) {
                logger.debug("{} is already complete at {} bytes", destination, existing);
                return existing;
            }

            boolean append;
            long total;
            if (code == 206) {
                long start = contentRangeStart(response.header("Content-Range"));
                if (start != existing) {
                    Files.deleteIfExists(destination);
                    throw new IOException("Server resumed at " + start + " instead of " + existing + ", restarting");
                }
                append = true;
                total = contentRangeTotal(response.header("Content-Range"));
            } else if (code == 200) {
                append = false;
                existing = 0;
                total = parseLong(response.header("Content-Length"));
            } else if (code == 408 || code == 429 || code >= 500) {
                throw new IOException("HTTP " + code + " from " + transfer.source());
            } else {
                throw new NonRetryableException("HTTP " + code + " from " + transfer.source());
            }

            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("No response body for " + transfer.source());
            }
            if (existing > 0) {
                logger.debug("Resuming {} at byte {}", destination, existing);
            }

            ProgressLogger progress = new ProgressLogger(
                    logger, destination.getFileName().toString(), total, existing, transfer.progress());
            long written = existing;
            byte[] buffer = new byte[BUFFER_SIZE];
            StandardOpenOption mode = append ? StandardOpenOption.APPEND : StandardOpenOption.TRUNCATE_EXISTING;
            try (InputStream in = body.byteStream();
                     OutputStream out = Files.newOutputStream(destination, StandardOpenOption.CREATE, StandardOpenOption.WRITE, mode))
            {
                int read;
                while ((read = in.read(buffer)) != -1) {
                    out.write(buffer, 0, read);
                    written += read;
                    progress.update(written);
                }
            }
            if (total > 0 && written != total) {
                throw new IOException("Transfer of " + transfer.source() + " ended at " + written + " of " + total + " bytes");
            }
            return written;
        }
    }

    private void pause() throws InterruptedIOException {
        if (backoff.isZero()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting to retry");
        }
    }

    /// Parses the first byte position of a `bytes start-end/total` header.
    static long contentRangeStart(String contentRange) throws IOException {
        if (contentRange == null || !contentRange.startsWith("bytes ")) {
            throw new IOException("Invalid Content-Range header: " + contentRange);
        }
        String range = contentRange.substring("bytes ".length());
        int dash = range.indexOf('-');
        if (dash <= 0) {
            throw new IOException("Invalid Content-Range header: " + contentRange);
        }
        try {
            return Long.parseLong(range.substring(0, dash).trim());
        } catch (NumberFormatException e) {
            throw new IOException("Invalid Content-Range header: " + contentRange, e);
        }
    }

    /// Parses the total size of a `bytes start-end/total` header, -1 if it is `*` or absent.
    static long contentRangeTotal(String contentRange) {
        if (contentRange == null) {
            return -1;
        }
        int slash = contentRange.lastIndexOf('/');
        return slash < 0 ? -1 : parseLong(contentRange.substring(slash + 1));
    }

    private static long parseLong(String value) {
        if (value == null) {
            return -1;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public void close() {
        HttpClients.shutdown(client);
    }

    private static class NonRetryableException extends IOException {
        NonRetryableException(String message) {
            super(message);
        }
    }
}
