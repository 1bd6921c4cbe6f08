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
import io.fetchboot.api.transport.TransferRequest;
import io.fetchboot.api.transport.TransferResult;
import io.fetchboot.api.transport.Transport;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/// Primary transport: one plain GET request streamed into the destination.
///
/// Any existing destination is overwritten. On failure the bytes received so far stay at
/// the destination; the download engine decides what to do with them.
public class NativeHttpTransport implements Transport {
    private static final Logger logger = LogManager.getLogger(NativeHttpTransport.class);

    /// Kind name this transport is registered under
    public static final String KIND = "native";

    private static final int BUFFER_SIZE = 8192 * 2;

    private final OkHttpClient client;

    /// @param settings timeouts for the HTTP client
    public NativeHttpTransport(FetchbootSettings settings) {
        this(HttpClients.create(settings));
    }

    /// @param client the HTTP client to use
    public NativeHttpTransport(OkHttpClient client) {
        this.client = client;
    }

    @Override
    public TransferResult transfer(TransferRequest transfer) throws IOException {
        Path destination = transfer.destination();
        Request request = new Request.Builder().url(transfer.source().toString()).get().build();

        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("HTTP " + response.code() + " error downloading " + transfer.source());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("No response body for " + transfer.source());
            }
            ProgressLogger progress = new ProgressLogger(
                    logger, destination.getFileName().toString(), body.contentLength(), 0, transfer.progress());

            long written = 0;
            byte[] buffer = new byte[BUFFER_SIZE];
            try (InputStream in = body.byteStream();
                     OutputStream out = Files.newOutputStream(
                             destination, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                             StandardOpenOption.WRITE))
            {
                int read;
                while ((read = in.read(buffer)) != -1) {
                    out.write(buffer, 0, read);
                    written += read;
                    progress.update(written);
                }
            }
            logger.debug("Transferred {} bytes from {} to {}", written, transfer.source(), destination);
            return new TransferResult(destination, written, 1);
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
}
