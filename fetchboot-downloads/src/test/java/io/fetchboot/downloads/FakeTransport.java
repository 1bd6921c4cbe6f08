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

import io.fetchboot.api.transport.TransferRequest;
import io.fetchboot.api.transport.TransferResult;
import io.fetchboot.api.transport.Transport;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// A transport that writes a fixed number of bytes, optionally failing afterwards.
class FakeTransport implements Transport {
    private final String kind;
    private final int bytesToWrite;
    private final IOException failure;
    final List<URI> requested = new ArrayList<>();

    private FakeTransport(String kind, int bytesToWrite, IOException failure) {
        this.kind = kind;
        this.bytesToWrite = bytesToWrite;
        this.failure = failure;
    }

    static FakeTransport writing(String kind, int bytes) {
        return new FakeTransport(kind, bytes, null);
    }

    static FakeTransport failingAfter(String kind, int bytes, String message) {
        return new FakeTransport(kind, bytes, new IOException(message));
    }

    @Override
    public TransferResult transfer(TransferRequest request) throws IOException {
        requested.add(request.source());
        if (bytesToWrite > 0) {
            byte[] content = new byte[bytesToWrite];
            Arrays.fill(content, (byte) 7);
            Files.write(request.destination(), content);
        }
        if (failure != null) {
            throw failure;
        }
        return new TransferResult(request.destination(), bytesToWrite, 1);
    }

    @Override
    public String kind() {
        return kind;
    }

    int calls() {
        return requested.size();
    }

    /// A transport failing with an unchecked exception.
    static class Throwing implements Transport {
        @Override
        public TransferResult transfer(TransferRequest request) {
            throw new IllegalStateException("unexpected transport state");
        }

        @Override
        public String kind() {
            return "throwing";
        }
    }
}
