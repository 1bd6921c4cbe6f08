package io.fetchboot.api.transport;

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

import java.io.Closeable;
import java.io.IOException;

/// A single-file transfer capability: copies the content behind a URL into a local file.
///
/// Implementations are synchronous. A transfer either completes, fails with an
/// {@link IOException}, or blocks until the underlying client times out. Whether a
/// failed transfer leaves bytes behind at the destination is implementation specific;
/// callers that need a clean destination must remove it themselves.
public interface Transport extends Closeable {

    /// Transfers the request's source into its destination.
    ///
    /// @param request the source and destination of the transfer
    /// @return the number of bytes present at the destination and the attempts it took
    /// @throws IOException if the content could not be transferred
    TransferResult transfer(TransferRequest request) throws IOException;

    /// @return the kind name this transport was registered under
    String kind();

    @Override
    default void close() throws IOException {
    }
}
