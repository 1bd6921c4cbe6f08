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

import java.net.URI;
import java.nio.file.Path;
import java.util.Objects;

/// Describes one transfer from a remote source into a local file.
///
/// @param source the remote location to read from
/// @param destination the local file to write
/// @param quiet suppress per-attempt status output of the transport
/// @param progress report transfer progress while bytes are flowing
public record TransferRequest(URI source, Path destination, boolean quiet, boolean progress) {

    public TransferRequest {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(destination, "destination");
    }

    /// Creates a request with progress reporting disabled and normal output.
    /// @param source the remote location
    /// @param destination the local file
    /// @return a new request
    public static TransferRequest of(URI source, Path destination) {
        return new TransferRequest(source, destination, false, false);
    }

    /// @param enabled whether progress should be reported
    /// @return a copy of this request with the given progress setting
    public TransferRequest withProgress(boolean enabled) {
        return new TransferRequest(source, destination, quiet, enabled);
    }

    /// @param enabled whether per-attempt output should be suppressed
    /// @return a copy of this request with the given quiet setting
    public TransferRequest withQuiet(boolean enabled) {
        return new TransferRequest(source, destination, enabled, progress);
    }
}
