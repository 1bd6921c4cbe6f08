package io.fetchboot.api.artifacts;

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

/// One attempt of the download engine to materialize a file through a transport.
///
/// @param transport kind name of the transport that was used
/// @param url the URL that was requested
/// @param bytesOnDisk size of the destination after the attempt, -1 if it did not exist
/// @param valid whether the destination passed size validation after the attempt
/// @param error the failure message of the attempt, null when the transport reported success
public record TransferAttempt(String transport, String url, long bytesOnDisk, boolean valid, String error) {
}
