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

/// How an artifact resolution ended.
public enum ResolutionStatus {
    /// The file spec named a file that already exists locally; nothing was fetched
    LOCAL,
    /// The artifact was fetched and validated
    DOWNLOADED,
    /// The artifact is known to the source but could not be fetched
    UNRESOLVED,
    /// The name is not a local file, a URL, or an asset of the release
    NOT_FOUND
}
