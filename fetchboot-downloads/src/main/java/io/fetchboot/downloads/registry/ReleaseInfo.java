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

import java.util.List;
import java.util.Objects;

/// A release as the registry describes it.
///
/// @param tag the release tag, such as `v7.0`
/// @param assetNames the names of the files attached to the release
public record ReleaseInfo(String tag, List<String> assetNames) {

    public ReleaseInfo {
        Objects.requireNonNull(tag, "tag");
        assetNames = List.copyOf(assetNames);
    }
}
