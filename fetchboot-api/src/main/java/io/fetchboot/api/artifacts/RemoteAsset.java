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

import java.util.List;
import java.util.Optional;

/// Identifies what is being fetched and from where. Created per resolution call.
///
/// @param requestedName the file name or path spec the caller asked for
/// @param resolvedUrl the concrete download URL, when one was determined
/// @param releaseTag the release tag the URL was built for, when resolved through a registry
/// @param candidateAssetNames the asset names known for the release, in registry order
public record RemoteAsset(
        String requestedName,
        Optional<String> resolvedUrl,
        Optional<String> releaseTag,
        List<String> candidateAssetNames
) {

    public RemoteAsset {
        candidateAssetNames = List.copyOf(candidateAssetNames);
    }

    /// @param requestedName the requested name
    /// @param url the direct URL the name was derived from
    /// @return an asset that is fetched straight from a URL
    public static RemoteAsset direct(String requestedName, String url) {
        return new RemoteAsset(requestedName, Optional.of(url), Optional.empty(), List.of());
    }

    /// @param requestedName the requested asset name
    /// @param tag the release tag
    /// @param candidates the asset names of the release
    /// @return an asset resolved against a release, without a download URL yet
    public static RemoteAsset released(String requestedName, String tag, List<String> candidates) {
        return new RemoteAsset(requestedName, Optional.empty(), Optional.of(tag), candidates);
    }

    /// @param url the download URL
    /// @return a copy of this asset with the given download URL
    public RemoteAsset withUrl(String url) {
        return new RemoteAsset(requestedName, Optional.of(url), releaseTag, candidateAssetNames);
    }

    /// @return true if the requested name is one of the release's assets
    public boolean isListed() {
        return candidateAssetNames.contains(requestedName);
    }
}
