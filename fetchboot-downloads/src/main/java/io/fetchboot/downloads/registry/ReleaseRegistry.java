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

import java.io.IOException;

/// A remote registry of versioned releases and their attached assets.
public interface ReleaseRegistry {

    /// The tag name that selects the most recent release
    String LATEST = "latest";

    /// Looks up one release of a repository.
    ///
    /// @param repository the repository, as `owner/name`
    /// @param tag the release tag, or {@link #LATEST}
    /// @return the release tag and its asset names
    /// @throws IOException if the registry cannot be reached, answers with an error, or
    ///     returns something that is not a release description
    ReleaseInfo lookup(String repository, String tag) throws IOException;
}
