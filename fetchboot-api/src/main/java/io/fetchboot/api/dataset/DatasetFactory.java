package io.fetchboot.api.dataset;

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

/// The external dataset collaborator.
///
/// {@link #build(DatasetRequest)} may do expensive process-wide work, such as scanning
/// labels and writing a derived index or cache next to the data. In a process group it is
/// only called by the leader. Followers call {@link #reuse(DatasetRequest)} after the
/// leader finished, and are expected to pick up what the leader wrote.
public interface DatasetFactory {

    /// Constructs the dataset, building any derived index or cache it needs.
    ///
    /// @param request the dataset parameters
    /// @return the dataset
    /// @throws IOException if the dataset cannot be read
    DatasetHandle build(DatasetRequest request) throws IOException;

    /// Constructs the dataset from the index or cache a previous {@link #build} produced.
    /// The default implementation calls {@link #build}, which is correct for datasets that
    /// validate and reuse their cache on their own.
    ///
    /// @param request the dataset parameters
    /// @return the dataset
    /// @throws IOException if the dataset cannot be read
    default DatasetHandle reuse(DatasetRequest request) throws IOException {
        return build(request);
    }
}
