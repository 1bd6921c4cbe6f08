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

/// Opaque reference to an externally constructed dataset.
///
/// The bootstrap only inspects a dataset's identity, to tell whether two processes see
/// the same derived index, and its length, to bound the batch size.
public interface DatasetHandle {

    /// @return a stable identity of the dataset content, equal across processes that
    ///     loaded the same index
    String identity();

    /// @return the number of samples in the dataset
    int length();
}
