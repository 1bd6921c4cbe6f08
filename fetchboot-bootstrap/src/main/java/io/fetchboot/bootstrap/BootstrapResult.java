package io.fetchboot.bootstrap;

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

import io.fetchboot.api.dataset.DatasetHandle;

/// What a bootstrap produces: the dataset and how to iterate it.
///
/// @param loader the derived iteration parameters
/// @param dataset the constructed or reused dataset
public record BootstrapResult(LoaderConfig loader, DatasetHandle dataset) {
}
