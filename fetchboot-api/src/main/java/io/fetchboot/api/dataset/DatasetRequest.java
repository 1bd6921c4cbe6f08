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

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/// Everything the dataset collaborator needs to construct a dataset.
///
/// @param path the dataset location, a directory, list file or glob understood by the dataset
/// @param imageSize target image size in pixels
/// @param batchSize the requested batch size, used by rectangular batching
/// @param stride model stride the image shapes must be a multiple of
/// @param augment apply training augmentation
/// @param hyperparameters augmentation hyperparameters, may be empty
/// @param rect use rectangular batches
/// @param cache where decoded samples are cached
/// @param singleClass treat every label as one class
/// @param pad padding fraction applied to rectangular shapes
/// @param imageWeights sample images weighted by their labels
/// @param prefix prefix for the dataset's log lines
/// @param ignoreCache rebuild the label index even when a valid cache file exists
public record DatasetRequest(
        Path path,
        int imageSize,
        int batchSize,
        int stride,
        boolean augment,
        Map<String, Double> hyperparameters,
        boolean rect,
        CacheMode cache,
        boolean singleClass,
        double pad,
        boolean imageWeights,
        String prefix,
        boolean ignoreCache
) {

    public DatasetRequest {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(cache, "cache");
        hyperparameters = hyperparameters == null ? Map.of() : Map.copyOf(hyperparameters);
        prefix = prefix == null ? "" : prefix;
    }
}
