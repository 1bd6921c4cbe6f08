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

/// Iteration parameters derived for one dataset on one host.
///
/// @param batchSize samples per batch, never more than the dataset length
/// @param workerCount loader worker threads
/// @param shuffle whether the loader itself shuffles; always false under a sampler
/// @param samplerKind how samples are sharded across ranks
/// @param samplerShuffle whether the sampler shuffles its shard
/// @param batchAssembly how the iteration layer collates batches
/// @param loaderKind which loader facade to build
/// @param pinMemory whether batches are copied to page-locked memory
/// @param generatorSeed seed for the loader's random generator, distinct per rank
public record LoaderConfig(
    int batchSize,
    int workerCount,
    boolean shuffle,
    SamplerKind samplerKind,
    boolean samplerShuffle,
    BatchAssembly batchAssembly,
    LoaderKind loaderKind,
    boolean pinMemory,
    long generatorSeed
) {
}
