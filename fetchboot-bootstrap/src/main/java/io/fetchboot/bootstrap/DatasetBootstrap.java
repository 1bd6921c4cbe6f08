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

import io.fetchboot.api.config.FetchbootSettings;
import io.fetchboot.api.dataset.DatasetFactory;
import io.fetchboot.api.dataset.DatasetHandle;
import io.fetchboot.api.dataset.DatasetRequest;
import io.fetchboot.bootstrap.barrier.DistributedBarrier;
import io.fetchboot.bootstrap.barrier.GroupBarrier;
import io.fetchboot.bootstrap.barrier.GuardedWork;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;

/// Constructs a dataset once per process group and derives how it should be iterated.
///
/// The dataset is built by rank 0 inside a {@link DistributedBarrier}, so an expensive
/// index or cache build happens once while the other ranks wait, and the other ranks then
/// reuse what rank 0 built. The loader parameters are derived from the dataset length and
/// the host's processors and accelerator devices:
///
/// - `batchSize = min(requested, dataset length)`
/// - `workerCount = min(cpus / max(devices, 1), batchSize > 1 ? batchSize : 0, ceiling)`
/// - a distributed shuffled sampler for every rank of a group, none for rank -1
/// - quad batch assembly only when asked for, and never with image weights
/// - the reweightable loader facade when image weights are used, the repeating one otherwise
///
/// Failures of the dataset collaborator are thrown to the caller.
public class DatasetBootstrap {
    private static final Logger logger = LogManager.getLogger(DatasetBootstrap.class);

    static final long SEED_BASE = 6148914691236517205L;

    private final DatasetFactory factory;
    private final DistributedBarrier barrier;
    private final HostProfile host;
    private final int defaultWorkerCeiling;

    /// Creates a bootstrap for the detected host, with the configured worker ceiling.
    /// @param factory the dataset collaborator
    /// @param group the barrier of this process's group
    /// @param settings the worker ceiling
    public DatasetBootstrap(DatasetFactory factory, GroupBarrier group, FetchbootSettings settings) {
        this(factory, group, HostProfile.detect(), settings.workerCeiling());
    }

    /// @param factory the dataset collaborator
    /// @param group the barrier of this process's group
    /// @param host the host's processor and device counts
    /// @param defaultWorkerCeiling the worker ceiling used when a call does not pass one
    public DatasetBootstrap(DatasetFactory factory, GroupBarrier group, HostProfile host, int defaultWorkerCeiling) {
        if (defaultWorkerCeiling < 0) {
            throw new IllegalArgumentException("worker ceiling must not be negative: " + defaultWorkerCeiling);
        }
        this.factory = factory;
        this.barrier = new DistributedBarrier(group);
        this.host = host;
        this.defaultWorkerCeiling = defaultWorkerCeiling;
    }

    /// Bootstraps with the default worker ceiling.
    /// @see #bootstrap(Path, int, int, int, int, int, BootstrapOptions)
    public BootstrapResult bootstrap(Path path, int imageSize, int batchSize, int rank, int stride, BootstrapOptions options)
            throws IOException
    {
        return bootstrap(path, imageSize, batchSize, rank, stride, defaultWorkerCeiling, options);
    }

    /// Constructs the dataset under the group barrier and derives its loader configuration.
    ///
    /// @param path the dataset location
    /// @param imageSize target image size in pixels
    /// @param batchSize the requested batch size
    /// @param rank this process's rank, -1 outside a group
    /// @param stride the model stride
    /// @param workerCeiling upper bound for loader workers
    /// @param options the optional settings
    /// @return the loader configuration and the dataset
    /// @throws IOException if the dataset collaborator fails
    /// @throws io.fetchboot.bootstrap.barrier.BarrierException if the group barrier cannot be passed
    public BootstrapResult bootstrap(
            Path path,
            int imageSize,
            int batchSize,
            int rank,
            int stride,
            int workerCeiling,
            BootstrapOptions options
    ) throws IOException
    {
        if (imageSize < 1 || batchSize < 1 || stride < 1) {
            throw new IllegalArgumentException(
                    "imageSize, batchSize and stride must be positive: " + imageSize + ", " + batchSize + ", " + stride);
        }
        if (workerCeiling < 0) {
            throw new IllegalArgumentException("worker ceiling must not be negative: " + workerCeiling);
        }
        if (rank < DistributedBarrier.NO_GROUP) {
            throw new IllegalArgumentException("rank must be -1 or greater: " + rank);
        }

        boolean shuffle = options.shuffle();
        if (options.rect() && shuffle) {
            logger.warn("{}WARNING: --rect is incompatible with DataLoader shuffle, setting shuffle=False", options.prefix());
            shuffle = false;
        }
        BatchAssembly assembly = options.quad() ? BatchAssembly.QUAD : BatchAssembly.STANDARD;
        if (options.quad() && options.imageWeights()) {
            logger.warn("{}WARNING: --quad is incompatible with image weights, using standard batch assembly", options.prefix());
            assembly = BatchAssembly.STANDARD;
        }

        DatasetRequest request = new DatasetRequest(
                path,
                imageSize,
                batchSize,
                stride,
                options.augment(),
                options.hyperparameters(),
                options.rect(),
                options.cache(),
                options.singleClass(),
                options.pad(),
                options.imageWeights(),
                options.prefix(),
                options.ignoreCache());

        DatasetHandle dataset = barrier.withBarrier(rank, new GuardedWork<>() {
            @Override
            public DatasetHandle perform() throws IOException {
                return factory.build(request);
            }

            @Override
            public DatasetHandle reuse() throws IOException {
                return factory.reuse(request);
            }
        });

        int effectiveBatchSize = Math.min(batchSize, dataset.length());
        if (effectiveBatchSize == 0) {
            logger.warn("{}Dataset {} is empty", options.prefix(), path);
        }
        int workers = workerCount(host.cpuCount(), host.deviceCount(), effectiveBatchSize, workerCeiling);
        SamplerKind sampler = rank == DistributedBarrier.NO_GROUP ? SamplerKind.NONE : SamplerKind.DISTRIBUTED_SHUFFLED;
        LoaderKind loaderKind = options.imageWeights() ? LoaderKind.REWEIGHTABLE : LoaderKind.STANDARD;

        LoaderConfig loader = new LoaderConfig(
                effectiveBatchSize,
                workers,
                shuffle && sampler == SamplerKind.NONE,
                sampler,
                sampler != SamplerKind.NONE && shuffle,
                assembly,
                loaderKind,
                true,
                SEED_BASE + options.seed() + rank);
        logger.debug("{}Rank {} loader for {} ({} samples): {}", options.prefix(), rank, path, dataset.length(), loader);
        return new BootstrapResult(loader, dataset);
    }

    /// @param cpuCount available processors
    /// @param deviceCount visible accelerator devices, 0 if none
    /// @param batchSize the effective batch size
    /// @param workerCeiling upper bound for workers
    /// @return `min(cpuCount / max(deviceCount, 1), batchSize > 1 ? batchSize : 0, workerCeiling)`,
    ///     never negative
    public static int workerCount(int cpuCount, int deviceCount, int batchSize, int workerCeiling) {
        int perDevice = cpuCount / Math.max(deviceCount, 1);
        int byBatch = batchSize > 1 ? batchSize : 0;
        return Math.max(0, Math.min(perDevice, Math.min(byBatch, workerCeiling)));
    }
}
