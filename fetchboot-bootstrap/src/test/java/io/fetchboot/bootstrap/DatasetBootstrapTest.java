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
import io.fetchboot.api.dataset.CacheMode;
import io.fetchboot.api.dataset.DatasetHandle;
import io.fetchboot.api.dataset.DatasetRequest;
import io.fetchboot.bootstrap.barrier.GroupBarriers;
import io.fetchboot.bootstrap.barrier.LocalGroupBarrier;
import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DatasetBootstrapTest {

    private static final Path DATA = Path.of("datasets/coco128/images/train2017");
    private static final HostProfile EIGHT_CPUS = new HostProfile(8, 0);

    private static DatasetBootstrap solo(FakeDataset dataset, HostProfile host) {
        return new DatasetBootstrap(dataset, GroupBarriers.solo(), host, 8);
    }

    @Test
    public void testWorkerCountStaysWithinBounds() {
        for (int cpus = 1; cpus <= 16; cpus++) {
            for (int devices = 0; devices <= 4; devices++) {
                for (int batch = 0; batch <= 20; batch++) {
                    for (int ceiling = 0; ceiling <= 10; ceiling++) {
                        int workers = DatasetBootstrap.workerCount(cpus, devices, batch, ceiling);
                        assertThat(workers).isBetween(0, ceiling);
                        assertThat(workers).isLessThanOrEqualTo(batch);
                        assertThat(workers).isLessThanOrEqualTo(cpus / Math.max(devices, 1));
                        if (batch <= 1) {
                            assertThat(workers).isZero();
                        }
                    }
                }
            }
        }
        assertThat(DatasetBootstrap.workerCount(32, 4, 16, 8)).isEqualTo(8);
        assertThat(DatasetBootstrap.workerCount(32, 0, 16, 64)).isEqualTo(16);
        assertThat(DatasetBootstrap.workerCount(6, 4, 16, 8)).isEqualTo(1);
    }

    @Test
    public void testBatchSizeIsCappedByDatasetLength() throws IOException {
        BootstrapResult small = solo(new FakeDataset(5), EIGHT_CPUS)
            .bootstrap(DATA, 640, 16, -1, 32, 8, BootstrapOptions.defaults());
        assertThat(small.loader().batchSize()).isEqualTo(5);
        assertThat(small.loader().workerCount()).isEqualTo(5);

        BootstrapResult large = solo(new FakeDataset(1000), EIGHT_CPUS)
            .bootstrap(DATA, 640, 16, -1, 32, 8, BootstrapOptions.defaults());
        assertThat(large.loader().batchSize()).isEqualTo(16);
        assertThat(large.loader().workerCount()).isEqualTo(8);
    }

    @Test
    public void testSingleSampleBatchesUseNoWorkers() throws IOException {
        BootstrapResult result = solo(new FakeDataset(1000), EIGHT_CPUS)
            .bootstrap(DATA, 640, 1, -1, 32, 8, BootstrapOptions.defaults());
        assertThat(result.loader().workerCount()).isZero();
    }

    @Test
    public void testRectDisablesShuffleWithWarning() throws IOException {
        BootstrapOptions options = BootstrapOptions.builder().rect(true).shuffle(true).prefix("train: ").build();
        BootstrapResult result;
        try (CapturingAppender captured = CapturingAppender.attach(DatasetBootstrap.class, Level.WARN)) {
            result = solo(new FakeDataset(100), EIGHT_CPUS).bootstrap(DATA, 640, 16, -1, 32, 8, options);
            assertThat(captured.messages())
                .anySatisfy(m -> assertThat(m).contains("--rect is incompatible with DataLoader shuffle, setting shuffle=False"));
        }
        assertThat(result.loader().shuffle()).isFalse();
        assertThat(result.loader().samplerShuffle()).isFalse();
    }

    @Test
    public void testShuffleWithoutRectIsKept() throws IOException {
        BootstrapOptions options = BootstrapOptions.builder().shuffle(true).build();
        try (CapturingAppender captured = CapturingAppender.attach(DatasetBootstrap.class, Level.WARN)) {
            BootstrapResult result = solo(new FakeDataset(100), EIGHT_CPUS).bootstrap(DATA, 640, 16, -1, 32, 8, options);
            assertThat(result.loader().shuffle()).isTrue();
            assertThat(result.loader().samplerKind()).isEqualTo(SamplerKind.NONE);
            assertThat(captured.messages()).isEmpty();
        }
    }

    @Test
    public void testGroupRanksUseDistributedSamplerThatOwnsShuffling() throws IOException {
        BootstrapOptions options = BootstrapOptions.builder().shuffle(true).build();
        BootstrapResult result = solo(new FakeDataset(100), EIGHT_CPUS).bootstrap(DATA, 640, 16, 0, 32, 8, options);

        assertThat(result.loader().samplerKind()).isEqualTo(SamplerKind.DISTRIBUTED_SHUFFLED);
        assertThat(result.loader().shuffle()).isFalse();
        assertThat(result.loader().samplerShuffle()).isTrue();
    }

    @Test
    public void testQuadAndImageWeightsSelection() throws IOException {
        DatasetBootstrap bootstrap = solo(new FakeDataset(100), EIGHT_CPUS);

        LoaderConfig quad = bootstrap.bootstrap(DATA, 640, 16, -1, 32, 8,
            BootstrapOptions.builder().quad(true).build()).loader();
        assertThat(quad.batchAssembly()).isEqualTo(BatchAssembly.QUAD);
        assertThat(quad.loaderKind()).isEqualTo(LoaderKind.STANDARD);

        LoaderConfig weighted = bootstrap.bootstrap(DATA, 640, 16, -1, 32, 8,
            BootstrapOptions.builder().imageWeights(true).build()).loader();
        assertThat(weighted.batchAssembly()).isEqualTo(BatchAssembly.STANDARD);
        assertThat(weighted.loaderKind()).isEqualTo(LoaderKind.REWEIGHTABLE);

        try (CapturingAppender captured = CapturingAppender.attach(DatasetBootstrap.class, Level.WARN)) {
            LoaderConfig both = bootstrap.bootstrap(DATA, 640, 16, -1, 32, 8,
                BootstrapOptions.builder().quad(true).imageWeights(true).build()).loader();
            assertThat(both.batchAssembly()).isEqualTo(BatchAssembly.STANDARD);
            assertThat(both.loaderKind()).isEqualTo(LoaderKind.REWEIGHTABLE);
            assertThat(captured.messages()).anySatisfy(m -> assertThat(m).contains("--quad"));
        }
    }

    @Test
    public void testDevicesDivideTheWorkerBudget() throws IOException {
        BootstrapResult result = solo(new FakeDataset(1000), new HostProfile(16, 4))
            .bootstrap(DATA, 640, 64, 0, 32, 8, BootstrapOptions.defaults());
        assertThat(result.loader().workerCount()).isEqualTo(4);
        assertThat(result.loader().pinMemory()).isTrue();
    }

    @Test
    public void testOptionsReachTheDatasetCollaborator() throws IOException {
        FakeDataset dataset = new FakeDataset(100);
        BootstrapOptions options = BootstrapOptions.builder()
            .augment(true)
            .hyperparameters(Map.of("mosaic", 1.0, "fliplr", 0.5))
            .cache(CacheMode.DISK)
            .rect(true)
            .singleClass(true)
            .pad(0.5)
            .prefix("val: ")
            .ignoreCache(true)
            .build();

        solo(dataset, EIGHT_CPUS).bootstrap(DATA, 320, 32, -1, 64, 8, options);

        DatasetRequest request = dataset.requests.get(0);
        assertThat(request.path()).isEqualTo(DATA);
        assertThat(request.imageSize()).isEqualTo(320);
        assertThat(request.batchSize()).isEqualTo(32);
        assertThat(request.stride()).isEqualTo(64);
        assertThat(request.augment()).isTrue();
        assertThat(request.hyperparameters()).containsEntry("fliplr", 0.5);
        assertThat(request.cache()).isEqualTo(CacheMode.DISK);
        assertThat(request.rect()).isTrue();
        assertThat(request.singleClass()).isTrue();
        assertThat(request.pad()).isEqualTo(0.5);
        assertThat(request.prefix()).isEqualTo("val: ");
        assertThat(request.ignoreCache()).isTrue();
    }

    @Test
    public void testSeedDiffersPerRank() throws IOException {
        DatasetBootstrap bootstrap = solo(new FakeDataset(100), EIGHT_CPUS);
        BootstrapOptions options = BootstrapOptions.builder().seed(3).build();
        long none = bootstrap.bootstrap(DATA, 640, 16, -1, 32, 8, options).loader().generatorSeed();
        long leader = bootstrap.bootstrap(DATA, 640, 16, 0, 32, 8, options).loader().generatorSeed();
        assertThat(none).isEqualTo(DatasetBootstrap.SEED_BASE + 2);
        assertThat(leader).isEqualTo(none + 1);
    }

    @Test
    public void testTwoRanksBuildTheDatasetOnce() throws Exception {
        FakeDataset dataset = new FakeDataset(500, 200);
        LocalGroupBarrier group = new LocalGroupBarrier(2);
        DatasetBootstrap bootstrap = new DatasetBootstrap(dataset, group, EIGHT_CPUS, 8);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<BootstrapResult> rank0 = pool.submit(
                () -> bootstrap.bootstrap(DATA, 640, 16, 0, 32, 8, BootstrapOptions.defaults()));
            Future<BootstrapResult> rank1 = pool.submit(
                () -> bootstrap.bootstrap(DATA, 640, 16, 1, 32, 8, BootstrapOptions.defaults()));

            BootstrapResult leader = rank0.get(10, TimeUnit.SECONDS);
            BootstrapResult follower = rank1.get(10, TimeUnit.SECONDS);

            assertThat(dataset.builds.get()).isEqualTo(1);
            assertThat(dataset.reuses.get()).isEqualTo(1);
            assertThat(follower.dataset().identity()).isEqualTo(leader.dataset().identity());
            assertThat(follower.dataset().length()).isEqualTo(leader.dataset().length());
            assertThat(follower.loader().batchSize()).isEqualTo(leader.loader().batchSize());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void testCollaboratorFailureIsThrown() {
        FakeDataset dataset = new FakeDataset(10) {
            @Override
            public DatasetHandle build(DatasetRequest request) throws IOException {
                throw new IOException("no labels found in " + request.path());
            }
        };
        assertThatThrownBy(() -> solo(dataset, EIGHT_CPUS).bootstrap(DATA, 640, 16, -1, 32, 8, BootstrapOptions.defaults()))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("no labels found");
    }

    @Test
    public void testDefaultWorkerCeilingComesFromSettings() throws IOException {
        FetchbootSettings settings = FetchbootSettings.builder().workerCeiling(2).build();
        DatasetBootstrap bootstrap = new DatasetBootstrap(new FakeDataset(100), GroupBarriers.solo(), settings);
        BootstrapResult result = bootstrap.bootstrap(DATA, 640, 16, -1, 32, BootstrapOptions.defaults());
        assertThat(result.loader().workerCount()).isLessThanOrEqualTo(2);
    }

    @Test
    public void testRejectsInvalidArguments() {
        DatasetBootstrap bootstrap = solo(new FakeDataset(10), EIGHT_CPUS);
        List<Runnable> invalid = List.of(
            () -> call(bootstrap, 0, 16, -1, 32, 8),
            () -> call(bootstrap, 640, 0, -1, 32, 8),
            () -> call(bootstrap, 640, 16, -2, 32, 8),
            () -> call(bootstrap, 640, 16, -1, 0, 8),
            () -> call(bootstrap, 640, 16, -1, 32, -1));
        for (Runnable call : invalid) {
            assertThatThrownBy(call::run).isInstanceOf(IllegalArgumentException.class);
        }
    }

    private static void call(DatasetBootstrap bootstrap, int imageSize, int batchSize, int rank, int stride, int ceiling) {
        try {
            bootstrap.bootstrap(DATA, imageSize, batchSize, rank, stride, ceiling, BootstrapOptions.defaults());
        } catch (IOException e) {
            throw new AssertionError(e);
        }
    }
}
