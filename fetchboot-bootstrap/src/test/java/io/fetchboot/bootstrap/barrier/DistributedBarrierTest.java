package io.fetchboot.bootstrap.barrier;

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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DistributedBarrierTest {

    /// Guarded work that records whether any reuse saw the work unfinished.
    private static class IndexBuild implements GuardedWork<String> {
        final AtomicInteger performed = new AtomicInteger();
        final AtomicBoolean complete = new AtomicBoolean();
        final AtomicInteger prematureReuses = new AtomicInteger();

        @Override
        public String perform() throws IOException {
            performed.incrementAndGet();
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException(e);
            }
            complete.set(true);
            return "index";
        }

        @Override
        public String reuse() {
            if (!complete.get()) {
                prematureReuses.incrementAndGet();
            }
            return "index";
        }
    }

    private static List<Future<String>> runRanks(
        ExecutorService pool, DistributedBarrier barrier, int worldSize, GuardedWork<String> work)
    {
        List<Future<String>> results = new ArrayList<>();
        // followers first, so they are already waiting when the leader arrives
        for (int rank = worldSize - 1; rank >= 0; rank--) {
            int r = rank;
            results.add(0, pool.submit(() -> barrier.withBarrier(r, work)));
        }
        return results;
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 5, 8})
    public void testWorkRunsOnceBeforeAnyFollowerProceeds(int worldSize) throws Exception {
        DistributedBarrier barrier = new DistributedBarrier(new LocalGroupBarrier(worldSize));
        IndexBuild work = new IndexBuild();
        ExecutorService pool = Executors.newFixedThreadPool(worldSize);
        try {
            for (Future<String> result : runRanks(pool, barrier, worldSize, work)) {
                assertThat(result.get(10, TimeUnit.SECONDS)).isEqualTo("index");
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(work.performed.get()).isEqualTo(1);
        assertThat(work.prematureReuses.get()).isZero();
    }

    @Test
    public void testRepeatedCallsRunOncePerCall() throws Exception {
        DistributedBarrier barrier = new DistributedBarrier(new LocalGroupBarrier(3));
        IndexBuild work = new IndexBuild();
        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            for (int round = 0; round < 3; round++) {
                for (Future<String> result : runRanks(pool, barrier, 3, work)) {
                    result.get(10, TimeUnit.SECONDS);
                }
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(work.performed.get()).isEqualTo(3);
    }

    @Test
    public void testNoGroupPerformsImmediately() throws IOException {
        LocalGroupBarrier group = new LocalGroupBarrier(4, Duration.ofMillis(50));
        IndexBuild work = new IndexBuild();
        assertThat(new DistributedBarrier(group).withBarrier(-1, work)).isEqualTo("index");
        assertThat(work.performed.get()).isEqualTo(1);
    }

    @Test
    public void testLeaderFailureAbortsFollowers() throws Exception {
        DistributedBarrier barrier = new DistributedBarrier(new LocalGroupBarrier(3));
        GuardedWork<String> failing = () -> {
            throw new IOException("cache build failed");
        };
        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            List<Future<String>> results = runRanks(pool, barrier, 3, failing);

            assertThatThrownBy(() -> results.get(0).get(10, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IOException.class)
                .hasRootCauseMessage("cache build failed");
            for (Future<String> follower : results.subList(1, 3)) {
                assertThatThrownBy(() -> follower.get(10, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .cause()
                    .isInstanceOf(BarrierAbortedException.class)
                    .hasMessageContaining("cache build failed");
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void testGroupIsUsableAfterAnAbortedRound() throws Exception {
        DistributedBarrier barrier = new DistributedBarrier(new LocalGroupBarrier(2));
        AtomicInteger calls = new AtomicInteger();
        GuardedWork<String> flaky = () -> {
            if (calls.incrementAndGet() == 1) {
                throw new IOException("first build failed");
            }
            return "index";
        };
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (Future<String> result : runRanks(pool, barrier, 2, flaky)) {
                assertThatThrownBy(() -> result.get(10, TimeUnit.SECONDS)).isInstanceOf(ExecutionException.class);
            }
            GuardedWork<String> reuseOnly = new GuardedWork<>() {
                @Override
                public String perform() throws IOException {
                    return flaky.perform();
                }

                @Override
                public String reuse() {
                    return "index";
                }
            };
            for (Future<String> result : runRanks(pool, barrier, 2, reuseOnly)) {
                assertThat(result.get(10, TimeUnit.SECONDS)).isEqualTo("index");
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    public void testFollowerTimesOutWithoutLeader() {
        DistributedBarrier barrier = new DistributedBarrier(new LocalGroupBarrier(2, Duration.ofMillis(200)));
        assertThatThrownBy(() -> barrier.withBarrier(1, new IndexBuild()))
            .isInstanceOf(BarrierTimeoutException.class)
            .satisfies(e -> assertThat(((BarrierTimeoutException) e).getPhase()).isEqualTo(BarrierPhase.ENTRY));
    }

    @Test
    public void testRankOutsideGroupIsRejected() {
        DistributedBarrier barrier = new DistributedBarrier(new LocalGroupBarrier(2));
        assertThatThrownBy(() -> barrier.withBarrier(2, new IndexBuild())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> barrier.withBarrier(-2, new IndexBuild())).isInstanceOf(IllegalArgumentException.class);
    }
}
