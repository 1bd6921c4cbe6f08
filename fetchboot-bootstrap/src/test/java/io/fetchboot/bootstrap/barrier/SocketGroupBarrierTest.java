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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SocketGroupBarrierTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final List<SocketGroupBarrier> barriers = new ArrayList<>();
    private final ExecutorService pool = Executors.newCachedThreadPool();

    @AfterEach
    public void tearDown() {
        pool.shutdownNow();
        barriers.forEach(SocketGroupBarrier::close);
    }

    /// One barrier instance per rank, as separate processes would hold them.
    private List<SocketGroupBarrier> group(int worldSize) throws IOException {
        SocketGroupBarrier leader = new SocketGroupBarrier(0, worldSize, new InetSocketAddress("127.0.0.1", 0), TIMEOUT);
        barriers.add(leader);
        InetSocketAddress address = new InetSocketAddress("127.0.0.1", leader.localPort());
        for (int rank = 1; rank < worldSize; rank++) {
            barriers.add(new SocketGroupBarrier(rank, worldSize, address, TIMEOUT));
        }
        return new ArrayList<>(barriers);
    }

    private List<Future<String>> runAll(List<SocketGroupBarrier> group, GuardedWork<String> work) {
        List<Future<String>> results = new ArrayList<>();
        for (int rank = 0; rank < group.size(); rank++) {
            int r = rank;
            DistributedBarrier barrier = new DistributedBarrier(group.get(r));
            results.add(pool.submit(() -> barrier.withBarrier(r, work)));
        }
        return results;
    }

    @Test
    public void testGuardedWorkRunsOnceAcrossSockets() throws Exception {
        List<SocketGroupBarrier> group = group(3);
        AtomicInteger performed = new AtomicInteger();
        GuardedWork<String> work = new GuardedWork<>() {
            @Override
            public String perform() {
                performed.incrementAndGet();
                return "built";
            }

            @Override
            public String reuse() {
                return performed.get() == 1 ? "reused" : "premature";
            }
        };

        List<Future<String>> results = runAll(group, work);

        assertThat(results.get(0).get(20, TimeUnit.SECONDS)).isEqualTo("built");
        assertThat(results.get(1).get(20, TimeUnit.SECONDS)).isEqualTo("reused");
        assertThat(results.get(2).get(20, TimeUnit.SECONDS)).isEqualTo("reused");
        assertThat(performed.get()).isEqualTo(1);
        assertThat(group.get(0).connectedFollowers()).containsExactly(1, 2);
    }

    @Test
    public void testLeaderFailureReachesFollowersAndGroupRecovers() throws Exception {
        List<SocketGroupBarrier> group = group(3);
        AtomicInteger calls = new AtomicInteger();
        GuardedWork<String> work = new GuardedWork<>() {
            @Override
            public String perform() throws IOException {
                if (calls.incrementAndGet() == 1) {
                    throw new IOException("label scan failed");
                }
                return "built";
            }

            @Override
            public String reuse() {
                return "reused";
            }
        };

        List<Future<String>> first = runAll(group, work);
        assertThatThrownBy(() -> first.get(0).get(20, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasRootCauseMessage("label scan failed");
        for (Future<String> follower : first.subList(1, 3)) {
            assertThatThrownBy(() -> follower.get(20, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .cause()
                .isInstanceOf(BarrierAbortedException.class)
                .hasMessageContaining("label scan failed");
        }

        List<Future<String>> second = runAll(group, work);
        assertThat(second.get(0).get(20, TimeUnit.SECONDS)).isEqualTo("built");
        assertThat(second.get(1).get(20, TimeUnit.SECONDS)).isEqualTo("reused");
        assertThat(second.get(2).get(20, TimeUnit.SECONDS)).isEqualTo("reused");
    }

    @Test
    public void testFollowerTimesOutWithoutLeader() throws IOException {
        int port;
        try (ServerSocket probe = new ServerSocket(0)) {
            port = probe.getLocalPort();
        }
        SocketGroupBarrier follower = new SocketGroupBarrier(
            1, 2, new InetSocketAddress("127.0.0.1", port), Duration.ofMillis(300));
        barriers.add(follower);

        assertThatThrownBy(() -> follower.await(1, BarrierPhase.ENTRY)).isInstanceOf(BarrierTimeoutException.class);
    }

    @Test
    public void testLeaderLossAbortsFollower() throws Exception {
        List<SocketGroupBarrier> group = group(2);
        SocketGroupBarrier leader = group.get(0);
        SocketGroupBarrier follower = group.get(1);

        Future<?> entry = pool.submit(() -> leader.await(0, BarrierPhase.ENTRY));
        follower.await(1, BarrierPhase.ENTRY);
        entry.get(20, TimeUnit.SECONDS);

        leader.close();
        assertThatThrownBy(() -> follower.await(1, BarrierPhase.EXIT)).isInstanceOf(BarrierAbortedException.class);
    }

    @Test
    public void testLeaderListensOnlyOnTheMasterAddress() throws IOException {
        SocketGroupBarrier leader = new SocketGroupBarrier(0, 2, new InetSocketAddress("127.0.0.1", 0), TIMEOUT);
        barriers.add(leader);
        InetSocketAddress bound = leader.boundAddress();
        assertThat(bound.getAddress().isAnyLocalAddress()).isFalse();
        assertThat(bound.getAddress().getHostAddress()).isEqualTo("127.0.0.1");
        assertThat(bound.getPort()).isEqualTo(leader.localPort());
    }

    @Test
    public void testRanksMustMatchTheInstance() throws IOException {
        List<SocketGroupBarrier> group = group(2);
        assertThatThrownBy(() -> group.get(1).await(0, BarrierPhase.ENTRY)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SocketGroupBarrier(2, 2, new InetSocketAddress("127.0.0.1", 1), TIMEOUT))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testParsesHello() {
        assertThat(SocketGroupBarrier.parseHello("HELLO 3")).isEqualTo(3);
        assertThat(SocketGroupBarrier.parseHello("HELLO x")).isEqualTo(-1);
        assertThat(SocketGroupBarrier.parseHello("GET / HTTP/1.1")).isEqualTo(-1);
        assertThat(SocketGroupBarrier.parseHello(null)).isEqualTo(-1);
    }
}
