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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/// A {@link GroupBarrier} for ranks running as separate processes, coordinated over TCP.
///
/// Rank 0 listens on the leader address; every other rank connects to it and introduces
/// itself with `HELLO <rank>`. For each phase a follower sends `ARRIVE <phase>` and waits for
/// `RELEASE <phase>`, which the leader sends once it has heard from every follower and has
/// arrived itself. An abort is sent as `ABORT <phase> <message>`. A follower that loses its
/// connection to the leader treats the phase as aborted.
///
/// One instance belongs to one rank; ranks passed to {@link #await(int, BarrierPhase)} must
/// match the rank the instance was created for.
public class SocketGroupBarrier implements GroupBarrier {
    private static final Logger logger = LogManager.getLogger(SocketGroupBarrier.class);

    private static final long CONNECT_RETRY_MILLIS = 100;

    private final int rank;
    private final int worldSize;
    private final InetSocketAddress leaderAddress;
    private final Duration timeout;

    private final ServerSocket serverSocket;
    private final Map<Integer, Peer> followers = new TreeMap<>();
    private Peer leader;

    /// @param rank this process's rank, `0..worldSize-1`
    /// @param worldSize the number of ranks, at least 1
    /// @param leaderAddress where rank 0 listens; rank 0 binds this address only, port 0 picks a free one
    /// @param timeout how long to wait for peers, zero to wait indefinitely
    /// @throws IOException if rank 0 cannot listen on the leader address
    public SocketGroupBarrier(int rank, int worldSize, InetSocketAddress leaderAddress, Duration timeout)
            throws IOException
    {
        if (worldSize < 1) {
            throw new IllegalArgumentException("worldSize must be at least 1: " + worldSize);
        }
        if (rank < 0 || rank >= worldSize) {
            throw new IllegalArgumentException("rank " + rank + " is outside the group of size " + worldSize);
        }
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative: " + timeout);
        }
        this.rank = rank;
        this.worldSize = worldSize;
        this.leaderAddress = leaderAddress;
        this.timeout = timeout;

        if (rank == 0) {
            serverSocket = new ServerSocket();
            serverSocket.setReuseAddress(true);
            if (leaderAddress.isUnresolved()) {
                throw new IOException("Unable to resolve barrier leader address " + leaderAddress);
            }
            serverSocket.bind(leaderAddress, worldSize);
            logger.debug("Barrier leader listening on {} for {} followers", serverSocket.getLocalSocketAddress(), worldSize - 1);
        } else {
            serverSocket = null;
        }
    }

    /// @return the port rank 0 listens on, or -1 for other ranks
    public int localPort() {
        return serverSocket == null ? -1 : serverSocket.getLocalPort();
    }

    InetSocketAddress boundAddress() {
        return serverSocket == null ? null : (InetSocketAddress) serverSocket.getLocalSocketAddress();
    }

    @Override
    public int worldSize() {
        return worldSize;
    }

    @Override
    public synchronized void await(int rank, BarrierPhase phase) {
        checkRank(rank);
        if (worldSize == 1) {
            return;
        }
        if (this.rank == 0) {
            leaderAwait(phase);
        } else {
            followerAwait(phase);
        }
    }

    @Override
    public synchronized void abort(int rank, BarrierPhase phase, Throwable cause) {
        checkRank(rank);
        String message = cause == null || cause.getMessage() == null ? "aborted" : cause.getMessage();
        if (this.rank == 0) {
            logger.debug("Barrier leader aborts {} for {} followers", phase, followers.size());
            broadcastAbort(phase, message, -1);
        } else if (leader != null) {
            leader.send("ABORT " + phase + " " + oneLine(message));
            closeQuietly(leader);
            leader = null;
        }
    }

    private void leaderAwait(BarrierPhase phase) {
        acceptFollowers(phase);
        String expected = "ARRIVE " + phase;
        for (Map.Entry<Integer, Peer> entry : new ArrayList<>(followers.entrySet())) {
            int followerRank = entry.getKey();
            Peer follower = entry.getValue();
            String line;
            try {
                line = follower.nextArrival();
            } catch (SocketTimeoutException e) {
                throw new BarrierTimeoutException(phase, 0, timeout);
            } catch (IOException e) {
                line = null;
            }
            if (expected.equals(line)) {
                continue;
            }
            String reason = line == null ? "rank " + followerRank + " disconnected" : "rank " + followerRank + ": " + line;
            followers.remove(followerRank);
            closeQuietly(follower);
            broadcastAbort(phase, reason, followerRank);
            throw new BarrierAbortedException(phase, 0, new IOException(reason));
        }
        for (Peer follower : followers.values()) {
            follower.send("RELEASE " + phase);
        }
    }

    private void followerAwait(BarrierPhase phase) {
        connectToLeader(phase);
        leader.send("ARRIVE " + phase);
        String line;
        try {
            line = leader.reader.readLine();
        } catch (SocketTimeoutException e) {
            throw new BarrierTimeoutException(phase, rank, timeout);
        } catch (IOException e) {
            throw leaderLost(phase, e);
        }
        if (line == null) {
            throw leaderLost(phase, new IOException("leader closed the connection"));
        }
        if (line.equals("RELEASE " + phase)) {
            return;
        }
        String abortPrefix = "ABORT " + phase;
        if (line.startsWith(abortPrefix)) {
            throw new BarrierAbortedException(phase, rank, new IOException(line.substring(abortPrefix.length()).trim()));
        }
        throw new BarrierException("Unexpected barrier message from leader: " + line, phase, rank, null);
    }

    private BarrierAbortedException leaderLost(BarrierPhase phase, IOException cause) {
        closeQuietly(leader);
        leader = null;
        return new BarrierAbortedException(phase, rank, cause);
    }

    private void acceptFollowers(BarrierPhase phase) {
        try {
            serverSocket.setSoTimeout(timeoutMillis());
            while (followers.size() < worldSize - 1) {
                Socket socket = serverSocket.accept();
                Peer peer = new Peer(socket, timeoutMillis());
                String hello = peer.reader.readLine();
                int followerRank = parseHello(hello);
                if (followerRank < 1 || followerRank >= worldSize || followers.containsKey(followerRank)) {
                    logger.warn("Rejecting barrier connection from {}: {}", socket.getRemoteSocketAddress(), hello);
                    closeQuietly(peer);
                    continue;
                }
                followers.put(followerRank, peer);
                logger.debug("Rank {} joined the barrier group ({}/{})", followerRank, followers.size() + 1, worldSize);
            }
        } catch (SocketTimeoutException e) {
            throw new BarrierTimeoutException(phase, 0, timeout);
        } catch (IOException e) {
            throw new BarrierException("Unable to accept barrier followers", phase, 0, e);
        }
    }

    private void connectToLeader(BarrierPhase phase) {
        if (leader != null) {
            return;
        }
        long deadline = timeout.isZero() ? Long.MAX_VALUE : System.currentTimeMillis() + timeout.toMillis();
        while (true) {
            try {
                Socket socket = new Socket();
                try {
                    socket.connect(leaderAddress, (int) Math.min(Integer.MAX_VALUE, Math.max(1, deadline - System.currentTimeMillis())));
                } catch (IOException e) {
                    socket.close();
                    throw e;
                }
                leader = new Peer(socket, timeoutMillis());
                leader.send("HELLO " + rank);
                logger.debug("Rank {} connected to barrier leader at {}", rank, leaderAddress);
                return;
            } catch (ConnectException e) {
                if (System.currentTimeMillis() >= deadline) {
                    throw new BarrierTimeoutException(phase, rank, timeout);
                }
                pause(phase);
            } catch (SocketTimeoutException e) {
                throw new BarrierTimeoutException(phase, rank, timeout);
            } catch (IOException e) {
                throw new BarrierException("Unable to connect to barrier leader at " + leaderAddress, phase, rank, e);
            }
        }
    }

    private void pause(BarrierPhase phase) {
        try {
            Thread.sleep(CONNECT_RETRY_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BarrierAbortedException(phase, rank, e);
        }
    }

    private void broadcastAbort(BarrierPhase phase, String message, int exceptRank) {
        for (Map.Entry<Integer, Peer> entry : followers.entrySet()) {
            if (entry.getKey() != exceptRank) {
                entry.getValue().send("ABORT " + phase + " " + oneLine(message));
                entry.getValue().skipArrival = "ARRIVE " + phase;
            }
        }
    }

    static int parseHello(String hello) {
        if (hello == null || !hello.startsWith("HELLO ")) {
            return -1;
        }
        try {
            return Integer.parseInt(hello.substring("HELLO ".length()).trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static String oneLine(String message) {
        return message.replace('\r', ' ').replace('\n', ' ');
    }

    private int timeoutMillis() {
        return (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
    }

    private void checkRank(int rank) {
        if (rank != this.rank) {
            throw new IllegalArgumentException("this barrier belongs to rank " + this.rank + ", not " + rank);
        }
    }

    private static void closeQuietly(Closeable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            logger.debug("Error closing barrier connection: {}", e.getMessage());
        }
    }

    @Override
    public synchronized void close() {
        for (Peer follower : followers.values()) {
            closeQuietly(follower);
        }
        followers.clear();
        closeQuietly(leader);
        leader = null;
        closeQuietly(serverSocket);
    }

    private static class Peer implements Closeable {
        private final Socket socket;
        private final BufferedReader reader;
        private final PrintWriter writer;
        /// An arrival the peer sent for a round that was aborted before it was read
        private String skipArrival;

        Peer(Socket socket, int timeoutMillis) throws IOException {
            this.socket = socket;
            socket.setSoTimeout(timeoutMillis);
            socket.setTcpNoDelay(true);
            this.reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            this.writer = new PrintWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
        }

        String nextArrival() throws IOException {
            String line = reader.readLine();
            if (skipArrival != null && skipArrival.equals(line)) {
                skipArrival = null;
                line = reader.readLine();
            }
            skipArrival = null;
            return line;
        }

        void send(String line) {
            writer.print(line);
            writer.print('\n');
            writer.flush();
        }

        @Override
        public void close() throws IOException {
            socket.close();
        }
    }

    List<Integer> connectedFollowers() {
        return new ArrayList<>(followers.keySet());
    }
}
