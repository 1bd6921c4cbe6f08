package io.fetchboot.jetty.testserver;

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
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.DefaultServlet;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.MalformedURLException;
import java.net.ServerSocket;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;
import java.util.stream.Stream;

/**
 * A test fixture that starts a Jetty web server to host release registry responses and
 * release assets.
 * <p>
 * The server binds to 127.0.0.1 on a free port and serves a directory with Jetty's
 * {@link DefaultServlet}, which answers HEAD and ranged GET requests. Tests stage
 * generated content below the fixture's scratch directory; every other file under the
 * served root is treated as read-only and checked for modification when the fixture closes.
 * <p>
 * Example usage:
 * ```java
 * try (JettyFileServerFixture server = new JettyFileServerFixture(root)) {
 *     server.start();
 *     server.writeRandomFile("temp/assets/model.pt", 200_000);
 *     URL asset = server.urlFor("temp/assets/model.pt");
 * }
 * ```
 */
public class JettyFileServerFixture implements AutoCloseable {
    static {
        if (System.getProperty("log4j2.StatusLogger.level") == null) {
            System.setProperty("log4j2.StatusLogger.level", "FATAL");
        }
    }

    private static final Logger logger = LogManager.getLogger(JettyFileServerFixture.class);

    private Server server;
    private int port;
    private final Path resourcesRoot;
    private final Map<Path, FileTime> fileTimestamps = new HashMap<>();
    private Path scratchDirectory;

    /**
     * Creates a fixture serving the given directory.
     *
     * @param resourcesRoot The root directory containing the resources to serve
     */
    public JettyFileServerFixture(Path resourcesRoot) {
        this.resourcesRoot = resourcesRoot.toAbsolutePath();
        if (!Files.isDirectory(this.resourcesRoot)) {
            throw new UncheckedIOException(new IOException("Resources directory does not exist: " + resourcesRoot));
        }
    }

    /**
     * Sets the scratch directory tests may write into. It must be below the served root,
     * and it is excluded from the modification check.
     *
     * @param scratchDirectory The scratch directory path
     */
    public void setScratchDirectory(Path scratchDirectory) {
        Path absolute = scratchDirectory.toAbsolutePath();
        if (!absolute.startsWith(resourcesRoot)) {
            throw new IllegalArgumentException("scratch directory " + absolute + " is not below " + resourcesRoot);
        }
        this.scratchDirectory = absolute;
    }

    /**
     * Starts the web server on a free port and snapshots the read-only content.
     *
     * @throws IOException If the server cannot be started
     */
    public void start() throws IOException {
        snapshotReadOnlyFiles();
        this.port = findAvailablePort();

        server = new Server();
        ServerConnector connector = new ServerConnector(server);
        connector.setHost("127.0.0.1");
        connector.setPort(port);
        server.addConnector(connector);

        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        context.setContextPath("/");
        context.setResourceBase(resourcesRoot.toString());
        server.setHandler(context);

        ServletHolder defaultServlet = new ServletHolder("default", DefaultServlet.class);
        defaultServlet.setInitParameter("dirAllowed", "false");
        defaultServlet.setInitParameter("acceptRanges", "true");
        defaultServlet.setInitParameter("etags", "true");
        defaultServlet.setInitParameter("precompressed", "false");
        // content changes between tests, so nothing may be cached in memory
        defaultServlet.setInitParameter("maxCacheSize", "0");
        defaultServlet.setInitParameter("useFileMappedBuffer", "false");
        context.addServlet(defaultServlet, "/");

        try {
            server.start();
            logger.info("Jetty test web server started on port {} serving files from {}", port, resourcesRoot);
        } catch (Exception e) {
            throw new IOException("Failed to start Jetty server", e);
        }
    }

    /**
     * @return the base URL of the server, ending with a slash
     */
    public URL getBaseUrl() {
        try {
            return new URL("http://127.0.0.1:" + port + "/");
        } catch (MalformedURLException e) {
            throw new IllegalStateException("Failed to create server URL", e);
        }
    }

    /**
     * @param relativePath a path relative to the served root, without leading slash
     * @return the URL the file is served under
     */
    public URL urlFor(String relativePath) {
        try {
            return new URL(getBaseUrl(), relativePath);
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException("Invalid relative path: " + relativePath, e);
        }
    }

    /**
     * @return the root directory being served
     */
    public Path getRootDirectory() {
        return resourcesRoot;
    }

    /**
     * @return the scratch directory tests may write into, or null if none was set
     */
    public Path getScratchDirectory() {
        return scratchDirectory;
    }

    /**
     * Writes a file below the served root. The target must be inside the scratch directory.
     *
     * @param relativePath path relative to the served root
     * @param content the file content
     * @return the written file
     * @throws IOException if the file cannot be written
     */
    public Path writeFile(String relativePath, byte[] content) throws IOException {
        Path target = resourcesRoot.resolve(relativePath).normalize();
        if (!isInScratchDirectory(target)) {
            throw new IllegalArgumentException("tests may only write below " + scratchDirectory + ": " + target);
        }
        Files.createDirectories(target.getParent());
        return Files.write(target, content);
    }

    /**
     * Writes a UTF-8 text file below the scratch directory.
     *
     * @param relativePath path relative to the served root
     * @param content the text content
     * @return the written file
     * @throws IOException if the file cannot be written
     */
    public Path writeText(String relativePath, String content) throws IOException {
        return writeFile(relativePath, content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Writes a file of pseudo-random bytes below the scratch directory.
     *
     * @param relativePath path relative to the served root
     * @param size the number of bytes to write
     * @return the written file
     * @throws IOException if the file cannot be written
     */
    public Path writeRandomFile(String relativePath, int size) throws IOException {
        byte[] content = new byte[size];
        new Random(size).nextBytes(content);
        return writeFile(relativePath, content);
    }

    /**
     * Stops the server and verifies that no read-only file was modified, deleted or added.
     */
    @Override
    public void close() {
        if (server != null) {
            try {
                server.stop();
                logger.info("Jetty test web server stopped");
            } catch (Exception e) {
                logger.error("Error stopping Jetty server", e);
            }
        }
        checkForModifiedFiles();
    }

    /**
     * Finds a URL on the loopback interface where no server is listening, for tests that
     * need a source which refuses connections.
     *
     * @return a URL whose connections are refused
     */
    public static URL unreachableUrl() {
        try {
            return new URL("http://127.0.0.1:" + findAvailablePort() + "/");
        } catch (MalformedURLException e) {
            throw new IllegalStateException(e);
        }
    }

    private void snapshotReadOnlyFiles() {
        fileTimestamps.clear();
        try {
            fileTimestamps.putAll(readOnlyTimestamps());
            logger.debug("Took timestamp snapshot of {} read-only files in {}", fileTimestamps.size(), resourcesRoot);
        } catch (IOException e) {
            logger.warn("Failed to take file timestamp snapshot: {}", e.getMessage());
        }
    }

    private void checkForModifiedFiles() {
        Map<Path, FileTime> current;
        try {
            current = readOnlyTimestamps();
        } catch (IOException e) {
            logger.warn("Failed to check for modified files: {}", e.getMessage());
            return;
        }
        for (Map.Entry<Path, FileTime> before : fileTimestamps.entrySet()) {
            FileTime after = current.remove(before.getKey());
            if (after == null) {
                throw new IllegalStateException("test deleted read-only served file " + before.getKey());
            }
            if (!after.equals(before.getValue())) {
                throw new IllegalStateException("test modified read-only served file " + before.getKey());
            }
        }
        if (!current.isEmpty()) {
            throw new IllegalStateException("test created files outside " + scratchDirectory + ": " + current.keySet());
        }
    }

    // last-modified time of every served file outside the scratch area
    private Map<Path, FileTime> readOnlyTimestamps() throws IOException {
        Map<Path, FileTime> stamps = new HashMap<>();
        try (Stream<Path> files = Files.walk(resourcesRoot)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                if (Files.isRegularFile(file) && !isInScratchDirectory(file)) {
                    stamps.put(file, Files.getLastModifiedTime(file));
                }
            }
        }
        return stamps;
    }

    private boolean isInScratchDirectory(Path file) {
        return scratchDirectory != null && file.toAbsolutePath().startsWith(scratchDirectory);
    }

    private static int findAvailablePort() {
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to find available port", e);
        }
    }
}
