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
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/// A JUnit Jupiter extension that shares one {@link JettyFileServerFixture} across the
/// test classes of a module.
///
/// The server is started the first time a test class using the extension runs, and is
/// stopped by a shutdown hook when the JVM exits. It serves `src/test/resources/testserver`
/// of the module under test, or the directory named by the `fetchboot.testserver.root`
/// system property. Its `temp` subdirectory is the scratch area tests write into.
///
/// ```java
/// @ExtendWith(JettyFileServerExtension.class)
/// public class MyTest {
///     @Test
///     void fetches() throws IOException {
///         JettyFileServerExtension.getServer().writeRandomFile("temp/a.bin", 1024);
///         URL url = JettyFileServerExtension.getServer().urlFor("temp/a.bin");
///     }
/// }
/// ```
public class JettyFileServerExtension implements BeforeAllCallback {
    private static final Logger logger = LogManager.getLogger(JettyFileServerExtension.class);

    private static final String RESOURCES_ROOT_PROPERTY = "fetchboot.testserver.root";
    private static final String DEFAULT_RESOURCES_PATH = "src/test/resources/testserver";

    public static final Path DEFAULT_RESOURCES_ROOT;
    public static final Path TEMP_RESOURCES_ROOT;

    private static final Object lock = new Object();
    private static JettyFileServerFixture server;

    static {
        String resourcesPath = System.getProperty(RESOURCES_ROOT_PROPERTY, DEFAULT_RESOURCES_PATH);
        DEFAULT_RESOURCES_ROOT = Paths.get(resourcesPath).toAbsolutePath();
        TEMP_RESOURCES_ROOT = DEFAULT_RESOURCES_ROOT.resolve("temp");
    }

    /// Starts the shared server if it is not running yet. Thread-safe and idempotent.
    public static void initialize() {
        synchronized (lock) {
            if (server != null) {
                return;
            }
            try {
                Files.createDirectories(TEMP_RESOURCES_ROOT);
                JettyFileServerFixture fixture = new JettyFileServerFixture(DEFAULT_RESOURCES_ROOT);
                fixture.setScratchDirectory(TEMP_RESOURCES_ROOT);
                fixture.start();
                server = fixture;
                logger.info("Jetty test web server started at {}", fixture.getBaseUrl());

                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    synchronized (lock) {
                        if (server != null) {
                            server.close();
                            server = null;
                        }
                    }
                }));
            } catch (IOException e) {
                logger.error("Failed to start Jetty test web server", e);
                throw new UncheckedIOException("Failed to start Jetty test web server", e);
            }
        }
    }

    /// @return the base URL of the shared server
    public static URL getBaseUrl() {
        return getServer().getBaseUrl();
    }

    /// @return the shared server, started if necessary
    public static JettyFileServerFixture getServer() {
        initialize();
        return server;
    }

    @Override
    public void beforeAll(ExtensionContext context) {
        initialize();
        logger.debug("JettyFileServerExtension beforeAll called for {}", context.getDisplayName());
    }
}
