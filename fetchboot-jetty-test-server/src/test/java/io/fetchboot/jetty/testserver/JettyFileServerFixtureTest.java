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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class JettyFileServerFixtureTest {

    @Test
    public void testServesStagedFilesWithRanges(@TempDir Path root) throws IOException {
        Path scratch = root.resolve("temp");
        try (JettyFileServerFixture server = new JettyFileServerFixture(root)) {
            server.setScratchDirectory(scratch);
            server.start();
            server.writeText("temp/hello.txt", "hello, ranges");

            HttpURLConnection conn = (HttpURLConnection) server.urlFor("temp/hello.txt").openConnection();
            conn.setRequestProperty("Range", "bytes=7-");
            assertThat(conn.getResponseCode()).isEqualTo(206);
            try (InputStream in = conn.getInputStream()) {
                assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("ranges");
            }
        }
    }

    @Test
    public void testRejectsWritesOutsideScratch(@TempDir Path root) throws IOException {
        try (JettyFileServerFixture server = new JettyFileServerFixture(root)) {
            server.setScratchDirectory(root.resolve("temp"));
            server.start();
            assertThatThrownBy(() -> server.writeText("outside.txt", "nope"))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    public void testDetectsFilesCreatedOutsideScratch(@TempDir Path root) throws IOException {
        JettyFileServerFixture server = new JettyFileServerFixture(root);
        server.setScratchDirectory(root.resolve("temp"));
        server.start();
        Files.writeString(root.resolve("sneaky.txt"), "created behind the fixture's back");
        assertThatThrownBy(server::close).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void testUnreachableUrlRefusesConnections() {
        URL url = JettyFileServerFixture.unreachableUrl();
        assertThatThrownBy(() -> ((HttpURLConnection) url.openConnection()).getResponseCode())
            .isInstanceOf(ConnectException.class);
    }
}
