package io.fetchboot.transport;

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

import io.fetchboot.api.transport.TransferException;
import io.fetchboot.api.transport.TransferRequest;
import io.fetchboot.api.transport.TransferResult;
import io.fetchboot.api.config.FetchbootSettings;
import io.fetchboot.jetty.testserver.JettyFileServerExtension;
import io.fetchboot.jetty.testserver.JettyFileServerFixture;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(JettyFileServerExtension.class)
public class ResumableHttpTransportTest {

    @TempDir
    Path tempDir;

    private static URI uriFor(String relativePath) {
        return URI.create(JettyFileServerExtension.getServer().urlFor(relativePath).toString());
    }

    private static ResumableHttpTransport transport(int attempts) {
        return new ResumableHttpTransport(
            HttpClients.create(FetchbootSettings.defaults()), attempts, Duration.ZERO);
    }

    @Test
    public void testResumesFromPartialFile() throws IOException {
        JettyFileServerFixture server = JettyFileServerExtension.getServer();
        Path served = server.writeRandomFile("temp/resumable/partial.bin", 40_000);
        byte[] expected = Files.readAllBytes(served);

        Path dest = tempDir.resolve("partial.bin");
        Files.write(dest, Arrays.copyOf(expected, 12_345));

        try (ResumableHttpTransport transport = transport(9)) {
            TransferResult result = transport.transfer(TransferRequest.of(uriFor("temp/resumable/partial.bin"), dest));
            assertThat(result.bytesWritten()).isEqualTo(40_000);
            assertThat(result.attempts()).isEqualTo(1);
        }
        assertThat(Files.readAllBytes(dest)).isEqualTo(expected);
    }

    @Test
    public void testDownloadsFromScratch() throws IOException {
        JettyFileServerFixture server = JettyFileServerExtension.getServer();
        Path served = server.writeRandomFile("temp/resumable/scratch.bin", 20_000);

        Path dest = tempDir.resolve("scratch.bin");
        try (ResumableHttpTransport transport = transport(9)) {
            transport.transfer(TransferRequest.of(uriFor("temp/resumable/scratch.bin"), dest).withProgress(true));
        }
        assertThat(Files.readAllBytes(dest)).isEqualTo(Files.readAllBytes(served));
    }

    @Test
    public void testCompleteFileIsLeftAlone() throws IOException {
        JettyFileServerFixture server = JettyFileServerExtension.getServer();
        Path served = server.writeRandomFile("temp/resumable/complete.bin", 5_000);

        Path dest = tempDir.resolve("complete.bin");
        Files.copy(served, dest);
        try (ResumableHttpTransport transport = transport(9)) {
            TransferResult result = transport.transfer(TransferRequest.of(uriFor("temp/resumable/complete.bin"), dest));
            assertThat(result.bytesWritten()).isEqualTo(5_000);
        }
        assertThat(Files.readAllBytes(dest)).isEqualTo(Files.readAllBytes(served));
    }

    @Test
    public void testSpendsWholeRetryBudgetOnConnectionFailures() {
        Path dest = tempDir.resolve("never.bin");
        URI unreachable = URI.create(JettyFileServerFixture.unreachableUrl() + "never.bin");
        try (ResumableHttpTransport transport = transport(3)) {
            assertThatThrownBy(() -> transport.transfer(TransferRequest.of(unreachable, dest).withQuiet(true)))
                .isInstanceOfSatisfying(TransferException.class,
                    e -> assertThat(e.getAttempts()).isEqualTo(3));
        }
    }

    @Test
    public void testClientErrorIsNotRetried() {
        Path dest = tempDir.resolve("absent.bin");
        try (ResumableHttpTransport transport = transport(9)) {
            assertThatThrownBy(() -> transport.transfer(TransferRequest.of(uriFor("temp/resumable/absent.bin"), dest)))
                .isInstanceOfSatisfying(TransferException.class, e -> {
                    assertThat(e.getAttempts()).isEqualTo(1);
                    assertThat(e).hasMessageContaining("404");
                });
        }
    }

    @Test
    public void testRejectsEmptyRetryBudget() {
        OkHttpClient client = new OkHttpClient();
        assertThatThrownBy(() -> new ResumableHttpTransport(client, 0, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
        HttpClients.shutdown(client);
    }

    @Test
    public void testParsesContentRange() throws IOException {
        assertThat(ResumableHttpTransport.contentRangeStart("bytes 100-199/200")).isEqualTo(100);
        assertThat(ResumableHttpTransport.contentRangeTotal("bytes 100-199/200")).isEqualTo(200);
        assertThat(ResumableHttpTransport.contentRangeTotal("bytes 100-199/*")).isEqualTo(-1);
        assertThatThrownBy(() -> ResumableHttpTransport.contentRangeStart("items 1-2/3"))
            .isInstanceOf(IOException.class);
    }
}
