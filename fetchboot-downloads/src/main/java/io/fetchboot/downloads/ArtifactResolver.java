package io.fetchboot.downloads;

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

import io.fetchboot.api.artifacts.DownloadOutcome;
import io.fetchboot.api.artifacts.RemoteAsset;
import io.fetchboot.api.config.FetchbootSettings;
import io.fetchboot.downloads.registry.DefaultAssets;
import io.fetchboot.downloads.registry.GitTagSource;
import io.fetchboot.downloads.registry.GithubReleaseRegistry;
import io.fetchboot.downloads.registry.ReleaseInfo;
import io.fetchboot.downloads.registry.ReleaseRegistry;
import io.fetchboot.downloads.registry.TagSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/// Turns a file spec into a local path, downloading the file when it is not present.
///
/// A spec is one of three things:
///
/// - a path to an existing local file, returned as is without any network access
/// - an http or https URL, downloaded to a local file named after the URL's last segment
/// - a bare asset name of a release, looked up through the release registry chain and
///   downloaded from the release's download URL
///
/// For bare names the release is determined by asking the registry for the requested tag,
/// then for the latest release, then taking the last local git tag, then using the requested
/// tag as is. The asset list comes from the first registry lookup that succeeded, or from
/// {@link DefaultAssets} when none did. Each step is recorded as a {@link SourceAttempt}.
/// Lookup and download failures are logged and reported in the {@link ResolutionResult}, never
/// thrown.
public class ArtifactResolver implements Closeable {
    private static final Logger logger = LogManager.getLogger(ArtifactResolver.class);

    private final FetchbootSettings settings;
    private final DownloadEngine engine;
    private final ReleaseRegistry registry;
    private final TagSource localTags;
    private final Path baseDir;
    private final boolean ownsRegistry;

    /// Creates a resolver against the configured registry, relative to the current directory.
    /// The registry client created here is closed with the resolver.
    /// @param settings registry, asset and download settings
    /// @param engine the engine downloads go through
    public ArtifactResolver(FetchbootSettings settings, DownloadEngine engine) {
        this(settings, engine, new GithubReleaseRegistry(settings), new GitTagSource(Path.of("")), Path.of(""), true);
    }

    /// Creates a resolver over collaborators owned by the caller, which {@link #close()} leaves open.
    /// @param settings registry, asset and download settings
    /// @param engine the engine downloads go through
    /// @param registry the release registry to ask
    /// @param localTags where to look for a tag when the registry does not answer
    /// @param baseDir the directory relative specs are resolved against
    public ArtifactResolver(
            FetchbootSettings settings,
            DownloadEngine engine,
            ReleaseRegistry registry,
            TagSource localTags,
            Path baseDir
    )
    {
        this(settings, engine, registry, localTags, baseDir, false);
    }

    ArtifactResolver(
            FetchbootSettings settings,
            DownloadEngine engine,
            ReleaseRegistry registry,
            TagSource localTags,
            Path baseDir,
            boolean ownsRegistry
    )
    {
        this.settings = settings;
        this.engine = engine;
        this.registry = registry;
        this.localTags = localTags;
        this.baseDir = baseDir;
        this.ownsRegistry = ownsRegistry;
    }

    /// Resolves against the configured repository and release.
    /// @see #resolve(String, String, String)
    public ResolutionResult resolve(String fileSpec) {
        return resolve(fileSpec, settings.repository(), settings.release());
    }

    /// @return the path to use for the file spec, or the file spec itself when it could not be resolved
    /// @see #resolve(String, String, String)
    public String resolvePath(String fileSpec, String repository, String releaseTag) {
        return resolve(fileSpec, repository, releaseTag).path();
    }

    /// Resolves a file spec to a local path, downloading it if needed.
    ///
    /// @param fileSpec a local path, URL, or bare asset name; surrounding whitespace and single
    ///     quotes are removed first
    /// @param repository the release repository, as `owner/name`
    /// @param releaseTag the release to prefer, such as `v7.0`
    /// @return the resolution result
    /// @throws IllegalArgumentException if the file spec is blank
    public ResolutionResult resolve(String fileSpec, String repository, String releaseTag) {
        if (fileSpec == null || fileSpec.replace("'", "").isBlank()) {
            throw new IllegalArgumentException("file spec must not be blank");
        }
        String spec = fileSpec.trim().replace("'", "");
        List<SourceAttempt> attempts = new ArrayList<>();

        Path file = baseDir.resolve(spec);
        if (Files.exists(file)) {
            attempts.add(SourceAttempt.ok("local", file.toString()));
            return new ResolutionResult(fileSpec, spec, ResolutionStatus.LOCAL,
                    new RemoteAsset(spec, Optional.empty(), Optional.empty(), List.of()), attempts, Optional.empty());
        }
        attempts.add(SourceAttempt.failed("local", file + " does not exist"));

        if (Urls.hasHttpScheme(spec)) {
            return resolveUrl(fileSpec, Urls.repairScheme(spec), attempts);
        }
        return resolveReleaseAsset(fileSpec, spec, file, repository, releaseTag, attempts);
    }

    private ResolutionResult resolveUrl(String fileSpec, String url, List<SourceAttempt> attempts) {
        String name = Urls.localName(url);
        Path local = baseDir.resolve(name);
        RemoteAsset asset = RemoteAsset.direct(fileSpec, url);

        if (Files.isRegularFile(local)) {
            logger.info("Found {} locally at {}", url, local);
            attempts.add(SourceAttempt.ok("local", local.toString()));
            return new ResolutionResult(fileSpec, local.toString(), ResolutionStatus.LOCAL, asset, attempts, Optional.empty());
        }

        DownloadOutcome outcome = engine.fetch(url, local, settings.minBytes());
        attempts.add(downloadAttempt(outcome));
        ResolutionStatus status = outcome.succeeded() ? ResolutionStatus.DOWNLOADED : ResolutionStatus.UNRESOLVED;
        return new ResolutionResult(fileSpec, local.toString(), status, asset, attempts, Optional.of(outcome));
    }

    private ResolutionResult resolveReleaseAsset(
            String fileSpec,
            String spec,
            Path file,
            String repository,
            String releaseTag,
            List<SourceAttempt> attempts
    )
    {
        String name = Urls.localName(spec);
        String tag;
        List<String> assets;

        Optional<ReleaseInfo> release = lookup(repository, releaseTag, attempts);
        if (release.isEmpty()) {
            release = lookup(repository, ReleaseRegistry.LATEST, attempts);
        }
        if (release.isPresent()) {
            tag = release.get().tag();
            assets = release.get().assetNames();
        } else {
            tag = localTag(attempts).orElse(null);
            if (tag == null) {
                tag = releaseTag;
                attempts.add(SourceAttempt.ok("default-tag", tag));
            }
            assets = DefaultAssets.names(settings);
        }

        RemoteAsset asset = RemoteAsset.released(name, tag, assets);
        if (!asset.isListed()) {
            logger.debug("{} is not an asset of {} release {}", name, repository, tag);
            attempts.add(SourceAttempt.failed("assets", name + " is not an asset of release " + tag));
            return new ResolutionResult(fileSpec, spec, ResolutionStatus.NOT_FOUND, asset, attempts, Optional.empty());
        }

        String url = settings.downloadBase() + "/" + repository + "/releases/download/" + tag + "/" + name;
        String hint = spec + " missing, try downloading from " + settings.downloadBase() + "/" + repository + "/releases/" + tag;
        DownloadOutcome outcome = engine.fetch(url, file, settings.minBytes(), null, hint);
        attempts.add(downloadAttempt(outcome));
        ResolutionStatus status = outcome.succeeded() ? ResolutionStatus.DOWNLOADED : ResolutionStatus.UNRESOLVED;
        return new ResolutionResult(fileSpec, file.toString(), status, asset.withUrl(url), attempts, Optional.of(outcome));
    }

    private Optional<ReleaseInfo> lookup(String repository, String tag, List<SourceAttempt> attempts) {
        String source = "registry:" + (ReleaseRegistry.LATEST.equals(tag) ? tag : "tags/" + tag);
        try {
            ReleaseInfo info = registry.lookup(repository, tag);
            attempts.add(SourceAttempt.ok(source, info.tag()));
            return Optional.of(info);
        } catch (IOException | RuntimeException e) {
            logger.debug("Release lookup {} for {} failed: {}", source, repository, e.getMessage());
            attempts.add(SourceAttempt.failed(source, String.valueOf(e.getMessage())));
            return Optional.empty();
        }
    }

    private Optional<String> localTag(List<SourceAttempt> attempts) {
        try {
            Optional<String> tag = localTags.lastTag();
            if (tag.isPresent()) {
                attempts.add(SourceAttempt.ok("git-tag", tag.get()));
            } else {
                attempts.add(SourceAttempt.failed("git-tag", "no tags"));
            }
            return tag;
        } catch (IOException | RuntimeException e) {
            logger.debug("Local tag lookup failed: {}", e.getMessage());
            attempts.add(SourceAttempt.failed("git-tag", String.valueOf(e.getMessage())));
            return Optional.empty();
        }
    }

    private static SourceAttempt downloadAttempt(DownloadOutcome outcome) {
        return outcome.succeeded()
                ? SourceAttempt.ok("download", outcome.bytesWritten() + " bytes")
                : SourceAttempt.failed("download", outcome.errorDetail().orElse("failed"));
    }

    /// Closes the registry if this resolver created it. The download engine is left open.
    @Override
    public void close() throws IOException {
        if (ownsRegistry && registry instanceof Closeable) {
            ((Closeable) registry).close();
        }
    }
}
