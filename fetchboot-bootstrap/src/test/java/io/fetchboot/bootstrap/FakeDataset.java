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

import io.fetchboot.api.dataset.DatasetFactory;
import io.fetchboot.api.dataset.DatasetHandle;
import io.fetchboot.api.dataset.DatasetRequest;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/// A dataset collaborator whose expensive build publishes an index that reuse reads back.
class FakeDataset implements DatasetFactory {

    record Handle(String identity, int length) implements DatasetHandle {
    }

    private final int length;
    private final long buildMillis;
    final AtomicInteger builds = new AtomicInteger();
    final AtomicInteger reuses = new AtomicInteger();
    final AtomicReference<Handle> published = new AtomicReference<>();
    final List<DatasetRequest> requests = new CopyOnWriteArrayList<>();

    FakeDataset(int length) {
        this(length, 0);
    }

    FakeDataset(int length, long buildMillis) {
        this.length = length;
        this.buildMillis = buildMillis;
    }

    @Override
    public DatasetHandle build(DatasetRequest request) throws IOException {
        requests.add(request);
        int build = builds.incrementAndGet();
        if (buildMillis > 0) {
            try {
                Thread.sleep(buildMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted while building", e);
            }
        }
        Handle handle = new Handle(request.path() + "#index-" + build, length);
        published.set(handle);
        return handle;
    }

    @Override
    public DatasetHandle reuse(DatasetRequest request) throws IOException {
        requests.add(request);
        reuses.incrementAndGet();
        Handle handle = published.get();
        if (handle == null) {
            throw new IOException("index for " + request.path() + " has not been built");
        }
        return handle;
    }
}
