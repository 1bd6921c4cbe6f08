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

/// One step of a resolution, in the order it was taken.
///
/// @param source what was consulted, such as `local`, `registry:latest` or `download`
/// @param succeeded whether that source gave a usable answer
/// @param detail what the source answered, or why it failed
public record SourceAttempt(String source, boolean succeeded, String detail) {

    static SourceAttempt ok(String source, String detail) {
        return new SourceAttempt(source, true, detail);
    }

    static SourceAttempt failed(String source, String detail) {
        return new SourceAttempt(source, false, detail);
    }
}
