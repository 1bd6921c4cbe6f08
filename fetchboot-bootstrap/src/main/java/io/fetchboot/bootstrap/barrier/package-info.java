/// Group barriers and the two-phase leader-first protocol built on them.
///
/// ```java
/// ProcessGroup group = ProcessGroup.fromEnvironment();
/// try (GroupBarrier barrier = GroupBarriers.forGroup(group, Duration.ZERO)) {
///   Index index = new DistributedBarrier(barrier).withBarrier(group.rank(), new GuardedWork<>() {
///     public Index perform() throws IOException { return Index.build(path); }
///     public Index reuse() throws IOException { return Index.open(path); }
///   });
/// }
/// ```
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
