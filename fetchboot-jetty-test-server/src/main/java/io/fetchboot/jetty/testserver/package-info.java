/// Jetty based HTTP test server for registry and asset download tests.
///
/// {@link io.fetchboot.jetty.testserver.JettyFileServerFixture} serves a directory over
/// HTTP with range support; {@link io.fetchboot.jetty.testserver.JettyFileServerExtension}
/// shares one fixture across the test classes of a module.
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
