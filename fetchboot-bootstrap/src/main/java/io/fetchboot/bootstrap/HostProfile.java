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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// The concurrency available on this host.
///
/// @param cpuCount available processors
/// @param deviceCount visible accelerator devices, 0 if none
public record HostProfile(int cpuCount, int deviceCount) {
    private static final Logger logger = LogManager.getLogger(HostProfile.class);

    /// System property that sets the device count explicitly
    public static final String DEVICES_PROPERTY = "fetchboot.devices";
    /// Environment variable listing visible devices, comma separated
    public static final String VISIBLE_DEVICES_ENV = "CUDA_VISIBLE_DEVICES";

    public HostProfile {
        if (cpuCount < 1) {
            throw new IllegalArgumentException("cpuCount must be at least 1: " + cpuCount);
        }
        if (deviceCount < 0) {
            throw new IllegalArgumentException("deviceCount must not be negative: " + deviceCount);
        }
    }

    /// Detects the processor count from the runtime, and the device count from the
    /// `fetchboot.devices` system property, else from `CUDA_VISIBLE_DEVICES`, else 0.
    /// @return the host profile
    public static HostProfile detect() {
        return new HostProfile(
                Runtime.getRuntime().availableProcessors(),
                deviceCount(System.getProperty(DEVICES_PROPERTY), System.getenv(VISIBLE_DEVICES_ENV)));
    }

    static int deviceCount(String property, String visibleDevices) {
        if (property != null && !property.isBlank()) {
            try {
                return Math.max(0, Integer.parseInt(property.trim()));
            } catch (NumberFormatException e) {
                logger.warn("Ignoring {}={}, not a number", DEVICES_PROPERTY, property);
            }
        }
        if (visibleDevices == null || visibleDevices.isBlank()) {
            return 0;
        }
        int count = 0;
        for (String entry : visibleDevices.split(",")) {
            String device = entry.trim();
            // a negative or empty id hides this and every following device
            if (device.isEmpty() || device.startsWith("-")) {
                break;
            }
            count++;
        }
        return count;
    }

    /// @return the processors available to each device, counting at least one device
    public int cpusPerDevice() {
        return cpuCount / Math.max(deviceCount, 1);
    }
}
