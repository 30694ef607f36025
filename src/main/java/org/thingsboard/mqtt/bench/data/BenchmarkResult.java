/**
 * Copyright © 2016-2024 The Thingsboard Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.thingsboard.mqtt.bench.data;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.concurrent.TimeUnit;

@Getter
@Builder
@ToString
public class BenchmarkResult {
    private static final double NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

    private final BenchmarkAction action;
    private final String broker;
    private final int clients;
    private final int count;
    private final long elapsedNanos;
    private final long failedOperations;

    /**
     * Attempted operations, failed ones included.
     */
    public long getTotalOperations() {
        return (long) clients * count;
    }

    public long getDurationMillis() {
        return TimeUnit.NANOSECONDS.toMillis(elapsedNanos);
    }

    public double getThroughput() {
        return getTotalOperations() / (Math.max(elapsedNanos, 1L) / NANOS_PER_SECOND);
    }
}
