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
package org.thingsboard.mqtt.bench.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.thingsboard.mqtt.bench.data.BenchmarkResult;

import java.io.PrintStream;
import java.util.Locale;

@Slf4j
@Component
public class BenchmarkReporter {

    private final PrintStream out;

    public BenchmarkReporter() {
        this(System.out);
    }

    BenchmarkReporter(PrintStream out) {
        this.out = out;
    }

    public void report(BenchmarkResult result) {
        if (result.getFailedOperations() > 0) {
            log.warn("{} of {} operations failed.", result.getFailedOperations(), result.getTotalOperations());
        }
        out.println();
        out.println(format(result));
        out.flush();
    }

    // duration is truncated to whole milliseconds, throughput is computed from the nanosecond elapsed time
    public static String format(BenchmarkResult result) {
        return String.format(Locale.ROOT, "%s result : broker=%s, clients=%d, count=%d, duration=%dms, throughput=%.2fmessages/sec",
                result.getAction().getDisplayName(), result.getBroker(), result.getClients(), result.getCount(),
                result.getDurationMillis(), result.getThroughput());
    }
}
