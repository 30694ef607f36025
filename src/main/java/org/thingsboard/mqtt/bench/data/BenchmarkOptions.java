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
import lombok.Value;

/**
 * Validated run parameters. Built once by the command line front-end, never re-validated downstream.
 */
@Value
@Builder
public class BenchmarkOptions {
    String broker;
    int clients;
    int count;
    int messageSize;
    int qos;
}
