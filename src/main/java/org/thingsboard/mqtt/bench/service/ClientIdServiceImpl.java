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

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class ClientIdServiceImpl implements ClientIdService {

    @Value("${benchmark.client-id-prefix:mqtt-benchmark}")
    private String clientIdPrefix;
    @Value("${benchmark.topic-prefix:/mqtt-bench/benchmark/}")
    private String topicPrefix;

    @Override
    public String createClientId(int clientIndex) {
        return clientIdPrefix + clientIndex;
    }

    // the '/' between the indexes keeps (1, 11) and (11, 1) apart
    @Override
    public String createTopic(int clientIndex, int iteration) {
        return topicPrefix + clientIndex + "/" + iteration;
    }
}
