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

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.thingsboard.mqtt.bench.data.BenchmarkAction;
import org.thingsboard.mqtt.bench.data.BenchmarkMessage;
import org.thingsboard.mqtt.bench.data.ClientHandle;

/**
 * Runs the operations of one client sequentially. Counters are plain fields: they are written
 * by the worker thread only and read by the driver after the join barrier.
 */
@Slf4j
public class BenchmarkWorker implements Runnable {

    private final ClientHandle client;
    private final BenchmarkAction action;
    private final int count;
    private final int qos;
    private final BenchmarkMessage message;
    private final MqttClientAdapter mqttClientAdapter;
    private final ClientIdService clientIdService;

    @Getter
    private int attemptedOperations;
    @Getter
    private int failedOperations;

    public BenchmarkWorker(ClientHandle client, BenchmarkAction action, int count, int qos, BenchmarkMessage message,
                           MqttClientAdapter mqttClientAdapter, ClientIdService clientIdService) {
        this.client = client;
        this.action = action;
        this.count = count;
        this.qos = qos;
        this.message = message;
        this.mqttClientAdapter = mqttClientAdapter;
        this.clientIdService = clientIdService;
    }

    @Override
    public void run() {
        try {
            for (int iteration = 0; iteration < count; iteration++) {
                String topic = clientIdService.createTopic(client.getClientIndex(), iteration);
                boolean success;
                if (action == BenchmarkAction.PUBLISH) {
                    success = mqttClientAdapter.publish(client, topic, qos, message);
                } else {
                    success = mqttClientAdapter.subscribe(client, topic, qos);
                }
                attemptedOperations++;
                if (!success) {
                    failedOperations++;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Worker was interrupted after {} of {} operations", client.getClientId(), attemptedOperations, count);
        }
    }
}
