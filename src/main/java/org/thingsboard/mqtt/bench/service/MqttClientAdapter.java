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

import com.google.common.util.concurrent.ListenableFuture;
import org.thingsboard.mqtt.bench.data.BenchmarkMessage;
import org.thingsboard.mqtt.bench.data.ClientHandle;
import org.thingsboard.mqtt.bench.data.dto.HostPortDto;

/**
 * Single-operation access to one benchmark client. Operation failures are logged and reported
 * as return values, they are never thrown.
 */
public interface MqttClientAdapter {

    /**
     * Connects client number {@code clientIndex}. The future never fails: it completes with
     * {@code null} when the connection could not be established.
     */
    ListenableFuture<ClientHandle> connect(HostPortDto hostPort, int clientIndex);

    /**
     * Blocks until the broker acknowledged the message (or, for QoS 0, until it was written).
     *
     * @return {@code false} if the publish failed
     */
    boolean publish(ClientHandle client, String topic, int qos, BenchmarkMessage message) throws InterruptedException;

    /**
     * Blocks until SUBACK.
     *
     * @return {@code false} if the subscription failed or was rejected
     */
    boolean subscribe(ClientHandle client, String topic, int qos) throws InterruptedException;

    /**
     * Best-effort close, never throws.
     */
    void disconnect(ClientHandle client);
}
