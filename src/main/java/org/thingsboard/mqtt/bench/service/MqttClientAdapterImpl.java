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

import com.google.common.base.Throwables;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.paho.client.mqttv3.IMqttActionListener;
import org.eclipse.paho.client.mqttv3.IMqttAsyncClient;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.IMqttToken;
import org.eclipse.paho.client.mqttv3.MqttCallback;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.springframework.stereotype.Service;
import org.thingsboard.mqtt.bench.data.BenchmarkMessage;
import org.thingsboard.mqtt.bench.data.ClientHandle;
import org.thingsboard.mqtt.bench.data.dto.HostPortDto;

@Slf4j
@Service
@RequiredArgsConstructor
public class MqttClientAdapterImpl implements MqttClientAdapter {

    // SUBACK return code for a rejected subscription
    private static final int SUBSCRIPTION_FAILURE = 0x80;

    private final ClientInitializer clientInitializer;
    private final ClientIdService clientIdService;

    @Override
    public ListenableFuture<ClientHandle> connect(HostPortDto hostPort, int clientIndex) {
        String clientId = clientIdService.createClientId(clientIndex);
        SettableFuture<ClientHandle> future = SettableFuture.create();
        IMqttAsyncClient client;
        try {
            client = clientInitializer.createClient(clientId, hostPort);
        } catch (Exception e) {
            log.warn("[{}] Failed to create client, reason - {}", clientId, describe(e));
            future.set(null);
            return future;
        }
        client.setCallback(new LoggingCallback(clientId));
        try {
            clientInitializer.connectClient(client, hostPort, new IMqttActionListener() {
                @Override
                public void onSuccess(IMqttToken asyncActionToken) {
                    log.trace("[{}] Connected, session present - {}", clientId, asyncActionToken.getSessionPresent());
                    future.set(new ClientHandle(clientIndex, clientId, client));
                }

                @Override
                public void onFailure(IMqttToken asyncActionToken, Throwable t) {
                    log.warn("[{}] Failed to connect client to {}:{}, reason - {}",
                            clientId, hostPort.getHost(), hostPort.getPort(), describe(t));
                    closeQuietly(clientId, client);
                    future.set(null);
                }
            });
        } catch (Exception e) {
            log.warn("[{}] Failed to connect client to {}:{}, reason - {}",
                    clientId, hostPort.getHost(), hostPort.getPort(), describe(e));
            closeQuietly(clientId, client);
            future.set(null);
        }
        return future;
    }

    @Override
    public boolean publish(ClientHandle client, String topic, int qos, BenchmarkMessage message) throws InterruptedException {
        try {
            IMqttDeliveryToken token = client.getClient().publish(topic, message.payload(), qos, false);
            token.waitForCompletion();
            return true;
        } catch (MqttException e) {
            rethrowIfInterrupted(e);
            log.warn("[{}] Failed to publish msg to topic {}, reason - {}", client.getClientId(), topic, describe(e));
            return false;
        }
    }

    @Override
    public boolean subscribe(ClientHandle client, String topic, int qos) throws InterruptedException {
        try {
            IMqttToken token = client.getClient().subscribe(topic, qos);
            token.waitForCompletion();
            int[] grantedQos = token.getGrantedQos();
            if (grantedQos != null && grantedQos.length > 0 && grantedQos[0] >= SUBSCRIPTION_FAILURE) {
                log.warn("[{}] Subscription to topic {} was rejected by the broker", client.getClientId(), topic);
                return false;
            }
            return true;
        } catch (MqttException e) {
            rethrowIfInterrupted(e);
            log.warn("[{}] Failed to subscribe to topic {}, reason - {}", client.getClientId(), topic, describe(e));
            return false;
        }
    }

    @Override
    public void disconnect(ClientHandle client) {
        closeQuietly(client.getClientId(), client.getClient());
    }

    private void closeQuietly(String clientId, IMqttAsyncClient client) {
        try {
            if (client.isConnected()) {
                client.disconnectForcibly(0, clientInitializer.getDisconnectTimeoutMs());
            }
        } catch (MqttException e) {
            log.debug("[{}] Failed to disconnect client", clientId, e);
        }
        try {
            client.close();
        } catch (MqttException e) {
            log.debug("[{}] Failed to close client", clientId, e);
        }
    }

    // Paho reports an interrupted wait as an MqttException
    private static void rethrowIfInterrupted(MqttException e) throws InterruptedException {
        if (e.getCause() instanceof InterruptedException) {
            InterruptedException interrupted = new InterruptedException(e.getMessage());
            interrupted.initCause(e);
            throw interrupted;
        }
    }

    private static String describe(Throwable t) {
        Throwable rootCause = Throwables.getRootCause(t);
        return rootCause.getMessage() != null
                ? rootCause.getClass().getSimpleName() + ": " + rootCause.getMessage()
                : rootCause.getClass().getSimpleName();
    }

    private static class LoggingCallback implements MqttCallback {

        private final String clientId;

        LoggingCallback(String clientId) {
            this.clientId = clientId;
        }

        @Override
        public void connectionLost(Throwable cause) {
            log.warn("[{}] Connection lost, reason - {}", clientId, cause != null ? describe(cause) : "unknown");
        }

        @Override
        public void messageArrived(String topic, MqttMessage message) {
            log.trace("[{}] Received msg from topic {}", clientId, topic);
        }

        @Override
        public void deliveryComplete(IMqttDeliveryToken token) {
        }
    }
}
