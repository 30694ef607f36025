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

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.paho.client.mqttv3.IMqttActionListener;
import org.eclipse.paho.client.mqttv3.IMqttAsyncClient;
import org.eclipse.paho.client.mqttv3.IMqttToken;
import org.eclipse.paho.client.mqttv3.MqttAsyncClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.thingsboard.mqtt.bench.data.dto.HostPortDto;

@Slf4j
@Service
@RequiredArgsConstructor
public class ClientInitializerImpl implements ClientInitializer {

    private final SslConfig sslConfig;

    @Value("${mqtt.client.keep-alive-seconds:60}")
    private int keepAliveSeconds;
    @Value("${mqtt.client.connect-timeout-seconds:30}")
    private int connectTimeoutSeconds;
    @Value("${mqtt.client.protocol-version:MQTT_3_1_1}")
    private String protocolVersion;
    @Value("${mqtt.client.clean-session:true}")
    private boolean cleanSession;
    @Value("${mqtt.client.username:}")
    private String username;
    @Value("${mqtt.client.password:}")
    private String password;
    @Getter
    @Value("${mqtt.client.disconnect-timeout-ms:1000}")
    private long disconnectTimeoutMs;

    private int mqttVersion;

    @PostConstruct
    public void init() {
        mqttVersion = toMqttVersion(protocolVersion);
        log.debug("Initialized MQTT client factory, protocol version {}", protocolVersion);
    }

    @Override
    public IMqttAsyncClient createClient(String clientId, HostPortDto hostPort) throws MqttException {
        String serverUri = (hostPort.isSsl() ? "ssl" : "tcp") + "://" + hostPort.getHost() + ":" + hostPort.getPort();
        return new MqttAsyncClient(serverUri, clientId, new MemoryPersistence());
    }

    @Override
    public MqttConnectOptions createConnectOptions(HostPortDto hostPort) {
        MqttConnectOptions options = new MqttConnectOptions();
        options.setMqttVersion(mqttVersion);
        options.setCleanSession(cleanSession);
        options.setKeepAliveInterval(keepAliveSeconds);
        options.setConnectionTimeout(connectTimeoutSeconds);
        options.setAutomaticReconnect(false);
        if (!username.isEmpty()) {
            options.setUserName(username);
        }
        if (!password.isEmpty()) {
            options.setPassword(password.toCharArray());
        }
        if (hostPort.isSsl()) {
            options.setSocketFactory(sslConfig.getSslSocketFactory());
        }
        return options;
    }

    @Override
    public IMqttToken connectClient(IMqttAsyncClient client, HostPortDto hostPort, IMqttActionListener listener) throws MqttException {
        return client.connect(createConnectOptions(hostPort), null, listener);
    }

    static int toMqttVersion(String protocolVersion) {
        switch (protocolVersion) {
            case "MQTT_3_1":
                return MqttConnectOptions.MQTT_VERSION_3_1;
            case "MQTT_3_1_1":
                return MqttConnectOptions.MQTT_VERSION_3_1_1;
            default:
                throw new IllegalArgumentException("Unsupported MQTT protocol version: " + protocolVersion);
        }
    }
}
