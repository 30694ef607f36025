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

import org.eclipse.paho.client.mqttv3.IMqttAsyncClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import org.thingsboard.mqtt.bench.data.dto.HostPortDto;

import javax.net.ssl.SSLSocketFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClientInitializerImplTest {

    private final HostPortDto tlsHostPort = new HostPortDto("localhost", 8883, true);
    private final HostPortDto tcpHostPort = new HostPortDto("localhost", 1883, false);

    private ClientInitializerImpl clientInitializer;

    @BeforeEach
    void setUp() {
        SslConfig sslConfig = new SslConfig();
        ReflectionTestUtils.setField(sslConfig, "sslProtocol", "TLSv1.2");
        ReflectionTestUtils.setField(sslConfig, "keyStoreFile", "");
        ReflectionTestUtils.setField(sslConfig, "trustStoreFile", "");

        clientInitializer = new ClientInitializerImpl(sslConfig);
        ReflectionTestUtils.setField(clientInitializer, "keepAliveSeconds", 45);
        ReflectionTestUtils.setField(clientInitializer, "connectTimeoutSeconds", 10);
        ReflectionTestUtils.setField(clientInitializer, "protocolVersion", "MQTT_3_1_1");
        ReflectionTestUtils.setField(clientInitializer, "cleanSession", true);
        ReflectionTestUtils.setField(clientInitializer, "username", "");
        ReflectionTestUtils.setField(clientInitializer, "password", "");
        ReflectionTestUtils.setField(clientInitializer, "disconnectTimeoutMs", 1000L);
        clientInitializer.init();
    }

    @Test
    void givenTlsEndpoint_whenCreateClient_thenSslUriAndSocketFactoryFromDefaultTrustManagers() throws MqttException {
        IMqttAsyncClient client = clientInitializer.createClient("bench0", tlsHostPort);
        try {
            MqttConnectOptions options = clientInitializer.createConnectOptions(tlsHostPort);

            assertThat(client.getServerURI()).isEqualTo("ssl://localhost:8883");
            assertThat(client.getClientId()).isEqualTo("bench0");
            assertThat(options.getSocketFactory()).isInstanceOf(SSLSocketFactory.class);
        } finally {
            client.close();
        }
    }

    @Test
    void givenTcpEndpoint_whenCreateClient_thenTcpUriAndNoSocketFactory() throws MqttException {
        IMqttAsyncClient client = clientInitializer.createClient("bench1", tcpHostPort);
        try {
            assertThat(client.getServerURI()).isEqualTo("tcp://localhost:1883");
            assertThat(clientInitializer.createConnectOptions(tcpHostPort).getSocketFactory()).isNull();
        } finally {
            client.close();
        }
    }

    @Test
    void givenConfiguredSettings_whenCreateConnectOptions_thenSettingsMapped() {
        ReflectionTestUtils.setField(clientInitializer, "username", "bench-user");
        ReflectionTestUtils.setField(clientInitializer, "password", "secret");

        MqttConnectOptions options = clientInitializer.createConnectOptions(tcpHostPort);

        assertThat(options.getMqttVersion()).isEqualTo(MqttConnectOptions.MQTT_VERSION_3_1_1);
        assertThat(options.getKeepAliveInterval()).isEqualTo(45);
        assertThat(options.getConnectionTimeout()).isEqualTo(10);
        assertThat(options.isCleanSession()).isTrue();
        assertThat(options.isAutomaticReconnect()).isFalse();
        assertThat(options.getUserName()).isEqualTo("bench-user");
        assertThat(options.getPassword()).containsExactly('s', 'e', 'c', 'r', 'e', 't');
    }

    @Test
    void givenNoCredentials_whenCreateConnectOptions_thenAnonymousConnect() {
        MqttConnectOptions options = clientInitializer.createConnectOptions(tcpHostPort);

        assertThat(options.getUserName()).isNull();
        assertThat(options.getPassword()).isNull();
    }

    @Test
    void givenProtocolVersionName_whenMapped_thenPahoVersion() {
        assertThat(ClientInitializerImpl.toMqttVersion("MQTT_3_1")).isEqualTo(MqttConnectOptions.MQTT_VERSION_3_1);
        assertThat(ClientInitializerImpl.toMqttVersion("MQTT_3_1_1")).isEqualTo(MqttConnectOptions.MQTT_VERSION_3_1_1);
        assertThatThrownBy(() -> ClientInitializerImpl.toMqttVersion("MQTT_5")).isInstanceOf(IllegalArgumentException.class);
    }
}
