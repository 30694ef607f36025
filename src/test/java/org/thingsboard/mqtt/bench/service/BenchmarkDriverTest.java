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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import org.thingsboard.mqtt.bench.data.BenchmarkAction;
import org.thingsboard.mqtt.bench.data.BenchmarkOptions;
import org.thingsboard.mqtt.bench.data.BenchmarkResult;
import org.thingsboard.mqtt.bench.data.BenchmarkState;
import org.thingsboard.mqtt.bench.data.ClientHandle;
import org.thingsboard.mqtt.bench.data.ClientsConnectResult;
import org.thingsboard.mqtt.bench.data.dto.HostPortDto;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BenchmarkDriverTest {

    private static final String BROKER = "tcp://localhost:1883";
    private static final HostPortDto HOST_PORT = new HostPortDto("localhost", 1883, false);

    private ClientConnectionService clientConnectionService;
    private MqttClientAdapter mqttClientAdapter;
    private ByteArrayOutputStream output;
    private BenchmarkDriver benchmarkDriver;

    @BeforeEach
    void setUp() {
        clientConnectionService = mock(ClientConnectionService.class);
        mqttClientAdapter = mock(MqttClientAdapter.class);
        output = new ByteArrayOutputStream();

        ClientIdServiceImpl clientIdService = new ClientIdServiceImpl();
        ReflectionTestUtils.setField(clientIdService, "clientIdPrefix", "mqtt-benchmark");
        ReflectionTestUtils.setField(clientIdService, "topicPrefix", "/mqtt-bench/benchmark/");

        benchmarkDriver = new BenchmarkDriver(new PayloadGeneratorImpl(), new BrokerEndpointServiceImpl(),
                clientConnectionService, mqttClientAdapter, clientIdService,
                new BenchmarkReporter(new PrintStream(output, true, StandardCharsets.UTF_8)));
        ReflectionTestUtils.setField(benchmarkDriver, "settleDelayMs", 0L);
    }

    @Test
    void givenAllClientsConnected_whenPublish_thenClientsTimesCountPublishesAndReport() throws InterruptedException {
        List<ClientHandle> clients = handles(2);
        when(clientConnectionService.connectClients(HOST_PORT, 2)).thenReturn(new ClientsConnectResult(2, clients, 0));
        Set<String> topics = ConcurrentHashMap.newKeySet();
        when(mqttClientAdapter.publish(any(), anyString(), eq(1), any())).thenAnswer(invocation -> {
            topics.add(invocation.getArgument(1));
            return true;
        });

        Optional<BenchmarkResult> result = benchmarkDriver.execute(BenchmarkAction.PUBLISH, options(2, 5, 1));

        assertThat(result).isPresent();
        assertThat(result.get().getTotalOperations()).isEqualTo(10);
        assertThat(result.get().getFailedOperations()).isZero();
        verify(mqttClientAdapter, times(10)).publish(any(), anyString(), eq(1), any());
        assertThat(topics).hasSize(10).contains("/mqtt-bench/benchmark/0/0", "/mqtt-bench/benchmark/1/4");
        clients.forEach(client -> verify(mqttClientAdapter).disconnect(client));
        assertThat(benchmarkDriver.getState()).isEqualTo(BenchmarkState.REPORTED);
        assertThat(output.toString(StandardCharsets.UTF_8))
                .contains("Publish result : broker=tcp://localhost:1883, clients=2, count=5, duration=");
    }

    @Test
    void givenSubscribeAction_whenExecute_thenSubscribesOnly() throws InterruptedException {
        List<ClientHandle> clients = handles(3);
        when(clientConnectionService.connectClients(HOST_PORT, 3)).thenReturn(new ClientsConnectResult(3, clients, 0));
        when(mqttClientAdapter.subscribe(any(), anyString(), anyInt())).thenReturn(true);

        Optional<BenchmarkResult> result = benchmarkDriver.execute(BenchmarkAction.SUBSCRIBE, options(3, 4, 0));

        assertThat(result).isPresent();
        verify(mqttClientAdapter, times(12)).subscribe(any(), anyString(), eq(0));
        verify(mqttClientAdapter, never()).publish(any(), anyString(), anyInt(), any());
        assertThat(output.toString(StandardCharsets.UTF_8)).contains("Subscribe result : ");
    }

    @Test
    void givenConnectFailure_whenExecute_thenAbortDisconnectsPartialClientsWithoutOperations() throws InterruptedException {
        List<ClientHandle> connected = handles(2);
        when(clientConnectionService.connectClients(HOST_PORT, 3)).thenReturn(new ClientsConnectResult(3, connected, 1));

        Optional<BenchmarkResult> result = benchmarkDriver.execute(BenchmarkAction.PUBLISH, options(3, 5, 0));

        assertThat(result).isEmpty();
        assertThat(benchmarkDriver.getState()).isEqualTo(BenchmarkState.ABORTED);
        connected.forEach(client -> verify(mqttClientAdapter).disconnect(client));
        verify(mqttClientAdapter, never()).publish(any(), anyString(), anyInt(), any());
        verify(mqttClientAdapter, never()).subscribe(any(), anyString(), anyInt());
        assertThat(output.toString(StandardCharsets.UTF_8)).doesNotContain(" result : ");
    }

    @Test
    void givenOneClientFailing_whenPublish_thenSiblingsFinishAndTotalStaysClientsTimesCount() throws InterruptedException {
        List<ClientHandle> clients = handles(2);
        when(clientConnectionService.connectClients(HOST_PORT, 2)).thenReturn(new ClientsConnectResult(2, clients, 0));
        when(mqttClientAdapter.publish(eq(clients.get(0)), anyString(), anyInt(), any())).thenReturn(false);
        when(mqttClientAdapter.publish(eq(clients.get(1)), anyString(), anyInt(), any())).thenReturn(true);

        Optional<BenchmarkResult> result = benchmarkDriver.execute(BenchmarkAction.PUBLISH, options(2, 5, 0));

        assertThat(result).isPresent();
        assertThat(result.get().getTotalOperations()).isEqualTo(10);
        assertThat(result.get().getFailedOperations()).isEqualTo(5);
        verify(mqttClientAdapter, times(5)).publish(eq(clients.get(1)), anyString(), anyInt(), any());
    }

    @Test
    void givenFinishedRun_whenExecuteAgain_thenNewRunStarts() throws InterruptedException {
        List<ClientHandle> clients = handles(1);
        when(clientConnectionService.connectClients(HOST_PORT, 1)).thenReturn(new ClientsConnectResult(1, clients, 0));
        when(mqttClientAdapter.publish(any(), anyString(), anyInt(), any())).thenReturn(true);

        assertThat(benchmarkDriver.execute(BenchmarkAction.PUBLISH, options(1, 1, 0))).isPresent();
        assertThat(benchmarkDriver.execute(BenchmarkAction.PUBLISH, options(1, 1, 0))).isPresent();
    }

    private static BenchmarkOptions options(int clients, int count, int qos) {
        return BenchmarkOptions.builder()
                .broker(BROKER)
                .clients(clients)
                .count(count)
                .messageSize(16)
                .qos(qos)
                .build();
    }

    private static List<ClientHandle> handles(int clients) {
        List<ClientHandle> handles = new ArrayList<>(clients);
        for (int i = 0; i < clients; i++) {
            handles.add(new ClientHandle(i, "mqtt-benchmark" + i, mock(IMqttAsyncClient.class)));
        }
        return handles;
    }
}
