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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.time.StopWatch;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.thingsboard.mqtt.bench.data.ClientHandle;
import org.thingsboard.mqtt.bench.data.ClientsConnectResult;
import org.thingsboard.mqtt.bench.data.dto.HostPortDto;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;

@Slf4j
@Service
@RequiredArgsConstructor
public class ClientConnectionServiceImpl implements ClientConnectionService {

    private final MqttClientAdapter mqttClientAdapter;

    @Value("${benchmark.max-concurrent-connects:100}")
    private int maxConcurrentConnects;

    @Override
    public ClientsConnectResult connectClients(HostPortDto hostPort, int clients) {
        int batchSize = Math.max(1, maxConcurrentConnects);
        List<ClientHandle> connectedClients = new ArrayList<>(clients);
        int failedClients = 0;

        log.info("Started connecting {} clients to {}:{}.", clients, hostPort.getHost(), hostPort.getPort());
        StopWatch stopWatch = StopWatch.createStarted();
        for (int i = 0; i < clients && failedClients == 0; i += batchSize) {
            int clientsToProcess = Math.min(batchSize, clients - i);
            List<ListenableFuture<ClientHandle>> batch = new ArrayList<>(clientsToProcess);
            for (int clientIndex = i; clientIndex < i + clientsToProcess; clientIndex++) {
                batch.add(mqttClientAdapter.connect(hostPort, clientIndex));
            }
            for (int j = 0; j < batch.size(); j++) {
                ListenableFuture<ClientHandle> future = batch.get(j);
                ClientHandle client;
                try {
                    client = future.get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while connecting clients, {} clients connected so far.", connectedClients.size());
                    disconnectWhenConnected(batch.subList(j, batch.size()));
                    return new ClientsConnectResult(clients, connectedClients, failedClients);
                } catch (ExecutionException e) {
                    log.warn("Unexpected failure while connecting client", e.getCause());
                    client = null;
                }
                if (client != null) {
                    connectedClients.add(client);
                } else {
                    failedClients++;
                }
            }
            log.debug("Connected {} of {} clients.", connectedClients.size(), clients);
        }
        stopWatch.stop();

        if (failedClients > 0) {
            log.warn("Failed to connect {} clients, {} clients connected.", failedClients, connectedClients.size());
        } else {
            log.info("Connecting {} clients took {} ms.", clients, stopWatch.getTime());
        }
        return new ClientsConnectResult(clients, connectedClients, failedClients);
    }

    private void disconnectWhenConnected(List<ListenableFuture<ClientHandle>> futures) {
        for (ListenableFuture<ClientHandle> future : futures) {
            future.addListener(() -> {
                ClientHandle client = future.isCancelled() ? null : Futures.getUnchecked(future);
                if (client != null) {
                    mqttClientAdapter.disconnect(client);
                }
            }, MoreExecutors.directExecutor());
        }
    }
}
