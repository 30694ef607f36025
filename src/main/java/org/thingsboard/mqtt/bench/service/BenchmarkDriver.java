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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.time.StopWatch;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.thingsboard.mqtt.bench.data.BenchmarkAction;
import org.thingsboard.mqtt.bench.data.BenchmarkMessage;
import org.thingsboard.mqtt.bench.data.BenchmarkOptions;
import org.thingsboard.mqtt.bench.data.BenchmarkResult;
import org.thingsboard.mqtt.bench.data.BenchmarkState;
import org.thingsboard.mqtt.bench.data.ClientHandle;
import org.thingsboard.mqtt.bench.data.ClientsConnectResult;
import org.thingsboard.mqtt.bench.data.dto.HostPortDto;
import org.thingsboard.mqtt.bench.util.ThingsBoardThreadFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Runs one benchmark: connect all clients, run one worker per client inside the timed window,
 * disconnect everything and report the throughput.
 * <p>
 * The only coordination in the timed window is the latch every worker counts down when it is done.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BenchmarkDriver {

    private final PayloadGenerator payloadGenerator;
    private final BrokerEndpointService brokerEndpointService;
    private final ClientConnectionService clientConnectionService;
    private final MqttClientAdapter mqttClientAdapter;
    private final ClientIdService clientIdService;
    private final BenchmarkReporter benchmarkReporter;

    @Value("${benchmark.settle-delay-ms:3000}")
    private long settleDelayMs;

    private volatile BenchmarkState state = BenchmarkState.IDLE;

    /**
     * @return the run result, or an empty optional if the run was aborted before reporting
     */
    public Optional<BenchmarkResult> execute(BenchmarkAction action, BenchmarkOptions options) {
        if (!state.isTerminal() && state != BenchmarkState.IDLE) {
            throw new IllegalStateException("Benchmark is already running, state - " + state);
        }
        state = BenchmarkState.IDLE;
        log.info("Start {} benchmark: {}.", action, options);

        BenchmarkMessage message = BenchmarkMessage.of(payloadGenerator.generatePayload(options.getMessageSize()));
        HostPortDto hostPort = brokerEndpointService.resolve(options.getBroker());

        transitionTo(BenchmarkState.CONNECTING);
        ClientsConnectResult connectResult = clientConnectionService.connectClients(hostPort, options.getClients());
        List<ClientHandle> clients = connectResult.getConnectedClients();
        if (!connectResult.isSuccess()) {
            transitionTo(BenchmarkState.ABORTED);
            log.error("Aborting benchmark: {} of {} clients failed to connect.",
                    options.getClients() - clients.size(), options.getClients());
            disconnectAll(clients);
            return Optional.empty();
        }
        transitionTo(BenchmarkState.CONNECTED);

        BenchmarkResult result;
        try {
            if (settleDelayMs > 0) {
                Thread.sleep(settleDelayMs);
            }
            transitionTo(BenchmarkState.RUNNING);
            result = runWorkers(action, options, message, clients);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Benchmark was interrupted, disconnecting {} clients.", clients.size());
            transitionTo(BenchmarkState.DISCONNECTING);
            disconnectAll(clients);
            transitionTo(BenchmarkState.ABORTED);
            return Optional.empty();
        }

        transitionTo(BenchmarkState.DISCONNECTING);
        disconnectAll(clients);

        benchmarkReporter.report(result);
        transitionTo(BenchmarkState.REPORTED);
        return Optional.of(result);
    }

    public BenchmarkState getState() {
        return state;
    }

    private BenchmarkResult runWorkers(BenchmarkAction action, BenchmarkOptions options, BenchmarkMessage message,
                                       List<ClientHandle> clients) throws InterruptedException {
        List<BenchmarkWorker> workers = new ArrayList<>(clients.size());
        for (ClientHandle client : clients) {
            workers.add(new BenchmarkWorker(client, action, options.getCount(), options.getQos(), message,
                    mqttClientAdapter, clientIdService));
        }

        ThreadPoolExecutor workerExecutor = new ThreadPoolExecutor(clients.size(), clients.size(), 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), ThingsBoardThreadFactory.forName("benchmark-worker"));
        workerExecutor.prestartAllCoreThreads();
        CountDownLatch finishedLatch = new CountDownLatch(workers.size());
        StopWatch stopWatch = new StopWatch();
        try {
            stopWatch.start();
            for (BenchmarkWorker worker : workers) {
                workerExecutor.execute(() -> {
                    try {
                        worker.run();
                    } finally {
                        finishedLatch.countDown();
                    }
                });
            }
            finishedLatch.await();
            stopWatch.stop();
        } finally {
            workerExecutor.shutdownNow();
        }

        long failedOperations = workers.stream().mapToLong(BenchmarkWorker::getFailedOperations).sum();
        log.info("{} workers finished {} operations in {} ms.", workers.size(),
                workers.stream().mapToLong(BenchmarkWorker::getAttemptedOperations).sum(), stopWatch.getTime());
        return BenchmarkResult.builder()
                .action(action)
                .broker(options.getBroker())
                .clients(options.getClients())
                .count(options.getCount())
                .elapsedNanos(stopWatch.getNanoTime())
                .failedOperations(failedOperations)
                .build();
    }

    private void disconnectAll(List<ClientHandle> clients) {
        log.info("Disconnecting {} clients.", clients.size());
        for (ClientHandle client : clients) {
            mqttClientAdapter.disconnect(client);
        }
    }

    private void transitionTo(BenchmarkState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal benchmark state transition " + state + " -> " + next);
        }
        log.debug("Benchmark state {} -> {}", state, next);
        state = next;
    }
}
