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
package org.thingsboard.mqtt.bench.cli;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.thingsboard.mqtt.bench.data.BenchmarkAction;
import org.thingsboard.mqtt.bench.data.BenchmarkOptions;
import org.thingsboard.mqtt.bench.service.BenchmarkDriver;
import org.thingsboard.mqtt.bench.service.BrokerEndpointService;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.Optional;
import java.util.concurrent.Callable;

@Slf4j
@Component
@RequiredArgsConstructor
@CommandLine.Command(name = "mqtt-bench", sortOptions = false, showDefaultValues = true,
        description = "Measures the publish or subscribe throughput of an MQTT broker using concurrent clients.")
public class BenchmarkCommand implements Callable<Integer> {

    static final String BROKER_PLACEHOLDER = "tcp://{host}:{port}";
    static final String ACTION_PLACEHOLDER = "p/pub/publish or s/sub/subscribe";

    private final BenchmarkDriver benchmarkDriver;
    private final BrokerEndpointService brokerEndpointService;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "-broker", paramLabel = "<uri>", defaultValue = BROKER_PLACEHOLDER,
            description = "URI of MQTT broker (required)")
    private String broker;

    @CommandLine.Option(names = "-action", paramLabel = "<action>", defaultValue = ACTION_PLACEHOLDER,
            description = "Publish or Subscribe (required)")
    private String action;

    @CommandLine.Option(names = "-clients", paramLabel = "<int>", defaultValue = "10",
            description = "Number of clients")
    private int clients;

    @CommandLine.Option(names = "-count", paramLabel = "<int>", defaultValue = "100",
            description = "Number of loops per client")
    private int count;

    @CommandLine.Option(names = "-size", paramLabel = "<int>", defaultValue = "1024",
            description = "Message size per publish (byte)")
    private int size;

    @CommandLine.Option(names = "-qos", paramLabel = "<int>", defaultValue = "0",
            description = "MQTT QoS (0/1/2)")
    private int qos;

    @CommandLine.Option(names = {"-h", "-help", "--help"}, usageHelp = true,
            description = "Print this help and exit")
    private boolean helpRequested;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        if (BROKER_PLACEHOLDER.equals(broker) || !brokerEndpointService.isValid(broker)) {
            return invalidArgument(out, "broker", broker);
        }
        Optional<BenchmarkAction> benchmarkAction = BenchmarkAction.fromAlias(action);
        if (benchmarkAction.isEmpty()) {
            return invalidArgument(out, "action", action);
        }
        if (clients < 1) {
            return invalidArgument(out, "clients", clients);
        }
        if (count < 1) {
            return invalidArgument(out, "count", count);
        }
        if (size < 0) {
            return invalidArgument(out, "size", size);
        }
        if (qos < 0 || qos > 2) {
            return invalidArgument(out, "qos", qos);
        }

        BenchmarkOptions options = BenchmarkOptions.builder()
                .broker(broker)
                .clients(clients)
                .count(count)
                .messageSize(size)
                .qos(qos)
                .build();
        return benchmarkDriver.execute(benchmarkAction.get(), options).isPresent()
                ? ExitCodes.OK
                : ExitCodes.CONNECTION_FAILURE;
    }

    private static int invalidArgument(PrintWriter out, String option, Object value) {
        log.debug("Rejected -{} value {}", option, value);
        out.printf("Invalid argument : -%s -> %s%n", option, value);
        out.flush();
        return ExitCodes.INVALID_ARGUMENT;
    }
}
