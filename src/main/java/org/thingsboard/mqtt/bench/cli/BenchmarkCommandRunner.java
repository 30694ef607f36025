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
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class BenchmarkCommandRunner implements CommandLineRunner, ExitCodeGenerator {

    private final BenchmarkCommand benchmarkCommand;

    private volatile int exitCode = ExitCodes.OK;

    @Override
    public void run(String... args) {
        exitCode = execute(args, new PrintWriter(System.out, true), new PrintWriter(System.err, true));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(String[] args, PrintWriter out, PrintWriter err) {
        List<String> commandArgs = withoutSpringProperties(args);
        CommandLine commandLine = new CommandLine(benchmarkCommand);
        commandLine.setOut(out);
        commandLine.setErr(err);
        if (commandArgs.isEmpty()) {
            commandLine.usage(out);
            out.flush();
            return ExitCodes.OK;
        }
        return commandLine.execute(commandArgs.toArray(new String[0]));
    }

    /**
     * Drops {@code --some.property=value} arguments, they are consumed by Spring's environment.
     */
    static List<String> withoutSpringProperties(String[] args) {
        return Arrays.stream(args)
                .filter(arg -> !isSpringProperty(arg))
                .collect(Collectors.toList());
    }

    private static boolean isSpringProperty(String arg) {
        if (!arg.startsWith("--")) {
            return false;
        }
        int separator = arg.indexOf('=');
        String name = separator > 0 ? arg.substring(2, separator) : arg.substring(2);
        return name.contains(".");
    }
}
