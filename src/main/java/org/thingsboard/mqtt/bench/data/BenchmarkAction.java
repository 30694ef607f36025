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
package org.thingsboard.mqtt.bench.data;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

@Getter
@RequiredArgsConstructor
public enum BenchmarkAction {
    PUBLISH("Publish", Set.of("p", "pub", "publish")),
    SUBSCRIBE("Subscribe", Set.of("s", "sub", "subscribe"));

    private final String displayName;
    private final Set<String> aliases;

    public static Optional<BenchmarkAction> fromAlias(String alias) {
        if (alias == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(action -> action.aliases.contains(alias))
                .findFirst();
    }
}
