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

import java.util.EnumSet;
import java.util.Set;

public enum BenchmarkState {
    IDLE,
    CONNECTING,
    ABORTED,
    CONNECTED,
    RUNNING,
    DISCONNECTING,
    REPORTED;

    public boolean isTerminal() {
        return this == ABORTED || this == REPORTED;
    }

    public boolean canTransitionTo(BenchmarkState next) {
        return allowedTransitions().contains(next);
    }

    private Set<BenchmarkState> allowedTransitions() {
        switch (this) {
            case IDLE:
                return EnumSet.of(CONNECTING);
            case CONNECTING:
                return EnumSet.of(ABORTED, CONNECTED);
            case CONNECTED:
                return EnumSet.of(RUNNING, DISCONNECTING);
            case RUNNING:
                return EnumSet.of(DISCONNECTING);
            case DISCONNECTING:
                return EnumSet.of(REPORTED, ABORTED);
            default:
                return EnumSet.of(IDLE);
        }
    }
}
