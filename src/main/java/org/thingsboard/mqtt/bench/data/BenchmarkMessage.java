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

/**
 * Payload shared by every publisher of a run. The bytes are copied once on creation and must not be
 * modified by callers of {@link #payload()}.
 */
public final class BenchmarkMessage {

    private final byte[] payload;

    private BenchmarkMessage(byte[] payload) {
        this.payload = payload;
    }

    public static BenchmarkMessage of(byte[] payload) {
        return new BenchmarkMessage(payload.clone());
    }

    public byte[] payload() {
        return payload;
    }

    public int size() {
        return payload.length;
    }

    @Override
    public String toString() {
        return "BenchmarkMessage(size=" + size() + ")";
    }
}
