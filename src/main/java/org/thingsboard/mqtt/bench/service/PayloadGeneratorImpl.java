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

import org.springframework.stereotype.Service;

@Service
public class PayloadGeneratorImpl implements PayloadGenerator {

    /**
     * Repeats the ASCII digits 0-9 until the payload is exactly {@code size} bytes long.
     */
    @Override
    public byte[] generatePayload(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("Payload size must not be negative: " + size);
        }
        byte[] payload = new byte[size];
        for (int i = 0; i < size; i++) {
            payload[i] = (byte) ('0' + i % 10);
        }
        return payload;
    }
}
