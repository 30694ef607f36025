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

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PayloadGeneratorImplTest {

    private final PayloadGenerator payloadGenerator = new PayloadGeneratorImpl();

    @Test
    void givenSizeAboveTen_whenGeneratePayload_thenDigitsRepeat() {
        byte[] payload = payloadGenerator.generatePayload(13);

        assertThat(new String(payload, StandardCharsets.US_ASCII)).isEqualTo("0123456789012");
    }

    @Test
    void givenDefaultSize_whenGeneratePayload_thenLengthMatchesAndLastByteFollowsCycle() {
        byte[] payload = payloadGenerator.generatePayload(1024);

        assertThat(payload).hasSize(1024);
        assertThat(payload[1023]).isEqualTo((byte) '3');
    }

    @Test
    void givenZeroSize_whenGeneratePayload_thenEmpty() {
        assertThat(payloadGenerator.generatePayload(0)).isEmpty();
    }

    @Test
    void givenNegativeSize_whenGeneratePayload_thenRejected() {
        assertThatThrownBy(() -> payloadGenerator.generatePayload(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
