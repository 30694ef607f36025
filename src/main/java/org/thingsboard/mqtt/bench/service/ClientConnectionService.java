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

import org.thingsboard.mqtt.bench.data.ClientsConnectResult;
import org.thingsboard.mqtt.bench.data.dto.HostPortDto;

public interface ClientConnectionService {

    /**
     * Connects clients {@code 0..clients-1}, stopping after the first batch that contains a failure.
     * On interruption the interrupt flag is restored and the partial result is returned.
     */
    ClientsConnectResult connectClients(HostPortDto hostPort, int clients);
}
