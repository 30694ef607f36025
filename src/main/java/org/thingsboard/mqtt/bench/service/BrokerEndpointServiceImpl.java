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

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.thingsboard.mqtt.bench.data.dto.HostPortDto;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

@Slf4j
@Service
public class BrokerEndpointServiceImpl implements BrokerEndpointService {

    static final int DEFAULT_PORT = 1883;
    static final int DEFAULT_SSL_PORT = 8883;

    @Override
    public HostPortDto resolve(String brokerUri) {
        if (StringUtils.isBlank(brokerUri)) {
            throw new IllegalArgumentException("Broker URI is empty");
        }
        URI uri;
        try {
            uri = new URI(brokerUri.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Malformed broker URI " + brokerUri, e);
        }
        if (uri.getScheme() == null) {
            throw new IllegalArgumentException("Broker URI " + brokerUri + " has no scheme");
        }
        boolean ssl;
        switch (uri.getScheme().toLowerCase(Locale.ROOT)) {
            case "tcp":
            case "mqtt":
                ssl = false;
                break;
            case "ssl":
            case "tls":
            case "mqtts":
                ssl = true;
                break;
            default:
                throw new IllegalArgumentException("Unsupported broker URI scheme " + uri.getScheme());
        }
        if (StringUtils.isEmpty(uri.getHost())) {
            throw new IllegalArgumentException("Broker URI " + brokerUri + " has no host");
        }
        int port = uri.getPort() != -1 ? uri.getPort() : (ssl ? DEFAULT_SSL_PORT : DEFAULT_PORT);
        HostPortDto hostPort = new HostPortDto(uri.getHost(), port, ssl);
        log.debug("Resolved broker {} to {}", brokerUri, hostPort);
        return hostPort;
    }

    @Override
    public boolean isValid(String brokerUri) {
        try {
            resolve(brokerUri);
            return true;
        } catch (IllegalArgumentException e) {
            log.debug("Invalid broker URI {}: {}", brokerUri, e.getMessage());
            return false;
        }
    }
}
