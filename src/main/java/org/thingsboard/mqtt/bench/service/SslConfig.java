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

import com.google.common.io.Resources;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.net.ssl.KeyManager;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import java.io.File;
import java.io.FileInputStream;
import java.io.InputStream;
import java.net.URL;
import java.security.KeyStore;

@Slf4j
@Component
public class SslConfig {
    @Value("${mqtt.ssl.protocol:TLSv1.2}")
    private String sslProtocol;

    @Value("${mqtt.ssl.key_store:}")
    private String keyStoreFile;
    @Value("${mqtt.ssl.key_store_password:}")
    private String keyStorePassword;
    @Value("${mqtt.ssl.key_password:}")
    private String keyPassword;
    @Value("${mqtt.ssl.key_store_type:PKCS12}")
    private String keyStoreType;

    @Value("${mqtt.ssl.trust_store:}")
    private String trustStoreFile;
    @Value("${mqtt.ssl.trust_store_password:}")
    private String trustStorePassword;
    @Value("${mqtt.ssl.trust_store_type:PKCS12}")
    private String trustStoreType;

    private volatile SSLSocketFactory sslSocketFactory;

    /**
     * Lazily builds the socket factory shared by all TLS connections.
     * Without a configured trust store the JVM default trust managers are used.
     */
    public SSLSocketFactory getSslSocketFactory() {
        SSLSocketFactory result = sslSocketFactory;
        if (result == null) {
            synchronized (this) {
                result = sslSocketFactory;
                if (result == null) {
                    result = sslSocketFactory = createSslSocketFactory();
                }
            }
        }
        return result;
    }

    private SSLSocketFactory createSslSocketFactory() {
        try {
            KeyManagerFactory keyManagerFactory = initKeyStore();
            TrustManagerFactory trustManagerFactory = initTrustStore();
            KeyManager[] keyManagers = keyManagerFactory != null ? keyManagerFactory.getKeyManagers() : null;
            TrustManager[] trustManagers = trustManagerFactory != null ? trustManagerFactory.getTrustManagers() : null;
            SSLContext sslContext = SSLContext.getInstance(sslProtocol);
            sslContext.init(keyManagers, trustManagers, null);
            return sslContext.getSocketFactory();
        } catch (Exception e) {
            log.warn("Failed to create SSL socket factory", e);
            throw new IllegalStateException("Failed to create SSL socket factory", e);
        }
    }

    private KeyManagerFactory initKeyStore() throws Exception {
        if (!StringUtils.hasLength(keyStoreFile)) {
            return null;
        }
        File ksFile = getFile(keyStoreFile);
        KeyStore ks = KeyStore.getInstance(keyStoreType);
        try (InputStream ksFileInputStream = new FileInputStream(ksFile)) {
            ks.load(ksFileInputStream, keyStorePassword.toCharArray());
        }
        KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
        kmf.init(ks, keyPassword.toCharArray());
        return kmf;
    }

    private TrustManagerFactory initTrustStore() throws Exception {
        if (!StringUtils.hasLength(trustStoreFile)) {
            return null;
        }
        File tsFile = getFile(trustStoreFile);
        TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        KeyStore trustStore = KeyStore.getInstance(trustStoreType);
        try (InputStream tsFileInputStream = new FileInputStream(tsFile)) {
            trustStore.load(tsFileInputStream, trustStorePassword.toCharArray());
        }
        tmf.init(trustStore);
        return tmf;
    }

    private static File getFile(String filePath) {
        try {
            URL url = Resources.getResource(filePath);
            return new File(url.toURI());
        } catch (Exception e) {
            return new File(filePath);
        }
    }
}
