package com.monitintel.service.http;

import com.monitintel.service.config.MonitorConfig;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.util.logging.Logger;

/**
 * Builds the client shared by the Monit poll and the analysis handoff.
 */
public final class HttpClientFactory {
    private static final Logger LOGGER = Logger.getLogger(HttpClientFactory.class.getName());

    private HttpClientFactory() {
    }

    public static HttpClient create(MonitorConfig config) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(config.requestTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL);
        config.truststore().ifPresent(truststore -> {
            if (config.truststorePassword() == null) {
                throw new IllegalStateException("truststorePassword must be set when truststorePath is configured");
            }
            builder.sslContext(trusting(truststore, config.truststorePassword().toCharArray()));
        });
        return builder.build();
    }

    /**
     * TLS context trusting only the certificates in {@code truststore}. The keystore type (JKS or
     * PKCS12) is detected from the file content.
     */
    static SSLContext trusting(Path truststore, char[] password) {
        if (!Files.isRegularFile(truststore)) {
            throw new IllegalStateException("Truststore not found: " + truststore);
        }
        try {
            KeyStore keyStore = KeyStore.getInstance(truststore.toFile(), password);
            TrustManagerFactory trustManagers = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            trustManagers.init(keyStore);

            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, trustManagers.getTrustManagers(), null);
            LOGGER.info("Outbound TLS trusts " + keyStore.size() + " entries from " + keyStore.getType()
                    + " truststore " + truststore);
            return context;
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("Failed loading truststore " + truststore, e);
        }
    }
}
