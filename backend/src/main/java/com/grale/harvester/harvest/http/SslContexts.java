package com.grale.harvester.harvest.http;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.X509Certificate;

final class SslContexts {
    private SslContexts() {
    }

    static SSLContext forSettings(SessionSettings settings) {
        if (!settings.hasClientCertificate() && settings.verifyTls()) {
            return null;
        }
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(
                settings.hasClientCertificate() ? loadPkcs12(settings).getKeyManagers() : null,
                settings.verifyTls() ? null : new TrustManager[] {new AcceptAllTrustManager()},
                null
            );
            return context;
        } catch (GeneralSecurityException | IOException e) {
            throw new IllegalStateException("Unable to initialise TLS context from " + settings.pkcs12Path(), e);
        }
    }

    private static KeyManagerFactory loadPkcs12(SessionSettings settings) throws GeneralSecurityException, IOException {
        KeyStore keyStore = KeyStore.getInstance("PKCS12");
        try (InputStream in = Files.newInputStream(settings.pkcs12Path())) {
            keyStore.load(in, settings.pkcs12Password());
        }
        KeyManagerFactory factory = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
        factory.init(keyStore, settings.pkcs12Password());
        return factory;
    }

    private static final class AcceptAllTrustManager implements X509TrustManager {
        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
