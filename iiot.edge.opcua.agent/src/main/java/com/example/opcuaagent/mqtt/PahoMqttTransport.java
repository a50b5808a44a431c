package com.example.opcuaagent.mqtt;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;

import javax.net.ssl.KeyManager;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;

import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttCallbackExtended;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.opcuaagent.config.CredentialSettings;
import com.example.opcuaagent.config.MqttSettings;
import com.example.opcuaagent.exceptions.ConfigException;
import com.example.opcuaagent.exceptions.ConnectionException;
import com.example.opcuaagent.exceptions.ExceptionContext;
import com.example.opcuaagent.util.PemFiles;

/**
 * Eclipse Paho (MQTT 3.1.1) connection to the broker.
 * <p>
 * TLS is on by default. With a CA file the broker is verified against it, otherwise against
 * the platform trust store; a client certificate and key enable mutual TLS. Automatic
 * reconnect is off: {@link MqttPublisher} drives reconnects with its own backoff.
 */
public class PahoMqttTransport implements MqttTransport {

    private static final String ALPHANUMERIC = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    private static final int CLIENT_ID_LENGTH = 20;

    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final String serverUri;
    private final String clientId;
    private final MqttConnectOptions options;
    private final long publishTimeoutMillis;

    private volatile MqttClient client;

    /**
     * @param settings broker settings with secrets already resolved
     * @throws ConfigException if the TLS material cannot be loaded
     */
    public PahoMqttTransport(MqttSettings settings) throws ConfigException {
        this.serverUri = (settings.isTls() ? "ssl://" : "tcp://") + settings.getHost() + ":" + settings.getPort();
        this.clientId = settings.getClientId() != null && !settings.getClientId().isBlank()
                ? settings.getClientId() : randomClientId();
        this.publishTimeoutMillis = Math.max(settings.getConnectionTimeout().toMillis() * 3, 10_000L);

        options = new MqttConnectOptions();
        options.setMqttVersion(MqttConnectOptions.MQTT_VERSION_3_1_1);
        options.setCleanSession(true);
        options.setAutomaticReconnect(false);
        options.setKeepAliveInterval((int) settings.getKeepAlive().getSeconds());
        options.setConnectionTimeout((int) Math.max(1, settings.getConnectionTimeout().getSeconds()));

        CredentialSettings credentials = settings.getCredentials();
        if (credentials != null && credentials.hasPassword()) {
            options.setUserName(credentials.getUsername() != null
                    ? credentials.getUsername()
                    : deviceUsername(settings.getDevice(), settings.getApplication()));
            options.setPassword(credentials.getPassword());
        }

        if (settings.isTls() && (settings.getCaFile() != null || settings.getCertFile() != null)) {
            try {
                options.setSocketFactory(getSocketFactory(settings.getCaFile(), settings.getCertFile(), settings.getKeyFile()));
            } catch (IOException | GeneralSecurityException e) {
                throw new ConfigException(ExceptionContext.TLS, e.getMessage(), e);
            }
        }

        logger.info("MQTT broker {} with client id {}", serverUri, clientId);
    }

    @Override
    public synchronized void connect() throws ConnectionException {
        if (isConnected()) {
            return;
        }
        try {
            if (client == null) {
                client = new MqttClient(serverUri, clientId, new MemoryPersistence());
                client.setTimeToWait(publishTimeoutMillis);
                client.setCallback(new MqttCallbackExtended() {
                    @Override
                    public void connectionLost(Throwable cause) {
                        logger.warn("MQTT connection lost: {}", cause == null ? "unknown" : cause.getMessage());
                    }

                    @Override
                    public void messageArrived(String topic, MqttMessage message) {
                        logger.debug("Ignoring message on {}", topic);
                    }

                    @Override
                    public void deliveryComplete(IMqttDeliveryToken token) {
                        logger.trace("Delivery complete: {}", token.getMessageId());
                    }

                    @Override
                    public void connectComplete(boolean reconnect, String serverURI) {
                        logger.info("Connected to MQTT broker at {} (reconnect: {})", serverURI, reconnect);
                    }
                });
            }
            client.connect(options);
        } catch (MqttException e) {
            throw new ConnectionException(ExceptionContext.MQTT_CONNECT, e, isFatal(e));
        }
    }

    @Override
    public boolean isConnected() {
        MqttClient current = client;
        return current != null && current.isConnected();
    }

    @Override
    public void publish(String topic, byte[] payload, int qos) throws ConnectionException {
        MqttClient current = client;
        if (current == null) {
            throw new ConnectionException(ExceptionContext.MQTT_PUBLISH, "Not connected.", false);
        }
        MqttMessage message = new MqttMessage(payload);
        message.setQos(qos);
        message.setRetained(false);
        try {
            current.publish(topic, message);
        } catch (MqttException e) {
            throw new ConnectionException(ExceptionContext.MQTT_PUBLISH, e);
        }
    }

    @Override
    public synchronized void disconnect() {
        if (client == null) {
            return;
        }
        try {
            if (client.isConnected()) {
                client.disconnect();
                logger.info("Disconnected from MQTT broker");
            }
            client.close();
        } catch (MqttException e) {
            logger.error("Disconnection from MQTT broker failed: {}", e.getMessage(), e);
        } finally {
            client = null;
        }
    }

    /**
     * @return a random client id of 20 alphanumeric characters
     */
    static String randomClientId() {
        SecureRandom random = new SecureRandom();
        StringBuilder id = new StringBuilder(CLIENT_ID_LENGTH);
        for (int i = 0; i < CLIENT_ID_LENGTH; i++) {
            id.append(ALPHANUMERIC.charAt(random.nextInt(ALPHANUMERIC.length())));
        }
        return id.toString();
    }

    /**
     * Username for password-only authentication: {@code device@application}, both parts URL encoded.
     */
    static String deviceUsername(String device, String application) {
        return URLEncoder.encode(device, StandardCharsets.UTF_8) + "@" + URLEncoder.encode(application, StandardCharsets.UTF_8);
    }

    /**
     * Rejections a retry cannot fix.
     */
    private static boolean isFatal(MqttException e) {
        switch (e.getReasonCode()) {
            case MqttException.REASON_CODE_FAILED_AUTHENTICATION:
            case MqttException.REASON_CODE_NOT_AUTHORIZED:
            case MqttException.REASON_CODE_INVALID_CLIENT_ID:
            case MqttException.REASON_CODE_INVALID_PROTOCOL_VERSION:
                return true;
            default:
                return false;
        }
    }

    /**
     * Creates an SSL socket factory trusting the given CA (or the platform trust store) and
     * presenting the given client certificate (if any).
     */
    private SSLSocketFactory getSocketFactory(String caFile, String certFile, String keyFile)
            throws IOException, GeneralSecurityException {
        TrustManager[] trustManagers = null;
        if (caFile != null) {
            X509Certificate caCert = PemFiles.loadCertificate(Paths.get(caFile));
            logger.info("Loaded CA certificate from {}", caFile);

            KeyStore caKs = KeyStore.getInstance(KeyStore.getDefaultType());
            caKs.load(null, null);
            caKs.setCertificateEntry("ca-certificate", caCert);
            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(caKs);
            trustManagers = tmf.getTrustManagers();
        }

        KeyManager[] keyManagers = null;
        if (certFile != null) {
            X509Certificate cert = PemFiles.loadCertificate(Paths.get(certFile));
            PrivateKey key = PemFiles.loadPrivateKey(Paths.get(keyFile), null);
            logger.info("Loaded client certificate from {} and key from {}", certFile, keyFile);

            char[] keyStorePassword = new char[0];
            KeyStore ks = KeyStore.getInstance(KeyStore.getDefaultType());
            ks.load(null, null);
            ks.setCertificateEntry("certificate", cert);
            ks.setKeyEntry("private-key", key, keyStorePassword, new java.security.cert.Certificate[]{cert});
            KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
            kmf.init(ks, keyStorePassword);
            keyManagers = kmf.getKeyManagers();
        }

        SSLContext context = SSLContext.getInstance("TLSv1.2");
        context.init(keyManagers, trustManagers, null);
        return context.getSocketFactory();
    }
}
