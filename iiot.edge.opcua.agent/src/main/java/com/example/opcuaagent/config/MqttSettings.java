package com.example.opcuaagent.config;

import java.time.Duration;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import com.example.opcuaagent.mqtt.BackpressurePolicy;

/**
 * Broker connection shared by all channels.
 */
public class MqttSettings {

    private String host;

    /** Defaults to 8883 with TLS and 1883 without. */
    private Integer port;

    private boolean tls = true;

    /** Random 20 character id if not set. */
    private String clientId;

    /** Application the device belongs to; {application} in topic templates. */
    private String application;

    /** Device identity used for password-only authentication as {@code device@application}. */
    private String device;

    private CredentialSettings credentials;

    /** PEM CA certificate; the platform trust store is used if not set. */
    private String caFile;

    /** PEM client certificate and key for mutual TLS. */
    private String certFile;
    private String keyFile;

    @JsonDeserialize(using = FlexibleDurationDeserializer.class)
    private Duration keepAlive = Duration.ofSeconds(30);

    @JsonDeserialize(using = FlexibleDurationDeserializer.class)
    private Duration connectionTimeout = Duration.ofSeconds(10);

    @JsonDeserialize(using = FlexibleDurationDeserializer.class)
    private Duration reconnectMaxDelay = Duration.ofSeconds(60);

    /** Failed initial connects after which the agent gives up. */
    private int maxConnectAttempts = 10;

    private int queueCapacity = 1000;

    private BackpressurePolicy backpressure = BackpressurePolicy.BLOCK;

    public String getHost() { return host; }
    public int getPort() { return port != null ? port : (tls ? 8883 : 1883); }
    public boolean isTls() { return tls; }
    public String getClientId() { return clientId; }
    public String getApplication() { return application; }
    public String getDevice() { return device; }
    public CredentialSettings getCredentials() { return credentials; }
    public String getCaFile() { return caFile; }
    public String getCertFile() { return certFile; }
    public String getKeyFile() { return keyFile; }
    public Duration getKeepAlive() { return keepAlive; }
    public Duration getConnectionTimeout() { return connectionTimeout; }
    public Duration getReconnectMaxDelay() { return reconnectMaxDelay; }
    public int getMaxConnectAttempts() { return maxConnectAttempts; }
    public int getQueueCapacity() { return queueCapacity; }
    public BackpressurePolicy getBackpressure() { return backpressure; }

    public void setHost(String host) { this.host = host; }
    public void setPort(Integer port) { this.port = port; }
    public void setTls(boolean tls) { this.tls = tls; }
    public void setClientId(String clientId) { this.clientId = clientId; }
    public void setApplication(String application) { this.application = application; }
    public void setDevice(String device) { this.device = device; }
    public void setCredentials(CredentialSettings credentials) { this.credentials = credentials; }
    public void setCaFile(String caFile) { this.caFile = caFile; }
    public void setCertFile(String certFile) { this.certFile = certFile; }
    public void setKeyFile(String keyFile) { this.keyFile = keyFile; }
    public void setKeepAlive(Duration keepAlive) { this.keepAlive = keepAlive; }
    public void setConnectionTimeout(Duration connectionTimeout) { this.connectionTimeout = connectionTimeout; }
    public void setReconnectMaxDelay(Duration reconnectMaxDelay) { this.reconnectMaxDelay = reconnectMaxDelay; }
    public void setMaxConnectAttempts(int maxConnectAttempts) { this.maxConnectAttempts = maxConnectAttempts; }
    public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
    public void setBackpressure(BackpressurePolicy backpressure) { this.backpressure = backpressure; }
}
