package com.example.opcuaagent.config;

import java.time.Duration;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * One OPC UA server connection. Channels referencing the same connection share its session.
 */
public class OpcUaConnectionSettings {

    /** Endpoint URL, e.g. {@code opc.tcp://plc-1:4840}. */
    private String url;

    /** Security policy URI suffix, e.g. None, Basic256Sha256, Aes128_Sha256_RsaOaep. */
    private String securityPolicy = "None";

    /** None, Sign or SignAndEncrypt. */
    private String securityMode = "None";

    /** Trust any server certificate instead of checking against the trust list. */
    private boolean autoAcceptServerCertificate;

    private String applicationName = "OPC UA Telemetry Agent";
    private String applicationUri = "urn:example:opcua-agent";

    /** PEM client certificate for secured policies. */
    private String clientCertificate;

    /** PEM private key of the client certificate. */
    private String clientPrivateKey;

    /** Password of an encrypted client private key. */
    private char[] clientPrivateKeyPassword;

    /** Directory holding trusted/ and rejected/ server certificates. */
    private String trustListDirectory;

    private CredentialSettings credentials;

    @JsonDeserialize(using = FlexibleDurationDeserializer.class)
    private Duration sessionTimeout = Duration.ofSeconds(60);

    @JsonDeserialize(using = FlexibleDurationDeserializer.class)
    private Duration requestTimeout = Duration.ofSeconds(10);

    /** Upper bound of the reconnect backoff. */
    @JsonDeserialize(using = FlexibleDurationDeserializer.class)
    private Duration reconnectMaxDelay = Duration.ofSeconds(60);

    /** Failed connects in a row after which the connection is reported as fatal. */
    private int maxConnectAttempts = 10;

    /** Tries per node before it is skipped. */
    private int nodeResolveAttempts = 3;

    public String getUrl() { return url; }
    public String getSecurityPolicy() { return securityPolicy; }
    public String getSecurityMode() { return securityMode; }
    public boolean isAutoAcceptServerCertificate() { return autoAcceptServerCertificate; }
    public String getApplicationName() { return applicationName; }
    public String getApplicationUri() { return applicationUri; }
    public String getClientCertificate() { return clientCertificate; }
    public String getClientPrivateKey() { return clientPrivateKey; }
    public char[] getClientPrivateKeyPassword() { return clientPrivateKeyPassword; }
    public String getTrustListDirectory() { return trustListDirectory; }
    public CredentialSettings getCredentials() { return credentials; }
    public Duration getSessionTimeout() { return sessionTimeout; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public Duration getReconnectMaxDelay() { return reconnectMaxDelay; }
    public int getMaxConnectAttempts() { return maxConnectAttempts; }
    public int getNodeResolveAttempts() { return nodeResolveAttempts; }

    public void setUrl(String url) { this.url = url; }
    public void setSecurityPolicy(String securityPolicy) { this.securityPolicy = securityPolicy; }
    public void setSecurityMode(String securityMode) { this.securityMode = securityMode; }
    public void setAutoAcceptServerCertificate(boolean value) { this.autoAcceptServerCertificate = value; }
    public void setApplicationName(String applicationName) { this.applicationName = applicationName; }
    public void setApplicationUri(String applicationUri) { this.applicationUri = applicationUri; }
    public void setClientCertificate(String clientCertificate) { this.clientCertificate = clientCertificate; }
    public void setClientPrivateKey(String clientPrivateKey) { this.clientPrivateKey = clientPrivateKey; }
    public void setClientPrivateKeyPassword(char[] password) { this.clientPrivateKeyPassword = password; }
    public void setTrustListDirectory(String trustListDirectory) { this.trustListDirectory = trustListDirectory; }
    public void setCredentials(CredentialSettings credentials) { this.credentials = credentials; }
    public void setSessionTimeout(Duration sessionTimeout) { this.sessionTimeout = sessionTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    public void setReconnectMaxDelay(Duration reconnectMaxDelay) { this.reconnectMaxDelay = reconnectMaxDelay; }
    public void setMaxConnectAttempts(int maxConnectAttempts) { this.maxConnectAttempts = maxConnectAttempts; }
    public void setNodeResolveAttempts(int nodeResolveAttempts) { this.nodeResolveAttempts = nodeResolveAttempts; }
}
