package com.example.opcuaagent.opcua;

import static org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.Unsigned.uint;

import java.io.File;
import java.io.IOException;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.eclipse.milo.opcua.sdk.client.OpcUaClient;
import org.eclipse.milo.opcua.sdk.client.api.config.OpcUaClientConfig;
import org.eclipse.milo.opcua.sdk.client.api.config.OpcUaClientConfigBuilder;
import org.eclipse.milo.opcua.sdk.client.api.identity.AnonymousProvider;
import org.eclipse.milo.opcua.sdk.client.api.identity.IdentityProvider;
import org.eclipse.milo.opcua.sdk.client.api.identity.UsernameProvider;
import org.eclipse.milo.opcua.stack.client.DiscoveryClient;
import org.eclipse.milo.opcua.stack.client.security.ClientCertificateValidator;
import org.eclipse.milo.opcua.stack.client.security.DefaultClientCertificateValidator;
import org.eclipse.milo.opcua.stack.core.UaException;
import org.eclipse.milo.opcua.stack.core.security.DefaultTrustListManager;
import org.eclipse.milo.opcua.stack.core.security.SecurityPolicy;
import org.eclipse.milo.opcua.stack.core.types.builtin.LocalizedText;
import org.eclipse.milo.opcua.stack.core.types.enumerated.MessageSecurityMode;
import org.eclipse.milo.opcua.stack.core.types.structured.EndpointDescription;
import org.eclipse.milo.opcua.stack.core.util.EndpointUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.opcuaagent.config.CredentialSettings;
import com.example.opcuaagent.config.OpcUaConnectionSettings;
import com.example.opcuaagent.exceptions.ConnectionException;
import com.example.opcuaagent.exceptions.ExceptionContext;
import com.example.opcuaagent.util.PemFiles;

/**
 * Creates OPC UA clients for a configured connection.
 * <p>
 * The server endpoints are discovered first and the one matching the configured security
 * policy and mode is taken. Client certificate and key are loaded from PEM files when the
 * policy is not {@code None}. Users are authenticated with username and password when
 * credentials are configured, anonymously otherwise.
 */
public class OpcUaClientFactory {

    private final Logger logger = LoggerFactory.getLogger(getClass());

    /**
     * @return a new, not yet connected client
     * @throws ConnectionException if the server cannot be reached for discovery (transient), or has no
     *                             matching endpoint, or the client certificate cannot be loaded (fatal)
     */
    public OpcUaClient create(OpcUaConnectionSettings settings) throws ConnectionException {
        logger.info("Creating OPC UA client for {}", settings.getUrl());

        SecurityPolicy policy = SecurityPolicy.valueOf(settings.getSecurityPolicy());
        MessageSecurityMode mode = MessageSecurityMode.valueOf(settings.getSecurityMode());

        List<EndpointDescription> endpoints;
        try {
            endpoints = DiscoveryClient.getEndpoints(settings.getUrl())
                    .get(settings.getRequestTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException(ExceptionContext.OPCUA_CONNECT, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new ConnectionException(ExceptionContext.OPCUA_CONNECT, e);
        }

        EndpointDescription endpoint = selectEndpoint(endpoints, policy, mode)
                .orElseThrow(() -> new ConnectionException(ExceptionContext.OPCUA_ENDPOINT,
                        "No endpoint of " + settings.getUrl() + " offers " + policy + "/" + mode + ".", true));
        // Servers often announce a host name the agent cannot resolve.
        endpoint = EndpointUtil.updateUrl(endpoint, EndpointUtil.getHost(settings.getUrl()));

        OpcUaClientConfigBuilder config = OpcUaClientConfig.builder()
                .setApplicationName(LocalizedText.english(settings.getApplicationName()))
                .setApplicationUri(settings.getApplicationUri())
                .setEndpoint(endpoint)
                .setIdentityProvider(identityProvider(settings.getCredentials()))
                .setCertificateValidator(certificateValidator(settings))
                .setRequestTimeout(uint(settings.getRequestTimeout().toMillis()))
                .setSessionTimeout(uint(settings.getSessionTimeout().toMillis()));

        if (policy != SecurityPolicy.None) {
            X509Certificate certificate;
            PrivateKey privateKey;
            try {
                certificate = PemFiles.loadCertificate(Paths.get(settings.getClientCertificate()));
                privateKey = PemFiles.loadPrivateKey(Paths.get(settings.getClientPrivateKey()),
                        settings.getClientPrivateKeyPassword());
            } catch (IOException | GeneralSecurityException e) {
                throw new ConnectionException(ExceptionContext.TLS, e, true);
            }
            config.setCertificate(certificate)
                    .setKeyPair(new KeyPair(certificate.getPublicKey(), privateKey));
        }

        try {
            OpcUaClient client = OpcUaClient.create(config.build());
            logger.info("OPC UA client created for endpoint {} ({}/{})", endpoint.getEndpointUrl(), policy, mode);
            return client;
        } catch (UaException e) {
            throw new ConnectionException(ExceptionContext.OPCUA_CONNECT, e, true);
        }
    }

    /**
     * @return the most secure endpoint with the given policy and mode
     */
    static Optional<EndpointDescription> selectEndpoint(List<EndpointDescription> endpoints,
                                                        SecurityPolicy policy, MessageSecurityMode mode) {
        return endpoints.stream()
                .filter(e -> policy.getUri().equals(e.getSecurityPolicyUri()) && e.getSecurityMode() == mode)
                .max(Comparator.comparingInt(e -> e.getSecurityLevel() == null ? 0 : e.getSecurityLevel().intValue()));
    }

    private static IdentityProvider identityProvider(CredentialSettings credentials) {
        if (credentials == null || credentials.getUsername() == null) {
            return new AnonymousProvider();
        }
        // Milo takes the password as a String.
        String password = credentials.hasPassword() ? new String(credentials.getPassword()) : "";
        return new UsernameProvider(credentials.getUsername(), password);
    }

    private ClientCertificateValidator certificateValidator(OpcUaConnectionSettings settings) throws ConnectionException {
        if (settings.isAutoAcceptServerCertificate() || settings.getTrustListDirectory() == null) {
            if (!settings.isAutoAcceptServerCertificate() && SecurityPolicy.valueOf(settings.getSecurityPolicy()) != SecurityPolicy.None) {
                logger.warn("No trust list configured for {}, server certificates are not validated", settings.getUrl());
            }
            return new ClientCertificateValidator.InsecureValidator();
        }
        try {
            return new DefaultClientCertificateValidator(new DefaultTrustListManager(new File(settings.getTrustListDirectory())));
        } catch (IOException e) {
            throw new ConnectionException(ExceptionContext.TLS, e, true);
        }
    }
}
