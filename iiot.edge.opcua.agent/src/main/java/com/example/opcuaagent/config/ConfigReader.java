package com.example.opcuaagent.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.eclipse.milo.opcua.stack.core.security.SecurityPolicy;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;
import org.eclipse.milo.opcua.stack.core.types.enumerated.MessageSecurityMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import com.example.opcuaagent.exceptions.ConfigException;
import com.example.opcuaagent.exceptions.ExceptionContext;
import com.example.opcuaagent.middleware.Middleware;
import com.example.opcuaagent.mqtt.TopicTemplate;

/**
 * Reads and validates the agent configuration YAML.
 * <p>
 * The file is taken from the {@code CONFIG_FILE} environment variable, falling back to
 * {@value #DEFAULT_CONFIG_FILE}. Unknown properties are ignored, enum values are case
 * insensitive.
 */
public final class ConfigReader {

    public static final String CONFIG_FILE_ENV = "CONFIG_FILE";
    public static final String DEFAULT_CONFIG_FILE = "/etc/opcua-agent/config.yaml";

    private static final Logger logger = LoggerFactory.getLogger(ConfigReader.class);

    private static final ObjectMapper MAPPER = YAMLMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private ConfigReader() {
    }

    /**
     * @return the configuration file named by the environment
     */
    public static Path configFileFromEnvironment() {
        String file = System.getenv(CONFIG_FILE_ENV);
        return Paths.get(file == null || file.isBlank() ? DEFAULT_CONFIG_FILE : file);
    }

    /**
     * Reads and validates a configuration file.
     *
     * @throws ConfigException if the file cannot be read, parsed or is invalid
     */
    public static AgentSettings read(Path file) throws ConfigException {
        try (InputStream in = Files.newInputStream(file)) {
            AgentSettings settings = read(in);
            logger.info("Loaded configuration from {}: {} connections, {} channels",
                    file, settings.getConnections().size(), settings.getChannels().size());
            return settings;
        } catch (NoSuchFileException e) {
            throw new ConfigException(ExceptionContext.CONFIG_FILE, file + " does not exist.", e);
        } catch (IOException e) {
            throw new ConfigException(ExceptionContext.CONFIG_FILE, file.toString(), e);
        }
    }

    public static AgentSettings read(InputStream in) throws ConfigException, IOException {
        AgentSettings settings;
        try {
            settings = MAPPER.readValue(in, AgentSettings.class);
        } catch (JsonProcessingException e) {
            throw new ConfigException(ExceptionContext.CONFIG_INVALID, e.getOriginalMessage(), e);
        }
        if (settings == null) {
            throw new ConfigException(ExceptionContext.CONFIG_INVALID, "The configuration is empty.");
        }
        validate(settings);
        return settings;
    }

    /**
     * Replaces the credentials of every connection and of the broker that name a secret with the
     * secret's {@code username} and {@code password}.
     */
    public static void resolveSecrets(AgentSettings settings, SecretSource secrets) throws ConfigException {
        for (Map.Entry<String, OpcUaConnectionSettings> connection : settings.getConnections().entrySet()) {
            resolve(connection.getValue().getCredentials(), secrets);
        }
        if (settings.getMqtt() != null) {
            resolve(settings.getMqtt().getCredentials(), secrets);
        }
    }

    private static void resolve(CredentialSettings credentials, SecretSource secrets) throws ConfigException {
        if (credentials == null || credentials.getSecretName() == null) {
            return;
        }
        Map<String, char[]> secret = secrets.getSecret(credentials.getSecretName());
        char[] username = secret.get("username");
        char[] password = secret.get("password");
        if (password == null) {
            throw new ConfigException(ExceptionContext.SECRET, "Secret " + credentials.getSecretName() + " has no password.");
        }
        if (username != null) {
            credentials.setUsername(new String(username));
        }
        credentials.clear();
        credentials.setPassword(password);
    }

    /**
     * @throws ConfigException naming the first invalid setting
     */
    static void validate(AgentSettings settings) throws ConfigException {
        if (settings.getWorkerThreads() < 1) {
            throw invalid("workerThreads must be at least 1.");
        }
        validateMqtt(settings.getMqtt());

        for (Map.Entry<String, OpcUaConnectionSettings> entry : settings.getConnections().entrySet()) {
            validateConnection(entry.getKey(), entry.getValue());
        }

        if (settings.getChannels().isEmpty()) {
            throw invalid("No channels are configured.");
        }
        Set<String> devices = new HashSet<>();
        boolean anyEncrypted = false;
        for (ChannelSettings channel : settings.getChannels()) {
            validateChannel(channel, settings);
            if (!devices.add(channel.getDevice())) {
                throw invalid("Device " + channel.getDevice() + " is configured twice.");
            }
            anyEncrypted |= channel.isEncrypted();
        }

        if (anyEncrypted && isBlank(settings.getMegolm().getStateDirectory())) {
            throw invalid("megolm.stateDirectory is required for encrypted channels.");
        }
        validateMiddleware(settings);
    }

    private static void validateMiddleware(AgentSettings settings) throws ConfigException {
        for (Map.Entry<String, SourceSettings> entry : settings.getMiddleware().getSources().entrySet()) {
            SourceSettings source = entry.getValue();
            if (source == null || source.getTopic() == null) {
                continue;
            }
            TopicTemplate topic = TopicTemplate.parse(source.getTopic());
            if (topic.uses(TopicTemplate.APPLICATION) && isBlank(settings.getMqtt().getApplication())) {
                throw invalid("Source " + entry.getKey() + " topic uses {application} but mqtt.application is not set.");
            }
        }
        Middleware.create(settings.getMiddleware());
    }

    private static void validateMqtt(MqttSettings mqtt) throws ConfigException {
        if (mqtt == null) {
            throw invalid("The mqtt section is missing.");
        }
        if (isBlank(mqtt.getHost())) {
            throw invalid("mqtt.host is required.");
        }
        if (mqtt.getPort() < 1 || mqtt.getPort() > 65535) {
            throw invalid("mqtt.port " + mqtt.getPort() + " is out of range.");
        }
        if (mqtt.getQueueCapacity() < 1) {
            throw invalid("mqtt.queueCapacity must be at least 1.");
        }
        if (mqtt.getMaxConnectAttempts() < 1) {
            throw invalid("mqtt.maxConnectAttempts must be at least 1.");
        }
        if ((mqtt.getCertFile() == null) != (mqtt.getKeyFile() == null)) {
            throw invalid("mqtt.certFile and mqtt.keyFile must be given together.");
        }
        CredentialSettings credentials = mqtt.getCredentials();
        if (credentials != null && credentials.getSecretName() == null && credentials.getUsername() == null
                && (isBlank(mqtt.getDevice()) || isBlank(mqtt.getApplication()))) {
            throw invalid("Password-only MQTT credentials need mqtt.device and mqtt.application.");
        }
    }

    private static void validateConnection(String name, OpcUaConnectionSettings connection) throws ConfigException {
        if (connection == null || isBlank(connection.getUrl())) {
            throw invalid("Connection " + name + " has no url.");
        }
        if (!connection.getUrl().startsWith("opc.tcp://")) {
            throw invalid("Connection " + name + " url must start with opc.tcp://");
        }

        SecurityPolicy policy;
        try {
            policy = SecurityPolicy.valueOf(connection.getSecurityPolicy());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw invalid("Connection " + name + " has unknown securityPolicy " + connection.getSecurityPolicy() + ".");
        }
        try {
            MessageSecurityMode.valueOf(connection.getSecurityMode());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw invalid("Connection " + name + " has unknown securityMode " + connection.getSecurityMode() + ".");
        }
        if (policy != SecurityPolicy.None
                && (isBlank(connection.getClientCertificate()) || isBlank(connection.getClientPrivateKey()))) {
            throw invalid("Connection " + name + " needs clientCertificate and clientPrivateKey for " + policy + ".");
        }
        if (connection.getMaxConnectAttempts() < 1 || connection.getNodeResolveAttempts() < 1) {
            throw invalid("Connection " + name + " attempts must be at least 1.");
        }
    }

    private static void validateChannel(ChannelSettings channel, AgentSettings settings) throws ConfigException {
        String device = channel.getDevice();
        if (isBlank(device)) {
            throw invalid("A channel has no device.");
        }
        if (!isTopicLevelSafe(device) || device.indexOf('/') >= 0) {
            throw invalid("Device " + device + " must not contain '/', '+' or '#'.");
        }
        if (!settings.getConnections().containsKey(channel.getConnection())) {
            throw invalid("Channel " + device + " references unknown connection " + channel.getConnection() + ".");
        }
        if (channel.getQos() < 0 || channel.getQos() > 2) {
            throw invalid("Channel " + device + " qos must be 0, 1 or 2.");
        }
        if (channel.getSamplingInterval() == null || channel.getSamplingInterval().isNegative()) {
            throw invalid("Channel " + device + " samplingInterval must not be negative.");
        }
        if (channel.getTimestamps() == null) {
            channel.setTimestamps(TimestampsMode.SOURCE);
        }

        TopicTemplate topic = TopicTemplate.parse(channel.getTopic());
        if (topic.uses(TopicTemplate.APPLICATION) && isBlank(settings.getMqtt().getApplication())) {
            throw invalid("Channel " + device + " topic uses {application} but mqtt.application is not set.");
        }

        if (channel.getNodes().isEmpty()) {
            throw invalid("Channel " + device + " has no nodes.");
        }
        Set<String> features = new HashSet<>();
        for (NodeSettings node : channel.getNodes()) {
            if (node == null || isBlank(node.getId())) {
                throw invalid("Channel " + device + " has a node without id.");
            }
            if (NodeId.parseSafe(node.getId()).isEmpty()) {
                throw new ConfigException(ExceptionContext.NODE_ID_SYNTAX, node.getId());
            }
            String feature = node.getFeature();
            if (!isTopicLevelSafe(feature)) {
                throw invalid("Feature " + feature + " of channel " + device + " must not contain '+' or '#'.");
            }
            if (!features.add(feature)) {
                throw invalid("Feature " + feature + " is used twice in channel " + device + ", set an alias.");
            }
        }
    }

    private static boolean isTopicLevelSafe(String value) {
        return value.indexOf('+') < 0 && value.indexOf('#') < 0;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static ConfigException invalid(String detail) {
        return new ConfigException(ExceptionContext.CONFIG_INVALID, detail);
    }
}
