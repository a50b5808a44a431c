package com.example.opcuaagent.main;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.Security;
import java.time.Duration;

import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.opcuaagent.bridge.BridgeOrchestrator;
import com.example.opcuaagent.config.AgentSettings;
import com.example.opcuaagent.config.AwsSecretReader;
import com.example.opcuaagent.config.ChannelSettings;
import com.example.opcuaagent.config.ConfigReader;
import com.example.opcuaagent.config.MqttSettings;
import com.example.opcuaagent.config.SecretSource;
import com.example.opcuaagent.exceptions.AgentException;
import com.example.opcuaagent.exceptions.ConfigException;
import com.example.opcuaagent.exceptions.ExceptionContext;
import com.example.opcuaagent.mqtt.MqttPublisher;
import com.example.opcuaagent.mqtt.PahoMqttTransport;
import com.example.opcuaagent.opcua.MiloSubscriptionManager;
import com.example.opcuaagent.store.FileRatchetStatePersistence;
import com.example.opcuaagent.store.RatchetSessionStore;
import com.example.opcuaagent.util.Backoff;

/**
 * Entry point of the agent.
 * <p>
 * Reads the configuration named by {@code CONFIG_FILE}, resolves secrets, connects to the
 * broker and starts streaming every configured channel. Exits with status 1 if the
 * configuration is invalid, the broker cannot be reached or every channel has failed.
 */
public class MainRunner {

    private static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(10);

    private MainRunner() {
    }

    public static void main(String[] args) throws InterruptedException {
        AwsSecretReader.disableAwsAndApacheLogging();
        Logger logger = LoggerFactory.getLogger(MainRunner.class);

        Security.addProvider(new BouncyCastleProvider());

        BridgeOrchestrator bridge;
        try {
            Path configFile = args.length > 0 ? Paths.get(args[0]) : ConfigReader.configFileFromEnvironment();
            AgentSettings settings = ConfigReader.read(configFile);
            ConfigReader.resolveSecrets(settings, secretSource(settings));
            bridge = createBridge(settings);
            bridge.start();
        } catch (AgentException e) {
            logger.error("Agent cannot start: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }

        BridgeOrchestrator running = bridge;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> running.stop(DRAIN_TIMEOUT), "shutdown"));

        bridge.awaitFinished();
        if (bridge.allChannelsFailed()) {
            bridge.stop(DRAIN_TIMEOUT);
            System.exit(1);
        }
    }

    static BridgeOrchestrator createBridge(AgentSettings settings) throws AgentException {
        MqttSettings mqtt = settings.getMqtt();
        MqttPublisher publisher = new MqttPublisher(new PahoMqttTransport(mqtt), mqtt.getQueueCapacity(),
                mqtt.getBackpressure(), Backoff.withMax(mqtt.getReconnectMaxDelay()));

        RatchetSessionStore store = null;
        if (settings.getChannels().stream().anyMatch(ChannelSettings::isEncrypted)) {
            store = new RatchetSessionStore(new FileRatchetStatePersistence(Paths.get(settings.getMegolm().getStateDirectory())));
        }
        return new BridgeOrchestrator(settings, new MiloSubscriptionManager(settings), publisher, store);
    }

    /**
     * @return the AWS secret reader, or a source that fails if no region is configured
     */
    private static SecretSource secretSource(AgentSettings settings) {
        String region = settings.getAwsRegion();
        if (region == null || region.isBlank()) {
            return secretName -> {
                throw new ConfigException(ExceptionContext.SECRET, "awsRegion is required to read secret " + secretName + ".");
            };
        }
        return new AwsSecretReader(region.trim());
    }
}
