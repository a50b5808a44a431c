package com.example.opcuaagent.config;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.example.opcuaagent.exceptions.ConfigException;
import com.example.opcuaagent.exceptions.ExceptionContext;
import com.example.opcuaagent.mqtt.BackpressurePolicy;

public class ConfigReaderTest {

    @TempDir
    Path directory;

    private static AgentSettings fixture(String name) throws Exception {
        try (InputStream in = ConfigReaderTest.class.getResourceAsStream("/config/" + name)) {
            return ConfigReader.read(in);
        }
    }

    private static AgentSettings yaml(String text) throws ConfigException, IOException {
        return ConfigReader.read(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
    }

    private static final String VALID =
            "connections:\n"
                    + "  local:\n"
                    + "    url: opc.tcp://localhost:4840\n"
                    + "channels:\n"
                    + "  - device: pump-1\n"
                    + "    connection: local\n"
                    + "    nodes: [ \"ns=2;s=Pump1.Pressure\" ]\n"
                    + "mqtt:\n"
                    + "  host: localhost\n";

    private static final String MIDDLEWARE = VALID + "middleware:\n  sources:\n";

    @Test
    public void readsFullConfiguration() throws Exception {
        AgentSettings settings = fixture("agent.yaml");

        assertEquals("eu-north-1", settings.getAwsRegion());
        assertEquals(2, settings.getWorkerThreads());

        OpcUaConnectionSettings plc = settings.getConnections().get("plc-1");
        assertEquals("opc.tcp://plc-1:4840", plc.getUrl());
        assertEquals("Basic256Sha256", plc.getSecurityPolicy());
        assertEquals("SignAndEncrypt", plc.getSecurityMode());
        assertEquals("plc-1-user", plc.getCredentials().getSecretName());
        assertEquals(Duration.ofMinutes(2), plc.getSessionTimeout());
        assertEquals(Duration.ofSeconds(5), plc.getRequestTimeout());
        assertEquals(Duration.ofSeconds(30), plc.getReconnectMaxDelay());

        ChannelSettings pump = settings.getChannels().get(0);
        assertEquals("pump-1", pump.getDevice());
        assertEquals(1, pump.getQos());
        assertEquals(Duration.ofMillis(250), pump.getSamplingInterval());
        assertEquals(TimestampsMode.SOURCE, pump.getTimestamps());
        assertFalse(pump.isEncrypted());
        assertEquals("Pressure", pump.getNodes().get(0).getFeature());
        assertEquals("ns=2;s=Pump1.Speed", pump.getNodes().get(1).getId());
        assertEquals("rpm", pump.getNodes().get(1).getFeature());

        ChannelSettings valve = settings.getChannels().get(1);
        assertEquals(0, valve.getQos());
        assertTrue(valve.isEncrypted());
        assertEquals(TimestampsMode.BOTH, valve.getTimestamps());
        assertEquals(Duration.ofSeconds(1), valve.getSamplingInterval());

        MqttSettings mqtt = settings.getMqtt();
        assertEquals(8883, mqtt.getPort());
        assertEquals("plant-a", mqtt.getApplication());
        assertArrayEquals("s3cret".toCharArray(), mqtt.getCredentials().getPassword());
        assertEquals(500, mqtt.getQueueCapacity());
        assertEquals(BackpressurePolicy.DROP, mqtt.getBackpressure());

        assertFalse(settings.getMegolm().isMandatory());
    }

    @Test
    public void appliesDefaults() throws Exception {
        AgentSettings settings = fixture("minimal.yaml");

        OpcUaConnectionSettings local = settings.getConnections().get("local");
        assertEquals("None", local.getSecurityPolicy());
        assertEquals(10, local.getMaxConnectAttempts());
        assertNull(local.getCredentials());

        ChannelSettings pump = settings.getChannels().get(0);
        assertEquals("telemetry/{device}", pump.getTopic());
        assertEquals(1, pump.getQos());

        assertEquals(1883, settings.getMqtt().getPort());
        assertEquals(BackpressurePolicy.BLOCK, settings.getMqtt().getBackpressure());
        assertEquals(4, settings.getWorkerThreads());
        assertTrue(settings.getMegolm().isMandatory());
        assertEquals("/var/lib/opcua-agent/megolm", settings.getMegolm().getStateDirectory());
    }

    @Test
    public void readsFromFile() throws Exception {
        Path file = directory.resolve("config.yaml");
        Files.write(file, VALID.getBytes(StandardCharsets.UTF_8));
        assertEquals("pump-1", ConfigReader.read(file).getChannels().get(0).getDevice());
    }

    @Test
    public void missingFileIsReported() {
        ConfigException e = assertThrows(ConfigException.class, () -> ConfigReader.read(directory.resolve("absent.yaml")));
        assertEquals(ExceptionContext.CONFIG_FILE, e.getContext());
    }

    @Test
    public void rejectsInvalidConfigurations() {
        Map<String, String> invalid = new HashMap<>();
        invalid.put("unknown connection", VALID.replace("connection: local", "connection: plc-9"));
        invalid.put("qos out of range", VALID.replace("connection: local\n", "connection: local\n    qos: 3\n"));
        invalid.put("qos not a number", VALID.replace("connection: local\n", "connection: local\n    qos: high\n"));
        invalid.put("wildcard topic", VALID.replace("connection: local\n", "connection: local\n    topic: t/+\n"));
        invalid.put("application not set", VALID.replace("connection: local\n", "connection: local\n    topic: \"{application}/{device}\"\n"));
        invalid.put("device with slash", VALID.replace("device: pump-1", "device: line/pump-1"));
        invalid.put("no nodes", VALID.replace("    nodes: [ \"ns=2;s=Pump1.Pressure\" ]\n", ""));
        invalid.put("duplicate feature", VALID.replace("[ \"ns=2;s=Pump1.Pressure\" ]", "[ \"ns=2;s=Pump1.Pressure\", \"ns=3;s=Pump1.Pressure\" ]"));
        invalid.put("url scheme", VALID.replace("opc.tcp://", "http://"));
        invalid.put("security policy", VALID.replace("    url: opc.tcp://localhost:4840\n", "    url: opc.tcp://localhost:4840\n    securityPolicy: Basic512\n"));
        invalid.put("certificate missing", VALID.replace("    url: opc.tcp://localhost:4840\n", "    url: opc.tcp://localhost:4840\n    securityPolicy: Basic256Sha256\n    securityMode: Sign\n"));
        invalid.put("no mqtt host", VALID.replace("  host: localhost\n", "  port: 1883\n"));
        invalid.put("no channels", VALID.substring(0, VALID.indexOf("channels:")) + "mqtt:\n  host: localhost\n");
        invalid.put("bad duration", VALID.replace("connection: local\n", "connection: local\n    samplingInterval: soon\n"));
        invalid.put("source topic wildcard", MIDDLEWARE + "    \"opcua/local\":\n      topic: t/#\n");
        invalid.put("source topic application", MIDDLEWARE + "    \"opcua/local\":\n      topic: \"{application}/x\"\n");
        invalid.put("source feature", MIDDLEWARE + "    \"opcua\":\n      extensions: { feature: \"a+b\" }\n");
        invalid.put("duplicate device", VALID.replace("mqtt:", "  - device: pump-1\n    connection: local\n    nodes: [ \"ns=2;i=5\" ]\nmqtt:"));

        for (Map.Entry<String, String> entry : invalid.entrySet()) {
            assertThrows(ConfigException.class, () -> yaml(entry.getValue()), entry.getKey());
        }
    }

    @Test
    public void readsMiddlewareSources() throws Exception {
        AgentSettings settings = yaml(MIDDLEWARE
                + "    \"opcua/local\":\n      extensions: { site: hall-3, line: 2 }\n"
                + "    \"opcua/local/pump-1/ns=2;s=Pump1.Pressure\":\n      drop: true\n"
                + "    \"opcua/local/connection\":\n      topic: \"status/{device}\"\n");

        Map<String, SourceSettings> sources = settings.getMiddleware().getSources();
        assertEquals(3, sources.size());
        assertEquals("hall-3", sources.get("opcua/local").getExtensions().get("site"));
        assertEquals(2, sources.get("opcua/local").getExtensions().get("line"));
        assertNull(sources.get("opcua/local").getDrop());
        assertTrue(sources.get("opcua/local/pump-1/ns=2;s=Pump1.Pressure").getDrop());
        assertEquals("status/{device}", sources.get("opcua/local/connection").getTopic());

        assertTrue(yaml(VALID).getMiddleware().getSources().isEmpty());
    }

    @Test
    public void rejectsMalformedNodeId() {
        ConfigException e = assertThrows(ConfigException.class,
                () -> yaml(VALID.replace("ns=2;s=Pump1.Pressure", "Pump1.Pressure")));
        assertEquals(ExceptionContext.NODE_ID_SYNTAX, e.getContext());
    }

    @Test
    public void rejectsEmptyConfiguration() {
        assertThrows(ConfigException.class, () -> yaml(""));
    }

    @Test
    public void resolvesSecretsIntoCredentials() throws Exception {
        AgentSettings settings = fixture("agent.yaml");

        Map<String, char[]> secret = new HashMap<>();
        secret.put("username", "operator".toCharArray());
        secret.put("password", "plc-password".toCharArray());

        SecretSource secrets = createMock(SecretSource.class);
        expect(secrets.getSecret("plc-1-user")).andReturn(secret);
        replay(secrets);

        ConfigReader.resolveSecrets(settings, secrets);
        verify(secrets);

        CredentialSettings credentials = settings.getConnections().get("plc-1").getCredentials();
        assertEquals("operator", credentials.getUsername());
        assertArrayEquals("plc-password".toCharArray(), credentials.getPassword());
        // inline MQTT credentials are left alone
        assertArrayEquals("s3cret".toCharArray(), settings.getMqtt().getCredentials().getPassword());
    }

    @Test
    public void secretWithoutPasswordIsRejected() throws Exception {
        AgentSettings settings = fixture("agent.yaml");
        SecretSource secrets = createMock(SecretSource.class);
        expect(secrets.getSecret("plc-1-user")).andReturn(new HashMap<>());
        replay(secrets);

        ConfigException e = assertThrows(ConfigException.class, () -> ConfigReader.resolveSecrets(settings, secrets));
        assertEquals(ExceptionContext.SECRET, e.getContext());
    }
}
