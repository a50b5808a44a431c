package com.example.opcuaagent.config;

import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;

import com.example.opcuaagent.exceptions.ConfigException;
import com.example.opcuaagent.exceptions.ExceptionContext;

/**
 * AwsSecretReader retrieves credential secrets from AWS Secrets Manager.
 * The secret string must be a flat JSON object; values are returned as {@code char[]} to
 * reduce memory exposure.
 */
public class AwsSecretReader implements SecretSource {

    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final Region region;

    /**
     * @param region the AWS region where the secrets are stored
     */
    public AwsSecretReader(String region) {
        this.region = Region.of(region);
    }

    /**
     * Fetches a secret and parses it as a key-value map.
     *
     * @param secretName the name or ARN of the secret in Secrets Manager
     * @return a {@code Map<String, char[]>} of the parsed secret values
     * @throws ConfigException if the secret cannot be fetched, is binary or is not a JSON object
     */
    @Override
    public Map<String, char[]> getSecret(String secretName) throws ConfigException {
        disableAwsAndApacheLogging(); // before any sensitive data is fetched

        ObjectMapper mapper = new ObjectMapper();
        Map<String, char[]> secureMap = new HashMap<>();

        try (SecretsManagerClient client = SecretsManagerClient.builder()
                .region(region)
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build()) {

            GetSecretValueResponse response = client.getSecretValue(
                    GetSecretValueRequest.builder()
                            .secretId(secretName)
                            .build());

            String secretString = response.secretString();
            if (secretString == null || secretString.isBlank()) {
                throw new ConfigException(ExceptionContext.SECRET, "Secret " + secretName + " has no string value.");
            }

            Map<String, String> rawMap = mapper.readValue(secretString, new TypeReference<Map<String, String>>() {});
            for (Map.Entry<String, String> entry : rawMap.entrySet()) {
                String value = entry.getValue();
                if (value != null) {
                    secureMap.put(entry.getKey(), value.toCharArray());
                    entry.setValue(null);
                }
            }
            rawMap.clear();

            logger.info("Resolved secret {} ({} keys)", secretName, secureMap.size());
        } catch (SdkException e) {
            throw new ConfigException(ExceptionContext.SECRET, secretName, e);
        } catch (JsonProcessingException e) {
            throw new ConfigException(ExceptionContext.SECRET, "Secret " + secretName + " is not a JSON object.", e);
        }

        return secureMap;
    }

    /**
     * Disables verbose AWS and Apache HTTP logging that could expose secret values.
     * Called before any Secrets Manager request is made.
     */
    public static void disableAwsAndApacheLogging() {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext)) {
            return;
        }
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.getLogger("org.apache.http.wire").setLevel(Level.OFF);
        context.getLogger("org.apache.http.headers").setLevel(Level.OFF);
        context.getLogger("org.apache.http").setLevel(Level.OFF);
        context.getLogger("software.amazon.awssdk").setLevel(Level.OFF);
        context.getLogger("software.amazon.awssdk.request").setLevel(Level.OFF);
        context.getLogger("software.amazon.awssdk.response").setLevel(Level.OFF);
        context.getLogger("software.amazon.awssdk.http.apache").setLevel(Level.OFF);
        context.getLogger("software.amazon.awssdk.services.secretsmanager").setLevel(Level.OFF);
    }
}
