package com.example.opcuaagent.config;

import java.util.Map;

import com.example.opcuaagent.exceptions.ConfigException;

/**
 * Resolves a named secret to its key-value pairs.
 */
public interface SecretSource {

    /**
     * @return the secret's values as {@code char[]}, so callers can wipe them after use
     * @throws ConfigException if the secret cannot be fetched or parsed
     */
    Map<String, char[]> getSecret(String secretName) throws ConfigException;
}
