package com.example.opcuaagent.config;

import java.util.Arrays;

/**
 * Username and password, given inline or resolved from an AWS Secrets Manager secret holding
 * the JSON keys {@code username} and {@code password}. Passwords are kept as {@code char[]}.
 */
public class CredentialSettings {

    private String username;
    private char[] password;

    /** Name or ARN of the secret; resolved at startup and overrides inline values. */
    private String secretName;

    public String getUsername() { return username; }
    public char[] getPassword() { return password; }
    public String getSecretName() { return secretName; }

    public void setUsername(String username) { this.username = username; }
    public void setSecretName(String secretName) { this.secretName = secretName; }

    public void setPassword(char[] password) {
        this.password = password;
    }

    public boolean hasPassword() {
        return password != null && password.length > 0;
    }

    /** Overwrites the password in memory. */
    public void clear() {
        if (password != null) {
            Arrays.fill(password, '\0');
        }
    }

    @Override
    public String toString() {
        return "CredentialSettings{username=" + username + ", password=" + (hasPassword() ? "***" : "none")
                + ", secretName=" + secretName + "}";
    }
}
