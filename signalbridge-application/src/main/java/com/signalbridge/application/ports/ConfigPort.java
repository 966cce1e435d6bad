package com.signalbridge.application.ports;

/**
 * Abstraction over configuration and secrets.
 * Infrastructure provides the implementation (files + environment).
 */
public interface ConfigPort {

    String get(String key);

    String get(String key, String defaultValue);

    int getInt(String key, int defaultValue);

    double getDouble(String key, double defaultValue);

    boolean getBoolean(String key, boolean defaultValue);

    /** Returns a secret value, or null when not configured. */
    String getSecret(String key);
}
