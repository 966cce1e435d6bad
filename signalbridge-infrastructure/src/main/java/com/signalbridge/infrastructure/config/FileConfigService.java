package com.signalbridge.infrastructure.config;

import com.signalbridge.application.config.ConfigKey;
import com.signalbridge.application.ports.ConfigPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * File + env configuration.
 *
 * Load order (low -> high priority):
 *  1) config.properties
 *  2) .env (optional)
 *  3) secrets.properties (optional)
 *  4) environment variables: SIGNALBRIDGE_* mapping, then direct key names
 *
 * Environment overrides apply to every key already loaded and to every {@link ConfigKey},
 * so secrets can live in the environment only.
 */
public final class FileConfigService implements ConfigPort {

    private static final Logger log = LoggerFactory.getLogger(FileConfigService.class);

    static final String ENV_PREFIX = "SIGNALBRIDGE_";

    private final Properties props = new Properties();
    private final Path configDir;

    private FileConfigService(Path configDir, Map<String, String> env) throws IOException {
        this.configDir = configDir;
        loadAll();
        applyEnvOverrides(env);
    }

    public static FileConfigService defaultFromWorkingDir() throws IOException {
        return load(Path.of(System.getProperty("user.dir")).resolve("config"), System.getenv());
    }

    /** Loads from {@code configDir} with the given environment (tests pass a fixed map). */
    public static FileConfigService load(Path configDir, Map<String, String> env) throws IOException {
        return new FileConfigService(configDir, env);
    }

    public Path getConfigDir() {
        return configDir;
    }

    private void loadAll() throws IOException {
        if (configDir == null) return;

        loadPropsIfExists(configDir.resolve("config.properties"));

        Map<String, String> env = DotEnv.loadIfExists(configDir.resolve(".env"));
        for (Map.Entry<String, String> e : env.entrySet()) {
            props.setProperty(e.getKey(), e.getValue());
        }

        loadPropsIfExists(configDir.resolve("secrets.properties"));
    }

    private void loadPropsIfExists(Path file) throws IOException {
        if (!Files.isRegularFile(file)) return;
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        }
        log.debug("Loaded {}", file);
    }

    private void applyEnvOverrides(Map<String, String> env) {
        Set<String> keys = new LinkedHashSet<>(props.stringPropertyNames());
        for (ConfigKey ck : ConfigKey.values()) keys.add(ck.key());

        for (String key : keys) {
            String val = env.get(toEnvKey(key));
            if (val == null) val = env.get(key);
            if (val != null) props.setProperty(key, val);
        }
    }

    /**
     * Maps a properties key to its env-var name.
     *
     * Examples:
     * - risk.minQuantity -> SIGNALBRIDGE_RISK_MIN_QUANTITY
     * - CEX_API_KEY      -> SIGNALBRIDGE_CEX_API_KEY
     */
    static String toEnvKey(String key) {
        String s = key.replace('.', '_');
        s = s.replaceAll("([a-z0-9])([A-Z])", "$1_$2");
        return ENV_PREFIX + s.toUpperCase(Locale.ROOT);
    }

    @Override
    public String get(String key) {
        return get(key, null);
    }

    @Override
    public String get(String key, String defaultValue) {
        String v = props.getProperty(key);
        return (v == null || v.isBlank()) ? defaultValue : v;
    }

    @Override
    public int getInt(String key, int defaultValue) {
        String v = get(key, null);
        if (v == null) return defaultValue;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for {}: '{}', using {}", key, v, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public double getDouble(String key, double defaultValue) {
        String v = get(key, null);
        if (v == null) return defaultValue;
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid number for {}: '{}', using {}", key, v, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public boolean getBoolean(String key, boolean defaultValue) {
        String v = get(key, null);
        if (v == null) return defaultValue;
        return Boolean.parseBoolean(v.trim());
    }

    @Override
    public String getSecret(String key) {
        String v = props.getProperty(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }
}
