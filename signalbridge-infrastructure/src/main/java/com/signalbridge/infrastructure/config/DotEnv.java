package com.signalbridge.infrastructure.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * .env loader.
 * KEY=value, optional "export " prefix, optional matching quotes around the value.
 * Blank lines and lines starting with # are skipped.
 */
public final class DotEnv {

    private DotEnv() {}

    public static Map<String, String> loadIfExists(Path envFile) throws IOException {
        Map<String, String> map = new LinkedHashMap<>();
        if (envFile == null || !Files.isRegularFile(envFile)) return map;

        for (String line : Files.readAllLines(envFile, StandardCharsets.UTF_8)) {
            String t = line.trim();
            if (t.isEmpty() || t.startsWith("#")) continue;
            if (t.startsWith("export ")) t = t.substring("export ".length()).trim();

            int eq = t.indexOf('=');
            if (eq <= 0) continue;

            String key = t.substring(0, eq).trim();
            String val = t.substring(eq + 1).trim();
            if (val.length() >= 2 && isQuote(val.charAt(0)) && val.charAt(val.length() - 1) == val.charAt(0)) {
                val = val.substring(1, val.length() - 1);
            }
            map.put(key, val);
        }
        return map;
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }
}
