package com.signalbridge.cli.tools;

import com.signalbridge.application.config.ConfigKey;
import com.signalbridge.application.config.ConfigValidationResult;
import com.signalbridge.application.config.ConfigValidator;
import com.signalbridge.application.ports.ConfigPort;
import com.signalbridge.domain.token.TokenRegistry;

import java.io.PrintStream;

/**
 * Offline configuration diagnostics.
 *
 * Usage:
 *   java -jar signalbridge-cli.jar validate-config
 *
 * Exit codes:
 *   0: OK
 *   2: Problems found
 */
public final class ConfigDoctor {

    private ConfigDoctor() {
    }

    public static int run(ConfigPort cfg, PrintStream out) {
        out.println("== Configuration ==");
        for (ConfigKey k : ConfigKey.values()) {
            String v = k.isSecret() ? cfg.getSecret(k.key()) : cfg.get(k.key());
            out.printf("  %-30s %s%n", k.key(), k.isSecret() ? mask(v) : (v == null ? "<default>" : v));
        }

        ConfigValidationResult res = new ConfigValidator(TokenRegistry.defaults()).validate(cfg);
        for (String w : res.warnings()) {
            out.println("WARN " + w);
        }
        if (res.isValid()) {
            out.println("OK");
            return 0;
        }

        out.println("Problems:");
        for (String e : res.errors()) {
            out.println("  - " + e);
        }
        return 2;
    }

    static String mask(String v) {
        if (v == null || v.isBlank()) return "<missing>";
        if (v.length() <= 6) return "****";
        return v.substring(0, 3) + "****" + v.substring(v.length() - 3);
    }
}
