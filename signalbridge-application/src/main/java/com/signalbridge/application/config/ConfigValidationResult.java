package com.signalbridge.application.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Errors block startup; warnings are printed but do not change the exit code.
 */
public final class ConfigValidationResult {

    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public void addError(String error) {
        if (error != null && !error.isBlank()) errors.add(error);
    }

    public void addWarning(String warning) {
        if (warning != null && !warning.isBlank()) warnings.add(warning);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> errors() {
        return List.copyOf(errors);
    }

    public List<String> warnings() {
        return List.copyOf(warnings);
    }
}
