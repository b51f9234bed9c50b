package io.cardfederation.util;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Environment overrides for deployment-specific settings such as the origin URL
 * and the etcd endpoints.
 */
public final class EnvironmentUtils {

    private EnvironmentUtils() {
    }

    /**
     * Trimmed value of {@code name}, or {@code defaultValue} when unset or blank.
     */
    public static String getEnv(String name, String defaultValue) {
        String value = System.getenv(name);
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    /**
     * Comma separated list held by {@code name}; empty when unset.
     */
    public static List<String> getEnvList(String name) {
        return splitList(System.getenv(name));
    }

    static List<String> splitList(String value) {
        if (value == null || value.isBlank()) {
            return Collections.emptyList();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(item -> !item.isEmpty())
                .collect(Collectors.toList());
    }
}
