package me.christianrobert.closureconv.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory settings of the closure conversion.
 *
 * <p>Keys:</p>
 * <ul>
 *   <li>{@code closure.unknown-return-policy} - UNKNOWN or PLACEHOLDER</li>
 *   <li>{@code closure.placeholder-type} - return type emitted under PLACEHOLDER</li>
 *   <li>{@code closure.default-param-type} - type of parameters without a hint</li>
 *   <li>{@code closure.fallible-returns} - wrap return types of fallible closures in an error union</li>
 *   <li>{@code closure.default-return} - append a zero-value return to bodies that can fall off the end</li>
 *   <li>{@code closure.imported-modules} - comma-separated module names visible at module level</li>
 * </ul>
 */
@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String UNKNOWN_RETURN_POLICY = "closure.unknown-return-policy";
    public static final String PLACEHOLDER_TYPE = "closure.placeholder-type";
    public static final String DEFAULT_PARAM_TYPE = "closure.default-param-type";
    public static final String FALLIBLE_RETURNS = "closure.fallible-returns";
    public static final String DEFAULT_RETURN = "closure.default-return";
    public static final String IMPORTED_MODULES = "closure.imported-modules";

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConfigService() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(UNKNOWN_RETURN_POLICY, "UNKNOWN");
        configuration.put(PLACEHOLDER_TYPE, "i64");
        configuration.put(DEFAULT_PARAM_TYPE, "i64");
        configuration.put(FALLIBLE_RETURNS, true);
        configuration.put(DEFAULT_RETURN, true);
        configuration.put(IMPORTED_MODULES, "");

        log.info("Configuration service initialized with default values");
    }

    public Map<String, Object> getAllConfiguration() {
        return new HashMap<>(configuration);
    }

    public Object getConfigValue(String key) {
        return configuration.get(key);
    }

    public String getConfigValueAsString(String key) {
        Object value = configuration.get(key);
        return value != null ? value.toString() : null;
    }

    public Boolean getConfigValueAsBoolean(String key) {
        Object value = configuration.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return null;
    }

    /**
     * Gets a configuration value as a list of strings.
     * Supports comma-separated values: "math,os,json"
     *
     * @param key Configuration key
     * @return List of trimmed, non-empty strings; empty list if the value is null or blank
     */
    public List<String> getConfigValueAsStringList(String key) {
        String value = getConfigValueAsString(key);
        if (value == null || value.trim().isEmpty()) {
            return new ArrayList<>();
        }

        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    public void updateConfiguration(Map<String, Object> newConfig) {
        log.info("Updating configuration with {} entries", newConfig.size());

        newConfig.forEach((key, value) -> {
            Object oldValue = configuration.put(key, value);
            if (log.isDebugEnabled()) {
                log.debug("Config updated: {} = {} (was: {})", key, value, oldValue);
            }
        });
    }

    public void setConfigValue(String key, Object value) {
        Object oldValue = configuration.put(key, value);
        log.debug("Config value set: {} = {} (was: {})", key, value, oldValue);
    }

    public boolean hasConfigKey(String key) {
        return configuration.containsKey(key);
    }

    public void resetToDefaults() {
        log.info("Resetting configuration to defaults");
        configuration.clear();
        initializeDefaultConfiguration();
    }
}
