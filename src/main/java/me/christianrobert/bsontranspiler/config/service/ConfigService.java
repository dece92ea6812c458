package me.christianrobert.bsontranspiler.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runtime settings of the transpiler, editable through {@code /api/config}.
 *
 * <ul>
 *   <li>{@value #EVALUATOR_MAX_OPERATIONS} - node visits allowed per constant folding</li>
 *   <li>{@value #EVALUATOR_MAX_DEPTH} - nesting depth allowed per constant folding</li>
 *   <li>{@value #TRANSPILER_MAX_NESTING_DEPTH} - bracket nesting accepted by the parser</li>
 *   <li>{@value #TRANSPILER_INCLUDE_AST} - include the parse tree in every result</li>
 * </ul>
 *
 * <p>The limits only accept positive integers and the AST switch only accepts booleans.
 * Rejected values throw {@link IllegalArgumentException} and leave the configuration unchanged.
 */
@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String EVALUATOR_MAX_OPERATIONS = "evaluator.max-operations";
    public static final String EVALUATOR_MAX_DEPTH = "evaluator.max-depth";
    public static final String TRANSPILER_MAX_NESTING_DEPTH = "transpiler.max-nesting-depth";
    public static final String TRANSPILER_INCLUDE_AST = "transpiler.include-ast";

    private static final Set<String> POSITIVE_INT_KEYS =
            Set.of(EVALUATOR_MAX_OPERATIONS, EVALUATOR_MAX_DEPTH, TRANSPILER_MAX_NESTING_DEPTH);

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConfigService() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(EVALUATOR_MAX_OPERATIONS, 10000);
        configuration.put(EVALUATOR_MAX_DEPTH, 200);
        configuration.put(TRANSPILER_MAX_NESTING_DEPTH, 256);
        configuration.put(TRANSPILER_INCLUDE_AST, false);

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
     * Gets a configuration value as an int.
     * Accepts numbers and numeric strings (values set through the REST API arrive as either).
     *
     * @param key Configuration key
     * @param defaultValue Returned when the key is missing or not numeric
     */
    public int getConfigValueAsInt(String key, int defaultValue) {
        Object value = configuration.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                log.warn("Config value {} = '{}' is not a number, using default {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    /**
     * Checks a value against the rules of its key. Keys without rules accept any non-null value.
     *
     * @throws IllegalArgumentException if the value is not acceptable for the key
     */
    public void validate(String key, Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Value of " + key + " cannot be null");
        }
        if (POSITIVE_INT_KEYS.contains(key)) {
            Integer number = toInteger(value);
            if (number == null || number <= 0) {
                throw new IllegalArgumentException(key + " must be a positive integer, got: " + value);
            }
        } else if (TRANSPILER_INCLUDE_AST.equals(key)) {
            boolean isBoolean = value instanceof Boolean
                    || "true".equalsIgnoreCase(value.toString().trim())
                    || "false".equalsIgnoreCase(value.toString().trim());
            if (!isBoolean) {
                throw new IllegalArgumentException(key + " must be true or false, got: " + value);
            }
        }
    }

    private static Integer toInteger(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            long number = ((Number) value).longValue();
            return number > Integer.MAX_VALUE ? null : (int) number;
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public void updateConfiguration(Map<String, Object> newConfig) {
        log.info("Updating configuration with {} entries", newConfig.size());

        newConfig.forEach(this::validate);

        newConfig.forEach((key, value) -> {
            Object oldValue = configuration.put(key, value);
            if (log.isDebugEnabled()) {
                log.debug("Config updated: {} = {} (was: {})", key, value, oldValue);
            }
        });

        log.info("Configuration updated successfully");
    }

    public void setConfigValue(String key, Object value) {
        validate(key, value);
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
