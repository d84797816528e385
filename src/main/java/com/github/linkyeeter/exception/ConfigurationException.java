package com.github.linkyeeter.exception;

/**
 * Exception thrown when configuration is invalid or a required tool is missing.
 */
public class ConfigurationException extends LinkYeeterException {

    private final String configKey;
    private final String configValue;

    public ConfigurationException(String message) {
        super(message);
        this.configKey = null;
        this.configValue = null;
    }

    public ConfigurationException(String message, String configKey, String configValue) {
        super(message);
        this.configKey = configKey;
        this.configValue = configValue;
    }

    public ConfigurationException(String message, String configKey, String configValue, Throwable cause) {
        super(message, cause);
        this.configKey = configKey;
        this.configValue = configValue;
    }

    public String getConfigKey() {
        return configKey;
    }

    public String getConfigValue() {
        return configValue;
    }
}
