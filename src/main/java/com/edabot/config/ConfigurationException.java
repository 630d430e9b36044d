package com.edabot.config;

import com.edabot.core.PipelineException;

public class ConfigurationException extends PipelineException {

    public ConfigurationException(String message) {
        super("config", message);
    }

    public ConfigurationException(String stage, String message) {
        super(stage, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super("config", message, cause);
    }
}
