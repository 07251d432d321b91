package com.example.configserver.exception;

import lombok.Getter;

@Getter
public class ConfigFileNotFoundException extends ConfigServerException {
    private final String path;
    private final String label;

    public ConfigFileNotFoundException(String path, String label) {
        super(String.format("File '%s' not found at label '%s'", path, label));
        this.path = path;
        this.label = label;
    }
}
