package com.example.configserver.exception;

import lombok.Getter;

@Getter
public class EnvironmentNotFoundException extends ConfigServerException {
    private final String environment;

    public EnvironmentNotFoundException(String environment) {
        super(String.format("Environment '%s' not found", environment));
        this.environment = environment;
    }
}
