package com.example.configserver.exception;

import lombok.Getter;

/**
 * A configuration file was found but could not be decoded or parsed.
 */
@Getter
public class ConfigParseException extends ConfigServerException {
    private final String file;

    public ConfigParseException(String file, String reason, Throwable cause) {
        super(String.format("Failed to parse '%s': %s", file, reason), cause);
        this.file = file;
    }
}
