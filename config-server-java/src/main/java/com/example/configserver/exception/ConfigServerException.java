package com.example.configserver.exception;

/**
 * Base type for every failure the resolution engine reports.
 */
public abstract class ConfigServerException extends RuntimeException {
    protected ConfigServerException(String message) {
        super(message);
    }

    protected ConfigServerException(String message, Throwable cause) {
        super(message, cause);
    }
}
