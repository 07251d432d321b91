package com.example.configserver.exception;

public class BadRequestException extends ConfigServerException {
    public BadRequestException(String message) {
        super(message);
    }
}
