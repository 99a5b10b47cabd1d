package com.g11macro.manager.exception;

public class ConfigStorageException extends Exception {

    public ConfigStorageException(String message) {
        super(message);
    }

    public ConfigStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
