package com.g11macro.manager.exception;

public class InvalidEnumValueException extends IllegalArgumentException {

    private final String enumName;
    private final String value;

    public InvalidEnumValueException(String enumName, String value) {
        super("'" + value + "' is not a valid " + enumName);
        this.enumName = enumName;
        this.value = value;
    }

    public String getEnumName() {
        return enumName;
    }

    public String getValue() {
        return value;
    }
}
