package com.g11macro.manager.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SaveResponse(
        boolean success,
        String message,
        List<String> violations,
        Integer bindingCount) {

    public static SaveResponse saved(int bindingCount) {
        return new SaveResponse(true, "Saved, restart the daemon to apply", null, bindingCount);
    }

    public static SaveResponse invalid(List<String> violations) {
        return new SaveResponse(false, "Validation error", violations, null);
    }

    public static SaveResponse failed(String message) {
        return new SaveResponse(false, message, null, null);
    }
}
