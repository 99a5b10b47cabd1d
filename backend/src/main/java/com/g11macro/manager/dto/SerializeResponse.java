package com.g11macro.manager.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SerializeResponse(
        boolean success,
        String text,
        Integer bindingCount,
        List<String> violations) {

    public static SerializeResponse success(String text, int bindingCount) {
        return new SerializeResponse(true, text, bindingCount, null);
    }

    public static SerializeResponse rejected(List<String> violations) {
        return new SerializeResponse(false, null, null, violations);
    }
}
