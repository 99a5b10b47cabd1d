package com.g11macro.manager.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record NormalizeResponse(
        boolean success,
        String text,
        String error) {

    public static NormalizeResponse success(String text) {
        return new NormalizeResponse(true, text, null);
    }

    public static NormalizeResponse error(String error) {
        return new NormalizeResponse(false, null, error);
    }
}
