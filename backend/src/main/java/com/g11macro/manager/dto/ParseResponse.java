package com.g11macro.manager.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.g11macro.manager.model.KeyBinding;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParseResponse(
        boolean success,
        List<KeyBinding> bindings,
        String error,
        long analysisTimeMs) {

    public static ParseResponse success(List<KeyBinding> bindings, long analysisTimeMs) {
        return new ParseResponse(true, bindings, null, analysisTimeMs);
    }

    public static ParseResponse error(String error, long analysisTimeMs) {
        return new ParseResponse(false, List.of(), error, analysisTimeMs);
    }
}
