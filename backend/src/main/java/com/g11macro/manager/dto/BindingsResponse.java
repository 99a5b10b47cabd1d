package com.g11macro.manager.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.g11macro.manager.model.KeyBinding;

import java.util.List;

/**
 * Bindings read from disk. A failed read still answers with an empty list, plus the error.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BindingsResponse(
        List<KeyBinding> bindings,
        String error,
        String path) {
}
