package com.g11macro.manager.dto;

import com.g11macro.manager.model.KeyBinding;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record SerializeRequest(
        @NotNull(message = "Bindings cannot be null")
        List<KeyBinding> bindings) {
}
