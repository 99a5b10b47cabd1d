package com.g11macro.manager.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record TextRequest(
        @NotNull(message = "Text cannot be null")
        @Size(max = 1_000_000, message = "Text cannot exceed 1MB")
        String text) {
}
