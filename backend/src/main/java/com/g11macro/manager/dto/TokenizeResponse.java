package com.g11macro.manager.dto;

import com.g11macro.manager.ron.RonToken;

import java.util.List;

public record TokenizeResponse(List<RonToken> tokens, long analysisTimeMs) {
}
