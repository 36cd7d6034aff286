package com.autofurigana.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
