package com.autofurigana.interfaces.api.dto;

public record TokenizerStatusResponse(boolean ready) {}
