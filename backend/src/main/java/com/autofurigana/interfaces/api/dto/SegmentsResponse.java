package com.autofurigana.interfaces.api.dto;

import java.util.List;

public record SegmentsResponse(List<String> base, List<String> readings) {}
