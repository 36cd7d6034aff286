package com.autofurigana.domain.furigana.model;

public record AnnotationStats(
        int manualCandidateCount,
        int automaticCandidateCount,
        int exclusionZoneCount,
        int droppedByExclusionCount,
        int droppedByManualCount,
        int resolvedCount,
        int scannedLineCount,
        long latencyMs
) {}
