package com.autofurigana.domain.furigana.model;

public enum ExclusionType {
    SELECTION,
    INLINE_CODE,
    FENCED_CODE
}
