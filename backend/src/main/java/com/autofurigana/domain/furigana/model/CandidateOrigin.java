package com.autofurigana.domain.furigana.model;

public enum CandidateOrigin {
    MANUAL,     // inline override markup such as {漢字|かん|じ}
    AUTOMATIC   // tokenizer-derived reading over a detected Japanese run
}
