package com.newsresolver.domain.enums;

public enum DecodeStage {
    TOKEN_EXTRACTION,
    PARAM_FETCH,
    RESOLVE
}
