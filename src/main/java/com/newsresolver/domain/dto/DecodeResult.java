package com.newsresolver.domain.dto;

import com.newsresolver.domain.enums.DecodeStage;

public record DecodeResult(String url, DecodeStage failedStage, String error) {

    public static DecodeResult success(String url) {
        return new DecodeResult(url, null, null);
    }

    public static DecodeResult failure(DecodeStage stage, String error) {
        return new DecodeResult(null, stage, error);
    }

    public boolean isSuccess() {
        return failedStage == null;
    }

    public String describeFailure() {
        return failedStage + ": " + error;
    }
}
