package com.newsresolver.exception;

import com.newsresolver.domain.enums.DecodeStage;

public class InvalidLinkShapeException extends DecodeException {
    public InvalidLinkShapeException(String message) {
        super(DecodeStage.TOKEN_EXTRACTION, message, null);
    }
}
