package com.newsresolver.exception;

import com.newsresolver.domain.enums.DecodeStage;

public class MalformedUrlException extends DecodeException {
    public MalformedUrlException(String message, Throwable cause) {
        super(DecodeStage.TOKEN_EXTRACTION, message, cause);
    }
}
