package com.newsresolver.exception;

import com.newsresolver.domain.enums.DecodeStage;

public class ResolveException extends DecodeException {
    public ResolveException(String message, Throwable cause) {
        super(DecodeStage.RESOLVE, message, cause);
    }
}
