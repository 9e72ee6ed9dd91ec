package com.newsresolver.exception;

import com.newsresolver.domain.enums.DecodeStage;
import lombok.Getter;

@Getter
public abstract class DecodeException extends RuntimeException {

    private final DecodeStage stage;

    protected DecodeException(DecodeStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }
}
