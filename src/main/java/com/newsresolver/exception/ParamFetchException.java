package com.newsresolver.exception;

import com.newsresolver.domain.enums.DecodeStage;

public class ParamFetchException extends DecodeException {
    public ParamFetchException(String message) {
        super(DecodeStage.PARAM_FETCH, message, null);
    }
}
