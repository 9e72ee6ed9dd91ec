package com.newsresolver.exception;

public class FeedFetchException extends RuntimeException {
    public FeedFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
