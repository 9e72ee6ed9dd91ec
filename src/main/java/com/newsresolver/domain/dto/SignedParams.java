package com.newsresolver.domain.dto;

/**
 * Per-token signature and server timestamp required by the batch-execute call.
 */
public record SignedParams(String signature, long timestamp) {}
