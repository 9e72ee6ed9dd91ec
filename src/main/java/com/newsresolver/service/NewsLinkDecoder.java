package com.newsresolver.service;

import com.newsresolver.domain.dto.DecodeResult;
import com.newsresolver.domain.dto.SignedParams;
import com.newsresolver.exception.DecodeException;
import com.newsresolver.integration.googlenews.BatchExecuteResolver;
import com.newsresolver.integration.googlenews.SignedParamsFetcher;
import com.newsresolver.integration.googlenews.TokenExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Token extraction, signed parameter fetch and the batch-execute call, in that order.
 * The first failing stage ends the attempt; retries are the caller's business.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NewsLinkDecoder {

    private final TokenExtractor tokenExtractor;
    private final SignedParamsFetcher paramsFetcher;
    private final BatchExecuteResolver resolver;

    public DecodeResult decode(String feedLink) {
        try {
            String token = tokenExtractor.extractToken(feedLink);
            SignedParams params = paramsFetcher.fetchParams(token);
            String url = resolver.resolve(params, token);
            return DecodeResult.success(url);
        } catch (DecodeException e) {
            log.debug("Decoder: failed stage={} link={} err={}", e.getStage(), feedLink, e.getMessage());
            return DecodeResult.failure(e.getStage(), e.getMessage());
        }
    }
}
