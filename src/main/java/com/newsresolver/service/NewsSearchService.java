package com.newsresolver.service;

import com.newsresolver.domain.dto.BatchStats;
import com.newsresolver.domain.dto.DecodeResult;
import com.newsresolver.domain.dto.NewsArticle;
import com.newsresolver.domain.dto.ScreenshotOptions;
import com.newsresolver.domain.dto.SearchQuery;
import com.newsresolver.domain.dto.SearchResult;
import com.newsresolver.exception.FeedFetchException;
import com.newsresolver.processor.ArticleDeduplicator;
import com.newsresolver.publisher.PublisherDomainResolver;
import com.newsresolver.source.GoogleNewsFeedSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class NewsSearchService {

    private final GoogleNewsFeedSource feedSource;
    private final BatchDecodeScheduler batchDecodeScheduler;
    private final PublisherDomainResolver domainResolver;
    private final ArticleDeduplicator deduplicator;
    private final ScreenshotCaptureService screenshotCaptureService;
    private final NewsLinkDecoder newsLinkDecoder;

    @Value("${search.trending-max-results:20}")
    private int trendingMaxResults;

    public SearchResult search(SearchQuery query) {
        String searchId = UUID.randomUUID().toString();
        try (MDC.MDCCloseable ignored = MDC.putCloseable("searchId", searchId)) {
            log.info("Search started keyword='{}' lang={} country={} max={} decode={} screenshots={}",
                    query.getKeyword(), query.getLanguage(), query.getCountry(), query.getMaxResults(),
                    query.isDecodeUrls(), query.isCaptureScreenshots());

            List<NewsArticle> raw;
            try {
                raw = feedSource.search(query.getKeyword(), query.getLanguage(), query.getCountry());
            } catch (FeedFetchException e) {
                log.warn("Search failed keyword='{}' err={}", query.getKeyword(), e.getMessage());
                return SearchResult.failure(query.getKeyword(), e.getMessage());
            }

            SearchResult result = assemble(query.getKeyword(), raw, query.getMaxResults(), query.isDecodeUrls());

            if (query.isCaptureScreenshots() && !result.articles().isEmpty()) {
                ScreenshotOptions options = query.getScreenshotOptions() != null
                        ? query.getScreenshotOptions()
                        : ScreenshotOptions.defaults();
                screenshotCaptureService.captureAll(result.articles(), options, result.articles().size());
            }

            log.info("Search done keyword='{}' results={} stats={}",
                    query.getKeyword(), result.totalResults(), result.decodingStats());
            return result;
        }
    }

    public SearchResult trending(String language, String country) {
        String searchId = UUID.randomUUID().toString();
        try (MDC.MDCCloseable ignored = MDC.putCloseable("searchId", searchId)) {
            List<NewsArticle> raw;
            try {
                raw = feedSource.trending(language, country);
            } catch (FeedFetchException e) {
                log.warn("Trending fetch failed err={}", e.getMessage());
                return SearchResult.failure(null, e.getMessage());
            }
            return assemble(null, raw, trendingMaxResults, false);
        }
    }

    public DecodeResult decodeSingle(String link) {
        return newsLinkDecoder.decode(link);
    }

    private SearchResult assemble(String keyword, List<NewsArticle> raw, int maxResults, boolean decodeUrls) {
        BatchStats stats = null;
        if (decodeUrls) {
            stats = batchDecodeScheduler.decodeBatch(raw, new BatchStats());
        } else {
            for (NewsArticle a : raw) {
                a.setDomain(domainResolver.resolveDomain(a));
            }
        }

        List<NewsArticle> unique = deduplicator.dedupe(raw);
        List<NewsArticle> limited = unique.size() > maxResults ? List.copyOf(unique.subList(0, maxResults)) : unique;

        log.info("Articles raw={} unique={} returned={}", raw.size(), unique.size(), limited.size());
        return SearchResult.success(keyword, limited, stats);
    }
}
