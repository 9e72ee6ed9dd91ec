package com.newsresolver.service;

import com.newsresolver.domain.dto.BatchStats;
import com.newsresolver.domain.dto.DecodeResult;
import com.newsresolver.domain.dto.NewsArticle;
import com.newsresolver.domain.enums.DecodeStage;
import com.newsresolver.publisher.PublisherDomainResolver;
import com.newsresolver.util.UrlUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Decodes feed links in sequential groups. Each group runs concurrently and is joined before the
 * next one starts, with a fixed pause in between to stay under the aggregator's rate limits.
 */
@Slf4j
@Service
public class BatchDecodeScheduler {

    static final int SMALL_BATCH_THRESHOLD = 10;
    static final int SMALL_BATCH_CONCURRENCY = 3;
    static final int LARGE_BATCH_CONCURRENCY = 5;

    private final NewsLinkDecoder decoder;
    private final PublisherDomainResolver domainResolver;
    private final Executor executor;

    @Value("${resolver.batch-delay-ms:200}")
    private long batchDelayMs;

    public BatchDecodeScheduler(NewsLinkDecoder decoder,
                                PublisherDomainResolver domainResolver,
                                @Qualifier("decodeExecutor") Executor executor) {
        this.decoder = decoder;
        this.domainResolver = domainResolver;
        this.executor = executor;
    }

    public static int defaultConcurrency(int batchSize) {
        return batchSize <= SMALL_BATCH_THRESHOLD ? SMALL_BATCH_CONCURRENCY : LARGE_BATCH_CONCURRENCY;
    }

    public BatchStats decodeBatch(List<NewsArticle> articles, BatchStats stats) {
        int size = articles == null ? 0 : articles.size();
        return decodeBatch(articles, defaultConcurrency(size), stats);
    }

    public BatchStats decodeBatch(List<NewsArticle> articles, int concurrency, BatchStats stats) {
        if (articles == null || articles.isEmpty()) return stats;

        List<List<NewsArticle>> groups = partition(articles, concurrency);
        long t0 = System.currentTimeMillis();

        log.info("Batch: decoding articles={} groups={} concurrency={}", articles.size(), groups.size(), concurrency);

        for (int g = 0; g < groups.size(); g++) {
            List<NewsArticle> group = groups.get(g);
            stats.recordBatch();

            List<CompletableFuture<DecodeResult>> futures = group.stream()
                    .map(article -> CompletableFuture.supplyAsync(() -> decoder.decode(article.getLink()), executor)
                            .exceptionally(ex -> DecodeResult.failure(DecodeStage.RESOLVE, "Unexpected error: " + ex)))
                    .toList();

            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();

            for (int i = 0; i < group.size(); i++) {
                apply(group.get(i), futures.get(i).join(), stats);
            }

            log.debug("Batch: group {}/{} done size={} successful={} failed={}",
                    g + 1, groups.size(), group.size(), stats.getSuccessful(), stats.getFailed());

            if (g < groups.size() - 1 && batchDelayMs > 0) {
                sleep(batchDelayMs);
            }
        }

        long tookMs = System.currentTimeMillis() - t0;
        stats.addElapsedMs(tookMs);
        log.info("Batch: done total={} successful={} failed={} tookMs={}",
                stats.getTotal(), stats.getSuccessful(), stats.getFailed(), tookMs);
        return stats;
    }

    private void apply(NewsArticle article, DecodeResult result, BatchStats stats) {
        if (result.isSuccess()) {
            stats.recordSuccess();
            article.setResolvedUrl(result.url());
            article.setResolutionError(null);
            article.setDomain(UrlUtils.hostWithoutWww(result.url())
                    .orElseGet(() -> domainResolver.resolveDomain(article)));
        } else {
            stats.recordFailure();
            article.setResolvedUrl(null);
            article.setResolutionError(result.describeFailure());
            article.setDomain(domainResolver.resolveDomain(article));
            log.debug("Batch: decode failed title='{}' err={}",
                    UrlUtils.abbreviate(article.getTitle(), 80), article.getResolutionError());
        }
    }

    static <T> List<List<T>> partition(List<T> list, int size) {
        int n = Math.max(1, size);
        List<List<T>> parts = new ArrayList<>();
        for (int i = 0; i < list.size(); i += n) {
            parts.add(list.subList(i, Math.min(i + n, list.size())));
        }
        return parts;
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
