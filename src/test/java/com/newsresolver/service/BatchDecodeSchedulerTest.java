package com.newsresolver.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsresolver.domain.dto.BatchStats;
import com.newsresolver.domain.dto.DecodeResult;
import com.newsresolver.domain.dto.NewsArticle;
import com.newsresolver.domain.dto.SignedParams;
import com.newsresolver.domain.enums.DecodeStage;
import com.newsresolver.exception.ParamFetchException;
import com.newsresolver.integration.googlenews.BatchExecuteResolver;
import com.newsresolver.integration.googlenews.SignedParamsFetcher;
import com.newsresolver.integration.googlenews.TokenExtractor;
import com.newsresolver.publisher.PublisherDomainDictionary;
import com.newsresolver.publisher.PublisherDomainResolver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BatchDecodeSchedulerTest {

    @Mock NewsLinkDecoder decoder;
    @Mock PublisherDomainResolver domainResolver;

    ExecutorService executor;
    BatchDecodeScheduler scheduler;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(8);
        scheduler = new BatchDecodeScheduler(decoder, domainResolver, executor);
        ReflectionTestUtils.setField(scheduler, "batchDelayMs", 0L);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void defaultConcurrency_smallAndLargeBatches() {
        assertThat(BatchDecodeScheduler.defaultConcurrency(0)).isEqualTo(3);
        assertThat(BatchDecodeScheduler.defaultConcurrency(10)).isEqualTo(3);
        assertThat(BatchDecodeScheduler.defaultConcurrency(11)).isEqualTo(5);
        assertThat(BatchDecodeScheduler.defaultConcurrency(100)).isEqualTo(5);
    }

    @Test
    void partition_keepsOrderAndLastGroupIsRemainder() {
        List<Integer> items = IntStream.range(0, 12).boxed().toList();

        List<List<Integer>> groups = BatchDecodeScheduler.partition(items, 5);

        assertThat(groups).extracting(List::size).containsExactly(5, 5, 2);
        assertThat(groups.get(2)).containsExactly(10, 11);
    }

    @Test
    void decodeBatch_resultsLandOnTheirOwnArticleDespiteJitter() {
        when(decoder.decode(anyString())).thenAnswer(inv -> {
            String link = inv.getArgument(0);
            Thread.sleep(ThreadLocalRandom.current().nextInt(0, 30));
            return DecodeResult.success("https://www.site" + link.substring(link.lastIndexOf('/') + 1) + ".com/story");
        });

        List<NewsArticle> articles = articles(12);
        BatchStats stats = scheduler.decodeBatch(articles, 5, new BatchStats());

        for (int i = 0; i < articles.size(); i++) {
            NewsArticle a = articles.get(i);
            assertThat(a.getResolvedUrl()).isEqualTo("https://www.site" + i + ".com/story");
            assertThat(a.getDomain()).isEqualTo("site" + i + ".com");
            assertThat(a.getResolutionError()).isNull();
        }
        assertThat(stats.getTotal()).isEqualTo(12);
        assertThat(stats.getSuccessful()).isEqualTo(12);
        assertThat(stats.getFailed()).isZero();
        assertThat(stats.getBatches()).isEqualTo(3);
        verifyNoInteractions(domainResolver);
    }

    @Test
    void decodeBatch_neverExceedsConcurrencyInFlight() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        when(decoder.decode(anyString())).thenAnswer(inv -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            Thread.sleep(15);
            inFlight.decrementAndGet();
            return DecodeResult.success("https://example.com/x");
        });

        scheduler.decodeBatch(articles(17), 4, new BatchStats());

        assertThat(maxInFlight.get()).isLessThanOrEqualTo(4);
    }

    @Test
    void decodeBatch_resolvedUrlWithUnescapedCharacters_keepsItsOwnHost() {
        when(decoder.decode(anyString()))
                .thenReturn(DecodeResult.success("https://www.example.com/news/a|b?x=1 2"));

        NewsArticle a = article("Rates stay on hold", "https://news.google.com/rss/articles/T0", "Reuters");
        BatchStats stats = scheduler.decodeBatch(List.of(a), new BatchStats());

        assertThat(a.getDomain()).isEqualTo("example.com");
        assertThat(a.getResolvedUrl()).isEqualTo("https://www.example.com/news/a|b?x=1 2");
        assertThat(stats.getSuccessful()).isEqualTo(1);
        verifyNoInteractions(domainResolver);
    }

    @Test
    void decodeBatch_failureFallsBackToDomainResolver() {
        when(decoder.decode(anyString()))
                .thenReturn(DecodeResult.failure(DecodeStage.PARAM_FETCH, "no params"));
        when(domainResolver.resolveDomain(any(NewsArticle.class))).thenReturn("reuters.com");

        List<NewsArticle> articles = articles(2);
        BatchStats stats = scheduler.decodeBatch(articles, new BatchStats());

        assertThat(articles).allSatisfy(a -> {
            assertThat(a.getResolvedUrl()).isNull();
            assertThat(a.getResolutionError()).isEqualTo("PARAM_FETCH: no params");
            assertThat(a.getDomain()).isEqualTo("reuters.com");
        });
        assertThat(stats.getFailed()).isEqualTo(2);
        assertThat(stats.getBatches()).isEqualTo(1);
    }

    @Test
    void decodeBatch_unexpectedExceptionBecomesFailedArticle() {
        when(decoder.decode(anyString())).thenThrow(new IllegalStateException("boom"));
        when(domainResolver.resolveDomain(any(NewsArticle.class))).thenReturn("fallback.com");

        List<NewsArticle> articles = articles(1);
        BatchStats stats = scheduler.decodeBatch(articles, new BatchStats());

        assertThat(articles.get(0).getResolutionError()).startsWith("RESOLVE: Unexpected error");
        assertThat(articles.get(0).getDomain()).isEqualTo("fallback.com");
        assertThat(stats.getFailed()).isEqualTo(1);
    }

    @Test
    void decodeBatch_emptyInput_leavesStatsUntouched() {
        BatchStats stats = scheduler.decodeBatch(List.of(), new BatchStats());

        assertThat(stats.getTotal()).isZero();
        assertThat(stats.getBatches()).isZero();
        verifyNoInteractions(decoder);
    }

    @Test
    void decodeBatch_endToEnd_mixedOutcome() {
        SignedParamsFetcher paramsFetcher = mock(SignedParamsFetcher.class);
        BatchExecuteResolver rpc = mock(BatchExecuteResolver.class);
        SignedParams params = new SignedParams("sig", 1736700000L);
        when(paramsFetcher.fetchParams("AAA")).thenReturn(params);
        when(paramsFetcher.fetchParams("BBB")).thenThrow(new ParamFetchException("No signature/timestamp found"));
        when(rpc.resolve(params, "AAA")).thenReturn("https://www.example.com/a");

        NewsLinkDecoder realDecoder = new NewsLinkDecoder(new TokenExtractor("news.google.com"), paramsFetcher, rpc);
        PublisherDomainResolver realResolver = new PublisherDomainResolver(
                new PublisherDomainDictionary(new ObjectMapper()), "news.google.com");
        BatchDecodeScheduler real = new BatchDecodeScheduler(realDecoder, realResolver, executor);
        ReflectionTestUtils.setField(real, "batchDelayMs", 0L);

        NewsArticle first = article("Markets rally on rate cut hopes", "https://news.google.com/rss/articles/AAA?oc=5", "Example");
        NewsArticle second = article("Central bank holds steady", "https://news.google.com/rss/articles/BBB?oc=5", "Reuters");

        BatchStats stats = real.decodeBatch(List.of(first, second), new BatchStats());

        assertThat(first.getResolvedUrl()).isEqualTo("https://www.example.com/a");
        assertThat(first.getDomain()).isEqualTo("example.com");
        assertThat(first.getResolutionError()).isNull();

        assertThat(second.getResolvedUrl()).isNull();
        assertThat(second.getResolutionError()).startsWith("PARAM_FETCH:");
        assertThat(second.getDomain()).isEqualTo("reuters.com");

        assertThat(stats.getTotal()).isEqualTo(2);
        assertThat(stats.getSuccessful()).isEqualTo(1);
        assertThat(stats.getFailed()).isEqualTo(1);
    }

    private static List<NewsArticle> articles(int n) {
        List<NewsArticle> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(article("Story number " + i, "https://news.google.com/rss/articles/" + i, "Source " + i));
        }
        return out;
    }

    private static NewsArticle article(String title, String link, String source) {
        NewsArticle a = new NewsArticle();
        a.setTitle(title);
        a.setLink(link);
        a.setSourceName(source);
        return a;
    }
}
