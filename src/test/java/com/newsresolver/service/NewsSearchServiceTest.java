package com.newsresolver.service;

import com.newsresolver.domain.dto.BatchStats;
import com.newsresolver.domain.dto.DecodeResult;
import com.newsresolver.domain.dto.NewsArticle;
import com.newsresolver.domain.dto.ScreenshotOptions;
import com.newsresolver.domain.dto.SearchQuery;
import com.newsresolver.domain.dto.SearchResult;
import com.newsresolver.domain.enums.DecodeStage;
import com.newsresolver.exception.FeedFetchException;
import com.newsresolver.processor.ArticleDeduplicator;
import com.newsresolver.publisher.PublisherDomainResolver;
import com.newsresolver.source.GoogleNewsFeedSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NewsSearchServiceTest {

    @Mock GoogleNewsFeedSource feedSource;
    @Mock BatchDecodeScheduler batchDecodeScheduler;
    @Mock PublisherDomainResolver domainResolver;
    @Mock ScreenshotCaptureService screenshotCaptureService;
    @Mock NewsLinkDecoder newsLinkDecoder;

    NewsSearchService service;

    @BeforeEach
    void setUp() {
        service = new NewsSearchService(feedSource, batchDecodeScheduler, domainResolver,
                new ArticleDeduplicator(), screenshotCaptureService, newsLinkDecoder);
        ReflectionTestUtils.setField(service, "trendingMaxResults", 2);
    }

    @Test
    void search_feedFailure_returnsFailureResult() {
        when(feedSource.search("bitcoin", "en", "US"))
                .thenThrow(new FeedFetchException("Feed non-2xx status=503", null));

        SearchResult result = service.search(SearchQuery.builder().keyword("bitcoin").build());

        assertThat(result.success()).isFalse();
        assertThat(result.keyword()).isEqualTo("bitcoin");
        assertThat(result.articles()).isEmpty();
        assertThat(result.error()).contains("status=503");
        verifyNoInteractions(batchDecodeScheduler, screenshotCaptureService);
    }

    @Test
    void search_decodes_thenDedupes_thenTruncates() {
        List<NewsArticle> raw = articles(6);
        raw.add(article("Headline number zero repeated", raw.get(0).getLink()));
        when(feedSource.search("ai", "en", "US")).thenReturn(raw);
        when(batchDecodeScheduler.decodeBatch(same(raw), any(BatchStats.class))).thenAnswer(inv -> {
            BatchStats stats = inv.getArgument(1);
            List<NewsArticle> in = inv.getArgument(0);
            in.forEach(a -> stats.recordSuccess());
            return stats;
        });

        SearchResult result = service.search(SearchQuery.builder().keyword("ai").maxResults(4).build());

        assertThat(result.success()).isTrue();
        assertThat(result.totalResults()).isEqualTo(4);
        assertThat(result.articles()).containsExactlyElementsOf(raw.subList(0, 4));
        assertThat(result.decodingStats().getTotal()).isEqualTo(7);
        verifyNoInteractions(domainResolver, screenshotCaptureService);
    }

    @Test
    void search_queryWithoutExplicitLimit_usesDefaultOfTwenty() {
        SearchQuery query = SearchQuery.builder().keyword("ai").decodeUrls(false).build();
        assertThat(query.getMaxResults()).isEqualTo(20);

        List<NewsArticle> raw = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            raw.add(article("Distinct headline words" + i + " about topic" + i, "https://news.google.com/rss/articles/D" + i));
        }
        when(feedSource.search("ai", "en", "US")).thenReturn(raw);
        when(domainResolver.resolveDomain(any(NewsArticle.class))).thenReturn("example.com");

        SearchResult result = service.search(query);

        assertThat(result.totalResults()).isEqualTo(20);
    }

    @Test
    void search_withoutDecoding_resolvesDomainsHeuristically() {
        List<NewsArticle> raw = articles(3);
        when(feedSource.search("ai", "en", "GB")).thenReturn(raw);
        when(domainResolver.resolveDomain(any(NewsArticle.class))).thenReturn("example.com");

        SearchResult result = service.search(SearchQuery.builder()
                .keyword("ai").country("GB").decodeUrls(false).build());

        assertThat(result.decodingStats()).isNull();
        assertThat(result.articles()).extracting(NewsArticle::getDomain).containsOnly("example.com");
        verify(domainResolver, times(3)).resolveDomain(any(NewsArticle.class));
        verifyNoInteractions(batchDecodeScheduler);
    }

    @Test
    void search_withScreenshots_capturesReturnedArticles() {
        List<NewsArticle> raw = articles(2);
        when(feedSource.search("ai", "en", "US")).thenReturn(raw);
        when(domainResolver.resolveDomain(any(NewsArticle.class))).thenReturn("example.com");

        SearchResult result = service.search(SearchQuery.builder()
                .keyword("ai").decodeUrls(false).captureScreenshots(true).build());

        verify(screenshotCaptureService).captureAll(result.articles(), ScreenshotOptions.defaults(), 2);
    }

    @Test
    void trending_usesConfiguredLimitAndNoDecoding() {
        when(feedSource.trending("en", "US")).thenReturn(articles(5));
        when(domainResolver.resolveDomain(any(NewsArticle.class))).thenReturn("example.com");

        SearchResult result = service.trending("en", "US");

        assertThat(result.success()).isTrue();
        assertThat(result.keyword()).isNull();
        assertThat(result.totalResults()).isEqualTo(2);
        verifyNoInteractions(batchDecodeScheduler);
    }

    @Test
    void decodeSingle_delegatesToDecoder() {
        DecodeResult failed = DecodeResult.failure(DecodeStage.TOKEN_EXTRACTION, "Not an aggregator host: x.com");
        when(newsLinkDecoder.decode("https://x.com/a")).thenReturn(failed);

        assertThat(service.decodeSingle("https://x.com/a")).isSameAs(failed);
    }

    private static List<NewsArticle> articles(int n) {
        List<NewsArticle> out = new ArrayList<>();
        String[] topics = {"Markets", "Elections", "Weather", "Football", "Science", "Movies", "Travel"};
        for (int i = 0; i < n; i++) {
            out.add(article(topics[i] + " update for readers today", "https://news.google.com/rss/articles/T" + i));
        }
        return out;
    }

    private static NewsArticle article(String title, String link) {
        NewsArticle a = new NewsArticle();
        a.setTitle(title);
        a.setLink(link);
        return a;
    }
}
