package com.newsresolver.source;

import com.newsresolver.domain.dto.NewsArticle;
import com.newsresolver.exception.FeedFetchException;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads the aggregator's RSS search and top-stories feeds into {@link NewsArticle}s.
 */
@Slf4j
@Component
public class GoogleNewsFeedSource {

    private static final Pattern TITLE_PUBLISHER_SUFFIX = Pattern.compile("\\s*-\\s*[^-]+$");
    private static final Pattern SOURCE_TRAILER = Pattern.compile("\\s*-\\s*.*$");
    private static final String UNKNOWN_SOURCE = "Unknown";

    private final String feedBaseUrl;

    private HttpClient httpClient = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(7))
            .version(HttpClient.Version.HTTP_1_1)
            .build();

    @Value("${resolver.user-agent:Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/129.0.0.0 Safari/537.36}")
    private String userAgent;

    @Value("${feed.timeout-seconds:10}")
    private int timeoutSeconds;

    public GoogleNewsFeedSource(@Value("${resolver.news-host:news.google.com}") String newsHost) {
        this.feedBaseUrl = "https://" + newsHost + "/rss";
    }

    public List<NewsArticle> search(String keyword, String language, String country) {
        return fetchFeed(searchUrl(keyword, language, country));
    }

    public List<NewsArticle> trending(String language, String country) {
        return fetchFeed(feedBaseUrl + "?" + localeParams(language, country));
    }

    String searchUrl(String keyword, String language, String country) {
        return feedBaseUrl + "/search?q=" + URLEncoder.encode(keyword, StandardCharsets.UTF_8)
                + "&" + localeParams(language, country);
    }

    private static String localeParams(String language, String country) {
        return "hl=" + language + "-" + country + "&gl=" + country + "&ceid=" + country + ":" + language;
    }

    List<NewsArticle> fetchFeed(String feedUrl) {
        long t0 = System.currentTimeMillis();
        log.info("Feed: fetching url={}", feedUrl);

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(feedUrl))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .GET()
                .header("User-Agent", userAgent)
                .header("Accept", "application/rss+xml, application/xml;q=0.9, text/xml;q=0.8, */*;q=0.1")
                .build();

        HttpResponse<InputStream> resp;
        try {
            resp = httpClient.send(req, HttpResponse.BodyHandlers.ofInputStream());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new FeedFetchException("Interrupted fetching feed url=" + feedUrl, ie);
        } catch (Exception e) {
            throw new FeedFetchException("Feed request failed url=" + feedUrl + " cause=" + e.getClass().getSimpleName(), e);
        }

        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            throw new FeedFetchException("Feed non-2xx status=" + status + " url=" + feedUrl, null);
        }

        List<NewsArticle> out = new ArrayList<>();
        int seen = 0;
        int skipped = 0;

        try (InputStream is = resp.body(); XmlReader reader = new XmlReader(is)) {
            SyndFeed feed = new SyndFeedInput().build(reader);

            for (SyndEntry entry : feed.getEntries()) {
                seen++;
                String link = entry.getLink();
                String rawTitle = entry.getTitle();

                if (link == null || link.isBlank() || rawTitle == null || rawTitle.isBlank()) {
                    skipped++;
                    continue;
                }
                out.add(toArticle(entry, link.trim(), rawTitle.trim()));
            }
        } catch (Exception e) {
            throw new FeedFetchException("Feed parse failed url=" + feedUrl, e);
        }

        log.info("Feed: done seen={} accepted={} skipped={} tookMs={}",
                seen, out.size(), skipped, System.currentTimeMillis() - t0);
        return out;
    }

    private NewsArticle toArticle(SyndEntry entry, String link, String rawTitle) {
        NewsArticle a = new NewsArticle();
        a.setTitle(cleanTitle(rawTitle));
        a.setLink(link);
        a.setPublishedAt(entry.getPublishedDate() != null ? entry.getPublishedDate().toInstant() : Instant.now());

        String description = entry.getDescription() != null ? entry.getDescription().getValue() : "";
        a.setDescription(description == null ? "" : Jsoup.parse(description).text().trim());

        a.setSourceName(sourceName(entry, rawTitle));
        a.setGuid(entry.getUri() != null && !entry.getUri().isBlank() ? entry.getUri() : link);
        return a;
    }

    static String cleanTitle(String title) {
        if (title == null) return "";
        String cleaned = TITLE_PUBLISHER_SUFFIX.matcher(title).replaceFirst("").trim();
        return cleaned.isEmpty() ? title.trim() : cleaned;
    }

    static String sourceName(SyndEntry entry, String rawTitle) {
        String name = null;
        if (entry.getSource() != null && entry.getSource().getTitle() != null) {
            name = entry.getSource().getTitle();
        } else if (rawTitle != null) {
            int dash = rawTitle.lastIndexOf(" - ");
            if (dash > 0) name = rawTitle.substring(dash + 3);
        }

        if (name == null) return UNKNOWN_SOURCE;
        String cleaned = SOURCE_TRAILER.matcher(name).replaceFirst("").trim();
        return cleaned.isEmpty() ? UNKNOWN_SOURCE : cleaned;
    }
}
