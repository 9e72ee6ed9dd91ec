package com.newsresolver.integration.googlenews;

import com.newsresolver.domain.dto.SignedParams;
import com.newsresolver.exception.ParamFetchException;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Scrapes the per-token signature and timestamp from the aggregator's article page.
 * The markup carrying them differs by token category, so both article page shapes are tried in order.
 */
@Slf4j
@Component
public class SignedParamsFetcher {

    static final String PARAMS_SELECTOR = "c-wiz > div[jscontroller]";
    static final String SIGNATURE_ATTR = "data-n-a-sg";
    static final String TIMESTAMP_ATTR = "data-n-a-ts";

    private final String newsHost;
    private final List<UnaryOperator<String>> candidateUrls;

    private HttpClient httpClient = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(7))
            .version(HttpClient.Version.HTTP_1_1)
            .build();

    @Value("${resolver.user-agent:Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/129.0.0.0 Safari/537.36}")
    private String userAgent;

    @Value("${resolver.http-timeout-seconds:10}")
    private int timeoutSeconds;

    public SignedParamsFetcher(@Value("${resolver.news-host:news.google.com}") String newsHost) {
        this.newsHost = newsHost;
        this.candidateUrls = List.of(
                token -> "https://" + this.newsHost + "/articles/" + token,
                token -> "https://" + this.newsHost + "/rss/articles/" + token
        );
    }

    public SignedParams fetchParams(String token) {
        for (UnaryOperator<String> candidate : candidateUrls) {
            String url = candidate.apply(token);
            Optional<SignedParams> params = tryCandidate(url);
            if (params.isPresent()) {
                return params.get();
            }
        }
        throw new ParamFetchException("No signature/timestamp found on any of "
                + candidateUrls.size() + " article pages for token " + token);
    }

    private Optional<SignedParams> tryCandidate(String url) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .GET()
                .header("User-Agent", userAgent)
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .header("Accept-Language", "en-US,en;q=0.9")
                .build();

        try {
            HttpResponse<String> resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
            int status = resp.statusCode();
            if (status < 200 || status >= 300) {
                log.debug("Decoder: params page non-2xx status={} url={}", status, url);
                return Optional.empty();
            }
            return parseParams(resp.body(), url);

        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("Decoder: interrupted fetching params url={}", url);
            return Optional.empty();
        } catch (Exception e) {
            log.warn("Decoder: params page fetch failed url={} err={}, trying next", url, e.toString());
            return Optional.empty();
        }
    }

    static Optional<SignedParams> parseParams(String html, String url) {
        if (html == null || html.isBlank()) return Optional.empty();

        Document doc = Jsoup.parse(html, url);
        Element el = doc.selectFirst(PARAMS_SELECTOR);
        if (el == null) {
            log.debug("Decoder: no params element url={}", url);
            return Optional.empty();
        }

        String signature = el.attr(SIGNATURE_ATTR).trim();
        String timestamp = el.attr(TIMESTAMP_ATTR).trim();
        if (signature.isEmpty() || timestamp.isEmpty()) {
            log.debug("Decoder: params element missing attributes url={}", url);
            return Optional.empty();
        }

        try {
            return Optional.of(new SignedParams(signature, Long.parseLong(timestamp)));
        } catch (NumberFormatException e) {
            log.debug("Decoder: non-numeric timestamp '{}' url={}", timestamp, url);
            return Optional.empty();
        }
    }
}
