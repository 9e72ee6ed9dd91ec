package com.newsresolver.integration.screenshot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsresolver.domain.dto.ScreenshotOptions;
import com.newsresolver.domain.dto.ScreenshotResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Client for a hosted screenshot API: asks it to render the page, then downloads the image it returns.
 */
@Slf4j
@Component
public class ScreenshotApiClient implements ScreenshotClient {

    private final ObjectMapper mapper;

    private HttpClient httpClient = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(10))
            .version(HttpClient.Version.HTTP_1_1)
            .build();

    @Value("${screenshot.api-key:}")
    private String apiKey;

    @Value("${screenshot.base-url:https://shot.screenshotapi.net/v3/screenshot}")
    private String baseUrl;

    @Value("${screenshot.dir:screenshots/raw}")
    private String screenshotDir;

    @Value("${screenshot.max-retries:1}")
    private int maxRetries;

    @Value("${screenshot.retry-delay-ms:500}")
    private long retryDelayMs;

    @Value("${screenshot.download-timeout-seconds:30}")
    private int downloadTimeoutSeconds;

    public ScreenshotApiClient(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public ScreenshotResult capture(String url, String articleId, ScreenshotOptions options) {
        if (apiKey == null || apiKey.isBlank()) {
            return ScreenshotResult.failed(url, articleId, "Screenshot API key not configured");
        }
        ScreenshotOptions opts = options != null ? options : ScreenshotOptions.defaults();
        Path target = Path.of(screenshotDir).resolve(System.currentTimeMillis() + "_" + articleId + "." + opts.format());

        String lastError = "no attempt made";
        int attempts = Math.max(1, maxRetries);

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                log.info("Screenshot: capturing url={} attempt={}/{}", url, attempt, attempts);
                String imageUrl = requestScreenshot(url, opts);
                download(imageUrl, target);
                log.info("Screenshot: saved file={} url={}", target.getFileName(), url);
                return ScreenshotResult.captured(url, articleId, target);

            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return ScreenshotResult.failed(url, articleId, "Interrupted");
            } catch (Exception e) {
                lastError = e.getMessage() != null ? e.getMessage() : e.toString();
                log.warn("Screenshot: attempt {} failed url={} err={}", attempt, url, lastError);
                if (attempt < attempts) {
                    try {
                        Thread.sleep(retryDelayMs);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        return ScreenshotResult.failed(url, articleId, "Interrupted");
                    }
                }
            }
        }

        log.error("Screenshot: giving up url={} after {} attempts err={}", url, attempts, lastError);
        return ScreenshotResult.failed(url, articleId, lastError);
    }

    private String requestScreenshot(String url, ScreenshotOptions opts) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "?" + query(url, opts)))
                .timeout(Duration.ofSeconds(opts.timeoutSeconds() + 10L))
                .GET()
                .header("Accept", "application/json")
                .build();

        HttpResponse<String> resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new IOException("Screenshot API non-2xx status=" + resp.statusCode());
        }

        JsonNode root = mapper.readTree(resp.body());
        String imageUrl = root.path("screenshot").asText("");
        if (imageUrl.isBlank()) {
            throw new IOException("Invalid API response: missing screenshot URL");
        }
        return imageUrl;
    }

    private void download(String imageUrl, Path target) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(imageUrl))
                .timeout(Duration.ofSeconds(downloadTimeoutSeconds))
                .GET()
                .build();

        HttpResponse<InputStream> resp = httpClient.send(req, HttpResponse.BodyHandlers.ofInputStream());
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new IOException("Image download non-2xx status=" + resp.statusCode());
        }

        Files.createDirectories(target.toAbsolutePath().getParent());
        try (InputStream in = resp.body()) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    String query(String url, ScreenshotOptions opts) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("token", apiKey);
        params.put("url", url);
        params.put("output", "json");
        params.put("file_type", opts.format());
        params.put("viewport_width", String.valueOf(opts.viewportWidth()));
        params.put("viewport_height", String.valueOf(opts.viewportHeight()));
        params.put("full_page", String.valueOf(opts.fullPage()));
        params.put("delay", String.valueOf(opts.delaySeconds() * 1000L));
        params.put("timeout", String.valueOf(opts.timeoutSeconds() * 1000L));
        params.put("device_scale_factor", String.valueOf(opts.deviceScaleFactor()));
        if (opts.blockAds()) params.put("block_ads", "true");
        if (opts.blockCookieBanners()) params.put("block_cookie_banners", "true");
        if (opts.blockPopups()) params.put("block_popups", "true");

        return params.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }
}
