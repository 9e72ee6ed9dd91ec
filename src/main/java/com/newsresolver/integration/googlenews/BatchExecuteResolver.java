package com.newsresolver.integration.googlenews;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsresolver.domain.dto.SignedParams;
import com.newsresolver.exception.ResolveException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

@Slf4j
@Component
public class BatchExecuteResolver {

    private final ObjectMapper mapper;
    private final String endpoint;

    private HttpClient httpClient = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(7))
            .version(HttpClient.Version.HTTP_1_1)
            .build();

    @Value("${resolver.user-agent:Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/129.0.0.0 Safari/537.36}")
    private String userAgent;

    @Value("${resolver.http-timeout-seconds:10}")
    private int timeoutSeconds;

    public BatchExecuteResolver(ObjectMapper mapper,
                                @Value("${resolver.news-host:news.google.com}") String newsHost) {
        this.mapper = mapper;
        this.endpoint = "https://" + newsHost + "/_/DotsSplashUi/data/batchexecute";
    }

    public String resolve(SignedParams params, String token) {
        String body;
        try {
            body = BatchExecuteEnvelope.formBody(mapper, token, params);
        } catch (JsonProcessingException e) {
            throw new ResolveException("Failed to build batchexecute payload", e);
        }

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(endpoint))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .header("Content-Type", "application/x-www-form-urlencoded;charset=UTF-8")
                .header("User-Agent", userAgent)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> resp;
        try {
            resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ResolveException("Interrupted calling batchexecute", ie);
        } catch (Exception e) {
            throw new ResolveException("batchexecute request failed cause=" + e.getClass().getSimpleName(), e);
        }

        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new ResolveException("batchexecute non-2xx status=" + resp.statusCode(), null);
        }

        String url = parseResponse(resp.body());
        log.debug("Decoder: resolved token={} url={}", token, url);
        return url;
    }

    /**
     * The body is a multi-line envelope; the first line starting with {@code [[} holds a JSON array whose
     * {@code [0][2]} is itself a JSON document, and that document's {@code [1]} is the source URL.
     */
    String parseResponse(String body) {
        if (body == null || body.isBlank()) {
            throw new ResolveException("Empty batchexecute response", null);
        }

        String dataLine = body.lines()
                .filter(line -> line.startsWith("[["))
                .findFirst()
                .orElseThrow(() -> new ResolveException("No data line in batchexecute response", null));

        JsonNode outer;
        try {
            outer = mapper.readTree(dataLine);
        } catch (JsonProcessingException e) {
            throw new ResolveException("Data line is not valid JSON", e);
        }

        JsonNode innerText = outer.path(0).path(2);
        if (!innerText.isTextual()) {
            throw new ResolveException("Missing [0][2] payload string in batchexecute response", null);
        }

        JsonNode inner;
        try {
            inner = mapper.readTree(innerText.asText());
        } catch (JsonProcessingException e) {
            throw new ResolveException("Inner payload is not valid JSON", e);
        }

        JsonNode url = inner.path(1);
        if (!url.isTextual() || url.asText().isBlank()) {
            throw new ResolveException("Missing URL at [1] of inner payload", null);
        }
        return url.asText();
    }
}
