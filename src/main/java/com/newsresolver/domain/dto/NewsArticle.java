package com.newsresolver.domain.dto;

import lombok.Data;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;

@Data
public class NewsArticle {
    private String title;
    private String link;
    private Instant publishedAt;
    private String description;
    private String sourceName;
    private String guid;

    private String resolvedUrl;
    private String domain;
    private String resolutionError;

    private ScreenshotResult screenshot;

    /**
     * Stable identifier derived from title and feed link, used to name screenshot files.
     */
    public String articleId() {
        String seed = (title == null ? "" : title) + (link == null ? "" : link);
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            byte[] digest = md5.digest(seed.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    /**
     * The URL a reader should open: the resolved source URL when known, otherwise the feed link.
     */
    public String bestUrl() {
        return resolvedUrl != null && !resolvedUrl.isBlank() ? resolvedUrl : link;
    }
}
