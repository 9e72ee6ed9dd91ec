package com.newsresolver.integration.googlenews;

import com.newsresolver.exception.InvalidLinkShapeException;
import com.newsresolver.exception.MalformedUrlException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;

/**
 * Pulls the opaque article token out of an aggregator link such as
 * {@code https://news.google.com/rss/articles/CBMi...?oc=5}.
 */
@Component
public class TokenExtractor {

    private static final Set<String> ARTICLE_PATH_MARKERS = Set.of("articles", "read");

    private final String newsHost;

    public TokenExtractor(@Value("${resolver.news-host:news.google.com}") String newsHost) {
        this.newsHost = newsHost.trim().toLowerCase(Locale.ROOT);
    }

    public String extractToken(String link) {
        if (link == null || link.isBlank()) {
            throw new MalformedUrlException("Empty link", null);
        }

        URI uri;
        try {
            uri = new URI(link.trim());
        } catch (URISyntaxException e) {
            throw new MalformedUrlException("Unparseable link: " + link, e);
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new MalformedUrlException("Link has no scheme or host: " + link, null);
        }

        if (!newsHost.equals(uri.getHost().toLowerCase(Locale.ROOT))) {
            throw new InvalidLinkShapeException("Not an aggregator host: " + uri.getHost());
        }

        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        String[] parts = path.split("/", -1);
        if (parts.length < 2 || !ARTICLE_PATH_MARKERS.contains(parts[parts.length - 2])) {
            throw new InvalidLinkShapeException("Unexpected article path: " + path);
        }

        String token = parts[parts.length - 1];
        if (token.isBlank()) {
            throw new InvalidLinkShapeException("Empty article token in path: " + path);
        }
        return token;
    }
}
