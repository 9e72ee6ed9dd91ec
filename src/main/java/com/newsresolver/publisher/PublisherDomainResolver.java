package com.newsresolver.publisher;

import com.newsresolver.domain.dto.NewsArticle;
import com.newsresolver.util.UrlUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Best-effort publisher domain for an article. Authoritative when the source URL was resolved,
 * heuristic otherwise; always returns a non-empty string.
 */
@Slf4j
@Component
public class PublisherDomainResolver {

    private static final Pattern DOMAIN_LIKE = Pattern.compile("([a-z0-9-]+\\.[a-z]{2,})");
    private static final Pattern EMBEDDED_URL = Pattern.compile("https?://([^/\\s\"]+)");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");
    private static final String LEGACY_TOKEN_PREFIX = "CBMi";

    private final PublisherDomainDictionary dictionary;
    private final String newsHost;
    private final List<DomainStrategy> strategies;

    public PublisherDomainResolver(PublisherDomainDictionary dictionary,
                                   @Value("${resolver.news-host:news.google.com}") String newsHost) {
        this.dictionary = dictionary;
        this.newsHost = newsHost.trim().toLowerCase(Locale.ROOT);
        this.strategies = List.of(
                this::fromResolvedUrl,
                this::fromFeedLink,
                this::fromSourceDictionary,
                this::fromSourceNamePattern,
                this::fromTitleMention,
                this::synthesizedFromSourceName
        );
    }

    public String resolveDomain(NewsArticle article) {
        for (DomainStrategy strategy : strategies) {
            try {
                Optional<String> domain = strategy.apply(article);
                if (domain.isPresent() && !domain.get().isBlank()) {
                    return domain.get();
                }
            } catch (RuntimeException e) {
                log.debug("Domain: strategy failed title='{}' err={}",
                        article == null ? null : UrlUtils.abbreviate(article.getTitle(), 80), e.toString());
            }
        }
        return lastResort(article);
    }

    Optional<String> fromResolvedUrl(NewsArticle article) {
        return UrlUtils.hostWithoutWww(article.getResolvedUrl());
    }

    Optional<String> fromFeedLink(NewsArticle article) {
        String link = article.getLink();
        if (link == null || link.isBlank()) return Optional.empty();

        String host = UrlUtils.host(link).orElse("");
        if (host.isEmpty()) return Optional.empty();

        String path = UrlUtils.rawPath(link);
        if (host.equals(newsHost)) {
            return fromLegacyToken(path);
        }

        String hostAndPath = host + path.toLowerCase(Locale.ROOT);
        Optional<String> known = dictionary.matchPublisher(hostAndPath);
        if (known.isPresent()) return known;

        Matcher m = DOMAIN_LIKE.matcher(host);
        if (m.find()) {
            return UrlUtils.hostWithoutWww("https://" + host);
        }
        return Optional.empty();
    }

    /**
     * Older aggregator tokens are base64 protobufs with the source URL inside in clear text.
     */
    Optional<String> fromLegacyToken(String path) {
        if (path == null) return Optional.empty();
        int i = path.indexOf("/articles/");
        if (i < 0) return Optional.empty();

        String token = path.substring(i + "/articles/".length());
        if (!token.startsWith(LEGACY_TOKEN_PREFIX)) return Optional.empty();

        String body = token.substring(LEGACY_TOKEN_PREFIX.length()).replaceAll("0gE.*$", "")
                .replace('+', '-').replace('/', '_').replace("=", "");
        if (body.length() % 4 == 1) body = body.substring(0, body.length() - 1);

        String decoded;
        try {
            decoded = new String(Base64.getUrlDecoder().decode(body), StandardCharsets.ISO_8859_1);
        } catch (IllegalArgumentException e) {
            log.debug("Domain: token is not base64 path={}", path);
            return Optional.empty();
        }

        Matcher m = EMBEDDED_URL.matcher(decoded);
        if (!m.find()) return Optional.empty();
        return UrlUtils.hostWithoutWww("https://" + m.group(1));
    }

    Optional<String> fromSourceDictionary(NewsArticle article) {
        return dictionary.matchPublisher(article.getSourceName());
    }

    Optional<String> fromSourceNamePattern(NewsArticle article) {
        String source = article.getSourceName();
        if (source == null) return Optional.empty();
        Matcher m = DOMAIN_LIKE.matcher(source.toLowerCase(Locale.ROOT));
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    Optional<String> fromTitleMention(NewsArticle article) {
        return dictionary.matchTitleMention(article.getTitle());
    }

    Optional<String> synthesizedFromSourceName(NewsArticle article) {
        String source = article.getSourceName();
        if (source == null || source.isBlank() || "unknown".equalsIgnoreCase(source.trim())) {
            return Optional.empty();
        }
        String joined = words(source).stream().limit(2).collect(Collectors.joining());
        return joined.isEmpty() ? Optional.empty() : Optional.of(joined + ".com");
    }

    String lastResort(NewsArticle article) {
        List<String> words = article == null ? List.of() : words(article.getTitle());
        String word = words.stream()
                .filter(w -> w.length() > 4)
                .findFirst()
                .orElse(words.isEmpty() ? "news" : words.get(0));
        return word + ".unknown";
    }

    private static List<String> words(String s) {
        if (s == null || s.isBlank()) return List.of();
        return Arrays.stream(NON_ALNUM.split(s.toLowerCase(Locale.ROOT)))
                .filter(w -> !w.isEmpty())
                .toList();
    }
}
