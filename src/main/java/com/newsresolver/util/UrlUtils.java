package com.newsresolver.util;

import lombok.experimental.UtilityClass;

import java.net.URI;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@UtilityClass
public class UrlUtils {

    /**
     * Scheme, optional userinfo, host, optional port, then the raw path. Used when {@link URI} rejects
     * characters publishers leave unescaped ({@code |}, spaces, brackets).
     */
    private static final Pattern LENIENT_URL =
            Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://(?:[^@/?#\\s]*@)?([^/?#:@\\s]+)(?::\\d*)?([^?#]*)");

    /**
     * Lowercased host of {@code url}, if it has one.
     */
    public Optional<String> host(String url) {
        if (url == null || url.isBlank()) return Optional.empty();
        String trimmed = url.trim();

        String host = strictHost(trimmed);
        if (host == null || host.isBlank()) {
            Matcher m = LENIENT_URL.matcher(trimmed);
            host = m.find() ? m.group(1) : null;
        }
        if (host == null || host.isBlank()) return Optional.empty();
        return Optional.of(host.toLowerCase(Locale.ROOT));
    }

    private String strictHost(String url) {
        try {
            return URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Raw path of {@code url}, empty string when there is none.
     */
    public String rawPath(String url) {
        if (url == null || url.isBlank()) return "";
        String trimmed = url.trim();
        try {
            String path = URI.create(trimmed).getRawPath();
            return path == null ? "" : path;
        } catch (IllegalArgumentException e) {
            Matcher m = LENIENT_URL.matcher(trimmed);
            return m.find() ? m.group(2) : "";
        }
    }

    /**
     * Lowercased host of {@code url} without a leading "www.", if the URL has a host.
     */
    public Optional<String> hostWithoutWww(String url) {
        return host(url).map(h -> h.startsWith("www.") ? h.substring(4) : h);
    }

    /**
     * Comparison key for a URL: lowercased, trailing slashes removed.
     */
    public String dedupeKey(String url) {
        if (url == null) return "";
        String x = url.trim().toLowerCase(Locale.ROOT);
        while (x.endsWith("/")) x = x.substring(0, x.length() - 1);
        return x;
    }

    public String abbreviate(String s, int max) {
        if (s == null) return "";
        String t = s.trim();
        if (t.length() <= max) return t;
        return t.substring(0, Math.max(0, max - 1)) + "…";
    }
}
