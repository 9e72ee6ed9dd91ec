package com.newsresolver.processor;

import com.newsresolver.domain.dto.NewsArticle;
import com.newsresolver.util.UrlUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Drops exact URL repeats and near-identical headlines, keeping the first occurrence.
 */
@Slf4j
@Component
public class ArticleDeduplicator {

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]");
    private static final int TITLE_KEY_WORDS = 5;
    private static final int MIN_WORD_LENGTH = 4;

    public List<NewsArticle> dedupe(List<NewsArticle> articles) {
        if (articles == null || articles.isEmpty()) return List.of();

        Set<String> seenUrls = new HashSet<>();
        Set<String> seenTitles = new HashSet<>();
        List<NewsArticle> unique = new ArrayList<>(articles.size());

        for (NewsArticle a : articles) {
            String urlKey = UrlUtils.dedupeKey(a.bestUrl());
            String titleKey = titleKey(a.getTitle());

            if (!urlKey.isEmpty() && seenUrls.contains(urlKey)) {
                log.debug("Dedupe: duplicate url skipped title='{}'", UrlUtils.abbreviate(a.getTitle(), 50));
                continue;
            }
            if (!titleKey.isEmpty() && seenTitles.contains(titleKey)) {
                log.debug("Dedupe: similar title skipped title='{}'", UrlUtils.abbreviate(a.getTitle(), 50));
                continue;
            }

            if (!urlKey.isEmpty()) seenUrls.add(urlKey);
            if (!titleKey.isEmpty()) seenTitles.add(titleKey);
            unique.add(a);
        }

        log.debug("Dedupe: in={} out={}", articles.size(), unique.size());
        return unique;
    }

    static String titleKey(String title) {
        if (title == null || title.isBlank()) return "";
        String normalized = PUNCTUATION.matcher(title.toLowerCase(Locale.ROOT)).replaceAll("");
        return Arrays.stream(normalized.split("\\s+"))
                .filter(w -> w.length() >= MIN_WORD_LENGTH)
                .limit(TITLE_KEY_WORDS)
                .collect(Collectors.joining(" "));
    }
}
