package com.newsresolver.publisher;

import com.newsresolver.domain.dto.NewsArticle;

import java.util.Optional;

/**
 * One step of the domain fallback chain. Empty means "no opinion, ask the next step".
 */
@FunctionalInterface
public interface DomainStrategy {
    Optional<String> apply(NewsArticle article);
}
