package com.newsresolver.domain.dto;

import java.util.List;

public record SearchResult(
        boolean success,
        String keyword,
        int totalResults,
        List<NewsArticle> articles,
        BatchStats decodingStats,
        String error
) {

    public static SearchResult success(String keyword, List<NewsArticle> articles, BatchStats stats) {
        return new SearchResult(true, keyword, articles.size(), articles, stats, null);
    }

    public static SearchResult failure(String keyword, String error) {
        return new SearchResult(false, keyword, 0, List.of(), null, error);
    }
}
