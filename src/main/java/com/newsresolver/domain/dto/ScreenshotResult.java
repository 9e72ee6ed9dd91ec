package com.newsresolver.domain.dto;

import java.nio.file.Path;

public record ScreenshotResult(
        boolean success,
        String url,
        String articleId,
        Path filePath,
        String error
) {

    public static ScreenshotResult captured(String url, String articleId, Path filePath) {
        return new ScreenshotResult(true, url, articleId, filePath, null);
    }

    public static ScreenshotResult failed(String url, String articleId, String error) {
        return new ScreenshotResult(false, url, articleId, null, error);
    }

    public String fileName() {
        return filePath == null ? null : filePath.getFileName().toString();
    }
}
