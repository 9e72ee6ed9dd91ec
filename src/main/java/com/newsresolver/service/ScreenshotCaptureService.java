package com.newsresolver.service;

import com.newsresolver.domain.dto.NewsArticle;
import com.newsresolver.domain.dto.ScreenshotOptions;
import com.newsresolver.domain.dto.ScreenshotResult;
import com.newsresolver.integration.screenshot.ScreenshotClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ScreenshotCaptureService {

    private final ScreenshotClient screenshotClient;

    @Value("${screenshot.pause-between-ms:100}")
    private long pauseBetweenMs;

    /**
     * Captures articles in order until {@code targetCount} screenshots succeeded or the list runs out.
     * Sequential to stay within the screenshot API's rate limits. Results are attached to the articles.
     *
     * @return number of successful captures
     */
    public int captureAll(List<NewsArticle> articles, ScreenshotOptions options, int targetCount) {
        if (articles == null || articles.isEmpty() || targetCount <= 0) return 0;

        int successful = 0;
        int attempted = 0;

        for (NewsArticle article : articles) {
            if (successful >= targetCount) break;
            if (attempted > 0 && pauseBetweenMs > 0) sleep(pauseBetweenMs);

            ScreenshotResult result = screenshotClient.capture(article.bestUrl(), article.articleId(), options);
            article.setScreenshot(result);
            attempted++;
            if (result.success()) successful++;
        }

        log.info("Screenshot: batch done attempted={} successful={} target={}", attempted, successful, targetCount);
        return successful;
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
