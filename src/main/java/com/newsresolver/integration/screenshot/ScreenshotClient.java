package com.newsresolver.integration.screenshot;

import com.newsresolver.domain.dto.ScreenshotOptions;
import com.newsresolver.domain.dto.ScreenshotResult;

public interface ScreenshotClient {

    /**
     * Captures {@code url} and stores the image locally. Failures are reported in the result, never thrown.
     */
    ScreenshotResult capture(String url, String articleId, ScreenshotOptions options);
}
