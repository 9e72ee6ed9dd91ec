package com.newsresolver.domain.dto;

import lombok.Builder;

@Builder(toBuilder = true)
public record ScreenshotOptions(
        String format,
        int viewportWidth,
        int viewportHeight,
        int deviceScaleFactor,
        int delaySeconds,
        int timeoutSeconds,
        boolean fullPage,
        boolean blockAds,
        boolean blockCookieBanners,
        boolean blockPopups
) {

    public static ScreenshotOptions defaults() {
        return new ScreenshotOptions("jpeg", 1920, 1080, 1, 3, 30, true, false, false, true);
    }
}
