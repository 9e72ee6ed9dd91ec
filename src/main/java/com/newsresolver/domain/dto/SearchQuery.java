package com.newsresolver.domain.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SearchQuery {

    private String keyword;

    @Builder.Default
    private String language = "en";

    @Builder.Default
    private String country = "US";

    @Builder.Default
    private int maxResults = 20;

    @Builder.Default
    private boolean decodeUrls = true;

    @Builder.Default
    private boolean captureScreenshots = false;

    private ScreenshotOptions screenshotOptions;
}
