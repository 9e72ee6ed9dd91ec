package com.newsresolver.controller;

import com.newsresolver.domain.dto.DecodeResult;
import com.newsresolver.domain.dto.SearchQuery;
import com.newsresolver.domain.dto.SearchResult;
import com.newsresolver.service.NewsSearchService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/news")
@RequiredArgsConstructor
public class NewsSearchController {

    private final NewsSearchService newsSearchService;

    @GetMapping("/search")
    public ResponseEntity<SearchResult> search(
            @RequestParam("q") @NotBlank(message = "q must not be blank") String keyword,
            @RequestParam(name = "lang", required = false, defaultValue = "en") String language,
            @RequestParam(name = "country", required = false, defaultValue = "US") String country,
            @RequestParam(name = "max", required = false, defaultValue = "20")
            @Min(value = 1, message = "max must be between 1 and 100")
            @Max(value = 100, message = "max must be between 1 and 100") int maxResults,
            @RequestParam(name = "decode", required = false, defaultValue = "true") boolean decode,
            @RequestParam(name = "screenshots", required = false, defaultValue = "false") boolean screenshots
    ) {
        SearchQuery query = SearchQuery.builder()
                .keyword(keyword.trim())
                .language(language)
                .country(country)
                .maxResults(maxResults)
                .decodeUrls(decode)
                .captureScreenshots(screenshots)
                .build();

        return ResponseEntity.ok(newsSearchService.search(query));
    }

    @GetMapping("/trending")
    public ResponseEntity<SearchResult> trending(
            @RequestParam(name = "lang", required = false, defaultValue = "en") String language,
            @RequestParam(name = "country", required = false, defaultValue = "US") String country
    ) {
        return ResponseEntity.ok(newsSearchService.trending(language, country));
    }

    @GetMapping("/decode")
    public ResponseEntity<DecodeResponse> decode(
            @RequestParam("url") @NotBlank(message = "url must not be blank") String url
    ) {
        DecodeResult result = newsSearchService.decodeSingle(url.trim());
        log.info("Single decode url={} success={}", url, result.isSuccess());
        return ResponseEntity.ok(DecodeResponse.from(url.trim(), result));
    }

    public record DecodeResponse(String url, String resolvedUrl, String stage, String error) {
        static DecodeResponse from(String url, DecodeResult r) {
            return new DecodeResponse(
                    url,
                    r.url(),
                    r.failedStage() != null ? r.failedStage().name() : null,
                    r.error()
            );
        }
    }
}
