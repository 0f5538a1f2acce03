package com.siteharvest.core.crawler;

import com.siteharvest.core.model.CrawlFailure;
import com.siteharvest.core.model.PageExtraction;

import java.util.Objects;

/** 워커가 코디네이터에게 돌려주는 페이지 처리 결과(성공 또는 실패 중 하나) */
public final class PageOutcome {
    private final String url;
    private final PageExtraction extraction;
    private final CrawlFailure failure;

    private PageOutcome(String url, PageExtraction extraction, CrawlFailure failure) {
        this.url = Objects.requireNonNull(url, "url");
        this.extraction = extraction;
        this.failure = failure;
    }

    public static PageOutcome success(PageExtraction extraction) {
        return new PageOutcome(extraction.url(), extraction, null);
    }

    public static PageOutcome failure(CrawlFailure failure) {
        return new PageOutcome(failure.url(), null, failure);
    }

    public String url() { return url; }
    public boolean isSuccess() { return extraction != null; }
    public PageExtraction extraction() { return extraction; }
    public CrawlFailure failure() { return failure; }
}
