package com.siteharvest.core.crawler;

import com.siteharvest.core.api.IPageFetcher;
import com.siteharvest.core.api.IPageParser;
import com.siteharvest.core.api.PageParseException;
import com.siteharvest.core.api.ParsedPage;
import com.siteharvest.core.extract.PageExtractor;
import com.siteharvest.core.model.CrawlFailure;
import com.siteharvest.core.model.CrawlStats;
import com.siteharvest.core.model.FetchResponse;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * URL 하나에 대한 fetch → parse → extract.
 * 공유 상태를 건드리지 않으므로 워커 스레드에서 그대로 돌려도 된다.
 * 시도/재시도 집계는 fetcher 몫, 여기서는 페이지별 벽시계 시간만 기록한다.
 */
public final class PageProcessor {

    private final IPageFetcher fetcher;
    private final IPageParser parser;
    private final PageExtractor extractor;
    private final CrawlStats stats;

    public PageProcessor(IPageFetcher fetcher, IPageParser parser, PageExtractor extractor, CrawlStats stats) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.stats = (stats != null ? stats : new CrawlStats());
    }

    public PageOutcome process(String url) throws InterruptedException {
        long t0 = System.nanoTime();
        try {
            FetchResponse resp = fetcher.fetch(url);
            if (Thread.currentThread().isInterrupted()) throw new InterruptedException("fetch interrupted: " + url);

            if (resp == null || !resp.ok()) {
                String why = (resp == null) ? "no response" : resp.describeFailure();
                return PageOutcome.failure(new CrawlFailure(url, CrawlFailure.Kind.FETCH, why));
            }

            ParsedPage page;
            try {
                page = parser.parse(resp.body);
            } catch (PageParseException e) {
                return PageOutcome.failure(new CrawlFailure(url, CrawlFailure.Kind.PARSE, e.getMessage()));
            }

            return PageOutcome.success(extractor.extract(url, resp.body, page));
        } finally {
            stats.addWallTimeMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0));
        }
    }
}
