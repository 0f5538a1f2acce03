package com.siteharvest.core.service;

import com.siteharvest.core.api.ICrawler;
import com.siteharvest.core.api.IPageFetcher;
import com.siteharvest.core.api.IPageParser;
import com.siteharvest.core.config.PipelineContext;
import com.siteharvest.core.crawler.PageProcessor;
import com.siteharvest.core.crawler.SiteCrawler;
import com.siteharvest.core.http.HttpPageFetcher;
import com.siteharvest.core.model.CrawlConfig;
import com.siteharvest.core.model.CrawlResult;
import com.siteharvest.core.model.CrawlStats;
import com.siteharvest.core.parse.JsoupPageParser;
import com.siteharvest.core.util.ProgressListener;
import com.siteharvest.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 수집 오케스트레이터:
 *  - crawl(fetch/parse/extract) → 집계 → 어휘 분석 → CrawlResult
 *  - 기본 구현체(HttpPageFetcher/JsoupPageParser/SiteCrawler)
 *  - DI 생성자는 테스트용(가짜 fetcher/parser 주입)
 */
public final class HarvestService {

    private static final Logger LOG = LoggerFactory.getLogger(HarvestService.class);
    private static final StructuredLog SLOG = StructuredLog.get(HarvestService.class);

    private final CrawlStats stats;
    private final CrawlConfig config;
    private final PipelineContext context;
    private final ICrawler crawler;

    /** 기본 구현 */
    public HarvestService(CrawlConfig config, PipelineContext context) {
        this(config, context, new CrawlStats());
    }

    private HarvestService(CrawlConfig config, PipelineContext context, CrawlStats stats) {
        this(config, context, new HttpPageFetcher(config, stats), new JsoupPageParser(), stats);
    }

    /** DI/테스트용 */
    public HarvestService(CrawlConfig config, PipelineContext context, IPageFetcher fetcher, IPageParser parser) {
        this(config, context, fetcher, parser, new CrawlStats());
    }

    private HarvestService(CrawlConfig config, PipelineContext context,
                           IPageFetcher fetcher, IPageParser parser, CrawlStats stats) {
        this.stats = stats;
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.context = Objects.requireNonNull(context, "context");
        PageProcessor processor = new PageProcessor(
                Objects.requireNonNull(fetcher, "fetcher"),
                Objects.requireNonNull(parser, "parser"),
                context.pageExtractor(config),
                stats);
        this.crawler = new SiteCrawler(config, processor, context.scope(config), stats);
    }

    public CrawlResult run() {
        return run(ProgressListener.NONE, null);
    }

    public CrawlResult run(ProgressListener listener) {
        return run(listener, null);
    }

    /** 진행률 + 취소 플래그(옵션). 취소되면 그때까지 모은 것으로 결과를 만들고 cancelled=true */
    public CrawlResult run(ProgressListener listener, AtomicBoolean cancelFlag) {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final Instant started = Instant.now();

        LOG.info("Crawl start: seed={}, domain={} ({}), cc={}",
                config.getSeedUrl(), config.getDomain(), config.getMatchMode(), config.getConcurrency());
        SLOG.info("crawl-start",
                "seed", config.getSeedUrl(),
                "domain", config.getDomain(),
                "match", config.getMatchMode().name(),
                "cc", config.getConcurrency(),
                "maxAttempts", config.getMaxAttempts());

        pl.onProgress(0.0, "crawl", 0, -1);
        ResultAggregator aggregator = new ResultAggregator(config.getSeedUrl());
        boolean completed = crawler.crawl(aggregator, pl, cancelFlag);

        pl.onProgress(0.0, "analyze", 0, 1);
        long t0 = System.nanoTime();
        CrawlResult result = aggregator.complete(context.lexicalAnalyzer(), started, !completed);
        long analyzeMs = Duration.ofNanos(System.nanoTime() - t0).toMillis();
        pl.onProgress(1.0, "analyze", 1, 1);

        CrawlStats.Snapshot s = stats.snapshot();
        LOG.info("Crawl done. visited={}, failed={}, images={}, phones={}, zips={}, vocabulary={}, analyzeMs={}",
                result.getVisitedUrls().size(), result.getFailures().size(), result.getImageUrls().size(),
                result.getPhoneNumbers().size(), result.getZipCodes().size(),
                result.getVocabulary().size(), analyzeMs);
        SLOG.info("crawl-done",
                "visited", result.getVisitedUrls().size(),
                "failed", result.getFailures().size(),
                "vocabulary", result.getVocabulary().size(),
                "nouns", result.getNouns().size(),
                "verbs", result.getVerbs().size(),
                "retries", s.retriesTotal,
                "maxObservedCC", s.maxObservedConcurrency,
                "cancelled", result.isCancelled());
        return result;
    }

    public CrawlStats.Snapshot getRuntimeSnapshot() {
        return stats.snapshot();
    }
}
