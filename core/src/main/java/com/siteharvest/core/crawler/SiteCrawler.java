package com.siteharvest.core.crawler;

import com.siteharvest.core.api.CrawlSink;
import com.siteharvest.core.api.ICrawler;
import com.siteharvest.core.model.CrawlConfig;
import com.siteharvest.core.model.CrawlFailure;
import com.siteharvest.core.model.CrawlStats;
import com.siteharvest.core.model.PageExtraction;
import com.siteharvest.core.util.ProgressListener;
import com.siteharvest.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 스택 기반 사이트 크롤러.
 * - frontier: 마지막에 발견된 URL 을 먼저 방문(LIFO)
 * - visited: 추출 결과를 병합하기 직전에 1회만 등록. "한 번만 방문" 보장은 이 집합이 담당
 * - failed: fetch/parse 실패 URL. 같은 실행에서 다시 시도하지 않는다
 * - 깊이/페이지 수 제한 없음. frontier 가 비고 진행 중인 작업이 없으면 종료
 *
 * fetch/parse/extract 는 워커 풀(concurrency)에서, frontier/visited/집계는
 * crawl() 을 호출한 코디네이터 스레드에서만 다룬다. concurrency=1 이면 순수 스택 순서.
 */
public class SiteCrawler implements ICrawler {

    private static final Logger LOG = LoggerFactory.getLogger(SiteCrawler.class);
    private static final StructuredLog SLOG = StructuredLog.get(SiteCrawler.class);

    private final CrawlConfig config;
    private final PageProcessor processor;
    private final DomainScope scope;
    private final CrawlStats stats;

    public SiteCrawler(CrawlConfig config, PageProcessor processor, DomainScope scope, CrawlStats stats) {
        this.config = Objects.requireNonNull(config, "config");
        this.processor = Objects.requireNonNull(processor, "processor");
        this.scope = Objects.requireNonNull(scope, "scope");
        this.stats = (stats != null ? stats : new CrawlStats());
        Objects.requireNonNull(config.getSeedUrl(), "seedUrl");
        if (!scope.contains(config.getSeedUrl().trim())) {
            throw new IllegalArgumentException(
                    "seed " + config.getSeedUrl() + " is outside crawl domain '" + scope.domain() + "'");
        }
    }

    @Override
    public boolean crawl(CrawlSink sink, ProgressListener listener, AtomicBoolean cancelFlag) {
        Objects.requireNonNull(sink, "sink");
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final int cc = Math.max(1, config.getConcurrency());
        final String seed = config.getSeedUrl().trim();

        Deque<String> frontier = new ArrayDeque<>();
        Set<String> visited = new LinkedHashSet<>();
        Set<String> failed = new HashSet<>();
        Set<String> inFlight = new HashSet<>();
        frontier.addLast(seed);

        ExecutorService exec = Executors.newFixedThreadPool(cc, new NamedThreadFactory("crawl-worker"));
        CompletionService<PageOutcome> completion = new ExecutorCompletionService<>(exec);
        int running = 0;
        boolean cancelled = false;

        try {
            while (true) {
                if (!cancelled && isCancelled(cancelFlag)) {
                    cancelled = true;
                    LOG.info("Crawl cancelled: pending={}, inFlight={}", frontier.size(), running);
                    SLOG.info("crawl-cancelled", "pending", frontier.size(), "inFlight", running);
                }

                // 1) 배정: 빈 워커 수만큼 frontier 에서 꺼낸다
                while (!cancelled && running < cc && !frontier.isEmpty()) {
                    String url = frontier.pollLast();
                    if (visited.contains(url) || failed.contains(url) || inFlight.contains(url)) {
                        stats.duplicateDiscarded();
                        continue;
                    }
                    inFlight.add(url);
                    completion.submit(() -> safeProcess(url));
                    running++;
                    stats.observeConcurrency(running);
                }

                if (running == 0) break;

                // 2) 회수: 완료된 것 하나를 병합
                PageOutcome outcome;
                try {
                    outcome = completion.take().get();
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    LOG.warn("Crawl interrupted while waiting for workers; stopping");
                    cancelled = true;
                    break;
                } catch (ExecutionException e) {
                    // safeProcess 가 RuntimeException 을 흡수하므로 여기는 Error 뿐
                    throw new IllegalStateException("crawl worker died", e.getCause());
                }
                running--;
                inFlight.remove(outcome.url());

                if (outcome.isSuccess()) {
                    merge(outcome.extraction(), visited, frontier, sink);
                } else {
                    fail(outcome.failure(), failed, sink);
                }

                long done = visited.size() + failed.size();
                long total = done + frontier.size() + running;
                try {
                    pl.onProgress(total == 0 ? 0.0 : (double) done / (double) total, "crawl", done, total);
                } catch (RuntimeException e) {
                    LOG.debug("Progress listener failed: {}", e.toString());
                }
            }
        } finally {
            exec.shutdownNow();
            try {
                exec.awaitTermination(30, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }

        LOG.info("Crawl finished: visited={}, failed={}, cancelled={}", visited.size(), failed.size(), cancelled);
        return !cancelled;
    }

    private void merge(PageExtraction page, Set<String> visited, Deque<String> frontier, CrawlSink sink) {
        // visited 등록이 곧 선점(claim). 진 쪽 결과는 버린다
        if (!visited.add(page.url())) {
            stats.duplicateDiscarded();
            return;
        }
        sink.accept(page);
        stats.pageVisited();

        int queued = 0;
        for (String link : page.links()) {
            if (!visited.contains(link)) {
                frontier.addLast(link);
                queued++;
            }
        }

        LOG.info("Visited {} (page #{}) -> links={}, queued={}, images={}",
                page.url(), visited.size(), page.links().size(), queued, page.imageUrls().size());
        SLOG.info("page-visited",
                "url", page.url(),
                "pageNo", visited.size(),
                "links", page.links().size(),
                "queued", queued,
                "images", page.imageUrls().size(),
                "phones", page.phoneNumbers().size(),
                "zips", page.zipCodes().size());
    }

    private void fail(CrawlFailure failure, Set<String> failed, CrawlSink sink) {
        failed.add(failure.url());
        sink.failed(failure);
        stats.pageFailed();
        LOG.warn("Error fetching {} [{}]: {}", failure.url(), failure.kind(), failure.message());
        SLOG.warn("page-failed",
                "url", failure.url(),
                "kind", failure.kind().name(),
                "message", failure.message());
    }

    /** 예상 못 한 런타임 예외도 FETCH 실패로 바꿔 크롤을 계속한다 */
    private PageOutcome safeProcess(String url) {
        try {
            return processor.process(url);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return PageOutcome.failure(new CrawlFailure(url, CrawlFailure.Kind.FETCH, "interrupted"));
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure while processing {}", url, e);
            return PageOutcome.failure(new CrawlFailure(url, CrawlFailure.Kind.FETCH, e.toString()));
        }
    }

    private static boolean isCancelled(AtomicBoolean flag) {
        return Thread.currentThread().isInterrupted() || (flag != null && flag.get());
    }

    public CrawlStats stats() { return stats; }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
