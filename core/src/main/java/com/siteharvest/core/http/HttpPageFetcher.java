package com.siteharvest.core.http;

import com.siteharvest.core.api.IPageFetcher;
import com.siteharvest.core.model.CrawlConfig;
import com.siteharvest.core.model.CrawlStats;
import com.siteharvest.core.model.FetchResponse;
import com.siteharvest.core.util.DefaultSleeper;
import com.siteharvest.core.util.Sleeper;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * JDK HttpClient 기반 fetcher.
 * - timeout 은 헤더가 아니라 본문까지 받는 전체 교환에 건다(멈춘 fetch 는 -1 실패)
 * - 본문은 Content-Type 의 charset 으로 디코딩, 없으면 UTF-8
 * - 재시도는 RetryPolicy 에 위임, 기본은 1회 시도. 시도/재시도 수는 CrawlStats 에 기록
 */
public class HttpPageFetcher implements IPageFetcher {

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws Exception;
    }

    private static final long MAX_RETRY_AFTER_SEC = 30;

    private final CrawlConfig config;
    private final CrawlStats stats;
    private final HttpClient client;   // 프로덕션 경로
    private final HttpSender sender;   // 테스트 경로(있으면 이걸 사용)

    public HttpPageFetcher(CrawlConfig config) {
        this(config, (CrawlStats) null);
    }

    public HttpPageFetcher(CrawlConfig config, CrawlStats stats) {
        this.config = Objects.requireNonNull(config, "config");
        this.stats = (stats != null ? stats : new CrawlStats());
        this.client = HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .build();
        this.sender = null;
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpPageFetcher(CrawlConfig config, HttpSender testSender) {
        this(config, null, testSender);
    }

    /** 테스트용 생성자(송신 훅 + 통계) */
    public HttpPageFetcher(CrawlConfig config, CrawlStats stats, HttpSender testSender) {
        this.config = Objects.requireNonNull(config, "config");
        this.stats = (stats != null ? stats : new CrawlStats());
        this.client = null;
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    /** 설정의 fetch.maxAttempts 를 따르는 기본 경로. 시도/재시도 수를 stats 에 더한다 */
    @Override
    public FetchResponse fetch(String url) {
        CountingRetryPolicy counting = new CountingRetryPolicy(defaultPolicy());
        try {
            return fetchWithRetry(url, counting, new DefaultSleeper());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return FetchResponse.fail(url, "interrupted");
        } finally {
            stats.addAttempts(1L + counting.getRetryCount());
            stats.addRetries(counting.getRetryCount());
        }
    }

    public RetryPolicy defaultPolicy() {
        return new DefaultRetryPolicy(config.getMaxAttempts(), 250);
    }

    /** 한 번 GET. 예외는 status -1 실패 응답으로 바꾼다. */
    public FetchResponse fetchOnce(String url) throws InterruptedException {
        Objects.requireNonNull(url, "url");
        try {
            HttpRequest req = HttpRequest.newBuilder(URI.create(url.trim()))
                    .timeout(config.getTimeout())
                    .header("User-Agent", config.getUserAgent())
                    .header("Accept", "text/html,application/xhtml+xml,*/*;q=0.8")
                    .GET()
                    .build();

            HttpResponse<String> resp = (sender != null) ? sender.send(req) : exchange(req);

            return new FetchResponse(url, resp.statusCode(), resp.body(), null,
                    resp.headers().firstValue("Retry-After").orElse(null));
        } catch (InterruptedException ie) {
            throw ie;
        } catch (TimeoutException te) {
            return FetchResponse.fail(url, "timeout after " + config.getTimeoutMs() + " ms");
        } catch (Exception e) {
            // 잘못된 URL, 연결 실패 모두 여기로
            return FetchResponse.fail(url, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /** 본문 수신까지 timeout 안에 끝나야 한다. 넘기면 교환을 취소한다 */
    private HttpResponse<String> exchange(HttpRequest req) throws Exception {
        CompletableFuture<HttpResponse<String>> future =
                client.sendAsync(req, HttpResponse.BodyHandlers.ofString());
        try {
            return future.get(config.getTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof Exception ex) throw ex;
            throw ee;
        }
    }

    /** 재시도 포함: 정책이 허락하는 상태(429/5xx/-1)에서만 재시도, Retry-After 우선 */
    public FetchResponse fetchWithRetry(String url, RetryPolicy policy, Sleeper sleeper) throws InterruptedException {
        int attempt = 1;
        while (true) {
            FetchResponse data = fetchOnce(url);
            if (!policy.shouldRetry(data.status, attempt)) {
                return data;
            }
            sleeper.sleep(resolveRetryAfterOr(policy.nextDelay(attempt), data));

            attempt++;
            if (attempt > policy.maxAttempts()) {
                return data; // 마지막 시도 결과 반환
            }
        }
    }

    /** Retry-After(초) 를 존중하되 30초로 상한. HTTP-date 형식은 fallback */
    private static Duration resolveRetryAfterOr(Duration fallback, FetchResponse data) {
        if (data.retryAfter.isEmpty()) return fallback;
        try {
            long sec = Long.parseLong(data.retryAfter.get().trim());
            return Duration.ofSeconds(Math.max(0, Math.min(sec, MAX_RETRY_AFTER_SEC)));
        } catch (NumberFormatException ignore) {
            return fallback;
        }
    }
}
