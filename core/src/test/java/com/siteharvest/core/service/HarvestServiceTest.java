package com.siteharvest.core.service;

import com.siteharvest.core.FakeNlp;
import com.siteharvest.core.model.CrawlConfig;
import com.siteharvest.core.model.CrawlFailure;
import com.siteharvest.core.model.CrawlResult;
import com.siteharvest.core.service.export.ReportCoordinator;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HarvestService: 로컬 HTTP 서버 대상 end-to-end")
class HarvestServiceTest {

    private HttpServer server;
    private String base;
    private final Map<String, Integer> hits = new ConcurrentHashMap<>();

    @BeforeEach
    void start() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        base = "http://127.0.0.1:" + server.getAddress().getPort();

        Map<String, String> pages = Map.of(
                "/", """
                        <html><head><style>.hidden{display:none}</style>
                        <script>var tracking = "secret";</script></head>
                        <body>
                          <h1>Welcome visitors</h1>
                          <p>Call (555) 123-4567 or 555-987-6543. Visit us at 30301-1234.</p>
                          <a href="%1$s/about">About</a>
                          <a href="/relative">relative</a>
                          <a href="https://other.test/x">external</a>
                          <img src="/img/logo.png"><img src="https://cdn.test/a.png">
                        </body></html>
                        """.formatted(base),
                "/about", """
                        <html><body>
                          <p>Our crawler visited pages and crawled pages.</p>
                          <a href="%1$s/">home</a>
                          <a href="%1$s/missing">gone</a>
                          <img src="/img/logo.png">
                        </body></html>
                        """.formatted(base));

        server.createContext("/", ex -> {
            String path = ex.getRequestURI().getPath();
            hits.merge(path, 1, Integer::sum);
            String html = pages.get(path);
            byte[] body = (html == null ? "not found" : html).getBytes(StandardCharsets.UTF_8);
            ex.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
            ex.sendResponseHeaders(html == null ? 404 : 200, body.length);
            try (OutputStream os = ex.getResponseBody()) { os.write(body); }
        });
        server.start();
    }

    @AfterEach
    void stop() {
        server.stop(0);
    }

    private CrawlConfig cfg(int concurrency) {
        return CrawlConfig.defaults()
                .setSeedUrl(base + "/")
                .setTimeoutMs(3000)
                .setConcurrency(concurrency);
    }

    @Test
    @DisplayName("방문/이미지/전화/우편번호/어휘/명사/동사 집계")
    void end_to_end_crawl_and_analysis() {
        HarvestService svc = new HarvestService(cfg(1), FakeNlp.context());
        List<String> phases = new ArrayList<>();

        CrawlResult r = svc.run((p, phase, done, total) -> phases.add(phase));

        assertThat(r.isCancelled()).isFalse();
        assertThat(r.getVisitedUrls()).containsExactly(base + "/", base + "/about");
        assertThat(r.getImageUrls()).containsExactly(base + "/img/logo.png", "https://cdn.test/a.png");
        assertThat(r.getPhoneNumbers()).containsExactly("(555) 123-4567", "555-987-6543");
        // 원문 HTML 전체를 훑으므로 포트 번호(5자리)가 섞일 수 있다
        assertThat(r.getZipCodes()).contains("30301-1234");

        assertThat(r.getFailures()).extracting(CrawlFailure::url).containsExactly(base + "/missing");
        assertThat(hits.get("/missing")).isEqualTo(1);
        assertThat(hits).doesNotContainKey("/relative");

        assertThat(r.getVocabulary()).contains("welcome", "visitors", "crawler", "pages")
                .doesNotContain("tracking", "secret", "display", "the");
        assertThat(r.getVerbs()).containsExactlyInAnyOrder("visit", "crawl");
        assertThat(r.getNouns()).contains("crawler", "page", "visitor");
        assertThat(r.getNounFrequencies()).containsEntry("page", 2);
        assertThat(r.getNounFrequencies().keySet()).first().isEqualTo("page");

        assertThat(phases).contains("crawl", "analyze");
        assertThat(svc.getRuntimeSnapshot().pagesVisited).isEqualTo(2);
        assertThat(svc.getRuntimeSnapshot().pagesFailed).isEqualTo(1);
        // 기본 fetcher 가 공유 통계에 시도 수를 남긴다(재시도 없음)
        assertThat(svc.getRuntimeSnapshot().fetchesTotal).isEqualTo(3L);
        assertThat(svc.getRuntimeSnapshot().retriesTotal).isZero();
    }

    @Test
    @DisplayName("동시 실행(4)에서도 같은 집합")
    void parallel_run_matches_sequential() {
        CrawlResult seq = new HarvestService(cfg(1), FakeNlp.context()).run();
        CrawlResult par = new HarvestService(cfg(4), FakeNlp.context()).run();

        assertThat(par.getVisitedUrls()).containsExactlyInAnyOrderElementsOf(seq.getVisitedUrls());
        assertThat(par.getImageUrls()).containsExactlyInAnyOrderElementsOf(seq.getImageUrls());
        assertThat(par.getVocabulary()).isEqualTo(seq.getVocabulary());
        assertThat(par.getNounFrequencies()).isEqualTo(seq.getNounFrequencies());
    }

    @Test
    @DisplayName("시작 전에 취소되면 아무것도 받지 않고 cancelled=true")
    void cancelled_before_start() {
        CrawlResult r = new HarvestService(cfg(1), FakeNlp.context()).run(null, new AtomicBoolean(true));

        assertThat(r.isCancelled()).isTrue();
        assertThat(r.getVisitedUrls()).isEmpty();
        assertThat(hits).isEmpty();
    }

    @Test
    @DisplayName("결과를 report.txt 로 내보내기")
    void report_written(@TempDir Path dir) throws Exception {
        HarvestService svc = new HarvestService(cfg(1), FakeNlp.context());
        CrawlResult r = svc.run();

        new ReportCoordinator().withRuntime(svc::getRuntimeSnapshot)
                .writeAll(dir, r, Set.of("txt"));

        String txt = Files.readString(dir.resolve("report.txt"), StandardCharsets.UTF_8);
        assertThat(txt).startsWith("Report:\n\nUnique URLs:\n" + base + "/\n" + base + "/about\n\nImage URLs:\n");
        assertThat(txt).contains("\nVerbs:\ncrawl\nvisit\n\nNouns:\n");
    }
}
