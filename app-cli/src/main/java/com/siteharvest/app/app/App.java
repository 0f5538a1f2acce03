package com.siteharvest.app.app;

import com.siteharvest.app.logging.LogSetup;
import com.siteharvest.core.config.PipelineContext;
import com.siteharvest.core.model.CrawlConfig;
import com.siteharvest.core.model.CrawlResult;
import com.siteharvest.core.service.HarvestService;
import com.siteharvest.core.service.export.ReportCoordinator;
import com.siteharvest.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

/**
 * CLI 진입점: App [path/to/siteharvest.yml]
 * 종료 코드: 0 성공, 1 설정 오류, 2 보고서 쓰기 실패
 */
public final class App {

    private static final Logger LOG = LoggerFactory.getLogger(App.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_CONFIG = 1;
    public static final int EXIT_REPORT_IO = 2;

    /** 테스트에서 CoreNLP 대신 가짜 파이프라인을 끼우기 위한 훅 */
    @FunctionalInterface
    interface PipelineFactory {
        PipelineContext create(CrawlConfig cfg) throws IOException;
    }

    private App() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err, PipelineContext::standard));
    }

    static int run(String[] args, PrintStream out, PrintStream err, PipelineFactory pipelines) {
        // 1) 설정
        CrawlConfig cfg;
        try {
            cfg = (args != null && args.length > 0)
                    ? YamlConfigLoader.load(Path.of(args[0]))
                    : YamlConfigLoader.loadDefault();
        } catch (IOException | RuntimeException e) {
            err.println("Configuration error: " + e.getMessage());
            return EXIT_CONFIG;
        }

        // 2) 로그 (출력 디렉터리 기준)
        LogSetup.configure(cfg.getOutput().getDir());
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.error("Uncaught exception in {}", t.getName(), e));

        // 3) 파이프라인 자원 (불용어/태거 모델)
        PipelineContext ctx;
        try {
            ctx = pipelines.create(cfg);
        } catch (IOException | RuntimeException e) {
            LOG.error("Failed to initialise text pipeline", e);
            err.println("Configuration error: " + e.getMessage());
            return EXIT_CONFIG;
        }

        // 4) 크롤 + 분석
        HarvestService service;
        try {
            service = new HarvestService(cfg, ctx);
        } catch (IllegalArgumentException e) {
            err.println("Configuration error: " + e.getMessage());
            return EXIT_CONFIG;
        }
        out.println("Starting the web scraping process...");
        CrawlResult result = service.run();

        // 5) 보고서
        try {
            new ReportCoordinator()
                    .withRuntime(service::getRuntimeSnapshot)
                    .withConsole(cfg.getOutput().isConsole() ? out : null)
                    .writeAll(cfg.getOutput().getDir(), result, cfg.getOutput().getFormats());
        } catch (IOException e) {
            LOG.error("Failed to write report", e);
            err.println("Report error: " + e.getMessage());
            return EXIT_REPORT_IO;
        }

        out.println("Web scraping process completed.");
        return EXIT_OK;
    }
}
