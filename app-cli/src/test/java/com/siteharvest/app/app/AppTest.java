package com.siteharvest.app.app;

import com.siteharvest.core.config.PipelineContext;
import com.siteharvest.core.extract.PatternMatchers;
import com.siteharvest.core.lexical.Stopwords;
import com.siteharvest.core.lexical.TaggedToken;
import com.siteharvest.core.model.CrawlConfig;
import com.siteharvest.core.util.YamlConfigLoader;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CLI 종료 코드와 보고서 출력")
class AppTest {

    private HttpServer server;
    private String base;
    private final ByteArrayOutputStream outBuf = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuf = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(outBuf, true, StandardCharsets.UTF_8);
    private final PrintStream err = new PrintStream(errBuf, true, StandardCharsets.UTF_8);

    /** CoreNLP 모델 없이: 공백 토큰, 전부 NN, 표제어 = 단어 */
    private static final App.PipelineFactory FAKE = cfg -> new PipelineContext(
            new PatternMatchers(),
            Stopwords.of(List.of("the", "a", "and")),
            text -> new ArrayList<>(Arrays.asList(text.trim().split("\\s+"))),
            tokens -> tokens.stream().map(t -> new TaggedToken(t, "NN")).toList(),
            (word, tag) -> word);

    @BeforeEach
    void start() throws Exception {
        System.setProperty("sh.log.console", "false");
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        base = "http://127.0.0.1:" + server.getAddress().getPort();
        server.createContext("/", ex -> {
            byte[] body = ("<html><body><p>Harvest the garden. Call 555-987-6543.</p>"
                    + "<img src=\"/img/a.png\"></body></html>").getBytes(StandardCharsets.UTF_8);
            ex.sendResponseHeaders(200, body.length);
            try (OutputStream os = ex.getResponseBody()) { os.write(body); }
        });
        server.start();
    }

    @AfterEach
    void stop() {
        server.stop(0);
        System.clearProperty("sh.log.console");
    }

    private Path yml(Path dir, Path outDir) throws Exception {
        Path f = dir.resolve("siteharvest.yml");
        Files.writeString(f, String.join("\n",
                "seedUrl: \"" + base + "/\"",
                "timeoutMs: 3000",
                "output:",
                "  dir: \"" + outDir.toString().replace("\\", "/") + "\"",
                "  formats: [txt, json]",
                "  console: true",
                ""), StandardCharsets.UTF_8);
        return f;
    }

    @Test
    @DisplayName("정상 실행: 0, 콘솔 + report.txt/report.json")
    void success_writes_reports(@TempDir Path dir) throws Exception {
        Path outDir = dir.resolve("out");

        int code = App.run(new String[]{yml(dir, outDir).toString()}, out, err, FAKE);

        assertThat(code).isEqualTo(App.EXIT_OK);
        String stdout = outBuf.toString(StandardCharsets.UTF_8);
        assertThat(stdout).startsWith("Starting the web scraping process...");
        assertThat(stdout).contains("Report:", base + "/img/a.png", "555-987-6543", "harvest", "garden.");
        assertThat(stdout.trim()).endsWith("Web scraping process completed.");

        assertThat(outDir.resolve("report.txt")).exists();
        assertThat(Files.readString(outDir.resolve("report.json"), StandardCharsets.UTF_8))
                .contains("\"seedUrl\"", base + "/");
    }

    @Test
    @DisplayName("없는 설정 파일이면 1")
    void missing_config_file() {
        int code = App.run(new String[]{"/no/such/dir/siteharvest.yml"}, out, err, FAKE);

        assertThat(code).isEqualTo(App.EXIT_CONFIG);
        assertThat(errBuf.toString(StandardCharsets.UTF_8)).contains("Configuration error");
        assertThat(outBuf.toString(StandardCharsets.UTF_8)).isEmpty();
    }

    @Test
    @DisplayName("검증 실패(지원하지 않는 형식)면 1")
    void invalid_config(@TempDir Path dir) throws Exception {
        Path f = dir.resolve("bad.yml");
        Files.writeString(f, "seedUrl: \"" + base + "/\"\noutput:\n  formats: [pdf]\n", StandardCharsets.UTF_8);

        int code = App.run(new String[]{f.toString()}, out, err, FAKE);

        assertThat(code).isEqualTo(App.EXIT_CONFIG);
        assertThat(errBuf.toString(StandardCharsets.UTF_8)).contains("unsupported output format: pdf");
    }

    @Test
    @DisplayName("파이프라인 자원 로딩 실패면 1")
    void pipeline_failure(@TempDir Path dir) throws Exception {
        App.PipelineFactory broken = cfg -> { throw new IOException("tagger model missing"); };

        int code = App.run(new String[]{yml(dir, dir).toString()}, out, err, broken);

        assertThat(code).isEqualTo(App.EXIT_CONFIG);
        assertThat(errBuf.toString(StandardCharsets.UTF_8)).contains("tagger model missing");
    }

    @Test
    @DisplayName("보고서 디렉터리에 쓸 수 없으면 2")
    void report_io_failure(@TempDir Path dir) throws Exception {
        Path blocker = Files.writeString(dir.resolve("blocker"), "x");

        int code = App.run(new String[]{yml(dir, blocker).toString()}, out, err, FAKE);

        assertThat(code).isEqualTo(App.EXIT_REPORT_IO);
        assertThat(errBuf.toString(StandardCharsets.UTF_8)).contains("Report error");
    }

    @Test
    @DisplayName("동봉된 예시 siteharvest.yml 이 읽힌다")
    void bundled_sample_config_loads(@TempDir Path dir) throws Exception {
        Path copy = dir.resolve("siteharvest.yml");
        try (InputStream in = AppTest.class.getResourceAsStream("/siteharvest.yml")) {
            assertThat(in).isNotNull();
            Files.copy(in, copy);
        }

        CrawlConfig cfg = YamlConfigLoader.load(copy);

        assertThat(cfg.getSeedUrl()).isEqualTo("https://casl.website/");
        assertThat(cfg.getDomain()).isEqualTo("casl.website");
        assertThat(cfg.getMatchMode()).isEqualTo(CrawlConfig.MatchMode.SUBSTRING);
        assertThat(cfg.getConcurrency()).isEqualTo(1);
        assertThat(cfg.getMaxAttempts()).isEqualTo(1);
        assertThat(cfg.getStopwordsFile()).isNull();
        assertThat(cfg.getOutput().getFormats()).containsExactly("txt");
    }
}
