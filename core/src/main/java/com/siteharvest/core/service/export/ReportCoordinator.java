package com.siteharvest.core.service.export;

import com.siteharvest.core.model.CrawlResult;
import com.siteharvest.core.model.CrawlStats;
import com.siteharvest.core.util.ProgressListener;
import com.siteharvest.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 출력 조합: 콘솔(옵션) + formats 에 든 파일 보고서.
 * 파일 쓰기 실패는 IOException 으로 그대로 올린다.
 */
public final class ReportCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(ReportCoordinator.class);
    private static final StructuredLog SLOG = StructuredLog.get(ReportCoordinator.class);

    private final TextReportWriter text = new TextReportWriter();
    private final JsonReportWriter json = new JsonReportWriter();
    private PrintStream console;
    private ProgressListener progress = ProgressListener.NONE;

    /** 필요 시 런타임 통계 주입 */
    public ReportCoordinator withRuntime(Supplier<CrawlStats.Snapshot> source) {
        json.withRuntime(source);
        return this;
    }

    /** null 이면 콘솔 출력 안 함 */
    public ReportCoordinator withConsole(PrintStream ps) {
        this.console = ps;
        return this;
    }

    /** "export" 단계 진행률(파일 하나마다) */
    public ReportCoordinator withProgress(ProgressListener listener) {
        this.progress = (listener != null) ? listener : ProgressListener.NONE;
        return this;
    }

    /**
     * @param formats 소문자 {"txt","json"}
     * @return 생성된 파일 목록(요청 순서)
     */
    public List<Path> writeAll(Path dir, CrawlResult result, Set<String> formats) throws IOException {
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(formats, "formats");

        if (console != null) {
            text.print(console, result);
        }

        List<Path> written = new ArrayList<>();
        final int total = formats.size();
        progress.onProgress(0.0, "export", 0, total);
        for (String f : formats) {
            ReportWriter w = switch (f) {
                case "txt" -> text;
                case "json" -> json;
                default -> throw new IllegalArgumentException("unsupported output format: " + f);
            };
            Path p = w.write(dir, result);
            written.add(p);
            LOG.info("Report written: {}", p.toAbsolutePath());
            SLOG.info("report-written", "format", f, "path", p.toAbsolutePath().toString());
            progress.onProgress((double) written.size() / total, "export", written.size(), total);
        }
        return written;
    }
}
