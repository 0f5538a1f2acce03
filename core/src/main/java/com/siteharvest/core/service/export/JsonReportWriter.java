package com.siteharvest.core.service.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.siteharvest.core.model.CrawlFailure;
import com.siteharvest.core.model.CrawlResult;
import com.siteharvest.core.model.CrawlStats;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * report.json 작성기 (v1).
 * txt 보고서 내용 + 빈도 맵, 실패 목록, 시각/소요 시간, 취소 여부, 런타임 통계(있으면).
 */
public final class JsonReportWriter implements ReportWriter {

    public static final String REPORT_VERSION = "1";

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    // 런타임 통계 소스(선택)
    private Supplier<CrawlStats.Snapshot> runtimeSource;

    /** 체이닝용: .withRuntime(service::getRuntimeSnapshot) */
    public JsonReportWriter withRuntime(Supplier<CrawlStats.Snapshot> source) {
        this.runtimeSource = source;
        return this;
    }

    @Override
    public Path write(Path dir, CrawlResult result) throws IOException {
        Path out = ReportNaming.jsonPath(dir);
        Files.createDirectories(ReportNaming.outDir(dir));
        om.writerWithDefaultPrettyPrinter().writeValue(out.toFile(), toDocument(result));
        return out;
    }

    JsonReport toDocument(CrawlResult r) {
        JsonReport doc = new JsonReport();
        doc.meta = new Meta();
        doc.meta.reportVersion = REPORT_VERSION;
        doc.meta.seedUrl = r.getSeedUrl();
        doc.meta.startedAt = r.getStartedAt();
        doc.meta.finishedAt = r.getFinishedAt();
        doc.meta.durationMs = Duration.between(r.getStartedAt(), r.getFinishedAt()).toMillis();
        doc.meta.cancelled = r.isCancelled();
        doc.meta.runtime = (runtimeSource != null) ? runtimeSource.get() : null;

        doc.urls = List.copyOf(r.getVisitedUrls());
        doc.imageUrls = List.copyOf(r.getImageUrls());
        doc.phoneNumbers = List.copyOf(r.getPhoneNumbers());
        doc.zipCodes = List.copyOf(r.getZipCodes());
        doc.vocabulary = List.copyOf(r.getVocabulary());
        doc.verbs = List.copyOf(r.getVerbs());
        doc.nouns = List.copyOf(r.getNouns());
        doc.verbFrequencies = r.getVerbFrequencies();
        doc.nounFrequencies = r.getNounFrequencies();
        doc.failures = failures(r.getFailures());
        return doc;
    }

    private static List<Failure> failures(Collection<CrawlFailure> in) {
        List<Failure> out = new ArrayList<>(in.size());
        for (CrawlFailure f : in) {
            Failure x = new Failure();
            x.url = f.url();
            x.kind = f.kind().name();
            x.message = f.message();
            out.add(x);
        }
        return out;
    }

    // ===== 직렬화 DTO (필드 선언 순서 = 출력 순서) =====
    static final class JsonReport {
        public Meta meta;
        public List<String> urls;
        public List<String> imageUrls;
        public List<String> phoneNumbers;
        public List<String> zipCodes;
        public List<String> vocabulary;
        public List<String> verbs;
        public List<String> nouns;
        public Map<String, Integer> verbFrequencies;
        public Map<String, Integer> nounFrequencies;
        public List<Failure> failures;
    }

    static final class Meta {
        public String reportVersion;
        public String seedUrl;
        public Instant startedAt;
        public Instant finishedAt;
        public long durationMs;
        public boolean cancelled;
        public CrawlStats.Snapshot runtime;
    }

    static final class Failure {
        public String url;
        public String kind;
        public String message;
    }
}
