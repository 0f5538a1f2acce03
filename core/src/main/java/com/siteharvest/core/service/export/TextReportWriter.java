package com.siteharvest.core.service.export;

import com.siteharvest.core.model.CrawlResult;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Collection;

/**
 * report.txt 작성기.
 * 섹션 순서: Unique URLs → Image URLs → Phone Numbers → Zip Codes →
 * Vocabulary (Unique words) → Verbs → Nouns. 각 섹션 앞에 빈 줄 하나, 항목은 한 줄에 하나.
 */
public final class TextReportWriter implements ReportWriter {

    @Override
    public Path write(Path dir, CrawlResult result) throws IOException {
        Path out = ReportNaming.textPath(dir);
        Files.createDirectories(ReportNaming.outDir(dir));
        Files.writeString(out, render(result), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        return out;
    }

    /** 콘솔 출력도 같은 본문을 쓴다 */
    public void print(PrintStream ps, CrawlResult result) {
        ps.print(render(result));
        ps.flush();
    }

    public String render(CrawlResult r) {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("Report:\n");
        section(sb, "Unique URLs:", r.getVisitedUrls());
        section(sb, "Image URLs:", r.getImageUrls());
        section(sb, "Phone Numbers:", r.getPhoneNumbers());
        section(sb, "Zip Codes:", r.getZipCodes());
        section(sb, "Vocabulary (Unique words):", r.getVocabulary());
        section(sb, "Verbs:", r.getVerbs());
        section(sb, "Nouns:", r.getNouns());
        return sb.toString();
    }

    private static void section(StringBuilder sb, String title, Collection<String> items) {
        sb.append('\n').append(title).append('\n');
        for (String s : items) sb.append(s).append('\n');
    }
}
