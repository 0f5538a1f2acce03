package com.siteharvest.core.service;

import com.siteharvest.core.api.CrawlSink;
import com.siteharvest.core.lexical.LexicalAnalyzer;
import com.siteharvest.core.lexical.LexicalProfile;
import com.siteharvest.core.model.CrawlFailure;
import com.siteharvest.core.model.CrawlResult;
import com.siteharvest.core.model.PageExtraction;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 페이지별 추출 결과를 모으는 집계기.
 * 크롤러의 코디네이터 스레드에서만 호출되므로 동기화하지 않는다.
 */
public final class ResultAggregator implements CrawlSink {

    private final String seedUrl;
    private final Set<String> visitedUrls = new LinkedHashSet<>();
    private final Set<String> imageUrls = new LinkedHashSet<>();
    private final Set<String> phoneNumbers = new LinkedHashSet<>();
    private final Set<String> zipCodes = new LinkedHashSet<>();
    private final List<String> texts = new ArrayList<>();
    private final List<CrawlFailure> failures = new ArrayList<>();

    public ResultAggregator(String seedUrl) {
        this.seedUrl = seedUrl;
    }

    @Override
    public void accept(PageExtraction page) {
        visitedUrls.add(page.url());
        imageUrls.addAll(page.imageUrls());
        phoneNumbers.addAll(page.phoneNumbers());
        zipCodes.addAll(page.zipCodes());
        texts.add(page.visibleText());
    }

    @Override
    public void failed(CrawlFailure failure) {
        failures.add(failure);
    }

    /** 방문 순서대로 페이지 텍스트를 줄바꿈으로 이어 붙인 것 */
    public String accumulatedText() {
        return String.join("\n", texts);
    }

    public int visitedCount() { return visitedUrls.size(); }

    public CrawlResult complete(LexicalAnalyzer analyzer, Instant startedAt, boolean cancelled) {
        LexicalProfile profile = (analyzer == null) ? LexicalProfile.empty() : analyzer.analyze(accumulatedText());
        return CrawlResult.builder()
                .seedUrl(seedUrl)
                .visitedUrls(visitedUrls)
                .imageUrls(imageUrls)
                .phoneNumbers(phoneNumbers)
                .zipCodes(zipCodes)
                .vocabulary(profile.vocabulary())
                .nouns(profile.nouns())
                .verbs(profile.verbs())
                .nounFrequencies(profile.nounFrequencies())
                .verbFrequencies(profile.verbFrequencies())
                .failures(failures)
                .startedAt(startedAt)
                .finishedAt(Instant.now())
                .cancelled(cancelled)
                .build();
    }
}
