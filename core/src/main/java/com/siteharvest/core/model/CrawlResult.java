package com.siteharvest.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 크롤 최종 집계. 리포트 단계로 넘어간 뒤에는 바뀌지 않는다.
 * URL/이미지/전화/우편번호는 발견 순서, 어휘/명사/동사는 사전순.
 * 빈도 맵은 횟수 내림차순 → 단어 오름차순.
 */
public final class CrawlResult {
    private final String seedUrl;
    private final Set<String> visitedUrls;
    private final Set<String> imageUrls;
    private final Set<String> phoneNumbers;
    private final Set<String> zipCodes;
    private final SortedSet<String> vocabulary;
    private final SortedSet<String> nouns;
    private final SortedSet<String> verbs;
    private final Map<String, Integer> nounFrequencies;
    private final Map<String, Integer> verbFrequencies;
    private final List<CrawlFailure> failures;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final boolean cancelled;

    private CrawlResult(Builder b) {
        this.seedUrl = b.seedUrl;
        this.visitedUrls = ordered(b.visitedUrls);
        this.imageUrls = ordered(b.imageUrls);
        this.phoneNumbers = ordered(b.phoneNumbers);
        this.zipCodes = ordered(b.zipCodes);
        this.vocabulary = sorted(b.vocabulary);
        this.nouns = sorted(b.nouns);
        this.verbs = sorted(b.verbs);
        this.nounFrequencies = byCount(b.nounFrequencies);
        this.verbFrequencies = byCount(b.verbFrequencies);
        this.failures = (b.failures == null) ? List.of() : List.copyOf(b.failures);
        this.startedAt = (b.startedAt == null) ? Instant.now() : b.startedAt;
        this.finishedAt = (b.finishedAt == null) ? this.startedAt : b.finishedAt;
        this.cancelled = b.cancelled;
    }

    public String getSeedUrl() { return seedUrl; }
    public Set<String> getVisitedUrls() { return visitedUrls; }
    public Set<String> getImageUrls() { return imageUrls; }
    public Set<String> getPhoneNumbers() { return phoneNumbers; }
    public Set<String> getZipCodes() { return zipCodes; }
    public SortedSet<String> getVocabulary() { return vocabulary; }
    public SortedSet<String> getNouns() { return nouns; }
    public SortedSet<String> getVerbs() { return verbs; }
    public Map<String, Integer> getNounFrequencies() { return nounFrequencies; }
    public Map<String, Integer> getVerbFrequencies() { return verbFrequencies; }
    public List<CrawlFailure> getFailures() { return failures; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public boolean isCancelled() { return cancelled; }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String seedUrl;
        private Set<String> visitedUrls;
        private Set<String> imageUrls;
        private Set<String> phoneNumbers;
        private Set<String> zipCodes;
        private Set<String> vocabulary;
        private Set<String> nouns;
        private Set<String> verbs;
        private Map<String, Integer> nounFrequencies;
        private Map<String, Integer> verbFrequencies;
        private List<CrawlFailure> failures;
        private Instant startedAt;
        private Instant finishedAt;
        private boolean cancelled;

        public Builder seedUrl(String v) { this.seedUrl = v; return this; }
        public Builder visitedUrls(Set<String> v) { this.visitedUrls = v; return this; }
        public Builder imageUrls(Set<String> v) { this.imageUrls = v; return this; }
        public Builder phoneNumbers(Set<String> v) { this.phoneNumbers = v; return this; }
        public Builder zipCodes(Set<String> v) { this.zipCodes = v; return this; }
        public Builder vocabulary(Set<String> v) { this.vocabulary = v; return this; }
        public Builder nouns(Set<String> v) { this.nouns = v; return this; }
        public Builder verbs(Set<String> v) { this.verbs = v; return this; }
        public Builder nounFrequencies(Map<String, Integer> v) { this.nounFrequencies = v; return this; }
        public Builder verbFrequencies(Map<String, Integer> v) { this.verbFrequencies = v; return this; }
        public Builder failures(List<CrawlFailure> v) { this.failures = v; return this; }
        public Builder startedAt(Instant v) { this.startedAt = v; return this; }
        public Builder finishedAt(Instant v) { this.finishedAt = v; return this; }
        public Builder cancelled(boolean v) { this.cancelled = v; return this; }

        public CrawlResult build() { return new CrawlResult(this); }
    }

    // ----- helpers -----
    private static Set<String> ordered(Set<String> in) {
        return (in == null) ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(in));
    }

    private static SortedSet<String> sorted(Set<String> in) {
        return Collections.unmodifiableSortedSet(in == null ? new TreeSet<>() : new TreeSet<>(in));
    }

    private static Map<String, Integer> byCount(Map<String, Integer> in) {
        if (in == null || in.isEmpty()) return Map.of();
        Map<String, Integer> out = new LinkedHashMap<>();
        in.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .forEach(e -> out.put(e.getKey(), e.getValue()));
        return Collections.unmodifiableMap(out);
    }
}
