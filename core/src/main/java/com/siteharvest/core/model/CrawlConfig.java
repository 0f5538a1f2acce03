package com.siteharvest.core.model;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * 크롤 설정 (siteharvest.yml 매핑 대상). 순수 설정 보관용.
 * 시스템 프로퍼티 오버라이드는 YamlConfigLoader 쪽에서 처리한다.
 */
public final class CrawlConfig {

    /** 도메인 판정 방식. SUBSTRING 이 원래 동작(문자열 포함 여부) */
    public enum MatchMode { SUBSTRING, HOST }

    /** 출력 하위 설정: YAML의 `output:` 섹션과 매핑 */
    public static final class OutputCfg {
        private Path dir = Path.of(".");
        /** 소문자 {"txt","json"} */
        private Set<String> formats = new LinkedHashSet<>(List.of("txt"));
        private boolean console = true;

        public Path getDir() { return dir; }
        public OutputCfg setDir(Path dir) { this.dir = dir; return this; }

        public Set<String> getFormats() { return formats; }
        public OutputCfg setFormats(List<String> list) {
            if (list == null) return this;
            Set<String> out = new LinkedHashSet<>();
            for (String s : list) {
                if (s != null && !s.isBlank()) out.add(s.trim().toLowerCase(Locale.ROOT));
            }
            this.formats = out;
            return this;
        }

        public boolean isConsole() { return console; }
        public OutputCfg setConsole(boolean console) { this.console = console; return this; }
    }

    // ---------- 기본 필드 ----------
    private String seedUrl;                 // 시작 URL (필수)
    private String baseUrl;                 // 루트 상대 이미지 해석 기준. null 이면 seedUrl
    private String domain;                  // 도메인 판정 문자열. null 이면 seed host
    private MatchMode matchMode = MatchMode.SUBSTRING;

    private Duration timeout = Duration.ofSeconds(10); // 요청 타임아웃
    private boolean followRedirects = true;
    private String userAgent = "SiteHarvest/0.1 (+crawler)";
    private int concurrency = 1;            // 1 이면 순차(스택 순서) 탐색
    private int maxAttempts = 1;            // 1 이면 재시도 없음

    /** 외부 불용어 파일(한 줄 한 단어). null 이면 내장 영어 목록 */
    private Path stopwordsFile;
    private String taggerModel = "edu/stanford/nlp/models/pos-tagger/english-left3words-distsim.tagger";

    private final OutputCfg output = new OutputCfg();

    // ---------- getters ----------
    public String getSeedUrl() { return seedUrl; }

    /** 지정이 없으면 seedUrl */
    public String getBaseUrl() { return (baseUrl == null || baseUrl.isBlank()) ? seedUrl : baseUrl; }

    /** 지정이 없으면 seed의 host */
    public String getDomain() {
        if (domain != null && !domain.isBlank()) return domain;
        if (seedUrl == null) return null;
        try {
            String host = URI.create(seedUrl.trim()).getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public MatchMode getMatchMode() { return matchMode == null ? MatchMode.SUBSTRING : matchMode; }
    public Duration getTimeout() { return timeout; }
    public boolean isFollowRedirects() { return followRedirects; }
    public String getUserAgent() { return userAgent; }
    public int getConcurrency() { return concurrency; }
    public int getMaxAttempts() { return maxAttempts; }
    public Path getStopwordsFile() { return stopwordsFile; }
    public String getTaggerModel() { return taggerModel; }
    public OutputCfg getOutput() { return output; }

    // ---------- fluent setters ----------
    public CrawlConfig setSeedUrl(String seedUrl) { this.seedUrl = seedUrl; return this; }
    public CrawlConfig setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; return this; }
    public CrawlConfig setDomain(String domain) { this.domain = domain; return this; }
    public CrawlConfig setMatchMode(MatchMode mode) {
        this.matchMode = (mode != null ? mode : MatchMode.SUBSTRING);
        return this;
    }
    public CrawlConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public CrawlConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public CrawlConfig setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }
    public CrawlConfig setConcurrency(int concurrency) { this.concurrency = concurrency; return this; }
    public CrawlConfig setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; return this; }
    public CrawlConfig setStopwordsFile(Path stopwordsFile) { this.stopwordsFile = stopwordsFile; return this; }
    public CrawlConfig setTaggerModel(String taggerModel) { this.taggerModel = taggerModel; return this; }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(seedUrl, "seedUrl");
        String seed = seedUrl.trim();
        if (seed.isEmpty()) throw new IllegalArgumentException("seedUrl must not be blank");
        String lower = seed.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://"))
            throw new IllegalArgumentException("seedUrl must be an http(s) URL: " + seedUrl);

        String d = getDomain();
        if (d == null || d.isBlank()) throw new IllegalArgumentException("domain must not be blank");

        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        if (maxAttempts < 1) throw new IllegalArgumentException("fetch.maxAttempts must be >= 1");
        if (userAgent == null || userAgent.isBlank())
            throw new IllegalArgumentException("userAgent must not be blank");
        Objects.requireNonNull(taggerModel, "taggerModel");

        Objects.requireNonNull(output.getDir(), "output.dir");
        if (output.getFormats().isEmpty())
            throw new IllegalArgumentException("output.formats must not be empty");
        for (String f : output.getFormats()) {
            if (!f.equals("txt") && !f.equals("json"))
                throw new IllegalArgumentException("unsupported output format: " + f);
        }
    }

    // ---------- helpers ----------
    public static CrawlConfig defaults() { return new CrawlConfig(); }

    public long getTimeoutMs() { return timeout.toMillis(); }

    public CrawlConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }
}
