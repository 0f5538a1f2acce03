package com.siteharvest.core.crawler;

import com.siteharvest.core.model.CrawlConfig.MatchMode;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/**
 * 크롤 범위 판정.
 * - SUBSTRING: URL 문자열에 도메인 문자열이 들어 있으면 in-domain (서브도메인/쿼리 속 언급 포함)
 * - HOST: host 가 도메인과 같거나 "."+도메인 으로 끝날 때만 in-domain
 */
public final class DomainScope {

    private final String domain;
    private final MatchMode mode;

    private DomainScope(String domain, MatchMode mode) {
        this.domain = Objects.requireNonNull(domain, "domain").trim();
        if (this.domain.isEmpty()) throw new IllegalArgumentException("domain must not be blank");
        this.mode = (mode == null ? MatchMode.SUBSTRING : mode);
    }

    public static DomainScope of(String domain, MatchMode mode) {
        return new DomainScope(domain, mode);
    }

    public boolean contains(String url) {
        if (url == null || url.isEmpty()) return false;
        if (mode == MatchMode.SUBSTRING) return url.contains(domain);

        String host = hostOf(url);
        if (host == null) return false;
        String d = domain.toLowerCase(Locale.ROOT);
        return host.equals(d) || host.endsWith("." + d);
    }

    public String domain() { return domain; }
    public MatchMode mode() { return mode; }

    private static String hostOf(String url) {
        try {
            String h = URI.create(url.trim()).getHost();
            return h == null ? null : h.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            // 잘못된 URL은 범위 밖
            return null;
        }
    }
}
