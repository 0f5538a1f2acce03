package com.siteharvest.core.extract;

import com.siteharvest.core.api.ParsedPage;
import com.siteharvest.core.crawler.DomainScope;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/** a[href] → http(s) 로 시작하고 범위 안에 드는 절대 URL 만 수집. 상대 경로는 버린다. */
public class LinkExtractor {

    private final DomainScope scope;

    public LinkExtractor(DomainScope scope) {
        this.scope = Objects.requireNonNull(scope, "scope");
    }

    public Set<String> extract(ParsedPage page) {
        Set<String> out = new LinkedHashSet<>();
        for (String raw : page.attributeValues("a", "href")) {
            if (raw == null) continue;
            String href = raw.trim();
            if (href.isEmpty()) continue;
            if (!href.toLowerCase(Locale.ROOT).startsWith("http")) continue;
            if (!scope.contains(href)) continue;
            out.add(href);
        }
        return out;
    }
}
