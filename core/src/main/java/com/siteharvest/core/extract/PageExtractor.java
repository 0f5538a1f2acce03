package com.siteharvest.core.extract;

import com.siteharvest.core.api.ParsedPage;
import com.siteharvest.core.model.PageExtraction;

import java.util.Objects;

/** 한 페이지에 대한 추출기 묶음. 전화/우편번호는 파싱 전 원문 HTML 에서 찾는다. */
public class PageExtractor {

    private final LinkExtractor links;
    private final ImageExtractor images;
    private final PatternMatchers patterns;

    public PageExtractor(LinkExtractor links, ImageExtractor images, PatternMatchers patterns) {
        this.links = Objects.requireNonNull(links, "links");
        this.images = Objects.requireNonNull(images, "images");
        this.patterns = Objects.requireNonNull(patterns, "patterns");
    }

    public PageExtraction extract(String url, String rawHtml, ParsedPage page) {
        return new PageExtraction(
                url,
                links.extract(page),
                images.extract(page),
                patterns.findPhoneNumbers(rawHtml),
                patterns.findZipCodes(rawHtml),
                page.visibleText());
    }
}
