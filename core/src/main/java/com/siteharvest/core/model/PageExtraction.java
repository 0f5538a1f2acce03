package com.siteharvest.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 한 페이지에서 뽑은 사실들. 집계기에 병합된 뒤 버려진다.
 *
 * @param url          처리한 페이지 URL
 * @param links        도메인 안쪽 절대 링크
 * @param imageUrls    이미지 src (루트 상대 경로는 baseUrl 기준으로 해석됨)
 * @param phoneNumbers 원문 HTML에서 찾은 전화번호
 * @param zipCodes     원문 HTML에서 찾은 우편번호
 * @param visibleText  script/style 제거 후 보이는 텍스트
 */
public record PageExtraction(String url,
                             Set<String> links,
                             Set<String> imageUrls,
                             Set<String> phoneNumbers,
                             Set<String> zipCodes,
                             String visibleText) {

    public PageExtraction {
        links = frozen(links);
        imageUrls = frozen(imageUrls);
        phoneNumbers = frozen(phoneNumbers);
        zipCodes = frozen(zipCodes);
        visibleText = (visibleText == null ? "" : visibleText);
    }

    // 발견 순서 유지
    private static Set<String> frozen(Set<String> in) {
        return in == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(in));
    }
}
