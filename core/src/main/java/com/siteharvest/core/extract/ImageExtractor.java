package com.siteharvest.core.extract;

import com.siteharvest.core.api.ParsedPage;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * img[src] 수집.
 * 루트 상대("/x.png")만 baseUrl 에 이어 붙여 해석한다. 그 밖의 값은 그대로 둔다.
 * "../" 같은 상대 경로 해석은 하지 않는다.
 */
public class ImageExtractor {

    private final String baseUrl;

    public ImageExtractor(String baseUrl) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
    }

    public Set<String> extract(ParsedPage page) {
        Set<String> out = new LinkedHashSet<>();
        for (String src : page.attributeValues("img", "src")) {
            if (src == null || src.isEmpty()) continue;
            out.add(resolve(src));
        }
        return out;
    }

    /** 이미 해석된 값에 다시 적용해도 같은 값 */
    public String resolve(String src) {
        if (!src.startsWith("/")) return src;

        int i = 0;
        while (i < src.length() && src.charAt(i) == '/') i++;
        String rest = src.substring(i);
        return baseUrl.endsWith("/") ? baseUrl + rest : baseUrl + "/" + rest;
    }
}
