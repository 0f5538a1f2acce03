package com.siteharvest.core.api;

import java.util.List;

/** 파싱된 페이지 한 장 */
public interface ParsedPage {

    /** script/style 을 뺀 텍스트. 텍스트 노드를 trim 해서 공백 하나로 잇는다. */
    String visibleText();

    /** tag[attr] 요소들의 attr 값(문서 순서, 중복 포함) */
    List<String> attributeValues(String tag, String attr);
}
