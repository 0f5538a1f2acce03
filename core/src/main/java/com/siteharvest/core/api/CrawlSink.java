package com.siteharvest.core.api;

import com.siteharvest.core.model.CrawlFailure;
import com.siteharvest.core.model.PageExtraction;

/** 탐색 엔진이 페이지 단위 결과를 흘려보내는 곳. 엔진의 코디네이터 스레드에서만 호출된다. */
public interface CrawlSink {
    void accept(PageExtraction page);
    void failed(CrawlFailure failure);
}
