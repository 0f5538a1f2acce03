package com.siteharvest.core.api;

import com.siteharvest.core.model.FetchResponse;

/** 페이지 원문을 받아오는 계약. 네트워크 오류도 예외 대신 실패 응답으로 돌려준다. */
@FunctionalInterface
public interface IPageFetcher {
    FetchResponse fetch(String url);
}
