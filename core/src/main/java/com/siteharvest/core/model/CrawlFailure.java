package com.siteharvest.core.model;

/** 처리에 실패한 URL 한 건. 같은 실행 안에서는 다시 시도하지 않는다. */
public record CrawlFailure(String url, Kind kind, String message) {

    public enum Kind { FETCH, PARSE }
}
