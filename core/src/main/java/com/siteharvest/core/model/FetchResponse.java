package com.siteharvest.core.model;

import java.util.Optional;

/** 페이지 fetch 결과(본문은 텍스트 기준) */
public final class FetchResponse {
    public final String url;
    public final int status;                // HTTP status (-1 이면 네트워크 오류/타임아웃)
    public final String body;
    public final Optional<String> error;    // 오류 메시지
    public final Optional<String> retryAfter; // Retry-After 헤더 원문

    public FetchResponse(String url, int status, String body, String error) {
        this(url, status, body, error, null);
    }

    public FetchResponse(String url, int status, String body, String error, String retryAfter) {
        this.url = url;
        this.status = status;
        this.body = (body == null ? "" : body);
        this.error = Optional.ofNullable(error);
        this.retryAfter = Optional.ofNullable(retryAfter);
    }

    public static FetchResponse of(String url, int status, String body) {
        return new FetchResponse(url, status, body, null);
    }

    public static FetchResponse fail(String url, String msg) {
        return new FetchResponse(url, -1, "", msg);
    }

    /** 2xx 이고 오류가 없을 때만 성공 */
    public boolean ok() {
        return error.isEmpty() && status >= 200 && status < 300;
    }

    /** 로그/리포트용 실패 사유 */
    public String describeFailure() {
        if (error.isPresent()) return error.get();
        return "HTTP " + status;
    }
}
