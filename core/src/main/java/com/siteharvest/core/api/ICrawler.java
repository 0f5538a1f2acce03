package com.siteharvest.core.api;

import com.siteharvest.core.util.ProgressListener;

import java.util.concurrent.atomic.AtomicBoolean;

/** 크롤러 최소 계약: seed 부터 frontier 가 빌 때까지 돌며 sink 로 결과를 보낸다. */
public interface ICrawler extends AutoCloseable {

    /**
     * @param cancelFlag null 허용. true 가 되면 새 URL 배정을 멈추고 진행 중인 것만 마무리
     * @return frontier 를 끝까지 비웠으면 true, 취소로 멈췄으면 false
     */
    boolean crawl(CrawlSink sink, ProgressListener listener, AtomicBoolean cancelFlag);

    @Override default void close() throws Exception {}
}
