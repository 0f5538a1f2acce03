package com.siteharvest.core.service.export;

import com.siteharvest.core.model.CrawlResult;

import java.io.IOException;
import java.nio.file.Path;

/** 크롤 결과를 파일 보고서로 내보내는 책임 (txt/json) */
public interface ReportWriter {
    /**
     * @param dir    출력 디렉터리 (없으면 만든다)
     * @param result 최종 집계
     * @return 생성된 파일의 경로
     */
    Path write(Path dir, CrawlResult result) throws IOException;
}
