package com.siteharvest.core.service.export;

import java.nio.file.Path;

/** 보고서 파일 이름. 실행마다 같은 이름으로 덮어쓴다. */
public final class ReportNaming {

    public static final String TEXT_FILE = "report.txt";
    public static final String JSON_FILE = "report.json";

    private ReportNaming() {}

    public static Path outDir(Path dir) { return (dir == null ? Path.of(".") : dir); }
    public static Path textPath(Path dir) { return outDir(dir).resolve(TEXT_FILE); }
    public static Path jsonPath(Path dir) { return outDir(dir).resolve(JSON_FILE); }
}
