package com.siteharvest.core.api;

/** HTML 원문 → 질의 가능한 문서. */
@FunctionalInterface
public interface IPageParser {
    ParsedPage parse(String html) throws PageParseException;
}
