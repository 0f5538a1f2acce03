package com.siteharvest.core.api;

/** 마크업을 문서로 만들지 못했을 때 */
public class PageParseException extends Exception {

    public PageParseException(String message) {
        super(message);
    }

    public PageParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
