package com.spiderhub.crawler.exception;

/**
 * 크롤러 서비스 예외 기본 클래스
 */
public class CrawlerException extends RuntimeException {

    private final String errorCode;
    private final transient Object detail;

    public CrawlerException(String errorCode, String message) {
        this(errorCode, message, null, null);
    }

    public CrawlerException(String errorCode, String message, Throwable cause) {
        this(errorCode, message, null, cause);
    }

    public CrawlerException(String errorCode, String message, Object detail, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.detail = detail;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Object getDetail() {
        return detail;
    }
}
