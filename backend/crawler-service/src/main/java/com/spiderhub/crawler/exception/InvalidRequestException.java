package com.spiderhub.crawler.exception;

import java.util.Collection;

/**
 * 잘못된 요청 (스파이더 이름, 페이지 범위 등)
 */
public class InvalidRequestException extends CrawlerException {

    public InvalidRequestException(String errorCode, String message, Object detail) {
        super(errorCode, message, detail, null);
    }

    public static InvalidRequestException unknownSpider(String spiderName, Collection<String> allowed) {
        return new InvalidRequestException(
                "INVALID_SPIDER_NAME",
                "Invalid spider name: " + spiderName,
                "Allowed spiders: " + String.join(", ", allowed));
    }

    public static InvalidRequestException pagination(String message) {
        return new InvalidRequestException("INVALID_PAGINATION", message, null);
    }
}
