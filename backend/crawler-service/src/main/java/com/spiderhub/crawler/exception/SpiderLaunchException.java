package com.spiderhub.crawler.exception;

/**
 * 크롤 엔진이 스파이더를 시작하지 못한 경우.
 * 작업 ID가 이미 발급된 뒤이므로 API 오류가 아니라 FAILED 상태로 기록된다.
 */
public class SpiderLaunchException extends CrawlerException {

    private final String spiderName;

    public SpiderLaunchException(String spiderName, String message) {
        this(spiderName, message, null);
    }

    public SpiderLaunchException(String spiderName, String message, Throwable cause) {
        super("SPIDER_LAUNCH_FAILED", message, cause);
        this.spiderName = spiderName;
    }

    public String getSpiderName() {
        return spiderName;
    }
}
