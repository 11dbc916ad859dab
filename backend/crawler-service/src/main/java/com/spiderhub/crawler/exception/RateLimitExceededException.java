package com.spiderhub.crawler.exception;

public class RateLimitExceededException extends CrawlerException {

    private final long retryAfterSeconds;

    public RateLimitExceededException(int limit, long windowSeconds, long retryAfterSeconds) {
        super("RATE_LIMIT_EXCEEDED",
                "Request rate limit exceeded",
                String.format("At most %d requests per %d seconds", limit, windowSeconds),
                null);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
