package com.spiderhub.crawler.exception;

/**
 * Redis 또는 관계형 DB 장애 (503)
 */
public class InfrastructureUnavailableException extends CrawlerException {

    private final String component;

    public InfrastructureUnavailableException(String component, String message, Throwable cause) {
        super(component.toUpperCase() + "_UNAVAILABLE", message,
                cause != null ? cause.getMessage() : null, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }

    public static InfrastructureUnavailableException redis(String message, Throwable cause) {
        return new InfrastructureUnavailableException("redis", message, cause);
    }

    public static InfrastructureUnavailableException database(String message, Throwable cause) {
        return new InfrastructureUnavailableException("database", message, cause);
    }
}
