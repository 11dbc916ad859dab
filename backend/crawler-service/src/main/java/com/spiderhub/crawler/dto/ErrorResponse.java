package com.spiderhub.crawler.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.spiderhub.crawler.exception.CrawlerException;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String error,
        String message,
        Object detail,
        Instant timestamp
) {
    public static ErrorResponse of(String error, String message, Object detail) {
        return new ErrorResponse(error, message, detail, Instant.now());
    }

    public static ErrorResponse from(CrawlerException ex) {
        return of(ex.getErrorCode(), ex.getMessage(), ex.getDetail());
    }
}
