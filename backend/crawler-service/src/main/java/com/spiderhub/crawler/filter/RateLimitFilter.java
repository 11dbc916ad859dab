package com.spiderhub.crawler.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.spiderhub.crawler.dto.ErrorResponse;
import com.spiderhub.crawler.exception.InfrastructureUnavailableException;
import com.spiderhub.crawler.exception.RateLimitExceededException;
import com.spiderhub.crawler.service.RateLimiterService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 스파이더 API 요청 제한 필터
 *
 * 클라이언트 키는 X-Forwarded-For 의 첫 번째 주소, 없으면 remote address.
 * 제한 초과 시 429 + Retry-After, Redis 장애 시 503 으로 응답합니다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RateLimitFilter extends OncePerRequestFilter {

    static final String PROTECTED_PATH = "/api/v1/spiders";
    static final String HEADER_LIMIT = "X-RateLimit-Limit";
    static final String HEADER_REMAINING = "X-RateLimit-Remaining";

    private final RateLimiterService rateLimiterService;
    private final ObjectMapper objectMapper;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (!rateLimiterService.isEnabled()) {
            return true;
        }
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return !(path.equals(PROTECTED_PATH) || path.startsWith(PROTECTED_PATH + "/"));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String clientKey = resolveClientKey(request);

        RateLimiterService.Decision decision;
        try {
            decision = rateLimiterService.tryAcquire(clientKey);
        } catch (InfrastructureUnavailableException e) {
            writeError(response, HttpStatus.SERVICE_UNAVAILABLE, ErrorResponse.from(e));
            return;
        }

        response.setHeader(HEADER_LIMIT, String.valueOf(decision.limit()));
        response.setHeader(HEADER_REMAINING, String.valueOf(decision.remaining()));

        if (!decision.allowed()) {
            RateLimitExceededException ex = new RateLimitExceededException(
                    decision.limit(), rateLimiterService.getWindow().toSeconds(), decision.retryAfterSeconds());
            log.warn("Rate limit exceeded: client={}, path={}, retryAfter={}s",
                    clientKey, request.getRequestURI(), decision.retryAfterSeconds());
            response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));
            writeError(response, HttpStatus.TOO_MANY_REQUESTS, ErrorResponse.from(ex));
            return;
        }

        filterChain.doFilter(request, response);
    }

    static String resolveClientKey(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            String first = forwarded.split(",")[0].strip();
            if (!first.isEmpty()) {
                return first;
            }
        }
        return request.getRemoteAddr();
    }

    private void writeError(HttpServletResponse response, HttpStatus status, ErrorResponse body) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}
