package com.spiderhub.crawler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * SpiderHub Crawler Service Application
 *
 * Spring Boot 기반의 크롤링 작업 오케스트레이터
 * - 스파이더 작업 시작/조회/중지
 * - 수집 결과를 Redis에 보관하고 페이지 단위로 조회
 * - Redis 기반 요청 속도 제한
 */
@SpringBootApplication
public class CrawlerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CrawlerApplication.class, args);
    }
}
