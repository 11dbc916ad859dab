package com.spiderhub.crawler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Tunables for the spider task orchestrator.
 *
 * All values can be overridden from application.yml or environment variables
 * (e.g. CRAWLER_RUNTIME_STOP_TIMEOUT=10s).
 */
@Configuration
@ConfigurationProperties(prefix = "crawler")
@Data
public class CrawlerProperties {

    private Results results = new Results();

    private RateLimit rateLimit = new RateLimit();

    private Runtime runtime = new Runtime();

    private Tasks tasks = new Tasks();

    private Callback callback = new Callback();

    @Data
    public static class Results {
        /**
         * Redis key prefix for per-task record lists
         */
        private String keyPrefix = "crawl_results:";

        /**
         * Expiry applied to a task's record list on every append
         */
        private Duration ttl = Duration.ofHours(1);
    }

    @Data
    public static class RateLimit {
        private boolean enabled = true;

        private String keyPrefix = "rate_limit:";

        /**
         * Requests allowed per client within one window
         */
        private int requestsPerWindow = 60;

        private Duration window = Duration.ofSeconds(60);
    }

    @Data
    public static class Runtime {
        /**
         * Upper bound on waiting for the engine to confirm a job teardown
         */
        private Duration stopTimeout = Duration.ofSeconds(30);

        /**
         * Records per ingest batch
         */
        private int batchSize = 50;

        /**
         * Maximum time a partial batch waits before being delivered
         */
        private Duration flushInterval = Duration.ofSeconds(1);

        /**
         * max_items applied when the launch request does not set one
         */
        private int defaultMaxItems = 1000;
    }

    @Data
    public static class Tasks {
        /**
         * Terminal tasks older than this are evicted from the registry
         */
        private Duration retention = Duration.ofHours(24);
    }

    @Data
    public static class Callback {
        /**
         * POST the task summary to the callback_url kwarg when a task ends
         */
        private boolean enabled = true;

        private Duration connectTimeout = Duration.ofSeconds(5);

        /**
         * Upper bound on one callback request, response included
         */
        private Duration timeout = Duration.ofSeconds(10);

        private String userAgent = "SpiderHub-Crawler/1.0";
    }
}
