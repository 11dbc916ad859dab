package com.spiderhub.crawler.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * 작업 종료 콜백 전송용 WebClient
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient webClient(CrawlerProperties properties) {
        CrawlerProperties.Callback callback = properties.getCallback();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) callback.getConnectTimeout().toMillis())
                .responseTimeout(callback.getTimeout())
                .followRedirect(true);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.USER_AGENT, callback.getUserAgent())
                .build();
    }
}
