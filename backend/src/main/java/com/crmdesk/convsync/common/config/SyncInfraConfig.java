package com.crmdesk.convsync.common.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class SyncInfraConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "syncFetchExecutor", destroyMethod = "shutdownNow")
    public ExecutorService syncFetchExecutor(@Value("${app.sync.fetch-threads:4}") int threads) {
        var threadFactory = new CustomizableThreadFactory("sync-fetch-");
        threadFactory.setDaemon(true);
        return Executors.newFixedThreadPool(Math.max(1, Math.min(threads, 64)), threadFactory);
    }

    @Bean
    public HttpClient webhookHttpClient(@Value("${app.sync.outbound.connect-timeout-ms:5000}") long connectTimeoutMs) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(500, connectTimeoutMs)))
                .build();
    }

    @Bean
    public WebSocketClient changeFeedWebSocketClient() {
        return new StandardWebSocketClient();
    }
}
