package com.call_bridge_backend.config;

import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.concurrent.Executor;

@Configuration
@EnableCaching
public class VoiceAIConfig {

    public static final String ASSISTANT_CACHE = "vapi-assistants";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CacheManager cacheManager() {
        return new ConcurrentMapCacheManager(ASSISTANT_CACHE);
    }

    /**
     * JDK client so PATCH is available for assistant updates.
     */
    @Bean
    public RestTemplate vapiRestTemplate(RealtimeConfig realtimeConfig) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(realtimeConfig.getConnectTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(realtimeConfig.getConnectTimeout().multipliedBy(3));
        return new RestTemplate(requestFactory);
    }

    /**
     * Used to forward tool webhooks to the worker that owns the call.
     */
    @Bean
    public RestTemplate workerRestTemplate(RealtimeConfig realtimeConfig) {
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(HttpClient.newBuilder()
                .connectTimeout(realtimeConfig.getConnectTimeout())
                .build());
        requestFactory.setReadTimeout(realtimeConfig.getConnectTimeout().multipliedBy(3));
        return new RestTemplate(requestFactory);
    }

    @Bean
    public WebSocketClient realtimeWebSocketClient() {
        return new StandardWebSocketClient();
    }

    @Bean("toolCallExecutor")
    public Executor toolCallExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("ToolCall-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean("callStartupExecutor")
    public Executor callStartupExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(32);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("CallStart-");
        executor.initialize();
        return executor;
    }
}
