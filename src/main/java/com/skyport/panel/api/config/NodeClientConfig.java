package com.skyport.panel.api.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class NodeClientConfig {

    @Bean
    public RestClient nodeRestClient(RestClient.Builder builder, NodeClientProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()));
        requestFactory.setReadTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()));
        return builder.requestFactory(requestFactory).build();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService storeReadExecutor(@Value("${app.store.read-threads:4}") int readThreads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, readThreads), r -> {
            Thread thread = new Thread(r, "skyport-store-read-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
