package com.safejob.matching.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.*;


@Configuration
@Slf4j
public class Beans {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "scoringExecutor", destroyMethod = "shutdown")
    public ExecutorService scoringExecutor(
            MeterRegistry meterRegistry,
            @Value("${matching.recommendation.pool-size:0}") int configuredPoolSize,
            @Value("${matching.recommendation.queue-capacity:10000}") int queueCapacity) {
        int poolSize = configuredPoolSize > 0
                ? configuredPoolSize
                : Math.max(4, Runtime.getRuntime().availableProcessors());
        ThreadFactory threadFactory = new ThreadFactoryBuilder()
                .setNameFormat("match-scoring-%d")
                .setDaemon(true)
                .build();

        log.info("Creating scoring executor with poolSize={} queueCapacity={}", poolSize, queueCapacity);
        return new ThreadPoolExecutor(
                poolSize, poolSize,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queueCapacity),
                threadFactory,
                new ThreadPoolExecutor.CallerRunsPolicy() {
                    @Override
                    public void rejectedExecution(Runnable r, ThreadPoolExecutor e) {
                        meterRegistry.counter("scoring_executor_rejections").increment();
                        log.warn("Scoring executor saturated; running task on caller thread");
                        super.rejectedExecution(r, e);
                    }
                });
    }

    @Bean(name = "snapshotRestTemplate")
    public RestTemplate snapshotRestTemplate(
            RestTemplateBuilder builder,
            @Value("${clients.connect-timeout-ms:2000}") long connectTimeoutMs,
            @Value("${clients.read-timeout-ms:5000}") long readTimeoutMs) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }
}
