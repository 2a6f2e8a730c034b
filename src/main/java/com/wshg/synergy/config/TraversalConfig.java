package com.wshg.synergy.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 多跳遍历线程池与时钟。各触发设备互相独立，可并行遍历同一份只读向量快照。
 */
@Configuration
public class TraversalConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService traversalExecutor(SynergyProperties props) {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, props.getTraversalThreads()), r -> {
            Thread t = new Thread(r, "path-finder-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
