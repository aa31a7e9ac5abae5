package com.castleflow.castleflow_backend.config;

import com.castleflow.castleflow_backend.engine.InMemoryRateLimiter;
import com.castleflow.castleflow_backend.engine.RateLimiter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(AutomateProperties.class)
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RateLimiter rateLimiter(Clock clock) {
        return new InMemoryRateLimiter(clock);
    }

    // Contexts are per evaluation; the engine only caches parsed code
    @Bean(destroyMethod = "close")
    public org.graalvm.polyglot.Engine polyglotEngine() {
        return org.graalvm.polyglot.Engine.newBuilder("js")
                .option("engine.WarnInterpreterOnly", "false")
                .build();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService automateExecutor(AutomateProperties properties) {
        AutomateProperties.Engine engine = properties.getEngine();
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(null, runnable,
                    "automate-exec-" + counter.incrementAndGet(), engine.getWorkerStackSize());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, engine.getWorkerThreads()), factory);
    }
}
