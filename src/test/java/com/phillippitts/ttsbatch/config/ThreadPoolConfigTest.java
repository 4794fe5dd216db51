package com.phillippitts.ttsbatch.config;

import com.phillippitts.ttsbatch.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateModelExecutorFromProperties() {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getModel().setCorePoolSize(1);
        properties.getModel().setThreadNamePrefix("preload-");

        Executor executor = new ThreadPoolConfig(properties).modelExecutor();

        assertThat(executor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor taskExecutor = (ThreadPoolTaskExecutor) executor;
        assertThat(taskExecutor.getCorePoolSize()).isEqualTo(1);
        assertThat(taskExecutor.getMaxPoolSize()).isEqualTo(4);
        assertThat(taskExecutor.getThreadNamePrefix()).isEqualTo("preload-");
        taskExecutor.shutdown();
    }

    @Test
    void shouldPropagateLoggingContextToWorkers() throws InterruptedException {
        ThreadPoolTaskExecutor executor =
                (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties()).modelExecutor();
        ThreadContext.put("requestId", "abc");
        AtomicReference<String> seen = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        executor.execute(() -> {
            seen.set(ThreadContext.get("requestId"));
            done.countDown();
        });

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("abc");
        executor.shutdown();
    }

    @Test
    void decoratorRestoresWorkerContext() {
        ThreadContext.put("requestId", "submitter");
        Runnable decorated = ThreadPoolConfig.mdcPropagatingDecorator().decorate(() ->
                assertThat(ThreadContext.get("requestId")).isEqualTo("submitter"));
        ThreadContext.clearAll();
        ThreadContext.put("requestId", "worker");

        decorated.run();

        assertThat(ThreadContext.get("requestId")).isEqualTo("worker");
    }
}
