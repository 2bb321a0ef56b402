package com.agile.Buro.Config;

import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class AsyncConfigTest {

    @Test
    void notificationExecutor_dropsInsteadOfRejecting() {
        Executor executor = new AsyncConfig().notificationExecutor();
        try {
            assertThat(((ThreadPoolTaskExecutor) executor).getThreadPoolExecutor().getRejectedExecutionHandler())
                    .isInstanceOf(AsyncConfig.DropAndLogPolicy.class);
        } finally {
            ((ThreadPoolTaskExecutor) executor).shutdown();
        }
    }

    @Test
    void saturatedPool_dropsTaskWithoutThrowing() throws InterruptedException {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setRejectedExecutionHandler(new AsyncConfig.DropAndLogPolicy());
        executor.initialize();

        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(2);
        AtomicInteger ran = new AtomicInteger();
        Runnable blocking = () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            ran.incrementAndGet();
            finished.countDown();
        };
        try {
            executor.execute(blocking);
            executor.execute(blocking);

            assertThatCode(() -> executor.execute(ran::incrementAndGet)).doesNotThrowAnyException();

            release.countDown();
            assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(ran.get()).isEqualTo(2);
        } finally {
            executor.shutdown();
        }
    }
}
