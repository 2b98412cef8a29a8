package com.williamcallahan.game_catalog_engine.config;

import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AsyncConfigTest {

    @Test
    void taskExecutor_rejectsWorkAfterShutdown() {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) new AsyncConfig().taskExecutor();
        executor.shutdown();

        assertThatThrownBy(() -> CompletableFuture.supplyAsync(() -> "never", executor))
            .isInstanceOf(RejectedExecutionException.class);
    }

    @Test
    void taskExecutor_runsSubmittedWork() throws Exception {
        Executor executor = new AsyncConfig().taskExecutor();
        try {
            assertThat(CompletableFuture.supplyAsync(() -> "done", executor).get(5, TimeUnit.SECONDS))
                .isEqualTo("done");
        } finally {
            ((ThreadPoolTaskExecutor) executor).shutdown();
        }
    }

    @Test
    void callerRunsUnlessShutdown_runsOnCallerWhenSaturated() {
        ThreadPoolExecutor pool = new ThreadPoolExecutor(1, 1, 0, TimeUnit.SECONDS, new LinkedBlockingQueue<>(1));
        AtomicReference<Thread> ranOn = new AtomicReference<>();
        try {
            AsyncConfig.callerRunsUnlessShutdown().rejectedExecution(() -> ranOn.set(Thread.currentThread()), pool);
        } finally {
            pool.shutdown();
        }

        assertThat(ranOn.get()).isSameAs(Thread.currentThread());
    }
}
