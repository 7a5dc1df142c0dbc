package com.example.vidres.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.lang.reflect.Method;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@DisplayName("AsyncConfig Tests")
class AsyncConfigTest {

    private final AsyncConfig asyncConfig = new AsyncConfig();

    // Dummy method signature needed for testing the exception handler
    public void dummyAsyncMethod(String arg1, int arg2) {
        throw new RuntimeException("Async Test Error");
    }

    @Test
    @DisplayName("pipelineLoop should be a single-threaded scheduler")
    void pipelineLoop_SingleThread() {
        ThreadPoolTaskScheduler scheduler = asyncConfig.pipelineLoop();

        assertThat(scheduler.getPoolSize()).isEqualTo(1);
        assertThat(scheduler.getThreadNamePrefix()).isEqualTo("pipeline-loop-");
    }

    @Test
    @DisplayName("asyncTaskExecutor should return a bounded thread pool")
    void asyncTaskExecutor_ReturnsCorrectType() {
        AsyncTaskExecutor executor = asyncConfig.asyncTaskExecutor();

        assertThat(executor).isInstanceOf(ThreadPoolTaskExecutor.class);
        assertThat(((ThreadPoolTaskExecutor) executor).getMaxPoolSize()).isEqualTo(4);
    }

    @Test
    @DisplayName("AsyncUncaughtExceptionHandler should run without error")
    void asyncUncaughtExceptionHandler_RunsWithoutError() throws NoSuchMethodException {
        AsyncUncaughtExceptionHandler handler = asyncConfig.getAsyncUncaughtExceptionHandler();
        assertThat(handler).isNotNull();

        Method testMethod = AsyncConfigTest.class.getDeclaredMethod("dummyAsyncMethod", String.class, int.class);
        Object[] testParams = {"param1", 123};

        assertThatCode(() -> handler.handleUncaughtException(new RuntimeException("Async Test Error"), testMethod, testParams))
                .doesNotThrowAnyException();
    }
}
