package com.example.vidres.service.impl;

import com.example.vidres.config.PipelineProperties;
import com.example.vidres.domain.Owner;
import com.example.vidres.domain.ParkedHandle;
import com.example.vidres.domain.ProcessedVideo;
import com.example.vidres.domain.TrackedJob;
import com.example.vidres.domain.VideoVariant;
import com.example.vidres.exceptions.ProbeException;
import com.example.vidres.service.LifecycleCoordinator;
import com.example.vidres.service.ProcessingGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.BDDMockito.willReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;

@ExtendWith(MockitoExtension.class)
@DisplayName("CompletionPollerImpl Tests")
class CompletionPollerImplTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private ProcessingGateway processingGateway;
    @Mock
    private LifecycleCoordinator coordinator;
    @Mock
    private TaskScheduler taskScheduler;
    @Mock
    private ScheduledFuture<Object> scheduledFuture;

    private InMemoryJobRegistry registry;
    private CompletionPollerImpl poller;

    @BeforeEach
    void setUp() {
        registry = new InMemoryJobRegistry();
        PipelineProperties properties = new PipelineProperties(Duration.ofSeconds(30), Duration.ofHours(1), 100, 1000,
                new PipelineProperties.Limits(1, 5, 5), 0.033, null);
        poller = new CompletionPollerImpl(registry, processingGateway, coordinator, taskScheduler, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private TrackedJob track(String jobId, Duration age) {
        TrackedJob job = new TrackedJob(jobId, new Owner.User(1), new ParkedHandle("p-" + jobId),
                NOW.minus(age), 1024, 60, 1);
        registry.track(job);
        return job;
    }

    private static ProcessedVideo processed() {
        return new ProcessedVideo(new VideoVariant(Path.of("v-720p.mp4"), 720, 10), List.of());
    }

    @Nested
    @DisplayName("sweep Tests")
    class SweepTests {

        @Test
        @DisplayName("✅ Expired job times out without being probed")
        void sweep_ExpiredJob_TimesOutFirst() {
            TrackedJob job = track("j1", Duration.ofMinutes(61));

            poller.sweep();

            then(coordinator).should().handleTimeout("j1", Duration.ofMinutes(61));
            then(processingGateway).should(never()).probeCompletion(job.parkedHandle());
            then(coordinator).should(never()).handleCompletion(anyString(), any());
        }

        @Test
        @DisplayName("✅ Finished job is handed to the coordinator")
        void sweep_FinishedJob_Completed() {
            TrackedJob job = track("j1", Duration.ofMinutes(5));
            ProcessedVideo result = processed();
            given(processingGateway.probeCompletion(job.parkedHandle())).willReturn(Optional.of(result));

            poller.sweep();

            then(coordinator).should().handleCompletion("j1", result);
        }

        @Test
        @DisplayName("✅ Unfinished job is left alone")
        void sweep_StillProcessing_NoAction() {
            TrackedJob job = track("j1", Duration.ofMinutes(5));
            given(processingGateway.probeCompletion(job.parkedHandle())).willReturn(Optional.empty());

            poller.sweep();

            then(coordinator).shouldHaveNoInteractions();
            assertThat(registry.contains("j1")).isTrue();
        }

        @Test
        @DisplayName("⚠️ Status check failure keeps the job and does not stop the sweep")
        void sweep_ProbeFails_RetriedLater() {
            TrackedJob failing = track("j1", Duration.ofMinutes(5));
            TrackedJob done = track("j2", Duration.ofMinutes(5));
            given(processingGateway.probeCompletion(failing.parkedHandle())).willThrow(new ProbeException("io"));
            given(processingGateway.probeCompletion(done.parkedHandle())).willReturn(Optional.of(processed()));

            poller.sweep();

            assertThat(registry.contains("j1")).isTrue();
            then(coordinator).should(never()).handleCompletion(eq("j1"), any());
            then(coordinator).should().handleCompletion(eq("j2"), any());
        }

        @Test
        @DisplayName("⚠️ Job cancelled while being probed is not completed")
        void sweep_CancelledDuringProbe_Discarded() {
            TrackedJob job = track("j1", Duration.ofMinutes(5));
            given(processingGateway.probeCompletion(job.parkedHandle())).willAnswer(inv -> {
                registry.remove("j1");
                return Optional.of(processed());
            });

            poller.sweep();

            then(coordinator).should(never()).handleCompletion(anyString(), any());
        }

        @Test
        @DisplayName("⚠️ Unexpected error on one job does not stop the others")
        void sweep_UnexpectedError_ContinuesWithOthers() {
            TrackedJob broken = track("j1", Duration.ofMinutes(5));
            TrackedJob done = track("j2", Duration.ofMinutes(5));
            given(processingGateway.probeCompletion(broken.parkedHandle())).willThrow(new IllegalStateException("bug"));
            given(processingGateway.probeCompletion(done.parkedHandle())).willReturn(Optional.of(processed()));

            poller.sweep();

            then(coordinator).should().handleCompletion(eq("j2"), any());
        }

        @Test
        @DisplayName("✅ Empty registry does nothing")
        void sweep_NoJobs_NoInteractions() {
            poller.sweep();

            then(processingGateway).shouldHaveNoInteractions();
            then(coordinator).shouldHaveNoInteractions();
        }
    }

    @Nested
    @DisplayName("start / stop Tests")
    class LifecycleTests {

        @Test
        @DisplayName("✅ Start schedules one sweep task with the configured delay")
        void start_SchedulesOnce() {
            willReturn(scheduledFuture).given(taskScheduler)
                    .scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));

            poller.start();
            poller.start();

            then(taskScheduler).should(times(1))
                    .scheduleWithFixedDelay(any(Runnable.class), eq(NOW.plusSeconds(30)), eq(Duration.ofSeconds(30)));
        }

        @Test
        @DisplayName("✅ Stop cancels the scheduled sweep")
        void stop_CancelsTask() {
            willReturn(scheduledFuture).given(taskScheduler)
                    .scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));
            poller.start();

            poller.stop();

            then(scheduledFuture).should().cancel(false);
        }

        @Test
        @DisplayName("✅ Stop without start is harmless")
        void stop_NotStarted_NoOp() {
            poller.stop();

            then(taskScheduler).shouldHaveNoInteractions();
        }
    }
}
