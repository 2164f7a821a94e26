package com.genbridge.gateway.component.impl;

import com.genbridge.gateway.backend.CapabilityProfile;
import com.genbridge.gateway.component.ImageResults;
import com.genbridge.gateway.component.TaskQuery;
import com.genbridge.gateway.component.TaskSubmission;
import com.genbridge.gateway.component.VideoTaskResult;
import com.genbridge.gateway.error.TerminalTaskFailureException;
import com.genbridge.gateway.model.FetchOutcome;
import com.genbridge.gateway.model.GenerationResult;
import com.genbridge.gateway.model.InvocationContext;
import com.genbridge.gateway.model.TaskHandle;
import com.genbridge.gateway.model.TaskStatus;
import com.genbridge.gateway.task.AsyncTaskGateway;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * Components map gateway values onto their output records and pass failures through.
 */
@ExtendWith(MockitoExtension.class)
class ComponentRunTest {

    @Mock AsyncTaskGateway gateway;

    private final InvocationContext ctx = InvocationContext.withRequestId("job-1");

    @Test
    void submit_returnsTaskSubmission() {
        TextToVideoSubmit component = new TextToVideoSubmit(gateway, "wan2.6-t2v");
        TextToVideoSubmit.Input input = new TextToVideoSubmit.Input(
                "a robot", null, null, null, null, null, null, null, null);
        when(gateway.submit(any(CapabilityProfile.class), eq(input), eq(ctx)))
                .thenReturn(CompletableFuture.completedFuture(new TaskHandle("t1", TaskStatus.PENDING, "job-1")));

        TaskSubmission out = component.run(input, ctx).join();

        assertThat(out).isEqualTo(new TaskSubmission("t1", "PENDING", "job-1"));
    }

    @Test
    void fetch_inProgress_hasNoVideoUrl() {
        WanVideoFetch component = new WanVideoFetch(gateway);
        when(gateway.fetch(any(CapabilityProfile.class), eq("t1"), eq(ctx)))
                .thenReturn(CompletableFuture.completedFuture(FetchOutcome.inProgress("t1", TaskStatus.RUNNING, "job-1")));

        VideoTaskResult out = component.run(new TaskQuery("t1"), ctx).join();

        assertThat(out.taskStatus()).isEqualTo("RUNNING");
        assertThat(out.videoUrl()).isNull();
    }

    @Test
    void fetch_succeeded_returnsVideoUrl() {
        KeyframeToVideoFetch component = new KeyframeToVideoFetch(gateway);
        when(gateway.fetch(any(CapabilityProfile.class), eq("t1"), eq(ctx)))
                .thenReturn(CompletableFuture.completedFuture(FetchOutcome.succeeded(
                        new GenerationResult("t1", List.of("https://x/video.mp4"), "job-1"))));

        VideoTaskResult out = component.run(new TaskQuery("t1"), ctx).join();

        assertThat(out).isEqualTo(new VideoTaskResult("t1", "SUCCEEDED", "https://x/video.mp4", "job-1"));
    }

    @Test
    void fetch_failure_isPropagated() {
        WanVideoFetch component = new WanVideoFetch(gateway);
        when(gateway.fetch(any(CapabilityProfile.class), eq("t1"), eq(ctx)))
                .thenReturn(CompletableFuture.failedFuture(
                        new TerminalTaskFailureException("t1", TaskStatus.FAILED, "{}")));

        assertThatThrownBy(() -> component.run(new TaskQuery("t1"), ctx).join())
                .hasCauseInstanceOf(TerminalTaskFailureException.class);
    }

    @Test
    void imageGeneration_returnsAllUrls() {
        ImageGeneration component = new ImageGeneration(gateway, "wan2.6-t2i");
        when(gateway.generate(any(CapabilityProfile.class), any(), eq(ctx)))
                .thenReturn(CompletableFuture.completedFuture(
                        new GenerationResult(null, List.of("https://x/1.png", "https://x/2.png"), "job-1")));

        ImageResults out = component.run(
                new ImageGeneration.Input("a fox", null, null, null, 2, null, null), ctx).join();

        assertThat(out.results()).containsExactly("https://x/1.png", "https://x/2.png");
        assertThat(out.requestId()).isEqualTo("job-1");
    }

    @Test
    void textToSpeech_returnsAudioUrl() {
        TextToSpeech component = new TextToSpeech(gateway, "qwen-tts");
        when(gateway.generate(any(CapabilityProfile.class), any(), eq(ctx)))
                .thenReturn(CompletableFuture.completedFuture(
                        new GenerationResult(null, List.of("https://x/speech.wav"), "job-1")));

        SpeechResult out = component.run(new TextToSpeech.Input("hello", "Ethan"), ctx).join();

        assertThat(out).isEqualTo(new SpeechResult("https://x/speech.wav", "job-1"));
    }
}
