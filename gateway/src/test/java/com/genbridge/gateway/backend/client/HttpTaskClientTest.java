package com.genbridge.gateway.backend.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.genbridge.gateway.backend.ProviderRequest;
import com.genbridge.gateway.backend.http.StubProviderServer;
import com.genbridge.gateway.error.ResponseParseException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpTaskClientTest {

    StubProviderServer server;
    HttpTaskClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new StubProviderServer();
        client = new HttpTaskClient(server.transport(), new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void asyncCall_bindsSubmitReply() {
        server.reply(200, """
                {"output":{"task_id":"t1","task_status":"PENDING"},"request_id":"r1","usage":{"video_count":1}}
                """);

        TaskResponse resp = client.asyncCall(new ProviderRequest("wan2.2-kf2v-flash",
                "services/aigc/image2video/video-synthesis",
                Map.of("first_frame_url", "u1", "last_frame_url", "u2"), Map.of(), true), "sk-test").join();

        assertThat(resp.statusCode()).isEqualTo(200);
        assertThat(resp.requestId()).isEqualTo("r1");
        assertThat(resp.output().taskId()).isEqualTo("t1");
        assertThat(resp.output().taskStatus()).isEqualTo("PENDING");
        assertThat(server.received().get(0).path()).isEqualTo("/api/v1/services/aigc/image2video/video-synthesis");
    }

    @Test
    void fetch_bindsVideoUrl() {
        server.reply(200, """
                {"output":{"task_id":"t1","task_status":"SUCCEEDED","video_url":"https://x/video.mp4"},"request_id":"r2"}
                """);

        TaskResponse resp = client.fetch("t1", "sk-test").join();

        assertThat(resp.output().artifactReferences()).containsExactly("https://x/video.mp4");
        assertThat(server.received().get(0).path()).isEqualTo("/api/v1/tasks/t1");
    }

    @Test
    void fetch_encodesTaskIdAsOnePathSegment() {
        server.reply(200, """
                {"output":{"task_id":"t1","task_status":"RUNNING"}}
                """);

        client.fetch("t1?x=1", "sk-test").join();

        assertThat(server.received().get(0).rawPath()).isEqualTo("/api/v1/tasks/t1%3Fx=1");
        assertThat(server.received().get(0).rawQuery()).isNull();
    }

    @Test
    void fetch_nullBodyOn200_bindsToReplyWithoutOutput() {
        server.reply(200, "null");

        TaskResponse resp = client.fetch("t1", "sk-test").join();

        assertThat(resp.statusCode()).isEqualTo(200);
        assertThat(resp.output()).isNull();
    }

    @Test
    void fetch_errorBody_keepsCodeAndStatus() {
        server.reply(400, """
                {"code":"InvalidParameter","message":"task id is invalid","request_id":"r3"}
                """);

        TaskResponse resp = client.fetch("nope", "sk-test").join();

        assertThat(resp.statusCode()).isEqualTo(400);
        assertThat(resp.code()).isEqualTo("InvalidParameter");
        assertThat(resp.output()).isNull();
    }

    @Test
    void fetch_nonJsonErrorBody_keptAsMessage() {
        server.reply(502, "Bad Gateway");

        TaskResponse resp = client.fetch("t1", "sk-test").join();

        assertThat(resp.statusCode()).isEqualTo(502);
        assertThat(resp.message()).isEqualTo("Bad Gateway");
    }

    @Test
    void fetch_wrongShapeOn200_failsWithParseException() {
        server.reply(200, """
                {"output":"not an object"}
                """);

        assertThatThrownBy(() -> client.fetch("t1", "sk-test").join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(ResponseParseException.class);
    }
}
