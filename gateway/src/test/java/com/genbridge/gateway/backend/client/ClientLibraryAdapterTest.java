package com.genbridge.gateway.backend.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.genbridge.gateway.backend.ArtifactExtractor;
import com.genbridge.gateway.backend.BackendReply;
import com.genbridge.gateway.backend.ProviderRequest;
import com.genbridge.gateway.backend.ReplyReducer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ClientLibraryAdapterTest {

    @Mock TaskClient client;

    ClientLibraryAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new ClientLibraryAdapter(client, new ReplyReducer(new ObjectMapper(), new ArtifactExtractor()));
    }

    @Test
    void create_reducesTypedReply() {
        when(client.asyncCall(any(), eq("sk-test"))).thenReturn(CompletableFuture.completedFuture(
                new TaskResponse(200, "r1", null, null,
                        new TaskResponse.Output("t1", "PENDING", null, null, null, null))));

        BackendReply reply = adapter.create(
                new ProviderRequest("m", "res", Map.of(), Map.of(), true), "sk-test").join();

        assertThat(reply.transportOk()).isTrue();
        assertThat(reply.taskId()).isEqualTo("t1");
        assertThat(reply.status()).isEqualTo("PENDING");
        assertThat(reply.requestId()).isEqualTo("r1");
    }

    @Test
    void lookup_delegatesTaskIdAndKey() {
        when(client.fetch("t1", "sk-test")).thenReturn(CompletableFuture.completedFuture(
                new TaskResponse(200, "r2", null, null,
                        new TaskResponse.Output("t1", "SUCCEEDED", "https://x/video.mp4", null, null, null))));

        BackendReply reply = adapter.lookup("t1", "sk-test").join();

        verify(client).fetch("t1", "sk-test");
        assertThat(reply.artifacts()).containsExactly("https://x/video.mp4");
    }
}
