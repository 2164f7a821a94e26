package com.genbridge.gateway.task;

import com.genbridge.gateway.backend.BackendAdapter;
import com.genbridge.gateway.backend.BackendReply;
import com.genbridge.gateway.backend.CapabilityProfile;
import com.genbridge.gateway.backend.PayloadBuilder;
import com.genbridge.gateway.backend.TransportFamily;
import com.genbridge.gateway.config.ApiKeyProvider;
import com.genbridge.gateway.error.BackendCallException;
import com.genbridge.gateway.error.EmptyResultException;
import com.genbridge.gateway.error.TerminalTaskFailureException;
import com.genbridge.gateway.model.FetchOutcome;
import com.genbridge.gateway.model.GenerationResult;
import com.genbridge.gateway.model.InvocationContext;
import com.genbridge.gateway.model.TaskHandle;
import com.genbridge.gateway.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Submit / fetch orchestration for provider-side generation tasks.
 *
 * <p>Rules enforced here, for every capability:
 * <ul>
 *   <li>The API key is resolved before any provider call; a missing key fails
 *       the call without touching the network.</li>
 *   <li>{@link #submit} never returns a handle for a rejected, id-less or
 *       FAILED/CANCELED submission.</li>
 *   <li>{@link #fetch} makes exactly one provider round trip. In-progress
 *       statuses are returned as values; polling, backoff and give-up are the
 *       caller's policy.</li>
 *   <li>SUCCEEDED without artifacts is an {@link EmptyResultException}.</li>
 *   <li>Request ids are never blank: caller context first, then the provider
 *       reply, then a generated id. Fetches derive the generated id from the
 *       task id; submit and generate use a fresh UUID.</li>
 * </ul>
 *
 * <p>Caller mistakes (a blank task id, a profile of the wrong mode) throw
 * {@link IllegalArgumentException} synchronously, before any provider call.
 * Every other failure completes the returned future exceptionally with the
 * {@link com.genbridge.gateway.error.GenerationException} as cause; nothing is
 * retried. The gateway keeps no per-task state, so repeated fetches of an
 * unchanged task yield equal outcomes.
 */
public class AsyncTaskGateway {

    private static final Logger log = LoggerFactory.getLogger(AsyncTaskGateway.class);

    private final Map<TransportFamily, BackendAdapter> adapters;
    private final ApiKeyProvider   keys;
    private final StatusNormalizer normalizer;
    private final PayloadBuilder   payloads;
    private final CallInterceptor  interceptor;

    public AsyncTaskGateway(Map<TransportFamily, BackendAdapter> adapters,
                            ApiKeyProvider keys,
                            StatusNormalizer normalizer,
                            PayloadBuilder payloads,
                            CallInterceptor interceptor) {
        this.adapters    = new EnumMap<>(adapters);
        this.keys        = keys;
        this.normalizer  = normalizer;
        this.payloads    = payloads;
        this.interceptor = interceptor == null ? CallInterceptor.NOOP : interceptor;
    }

    // ------------------------------------------------------------------
    // Public API
    // ------------------------------------------------------------------

    /** Submit an asynchronous task and return its handle. */
    public CompletableFuture<TaskHandle> submit(CapabilityProfile profile, Object request, InvocationContext ctx) {
        requireMode(profile, CapabilityProfile.Mode.ASYNC_TASK);
        return call(profile.label() + ".submit", profile, ctx,
                (adapter, apiKey) -> adapter.create(payloads.build(profile, request), apiKey),
                reply -> toHandle(reply, ctx),
                TaskHandle::requestId);
    }

    /** One lookup of a task; in-progress statuses are returned, not raised. */
    public CompletableFuture<FetchOutcome> fetch(CapabilityProfile profile, String taskId, InvocationContext ctx) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId must not be blank");
        }
        return call(profile.label() + ".fetch", profile, ctx,
                (adapter, apiKey) -> adapter.lookup(taskId, apiKey),
                reply -> toOutcome(reply, taskId, ctx),
                FetchOutcome::requestId);
    }

    /** One round trip to a synchronous capability that answers with its artifacts directly. */
    public CompletableFuture<GenerationResult> generate(CapabilityProfile profile, Object request, InvocationContext ctx) {
        requireMode(profile, CapabilityProfile.Mode.SYNC);
        return call(profile.label() + ".generate", profile, ctx,
                (adapter, apiKey) -> adapter.create(payloads.build(profile, request), apiKey),
                reply -> toResult(reply, ctx),
                GenerationResult::requestId);
    }

    // ------------------------------------------------------------------
    // Reply interpretation
    // ------------------------------------------------------------------

    private TaskHandle toHandle(BackendReply reply, InvocationContext ctx) {
        if (!reply.transportOk()) {
            throw new BackendCallException("Task submission rejected (HTTP " + reply.statusCode() + ")",
                    reply.statusCode(), reply.rawText());
        }
        if (reply.taskId() == null) {
            throw new BackendCallException("Task submission reply carries no task_id",
                    reply.statusCode(), reply.rawText());
        }
        TaskStatus status = normalizer.normalize(reply.status());
        if (status.isFailure()) {
            throw new TerminalTaskFailureException(reply.taskId(), status, reply.rawText());
        }
        return new TaskHandle(reply.taskId(), status, resolveRequestId(ctx, reply, AsyncTaskGateway::randomRequestId));
    }

    private FetchOutcome toOutcome(BackendReply reply, String requestedTaskId, InvocationContext ctx) {
        if (!reply.transportOk()) {
            throw new BackendCallException("Lookup of task " + requestedTaskId + " failed (HTTP " + reply.statusCode() + ")",
                    reply.statusCode(), reply.rawText());
        }
        if (reply.status() == null) {
            throw new BackendCallException("Lookup reply for task " + requestedTaskId + " carries no task_status",
                    reply.statusCode(), reply.rawText());
        }
        String taskId = reply.taskId() != null ? reply.taskId() : requestedTaskId;
        TaskStatus status = normalizer.normalize(reply.status());
        if (status.isFailure()) {
            throw new TerminalTaskFailureException(taskId, status, reply.rawText());
        }
        String requestId = resolveRequestId(ctx, reply, () -> taskScopedRequestId(taskId));
        if (!status.isTerminal()) {
            return FetchOutcome.inProgress(taskId, status, requestId);
        }
        if (reply.artifacts().isEmpty()) {
            throw new EmptyResultException(taskId, reply.rawText());
        }
        return FetchOutcome.succeeded(new GenerationResult(taskId, reply.artifacts(), requestId));
    }

    private GenerationResult toResult(BackendReply reply, InvocationContext ctx) {
        if (!reply.transportOk()) {
            throw new BackendCallException("Generation call rejected (HTTP " + reply.statusCode() + ")",
                    reply.statusCode(), reply.rawText());
        }
        // synchronous replies usually carry no status at all
        TaskStatus status = reply.status() == null ? TaskStatus.SUCCEEDED : normalizer.normalize(reply.status());
        if (status.isFailure()) {
            throw new TerminalTaskFailureException(reply.taskId(), status, reply.rawText());
        }
        if (!status.isTerminal()) {
            throw new BackendCallException("Synchronous call returned in-progress status " + status,
                    reply.statusCode(), reply.rawText());
        }
        if (reply.artifacts().isEmpty()) {
            throw new EmptyResultException(reply.taskId(), reply.rawText());
        }
        return new GenerationResult(reply.taskId(), reply.artifacts(),
                resolveRequestId(ctx, reply, AsyncTaskGateway::randomRequestId));
    }

    private static String resolveRequestId(InvocationContext ctx, BackendReply reply, Supplier<String> fallback) {
        return ctx.callerRequestId()
                .orElseGet(() -> reply.requestId() != null ? reply.requestId() : fallback.get());
    }

    private static String randomRequestId() {
        return UUID.randomUUID().toString();
    }

    /** Stable per task id, so lookups of an unchanged task compare equal. */
    static String taskScopedRequestId(String taskId) {
        return UUID.nameUUIDFromBytes(("task:" + taskId).getBytes(StandardCharsets.UTF_8)).toString();
    }

    // ------------------------------------------------------------------
    // Call plumbing
    // ------------------------------------------------------------------

    private <T> CompletableFuture<T> call(String label,
                                          CapabilityProfile profile,
                                          InvocationContext ctx,
                                          BiFunction<BackendAdapter, String, CompletableFuture<BackendReply>> roundTrip,
                                          Function<BackendReply, T> interpret,
                                          Function<T, String> requestIdOf) {
        long started = System.nanoTime();
        CompletableFuture<T> future;
        try {
            String apiKey = keys.apiKey(ApiKeyProvider.DASHSCOPE, ctx);
            BackendAdapter adapter = adapterFor(profile);
            log.debug("{} via {} adapter", label, profile.transport());
            future = roundTrip.apply(adapter, apiKey).thenApply(interpret);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.whenComplete((value, err) -> {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            String requestId = value != null ? requestIdOf.apply(value) : ctx.callerRequestId().orElse(null);
            notifyInterceptor(new CallRecord(label, requestId, value, unwrap(err), elapsed));
        });
    }

    private BackendAdapter adapterFor(CapabilityProfile profile) {
        BackendAdapter adapter = adapters.get(profile.transport());
        if (adapter == null) {
            throw new IllegalStateException("No adapter registered for transport " + profile.transport());
        }
        return adapter;
    }

    private void notifyInterceptor(CallRecord record) {
        try {
            interceptor.onComplete(record);
        } catch (RuntimeException e) {
            log.warn("Call interceptor failed for {}: {}", record.label(), e.getMessage(), e);
        }
    }

    private static void requireMode(CapabilityProfile profile, CapabilityProfile.Mode expected) {
        if (profile.mode() != expected) {
            throw new IllegalArgumentException(
                    "Capability '%s' is %s, not %s".formatted(profile.label(), profile.mode(), expected));
        }
    }

    private static Throwable unwrap(Throwable err) {
        return err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
    }
}
