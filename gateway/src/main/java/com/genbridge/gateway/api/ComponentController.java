package com.genbridge.gateway.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.genbridge.gateway.model.InvocationContext;
import com.genbridge.gateway.registry.ComponentInvoker;
import com.genbridge.gateway.task.LoggingCallInterceptor;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletionException;

/**
 * Invocation API.
 *
 * POST /components/{name}  runs one component on the JSON body and returns its output.
 *
 * Example:
 *   curl -X POST http://localhost:8080/components/modelstudio_wan_video_fetch \
 *     -H "Content-Type: application/json" -H "X-Request-Id: job-42" \
 *     -d '{"task_id":"0385dc79-5ff8-4d82-bcb6-xxxxxx"}'
 *
 * Async video tools return immediately with a task id; the caller polls the
 * matching fetch component. This endpoint waits for the single provider round
 * trip of each call.
 */
@RestController
@RequestMapping("/components")
public class ComponentController {

    private final ComponentInvoker invoker;

    public ComponentController(ComponentInvoker invoker) {
        this.invoker = invoker;
    }

    @PostMapping("/{name}")
    public Object invoke(@PathVariable String name,
                         @RequestBody(required = false) JsonNode body,
                         @RequestHeader HttpHeaders headers) {
        InvocationContext ctx = new InvocationContext(
                headers.getFirst(InvocationContext.REQUEST_ID_HEADER), headers.toSingleValueMap());

        ctx.callerRequestId().ifPresent(id -> MDC.put(LoggingCallInterceptor.MDC_REQUEST_ID, id));
        try {
            return invoker.invoke(name, body, ctx).join();
        } catch (CompletionException e) {
            // surface the GenerationException itself to the exception handler
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        } finally {
            MDC.remove(LoggingCallInterceptor.MDC_REQUEST_ID);
        }
    }
}
