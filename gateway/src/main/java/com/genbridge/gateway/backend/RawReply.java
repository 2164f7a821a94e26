package com.genbridge.gateway.backend;

import com.genbridge.gateway.backend.client.TaskResponse;

/**
 * Tagged variant over the two reply families a {@link BackendAdapter} can
 * receive. {@link ReplyReducer} handles each variant explicitly.
 */
public sealed interface RawReply permits RawReply.Json, RawReply.Typed {

    /** Reply of a direct HTTP call: status code plus the unparsed body. */
    record Json(int statusCode, String body) implements RawReply {}

    /** Reply object returned by a typed client library. */
    record Typed(TaskResponse response) implements RawReply {}
}
