package com.genbridge.gateway.component;

import com.genbridge.gateway.model.InvocationContext;

import java.util.concurrent.CompletableFuture;

/**
 * A single named, typed, asynchronous generation operation.
 *
 * Every capability exposed to agents is one implementation of this contract.
 * {@link #run} performs at most one provider round trip and never swallows
 * errors: the returned future fails with whatever the gateway raised.
 *
 * @param <I> input record type
 * @param <O> output record type
 */
public interface GenerationComponent<I, O> {

    /** Name, description and schemas, as advertised in the capability registry. */
    ComponentSpec spec();

    /** Input record class; used to bind untyped (JSON) invocations. */
    Class<I> inputType();

    CompletableFuture<O> run(I input, InvocationContext ctx);

    default String name() {
        return spec().name();
    }
}
