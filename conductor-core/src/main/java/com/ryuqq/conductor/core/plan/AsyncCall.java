package com.ryuqq.conductor.core.plan;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Starts an asynchronous collaborator call on the executor supplied by the async bridge.
 *
 * <pre>
 * String text = context.awaitAsync(executor -&gt; aiClient.generateText(prompt, executor));
 * </pre>
 *
 * @param <T> result type
 * @author Conductor Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AsyncCall<T> {

    CompletableFuture<T> start(Executor executor);
}
