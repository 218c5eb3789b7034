package com.ryuqq.conductor.core.collaborator;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Text generation port of the AI provider.
 *
 * <p>Async-only: the provider SDK runs on the executor it is given, which the worker harness
 * scopes to a single operation. Retry, fallback and per-call timeouts are the provider's own
 * business.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public interface AiClient {

    /**
     * @param prompt full prompt
     * @param executor executor owned by the calling operation
     * @return future completing with the generated text, or exceptionally with the provider error
     */
    CompletableFuture<String> generateText(String prompt, Executor executor);
}
