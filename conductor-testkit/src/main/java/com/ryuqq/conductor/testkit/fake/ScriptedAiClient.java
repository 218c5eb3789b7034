package com.ryuqq.conductor.testkit.fake;

import com.ryuqq.conductor.core.collaborator.AiClient;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * {@link AiClient} that answers from a script.
 *
 * <p>Each call consumes the next scripted reply. When the script is empty the last reply is
 * repeated. Replies run on the executor passed by the caller, like a real provider SDK.</p>
 *
 * <pre>
 * ScriptedAiClient ai = new ScriptedAiClient()
 *     .thenReply("Summary of the change")
 *     .thenFail(new IOException("rate limited"));
 * </pre>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class ScriptedAiClient implements AiClient {

    private final Deque<Reply> script = new ArrayDeque<>();
    private final List<String> prompts = new CopyOnWriteArrayList<>();
    private final List<CompletableFuture<String>> pending = new CopyOnWriteArrayList<>();
    private final List<Executor> executors = new CopyOnWriteArrayList<>();
    private Reply last = Reply.text("");

    public synchronized ScriptedAiClient thenReply(String text) {
        script.add(Reply.text(text));
        return this;
    }

    public synchronized ScriptedAiClient thenFail(Throwable failure) {
        script.add(Reply.failure(failure));
        return this;
    }

    /**
     * Next call returns a future that never completes on its own.
     */
    public synchronized ScriptedAiClient thenHang() {
        script.add(Reply.HANG);
        return this;
    }

    @Override
    public CompletableFuture<String> generateText(String prompt, Executor executor) {
        prompts.add(prompt);
        executors.add(executor);
        Reply reply = nextReply();
        if (reply == Reply.HANG) {
            CompletableFuture<String> future = new CompletableFuture<>();
            pending.add(future);
            return future;
        }
        return CompletableFuture.supplyAsync(reply.supplier, executor);
    }

    public List<String> prompts() {
        return new ArrayList<>(prompts);
    }

    /**
     * @return executors passed by callers, in call order
     */
    public List<Executor> executors() {
        return new ArrayList<>(executors);
    }

    /**
     * @return futures handed out by {@link #thenHang()} replies
     */
    public List<CompletableFuture<String>> hangingCalls() {
        return new ArrayList<>(pending);
    }

    private synchronized Reply nextReply() {
        Reply reply = script.poll();
        if (reply == null) {
            return last;
        }
        last = reply;
        return reply;
    }

    private static final class Reply {

        static final Reply HANG = new Reply(null);

        final Supplier<String> supplier;

        private Reply(Supplier<String> supplier) {
            this.supplier = supplier;
        }

        static Reply text(String text) {
            return new Reply(() -> text);
        }

        static Reply failure(Throwable failure) {
            return new Reply(() -> {
                throw new CompletionException(failure);
            });
        }
    }
}
