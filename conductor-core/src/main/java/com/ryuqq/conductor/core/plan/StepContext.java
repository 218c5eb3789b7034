package com.ryuqq.conductor.core.plan;

import com.ryuqq.conductor.core.model.OperationId;
import com.ryuqq.conductor.core.model.OperationKind;
import com.ryuqq.conductor.core.model.OperationParams;

import java.util.Optional;

/**
 * Per-operation context handed to every {@link Step}.
 *
 * <p>Confined to the worker thread; implementations do not need to be thread-safe except for
 * {@link #isCancelled()}.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public interface StepContext {

    OperationId operationId();

    OperationKind kind();

    /**
     * @return input snapshot taken when the operation was started
     */
    OperationParams params();

    /**
     * @return output of the previous step, empty for the first step
     */
    Optional<String> previousResult();

    /**
     * Publishes a progress event and mirrors it into the registry's running message.
     *
     * @param text progress text (blank text is ignored)
     */
    void progress(String text);

    /**
     * @return true once cancellation was requested (eventually visible)
     */
    boolean isCancelled();

    /**
     * Throws if cancellation was requested. For long loops inside a single step.
     *
     * @throws StepCancelledException if cancelled
     */
    default void checkCancelled() throws StepCancelledException {
        if (isCancelled()) {
            throw new StepCancelledException(operationId());
        }
    }

    /**
     * Runs an async-only collaborator call and blocks the worker thread until it finishes.
     *
     * <p>The executor handed to the call belongs to this operation and is shut down when the
     * operation ends. While waiting, the cancellation flag is polled; on cancellation the
     * future is cancelled and {@link StepCancelledException} is thrown.</p>
     *
     * @param call async call
     * @param <T> result type
     * @return call result
     * @throws StepCancelledException if cancelled while waiting
     * @throws Exception the cause the future failed with, unwrapped
     */
    <T> T awaitAsync(AsyncCall<T> call) throws Exception;

    /**
     * Stores a value for later steps of the same operation.
     */
    void put(String key, Object value);

    /**
     * @return value stored by an earlier step, empty if absent or of another type
     */
    <T> Optional<T> get(String key, Class<T> type);
}
