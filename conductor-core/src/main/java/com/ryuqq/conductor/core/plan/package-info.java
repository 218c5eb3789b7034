/**
 * Step plan contract.
 *
 * <p>An operation is an {@link com.ryuqq.conductor.core.plan.OperationPlan}, an ordered list of
 * {@link com.ryuqq.conductor.core.plan.Step}s run by one worker. Steps see the operation through
 * {@link com.ryuqq.conductor.core.plan.StepContext}.</p>
 *
 * @since 1.0.0
 * @author Conductor Team
 */
package com.ryuqq.conductor.core.plan;
