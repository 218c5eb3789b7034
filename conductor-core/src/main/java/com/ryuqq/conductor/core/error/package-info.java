/**
 * Error taxonomy.
 *
 * <h2>Synchronous API errors (checked)</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.error.AlreadyRunningException} - single-flight violation on start</li>
 *   <li>{@link com.ryuqq.conductor.core.error.OperationNotFoundException} - unknown id</li>
 *   <li>{@link com.ryuqq.conductor.core.error.AlreadyTerminalException} - cancel after the operation ended</li>
 * </ul>
 *
 * <h2>Step failures (reported through the Failed event and status)</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.error.UserInputException} - nothing to do with the given input</li>
 *   <li>{@link com.ryuqq.conductor.core.error.CollaboratorException} - external collaborator failed</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Conductor Team
 */
package com.ryuqq.conductor.core.error;
