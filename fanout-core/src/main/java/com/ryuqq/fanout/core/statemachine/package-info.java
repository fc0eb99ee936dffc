/**
 * Region task state machine.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fanout.core.statemachine.TaskState} - Task lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.fanout.core.statemachine.TaskStateTransition} - Transition validation</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * TaskState state = TaskState.CREATED;
 * state = TaskStateTransition.transition(state, TaskState.DISPATCHED);
 * state = TaskStateTransition.transition(state, TaskState.ABORTED);
 *
 * // This will throw IllegalStateException
 * TaskStateTransition.validate(state, TaskState.COMPLETED);
 * </pre>
 *
 * @since 1.0.0
 * @author Fanout Team
 */
package com.ryuqq.fanout.core.statemachine;
