/**
 * Job and batch state machine package.
 *
 * <p>Defines the lifecycle states of a download job and of a download batch,
 * and the transition rules between them.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.classdrop.core.statemachine.JobState} - PENDING, ACTIVE, SUCCEEDED, FAILED, CANCELLED</li>
 *   <li>{@link com.ryuqq.classdrop.core.statemachine.BatchState} - IDLE, RUNNING, COMPLETED, CANCELLED</li>
 *   <li>{@link com.ryuqq.classdrop.core.statemachine.StateTransition} - Transition validation</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ClassDrop Team
 */
package com.ryuqq.classdrop.core.statemachine;
