/**
 * Immutable domain model shared by the worker pools and the session gateway.
 *
 * <p>{@link com.phillippitts.voiceforge.domain.Task} and
 * {@link com.phillippitts.voiceforge.domain.TaskResult} form the task submission contract;
 * {@link com.phillippitts.voiceforge.domain.StageResult} and
 * {@link com.phillippitts.voiceforge.domain.TurnRecord} carry pipeline latency accounting.
 */
package com.phillippitts.voiceforge.domain;
