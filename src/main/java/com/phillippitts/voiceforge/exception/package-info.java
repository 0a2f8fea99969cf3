/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.voiceforge.exception.VoiceForgeException} - Base exception</li>
 *   <li>{@link com.phillippitts.voiceforge.exception.TaskFailedException} - A task resolved
 *       with an error; carries the {@link com.phillippitts.voiceforge.domain.TaskErrorKind}</li>
 *   <li>{@link com.phillippitts.voiceforge.exception.UnknownTaskTypeException} - No pool for a
 *       task type; fatal at startup</li>
 *   <li>{@link com.phillippitts.voiceforge.exception.WorkerProtocolException} - A line on the
 *       worker IPC channel could not be decoded</li>
 *   <li>{@link com.phillippitts.voiceforge.exception.SessionProtocolException} - A client frame
 *       violated the session protocol</li>
 * </ul>
 *
 * <p>Worker faults never cross the IPC boundary as exceptions: the pool converts them into
 * {@code TaskFailedException}s that complete the submitter's future.
 *
 * @see com.phillippitts.voiceforge.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.voiceforge.exception;
