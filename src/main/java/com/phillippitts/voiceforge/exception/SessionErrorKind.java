package com.phillippitts.voiceforge.exception;

/**
 * Client protocol violations reported on the session stream.
 */
public enum SessionErrorKind {
    /** Frame addressed to a session that does not exist (or before {@code init}). */
    SESSION_NOT_FOUND,
    /** Frame not allowed in the session's current state, e.g. {@code resume} while not paused. */
    INVALID_STATE,
    /** Frame could not be parsed or is missing required fields. */
    INVALID_FRAME
}
