/**
 * Worker process side of the pool protocol. {@link com.phillippitts.voiceforge.service.worker.WorkerMain}
 * is the entry point launched by a pool slot; it runs one
 * {@link com.phillippitts.voiceforge.service.worker.TaskHandler} over newline-delimited JSON on
 * stdin/stdout. Logging goes to stderr.
 */
package com.phillippitts.voiceforge.service.worker;
