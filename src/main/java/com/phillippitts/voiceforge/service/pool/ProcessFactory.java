package com.phillippitts.voiceforge.service.pool;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so worker pools can be tested hermetically.
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests provide fake {@link Process}
 * instances whose stdin/stdout are in-JVM pipes driven by a scripted worker.
 */
public interface ProcessFactory {

    /**
     * Starts a new process.
     *
     * @param command    full command line, executable first
     * @param workingDir working directory (may be null)
     * @return started process
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
