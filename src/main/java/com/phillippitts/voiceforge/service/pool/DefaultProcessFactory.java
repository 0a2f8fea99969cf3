package com.phillippitts.voiceforge.service.pool;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Production {@link ProcessFactory} backed by {@link ProcessBuilder}.
 */
public final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command, Path workingDir) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        // stdout is the IPC channel; stderr is drained separately into the pool log
        pb.redirectErrorStream(false);
        return pb.start();
    }
}
