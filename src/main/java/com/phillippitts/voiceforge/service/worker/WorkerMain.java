package com.phillippitts.voiceforge.service.worker;

import com.phillippitts.voiceforge.domain.TaskType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.FileOutputStream;
import java.io.FileDescriptor;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Entry point of a worker process.
 *
 * <pre>
 * java -cp &lt;classpath&gt; com.phillippitts.voiceforge.service.worker.WorkerMain \
 *      --type=transcribe --handler=com.example.MyHandler
 * </pre>
 *
 * <p>Stdout is reserved for the IPC channel: {@link System#out} is redirected to stderr before
 * anything else runs, and logging is configured to write to stderr only.
 */
public final class WorkerMain {

    static final String LOG_CONFIG_PROPERTY = "log4j2.configurationFile";
    static final String LOG_CONFIG = "classpath:log4j2-worker.xml";

    private WorkerMain() {
    }

    public static void main(String[] args) {
        if (System.getProperty(LOG_CONFIG_PROPERTY) == null) {
            System.setProperty(LOG_CONFIG_PROPERTY, LOG_CONFIG);
        }
        OutputStream ipcOut = new FileOutputStream(FileDescriptor.out);
        System.setOut(new PrintStream(new FileOutputStream(FileDescriptor.err), true, StandardCharsets.UTF_8));

        Logger log = LogManager.getLogger(WorkerMain.class);
        WorkerArguments arguments;
        TaskHandler handler;
        try {
            arguments = WorkerArguments.parse(args);
            handler = instantiate(arguments.handlerClass());
        } catch (IllegalArgumentException e) {
            log.error("Cannot start worker: {}", e.getMessage());
            System.exit(WorkerRuntime.EXIT_INIT_FAILED);
            return;
        }

        int exit = new WorkerRuntime(arguments.type(), handler, System.in, ipcOut).run();
        System.exit(exit);
    }

    /**
     * Resolves a handler among those registered under {@code META-INF/services}.
     *
     * @throws IllegalArgumentException if no registered handler has that class name
     */
    static TaskHandler instantiate(String className) {
        try {
            return ServiceLoader.load(TaskHandler.class).stream()
                    .filter(provider -> provider.type().getName().equals(className))
                    .findFirst()
                    .map(ServiceLoader.Provider::get)
                    .orElseThrow(() -> new IllegalArgumentException("No registered TaskHandler named " + className));
        } catch (ServiceConfigurationError e) {
            throw new IllegalArgumentException("Cannot load handler " + className + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parsed command line of a worker process.
     */
    record WorkerArguments(TaskType type, String handlerClass) {

        static WorkerArguments parse(String[] args) {
            TaskType type = null;
            String handler = null;
            for (String arg : args) {
                if (arg.startsWith("--type=")) {
                    String name = arg.substring("--type=".length());
                    type = TaskType.fromWire(name)
                            .orElseThrow(() -> new IllegalArgumentException("Unknown task type: " + name));
                } else if (arg.startsWith("--handler=")) {
                    handler = arg.substring("--handler=".length());
                } else {
                    throw new IllegalArgumentException("Unrecognized argument: " + arg);
                }
            }
            if (type == null) {
                throw new IllegalArgumentException("Missing required --type");
            }
            if (handler == null || handler.isBlank()) {
                throw new IllegalArgumentException("Missing required --handler");
            }
            return new WorkerArguments(type, handler);
        }
    }
}
