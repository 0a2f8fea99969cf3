package com.phillippitts.voiceforge.config.pool;

import com.phillippitts.voiceforge.config.properties.WorkerPoolProperties;
import com.phillippitts.voiceforge.domain.TaskType;
import com.phillippitts.voiceforge.service.worker.WorkerMain;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the command line that starts one worker process.
 *
 * <p>An explicit {@code worker.pools.types.<type>.command} is used verbatim. Otherwise the worker
 * runs {@link WorkerMain} in a child JVM on the current classpath:
 * <pre>
 * java [jvm-args] -cp &lt;classpath&gt; -Dlog4j2.configurationFile=classpath:log4j2-worker.xml \
 *      com.phillippitts.voiceforge.service.worker.WorkerMain --type=&lt;type&gt; --handler=&lt;class&gt;
 * </pre>
 */
public final class WorkerCommandFactory {

    private final WorkerPoolProperties properties;
    private final String classpath;

    public WorkerCommandFactory(WorkerPoolProperties properties) {
        this(properties, System.getProperty("java.class.path"));
    }

    WorkerCommandFactory(WorkerPoolProperties properties, String classpath) {
        this.properties = properties;
        this.classpath = classpath;
    }

    public List<String> commandFor(TaskType type, WorkerPoolProperties.TypePool pool) {
        if (pool.getCommand() != null && !pool.getCommand().isEmpty()) {
            return List.copyOf(pool.getCommand());
        }
        String handler = pool.getHandlerClass() == null || pool.getHandlerClass().isBlank()
                ? properties.getHandlerClass()
                : pool.getHandlerClass();

        List<String> cmd = new ArrayList<>();
        cmd.add(properties.getJavaCommand());
        cmd.addAll(properties.getJvmArgs());
        cmd.add("-cp");
        cmd.add(classpath);
        cmd.add("-Dlog4j2.configurationFile=classpath:log4j2-worker.xml");
        cmd.add(WorkerMain.class.getName());
        cmd.add("--type=" + type.wireName());
        cmd.add("--handler=" + handler);
        return cmd;
    }
}
