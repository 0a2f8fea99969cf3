package com.phillippitts.voiceforge.service.pool;

import com.phillippitts.voiceforge.domain.TaskType;
import com.phillippitts.voiceforge.exception.WorkerProtocolException;
import com.phillippitts.voiceforge.service.worker.TaskHandler;
import com.phillippitts.voiceforge.service.worker.WorkerRuntime;
import com.phillippitts.voiceforge.service.worker.handler.EchoTaskHandler;
import com.phillippitts.voiceforge.service.worker.protocol.MessageKind;
import com.phillippitts.voiceforge.service.worker.protocol.WorkerMessage;
import com.phillippitts.voiceforge.service.worker.protocol.WorkerMessageCodec;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Shared test doubles for worker pool tests.
 * Worker "processes" are in-JVM threads running the real {@link WorkerRuntime} over pipes, so the
 * pool talks the real protocol without spawning anything.
 */
final class WorkerTestDoubles {

    static final List<String> FAKE_COMMAND = List.of("fake-worker");
    private static final int PIPE_BUFFER = 64 * 1024;

    private WorkerTestDoubles() {}

    /**
     * Settings with short intervals suitable for tests.
     */
    static WorkerPoolSettings fastSettings(TaskType type, int size) {
        return WorkerPoolSettings.defaults(type, size, FAKE_COMMAND)
                .withHealthCheck(Duration.ofMillis(100), Duration.ofMillis(500))
                .withStartupTimeout(Duration.ofSeconds(2))
                .withDefaultDeadline(Duration.ofSeconds(10));
    }

    /**
     * ProcessFactory handing out {@link FakeWorkerProcess}es and remembering each one.
     */
    static final class FakeProcessFactory implements ProcessFactory {
        private final TaskType type;
        private final Supplier<TaskHandler> handlers;
        private final List<FakeWorkerProcess> spawned = new CopyOnWriteArrayList<>();
        private final List<String> dispatched = new CopyOnWriteArrayList<>();
        private volatile boolean silent;

        FakeProcessFactory(TaskType type) {
            this(type, EchoTaskHandler::new);
        }

        FakeProcessFactory(TaskType type, Supplier<TaskHandler> handlers) {
            this.type = type;
            this.handlers = handlers;
        }

        /** Workers started from now on never report ready. */
        FakeProcessFactory silent() {
            this.silent = true;
            return this;
        }

        @Override
        public Process start(List<String> command, Path workingDir) {
            FakeWorkerProcess process = new FakeWorkerProcess(type, handlers.get(), silent, dispatched::add);
            spawned.add(process);
            return process;
        }

        List<FakeWorkerProcess> spawned() {
            return spawned;
        }

        FakeWorkerProcess latest() {
            return spawned.get(spawned.size() - 1);
        }

        /** Ids of task messages written to any worker, in write order. */
        List<String> dispatchedTaskIds() {
            return dispatched;
        }
    }

    /**
     * Fake Process backed by a {@link WorkerRuntime} thread. {@link #kill()} simulates a crash:
     * stdout reaches end of stream and stdin breaks. {@link #hang()} simulates a stuck process:
     * it stays alive but nothing written to it arrives any more.
     */
    static final class FakeWorkerProcess extends Process {
        private final RecordingStdin stdin;
        private final PipedInputStream workerIn;
        private final PipedOutputStream workerOut;
        private final PipedInputStream stdout;
        private final CountDownLatch exited = new CountDownLatch(1);
        private final Thread runner;
        private volatile boolean alive = true;
        private volatile int exitCode = -1;

        FakeWorkerProcess(TaskType type, TaskHandler handler, boolean silent, Consumer<String> taskIds) {
            try {
                this.workerIn = new PipedInputStream(PIPE_BUFFER);
                this.stdin = new RecordingStdin(new PipedOutputStream(workerIn), taskIds);
                this.stdout = new PipedInputStream(PIPE_BUFFER);
                this.workerOut = new PipedOutputStream(stdout);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            this.runner = new Thread(() -> {
                try {
                    if (silent) {
                        exited.await();
                    } else {
                        exitCode = new WorkerRuntime(type, handler, workerIn, workerOut).run();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    finish();
                }
            }, "fake-worker-" + type.wireName());
            this.runner.setDaemon(true);
            this.runner.start();
        }

        /** Simulates the process dying abruptly. */
        void kill() {
            exitCode = 137;
            finish();
            runner.interrupt();
        }

        void hang() {
            stdin.hung = true;
        }

        private void finish() {
            alive = false;
            closeQuietly(workerOut);
            closeQuietly(workerIn);
            exited.countDown();
        }

        private static void closeQuietly(AutoCloseable c) {
            try {
                c.close();
            } catch (Exception e) {
                // pipe already broken on the other side
            }
        }

        @Override
        public OutputStream getOutputStream() {
            return stdin;
        }

        @Override
        public InputStream getInputStream() {
            return stdout;
        }

        @Override
        public InputStream getErrorStream() {
            return new ByteArrayInputStream(new byte[0]);
        }

        @Override
        public int waitFor() throws InterruptedException {
            exited.await();
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            return exited.await(timeout, unit);
        }

        @Override
        public int exitValue() {
            if (alive) {
                throw new IllegalThreadStateException("process has not exited");
            }
            return exitCode;
        }

        @Override
        public void destroy() {
            kill();
        }

        @Override
        public Process destroyForcibly() {
            kill();
            return this;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }
    }

    /**
     * Worker stdin that notes the id of every task message passing through and can be made to
     * swallow input.
     */
    private static final class RecordingStdin extends OutputStream {
        private final OutputStream target;
        private final Consumer<String> taskIds;
        private final ByteArrayOutputStream line = new ByteArrayOutputStream();
        private volatile boolean hung;

        RecordingStdin(OutputStream target, Consumer<String> taskIds) {
            this.target = target;
            this.taskIds = taskIds;
        }

        @Override
        public void write(int b) throws IOException {
            write(new byte[] {(byte) b}, 0, 1);
        }

        @Override
        public synchronized void write(byte[] b, int off, int len) throws IOException {
            for (int i = off; i < off + len; i++) {
                if (b[i] == '\n') {
                    record(line.toString(StandardCharsets.UTF_8));
                    line.reset();
                } else {
                    line.write(b[i]);
                }
            }
            if (!hung) {
                target.write(b, off, len);
            }
        }

        private void record(String text) {
            try {
                WorkerMessage msg = WorkerMessageCodec.decode(text);
                if (msg.kind() == MessageKind.TASK) {
                    taskIds.accept(msg.id());
                }
            } catch (WorkerProtocolException e) {
                throw new IllegalStateException("pool wrote an invalid message: " + text, e);
            }
        }

        @Override
        public void flush() throws IOException {
            if (!hung) {
                target.flush();
            }
        }

        @Override
        public void close() throws IOException {
            target.close();
        }
    }
}
