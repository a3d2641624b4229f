package com.phillippitts.transcodeguard.service.engine.ffmpeg;

import com.phillippitts.transcodeguard.service.engine.EngineListener;
import com.phillippitts.transcodeguard.service.engine.EngineResult;
import com.phillippitts.transcodeguard.service.engine.ProgressEvent;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared test doubles for ffmpeg engine tests.
 * Provides a fake Process so no real ffmpeg binary is needed.
 */
final class FfmpegTestDoubles {

    private FfmpegTestDoubles() {}

    static final long PID = 4242;

    /**
     * Stub ProcessFactory that returns a pre-configured Process and remembers the command.
     */
    static final class StubProcessFactory implements ProcessFactory {
        private final Process p;
        volatile List<String> lastCommand;

        StubProcessFactory(Process p) {
            this.p = p;
        }

        @Override
        public Process start(List<String> command, Path workingDir) {
            lastCommand = command;
            return p;
        }
    }

    /**
     * Fake Process with fixed stdout/stderr. It exits with {@code exitCode} once
     * {@link #finish()} is called, or with 143 when destroyed.
     */
    static final class TestProcess extends Process {
        private final byte[] out;
        private final byte[] err;
        private final int exitCode;
        private final CountDownLatch done = new CountDownLatch(1);
        private volatile int actualExit;
        volatile boolean destroyCalled;
        volatile boolean destroyForciblyCalled;

        TestProcess(String stdout, String stderr, int exitCode, boolean exitImmediately) {
            this.out = stdout.getBytes(StandardCharsets.UTF_8);
            this.err = stderr.getBytes(StandardCharsets.UTF_8);
            this.exitCode = exitCode;
            if (exitImmediately) {
                finish();
            }
        }

        void finish() {
            actualExit = exitCode;
            done.countDown();
        }

        @Override
        public OutputStream getOutputStream() {
            return new ByteArrayOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return new ByteArrayInputStream(out);
        }

        @Override
        public InputStream getErrorStream() {
            return new ByteArrayInputStream(err);
        }

        @Override
        public int waitFor() throws InterruptedException {
            done.await();
            return actualExit;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            return done.await(timeout, unit);
        }

        @Override
        public int exitValue() {
            if (done.getCount() > 0) {
                throw new IllegalThreadStateException("process has not exited");
            }
            return actualExit;
        }

        @Override
        public void destroy() {
            destroyCalled = true;
            if (done.getCount() > 0) {
                actualExit = 143;
                done.countDown();
            }
        }

        @Override
        public Process destroyForcibly() {
            destroyForciblyCalled = true;
            destroy();
            return this;
        }

        @Override
        public boolean isAlive() {
            return done.getCount() > 0;
        }

        @Override
        public long pid() {
            return PID;
        }
    }

    /**
     * Records signals instead of sending them.
     */
    static final class RecordingSignalSender implements SignalSender {
        final List<String> signals = new CopyOnWriteArrayList<>();
        final AtomicInteger suspends = new AtomicInteger();
        final AtomicInteger resumes = new AtomicInteger();
        final CountDownLatch resumeHeld = new CountDownLatch(1);
        private volatile CountDownLatch resumeGate;

        /**
         * Makes resumes block, after signalling {@link #resumeHeld}, until {@code gate} opens.
         */
        void holdResumesUntil(CountDownLatch gate) {
            this.resumeGate = gate;
        }

        @Override
        public boolean suspend(long pid) {
            signals.add("STOP:" + pid);
            suspends.incrementAndGet();
            return true;
        }

        @Override
        public boolean resume(long pid) {
            CountDownLatch gate = resumeGate;
            if (gate != null) {
                resumeHeld.countDown();
                try {
                    gate.await(2, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            signals.add("CONT:" + pid);
            resumes.incrementAndGet();
            return true;
        }
    }

    /**
     * Captures engine callbacks.
     */
    static final class RecordingListener implements EngineListener {
        final List<ProgressEvent> progress = new CopyOnWriteArrayList<>();
        final List<EngineResult> results = new CopyOnWriteArrayList<>();
        final CountDownLatch resultLatch = new CountDownLatch(1);

        @Override
        public void onProgress(ProgressEvent event) {
            progress.add(event);
        }

        @Override
        public void onResult(EngineResult result) {
            results.add(result);
            resultLatch.countDown();
        }
    }
}
