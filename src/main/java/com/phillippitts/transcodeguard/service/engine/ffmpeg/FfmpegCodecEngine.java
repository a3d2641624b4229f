package com.phillippitts.transcodeguard.service.engine.ffmpeg;

import com.phillippitts.transcodeguard.config.properties.FfmpegProperties;
import com.phillippitts.transcodeguard.domain.EncodeParameters;
import com.phillippitts.transcodeguard.domain.InputDescriptor;
import com.phillippitts.transcodeguard.domain.OutputTarget;
import com.phillippitts.transcodeguard.exception.EngineException;
import com.phillippitts.transcodeguard.service.engine.CodecEngine;
import com.phillippitts.transcodeguard.service.engine.EngineHandle;
import com.phillippitts.transcodeguard.service.engine.EngineListener;
import com.phillippitts.transcodeguard.service.engine.EngineResult;
import com.phillippitts.transcodeguard.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link CodecEngine} backed by an external ffmpeg process.
 *
 * <p>Responsibilities:
 * - Build a deterministic CLI from {@link EncodeParameters}
 * - Start the process via {@link ProcessFactory}
 * - Read {@code -progress pipe:1} output from stdout and keep a stderr tail for diagnostics
 * - Report exactly one {@link EngineResult} when the process exits
 * - Pause, resume and throttle through {@link SignalSender} (SIGSTOP/SIGCONT)
 * - Stop with SIGTERM, escalating to a forcible kill after a grace period
 *
 * <p>Throttling duty-cycles the process: each cycle it runs for
 * {@code throttleDutyPercent} of {@code throttleCycleMs} and is suspended for the rest.
 */
public final class FfmpegCodecEngine implements CodecEngine, AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(FfmpegCodecEngine.class);

    static final String ENGINE_NAME = "ffmpeg";
    static final int STDERR_TAIL_CHARS = 2_000;

    private final FfmpegProperties props;
    private final ProcessFactory processFactory;
    private final SignalSender signals;
    private final ScheduledExecutorService scheduler;
    private final Set<FfmpegHandle> live = ConcurrentHashMap.newKeySet();

    public FfmpegCodecEngine(FfmpegProperties props) {
        this(props, new DefaultProcessFactory());
    }

    FfmpegCodecEngine(FfmpegProperties props, ProcessFactory processFactory) {
        this(props, processFactory, new KillSignalSender(processFactory));
    }

    public FfmpegCodecEngine(FfmpegProperties props, ProcessFactory processFactory, SignalSender signals) {
        this.props = Objects.requireNonNull(props, "props");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.signals = Objects.requireNonNull(signals, "signals");
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ffmpeg-control");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public String getEngineName() {
        return ENGINE_NAME;
    }

    @Override
    public EngineHandle begin(InputDescriptor input, OutputTarget output, EngineListener listener) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(listener, "listener");

        List<String> command = buildCommand(input, output);
        LOG.debug("Starting ffmpeg: {}", command);
        Process process;
        try {
            Path workingDir = output.path().toAbsolutePath().getParent();
            process = processFactory.start(command, workingDir);
        } catch (IOException e) {
            throw new EngineException("FFMPEG_START_FAILED", "Unable to start ffmpeg: " + e.getMessage(), e);
        }
        FfmpegHandle handle = new FfmpegHandle(process, listener, new FfmpegProgressParser(input.duration()));
        live.add(handle);
        handle.startThreads();
        return handle;
    }

    /**
     * CLI contract:
     * <pre>
     * ${binary} -hide_banner -nostdin -y -i ${input} [-threads n] -c:v ${vcodec} [-b:v ${bitrate}]
     *     [-crf n] [-preset p] [-vf scale=...] [-r fps] -c:a ${acodec} -progress pipe:1 -nostats ${output}
     * </pre>
     */
    List<String> buildCommand(InputDescriptor input, OutputTarget output) {
        EncodeParameters params = output.parameters();
        List<String> cmd = new ArrayList<>();
        cmd.add(resolveBinary(props.getBinaryPath()));
        cmd.add("-hide_banner");
        cmd.add("-nostdin");
        cmd.add("-y");
        cmd.add("-i");
        cmd.add(input.path().toAbsolutePath().toString());

        if (props.getThreads() > 0) {
            cmd.add("-threads");
            cmd.add(String.valueOf(props.getThreads()));
        }

        cmd.add("-c:v");
        cmd.add(params.videoCodec());
        if (params.targetBitrate() > 0) {
            cmd.add("-b:v");
            cmd.add(String.valueOf(params.targetBitrate()));
        }
        if (params.crf() != null) {
            cmd.add("-crf");
            cmd.add(String.valueOf(params.crf()));
        }
        if (params.preset() != null && !params.preset().isBlank()) {
            cmd.add("-preset");
            cmd.add(params.preset());
        }
        if (params.maxWidth() > 0 && params.maxHeight() > 0) {
            cmd.add("-vf");
            cmd.add("scale=" + params.maxWidth() + ":" + params.maxHeight()
                    + ":force_original_aspect_ratio=decrease");
        }
        if (params.frameRate() > 0) {
            cmd.add("-r");
            cmd.add(String.format(Locale.ROOT, "%.3f", params.frameRate()));
        }

        cmd.add("-c:a");
        cmd.add(params.audioCodec());

        cmd.add("-progress");
        cmd.add("pipe:1");
        cmd.add("-nostats");
        cmd.add(output.path().toAbsolutePath().toString());
        return cmd;
    }

    // A bare name is left for PATH lookup; anything with a separator is made absolute
    private static String resolveBinary(String binary) {
        if (binary.indexOf('/') < 0 && binary.indexOf('\\') < 0) {
            return binary;
        }
        Path path = Path.of(binary);
        if (path.isAbsolute()) {
            return path.toString();
        }
        return Path.of(".").toAbsolutePath().normalize().resolve(path).normalize().toString();
    }

    int liveCount() {
        return live.size();
    }

    /**
     * Stops every running conversion and shuts down the control thread.
     */
    @Override
    public void close() {
        for (FfmpegHandle handle : List.copyOf(live)) {
            handle.stop();
        }
        scheduler.shutdown();
    }

    private final class FfmpegHandle implements EngineHandle {

        private final Process process;
        private final EngineListener listener;
        private final FfmpegProgressParser parser;
        private final StringBuilder stderrTail = new StringBuilder();
        private final CompletableFuture<Void> exited = new CompletableFuture<>();
        private final AtomicBoolean stopRequested = new AtomicBoolean(false);

        private volatile boolean paused;
        private volatile boolean throttled;
        private ScheduledFuture<?> throttleTask; // guarded by this

        private Thread progressReader;
        private Thread stderrReader;

        FfmpegHandle(Process process, EngineListener listener, FfmpegProgressParser parser) {
            this.process = process;
            this.listener = listener;
            this.parser = parser;
        }

        void startThreads() {
            progressReader = daemon(this::readProgress, "ffmpeg-progress");
            stderrReader = daemon(this::readStderr, "ffmpeg-stderr");
            daemon(this::awaitExit, "ffmpeg-wait");
        }

        private void readProgress() {
            try (BufferedReader br = reader(process.getInputStream())) {
                String line;
                while ((line = br.readLine()) != null) {
                    parser.accept(line).ifPresent(listener::onProgress);
                }
            } catch (IOException e) {
                LOG.debug("ffmpeg progress reader stopped: {}", e.toString());
            }
        }

        private void readStderr() {
            try (BufferedReader br = reader(process.getErrorStream())) {
                String line;
                while ((line = br.readLine()) != null) {
                    synchronized (stderrTail) {
                        stderrTail.append(line).append('\n');
                        int overflow = stderrTail.length() - STDERR_TAIL_CHARS;
                        if (overflow > 0) {
                            stderrTail.delete(0, overflow);
                        }
                    }
                }
            } catch (IOException e) {
                LOG.debug("ffmpeg stderr reader stopped: {}", e.toString());
            }
        }

        private void awaitExit() {
            int exitCode;
            try {
                exitCode = process.waitFor();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while waiting for ffmpeg; stopping it");
                process.destroyForcibly();
                exitCode = -1;
            }
            // Let the readers drain so the last progress block precedes the result
            joinQuietly(progressReader);
            joinQuietly(stderrReader);
            cancelThrottle();
            live.remove(this);

            try {
                listener.onResult(resultFor(exitCode));
            } catch (RuntimeException e) {
                LOG.warn("Engine listener failed on result: {}", e.toString());
            } finally {
                exited.complete(null);
            }
        }

        private EngineResult resultFor(int exitCode) {
            if (stopRequested.get()) {
                return EngineResult.error("FFMPEG_STOPPED", "ffmpeg stopped on request (exit " + exitCode + ")");
            }
            if (exitCode == 0) {
                return EngineResult.succeeded();
            }
            String tail;
            synchronized (stderrTail) {
                tail = stderrTail.toString().strip();
            }
            String message = "ffmpeg exited with code " + exitCode + (tail.isEmpty() ? "" : ": " + lastLine(tail));
            return EngineResult.error("FFMPEG_EXIT_" + exitCode, message);
        }

        @Override
        public CompletableFuture<Void> stop() {
            if (stopRequested.compareAndSet(false, true)) {
                synchronized (this) {
                    cancelThrottle();
                    // A suspended process does not act on SIGTERM until continued
                    if (paused || throttled) {
                        signals.resume(process.pid());
                    }
                }
                process.destroy();
                try {
                    scheduler.schedule(this::killIfAlive,
                            ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                } catch (RejectedExecutionException e) {
                    killIfAlive();
                }
            }
            return exited.copy();
        }

        private void killIfAlive() {
            if (process.isAlive()) {
                LOG.warn("ffmpeg did not exit within {} ms of SIGTERM; killing",
                        ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis());
                process.destroyForcibly();
            }
        }

        @Override
        public synchronized void setThrottled(boolean enabled) {
            if (enabled == throttled || stopRequested.get()) {
                return;
            }
            throttled = enabled;
            if (!enabled) {
                cancelThrottle();
                if (!paused) {
                    signals.resume(process.pid());
                }
                return;
            }
            long cycleMs = props.getThrottleCycleMs();
            long runMs = cycleMs * props.getThrottleDutyPercent() / 100;
            if (runMs >= cycleMs) {
                return;
            }
            throttleTask = scheduler.scheduleAtFixedRate(() -> dutyCycle(runMs), 0, cycleMs, TimeUnit.MILLISECONDS);
        }

        // Flag checks and signals share the handle lock with pause()
        private synchronized void dutyCycle(long runMs) {
            if (!throttled || paused || stopRequested.get()) {
                return;
            }
            signals.resume(process.pid());
            scheduler.schedule(this::endRunWindow, runMs, TimeUnit.MILLISECONDS);
        }

        private synchronized void endRunWindow() {
            if (throttled && !paused && !stopRequested.get()) {
                signals.suspend(process.pid());
            }
        }

        private synchronized void cancelThrottle() {
            if (throttleTask != null) {
                throttleTask.cancel(false);
                throttleTask = null;
            }
        }

        @Override
        public synchronized void pause() {
            if (stopRequested.get()) {
                return;
            }
            paused = true;
            if (!signals.suspend(process.pid())) {
                LOG.warn("Unable to suspend ffmpeg pid {}", process.pid());
            }
        }

        @Override
        public synchronized void resume() {
            if (stopRequested.get()) {
                return;
            }
            paused = false;
            if (!signals.resume(process.pid())) {
                LOG.warn("Unable to continue ffmpeg pid {}", process.pid());
            }
        }
    }

    private static BufferedReader reader(InputStream in) {
        return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    private static Thread daemon(Runnable task, String name) {
        Thread thread = new Thread(task, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private static void joinQuietly(Thread thread) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(ProcessTimeouts.READER_FLUSH_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String lastLine(String text) {
        int nl = text.lastIndexOf('\n');
        return nl < 0 ? text : text.substring(nl + 1);
    }
}
