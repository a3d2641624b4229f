package com.phillippitts.transcodeguard.service.engine.ffmpeg;

import com.phillippitts.transcodeguard.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link SignalSender} that shells out to {@code kill -STOP} / {@code kill -CONT}.
 *
 * <p>POSIX only. On other platforms every call returns false and the engine keeps running
 * unthrottled.
 */
public final class KillSignalSender implements SignalSender {

    private static final Logger LOG = LogManager.getLogger(KillSignalSender.class);

    private final ProcessFactory processFactory;

    public KillSignalSender(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    @Override
    public boolean suspend(long pid) {
        return send("-STOP", pid);
    }

    @Override
    public boolean resume(long pid) {
        return send("-CONT", pid);
    }

    private boolean send(String signal, long pid) {
        try {
            Process kill = processFactory.start(List.of("kill", signal, Long.toString(pid)), null);
            if (!kill.waitFor(ProcessTimeouts.SIGNAL_COMMAND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                kill.destroyForcibly();
                LOG.warn("kill {} {} timed out", signal, pid);
                return false;
            }
            int exit = kill.exitValue();
            if (exit != 0) {
                LOG.warn("kill {} {} exited with {}", signal, pid, exit);
                return false;
            }
            return true;
        } catch (IOException e) {
            LOG.warn("Unable to send {} to pid {}: {}", signal, pid, e.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while sending {} to pid {}", signal, pid);
            return false;
        }
    }
}
