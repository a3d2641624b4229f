package com.phillippitts.transcodeguard.service.engine.ffmpeg;

/**
 * Suspends and continues an OS process. Used for pause and for throttle duty cycling.
 */
public interface SignalSender {

    /**
     * @return true if the signal was delivered
     */
    boolean suspend(long pid);

    /**
     * @return true if the signal was delivered
     */
    boolean resume(long pid);
}
